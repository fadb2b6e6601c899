/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.genai.tracing;

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.palantir.logsafe.SafeArg;
import java.time.Duration;
import org.immutables.value.Value;

/** Tuning knobs of a {@link TracingEngine}. Every setting has a default suitable for production use. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class TracingConfig {

    /**
     * Number of sealed traces the export buffer, and each sink's backlog, holds before applying
     * {@link #queueFullPolicy()}.
     */
    @Value.Default
    public int queueCapacity() {
        return 1000;
    }

    @Value.Default
    public QueueFullPolicy queueFullPolicy() {
        return QueueFullPolicy.DROP_OLDEST;
    }

    /** Longest wait for buffer space under {@link QueueFullPolicy#BLOCK_WITH_TIMEOUT}. */
    @Value.Default
    public Duration enqueueTimeout() {
        return Duration.ofMillis(100);
    }

    /**
     * A trace with unfinished spans and no span activity for this long is sealed by force. Slow model calls are
     * common, so this is measured in minutes.
     */
    @Value.Default
    public Duration maxPendingTime() {
        return Duration.ofMinutes(5);
    }

    /** How often in-flight traces are checked against {@link #maxPendingTime()}. */
    @Value.Default
    public Duration sealCheckInterval() {
        return Duration.ofSeconds(10);
    }

    /** Total number of attempts to write one trace to one sink, including the first. */
    @Value.Default
    public int sinkMaxAttempts() {
        return 3;
    }

    @Value.Default
    public Duration sinkInitialBackoff() {
        return Duration.ofMillis(200);
    }

    @Value.Default
    public Duration sinkMaxBackoff() {
        return Duration.ofSeconds(5);
    }

    /** Maximum length of the request and response previews on {@code TraceInfo}. */
    @Value.Default
    public int previewMaxLength() {
        return 1000;
    }

    /** How many span ids of sealed traces are remembered to reject late calls with a precise error. */
    @Value.Default
    public long sealedSpanMemory() {
        return 10_000;
    }

    @Value.Check
    protected void check() {
        checkArgument(queueCapacity() > 0, "queueCapacity must be positive", SafeArg.of("value", queueCapacity()));
        checkArgument(!enqueueTimeout().isNegative(), "enqueueTimeout must not be negative");
        checkArgument(isPositive(maxPendingTime()), "maxPendingTime must be positive");
        checkArgument(isPositive(sealCheckInterval()), "sealCheckInterval must be positive");
        checkArgument(
                sinkMaxAttempts() > 0, "sinkMaxAttempts must be positive", SafeArg.of("value", sinkMaxAttempts()));
        checkArgument(!sinkInitialBackoff().isNegative(), "sinkInitialBackoff must not be negative");
        checkArgument(
                sinkMaxBackoff().compareTo(sinkInitialBackoff()) >= 0,
                "sinkMaxBackoff must not be smaller than sinkInitialBackoff");
        checkArgument(
                previewMaxLength() >= 16,
                "previewMaxLength must be at least 16",
                SafeArg.of("value", previewMaxLength()));
        checkArgument(sealedSpanMemory() >= 0, "sealedSpanMemory must not be negative");
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    public static TracingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableTracingConfig.Builder {}
}
