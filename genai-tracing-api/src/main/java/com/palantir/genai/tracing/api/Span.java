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

package com.palantir.genai.tracing.api;

import static com.palantir.logsafe.Preconditions.checkState;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.palantir.logsafe.SafeArg;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value.Check;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;

/**
 * A value class representing a finalized span: one timed operation of a trace, with its structured inputs, outputs,
 * attributes and events. Spans in progress are never represented by this class.
 */
@Immutable
@Style(visibility = Style.ImplementationVisibility.PACKAGE)
@JsonSerialize(as = ImmutableSpan.class)
@JsonDeserialize(as = ImmutableSpan.class)
public abstract class Span {

    public abstract String getTraceId();

    public abstract String getSpanId();

    /** The enclosing span, empty for the root span of a trace. */
    public abstract Optional<String> getParentSpanId();

    public abstract String getName();

    public abstract SpanType getType();

    /** Wall-clock start of the span in microseconds since epoch. */
    public abstract long getStartTimeMicroSeconds();

    /** Duration measured on a monotonic clock. */
    public abstract long getDurationNanoSeconds();

    public abstract SpanStatus getStatus();

    /** Reason for an {@link SpanStatus#ERROR} status, such as {@link SpanStatus#CANCELLED}. */
    public abstract Optional<String> getStatusMessage();

    public abstract Optional<Value> getInputs();

    public abstract Optional<Value> getOutputs();

    public abstract Map<String, Value> getAttributes();

    public abstract List<SpanEvent> getEvents();

    @JsonIgnore
    public final long getEndTimeMicroSeconds() {
        return getStartTimeMicroSeconds() + getDurationNanoSeconds() / 1000;
    }

    @JsonIgnore
    public final boolean isRoot() {
        return getParentSpanId().isEmpty();
    }

    @Check
    protected void check() {
        checkState(
                getDurationNanoSeconds() >= 0,
                "span duration must not be negative",
                SafeArg.of("durationNanoSeconds", getDurationNanoSeconds()));
        checkState(
                getStatus() != SpanStatus.IN_PROGRESS,
                "finalized span must not be in progress",
                SafeArg.of("spanId", getSpanId()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableSpan.Builder {}
}
