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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.palantir.genai.tracing.api.InvalidStateException;
import com.palantir.genai.tracing.api.Span;
import com.palantir.genai.tracing.api.SpanEvent;
import com.palantir.genai.tracing.api.SpanStatus;
import com.palantir.genai.tracing.api.SpanType;
import com.palantir.genai.tracing.api.Value;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A span which has been started but not yet finalized. Identity and start time are fixed at construction; attributes
 * and events accumulate until the span is finished, after which it only serves as a read-only handle.
 *
 * <p>All mutations are serialized on the span's monitor, so tasks other than the one which started the span may safely
 * annotate or end it.
 */
final class LiveSpan {
    private final String traceId;
    private final String spanId;
    private final Optional<String> parentSpanId;
    private final String name;
    private final SpanType type;
    private final long startTimeMicroSeconds;
    private final long startClockNanoSeconds;
    private final Optional<Value> inputs;

    // Only access while holding this span's monitor
    private final Map<String, Value> attributes = new LinkedHashMap<>();
    private final List<SpanEvent> events = new ArrayList<>();

    @Nullable
    private Span finished;

    LiveSpan(
            String traceId,
            String spanId,
            Optional<String> parentSpanId,
            String name,
            SpanType type,
            long startTimeMicroSeconds,
            long startClockNanoSeconds,
            Optional<Value> inputs) {
        this.traceId = Preconditions.checkNotNull(traceId, "traceId");
        this.spanId = Preconditions.checkNotNull(spanId, "spanId");
        this.parentSpanId = parentSpanId;
        this.name = Preconditions.checkNotNull(name, "name");
        this.type = Preconditions.checkNotNull(type, "type");
        this.startTimeMicroSeconds = startTimeMicroSeconds;
        this.startClockNanoSeconds = startClockNanoSeconds;
        this.inputs = inputs;
    }

    String traceId() {
        return traceId;
    }

    String spanId() {
        return spanId;
    }

    Optional<String> parentSpanId() {
        return parentSpanId;
    }

    boolean isRoot() {
        return parentSpanId.isEmpty();
    }

    String name() {
        return name;
    }

    SpanType type() {
        return type;
    }

    long startTimeMicroSeconds() {
        return startTimeMicroSeconds;
    }

    /** Converts a reading of the monotonic clock into wall-clock microseconds relative to this span's start. */
    long toEpochMicros(long clockNanoSeconds) {
        return startTimeMicroSeconds + (clockNanoSeconds - startClockNanoSeconds) / 1000;
    }

    synchronized void setAttribute(String key, Value value) {
        Preconditions.checkNotNull(key, "key");
        checkNotFinished("setAttribute");
        attributes.put(key, value);
    }

    synchronized void addEvent(String eventName, long timestampMicroSeconds, Map<String, Value> payload) {
        Preconditions.checkNotNull(eventName, "eventName");
        checkNotFinished("addEvent");
        events.add(SpanEvent.of(eventName, timestampMicroSeconds, payload));
    }

    synchronized boolean isFinished() {
        return finished != null;
    }

    synchronized SpanStatus status() {
        return finished == null ? SpanStatus.IN_PROGRESS : finished.getStatus();
    }

    synchronized Optional<Span> finishedSpan() {
        return Optional.ofNullable(finished);
    }

    /**
     * Finalizes this span exactly once. The duration is never negative, even if the monotonic clock reading passed in
     * precedes the start reading.
     */
    synchronized Span finish(
            Optional<Value> outputs, SpanStatus status, Optional<String> statusMessage, long endClockNanoSeconds) {
        Preconditions.checkArgument(
                status != SpanStatus.IN_PROGRESS, "cannot finish a span as in progress", SafeArg.of("spanId", spanId));
        checkNotFinished("end");
        finished = Span.builder()
                .traceId(traceId)
                .spanId(spanId)
                .parentSpanId(parentSpanId)
                .name(name)
                .type(type)
                .startTimeMicroSeconds(startTimeMicroSeconds)
                .durationNanoSeconds(Math.max(0, endClockNanoSeconds - startClockNanoSeconds))
                .status(status)
                .statusMessage(statusMessage)
                .inputs(inputs)
                .outputs(outputs)
                .attributes(ImmutableMap.copyOf(attributes))
                .events(ImmutableList.copyOf(events))
                .build();
        return finished;
    }

    private void checkNotFinished(String operation) {
        if (finished != null) {
            throw new InvalidStateException(
                    "Span has already been finalized",
                    SafeArg.of("operation", operation),
                    SafeArg.of("spanId", spanId),
                    SafeArg.of("status", finished.getStatus()));
        }
    }

    @Override
    public String toString() {
        return "LiveSpan{traceId=" + traceId + ", spanId=" + spanId + ", parentSpanId=" + parentSpanId + ", name="
                + name + ", type=" + type + '}';
    }
}
