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

import com.google.common.collect.ImmutableMap;
import com.palantir.genai.tracing.api.InvalidStateException;
import com.palantir.genai.tracing.api.NotFoundException;
import com.palantir.genai.tracing.api.Span;
import com.palantir.genai.tracing.api.SpanStatus;
import com.palantir.genai.tracing.api.SpanType;
import com.palantir.genai.tracing.api.Value;
import com.palantir.logsafe.Preconditions;
import java.util.Map;
import java.util.Optional;

/**
 * Strict, id-based API for recording spans. Every operation completes in memory without blocking, except that ending
 * the last span of a trace may wait for export buffer space under {@link QueueFullPolicy#BLOCK_WITH_TIMEOUT}.
 *
 * <p>Operations on unknown span ids throw {@link NotFoundException}; operations on finalized spans, and on spans of
 * sealed traces, throw {@link InvalidStateException}. For a best-effort API which never throws, see {@link Tracer}.
 *
 * <p>This class is thread-safe.
 */
public final class SpanRecorder {
    private final TraceAssembler assembler;
    private final TimeSource time;

    SpanRecorder(TraceAssembler assembler) {
        this.assembler = assembler;
        this.time = assembler.time();
    }

    /**
     * Starts a span and returns its id. Without a parent the span becomes the root of a new trace; otherwise it joins
     * the trace of its parent, which may itself have ended already as long as the trace is not sealed.
     */
    public String start(String name, SpanType type, Optional<String> parentSpanId, Optional<Value> inputs) {
        return startSpan(name, type, parentSpanId, inputs).spanId();
    }

    public String start(String name, SpanType type) {
        return start(name, type, Optional.empty(), Optional.empty());
    }

    LiveSpan startSpan(String name, SpanType type, Optional<String> parentSpanId, Optional<Value> inputs) {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkNotNull(type, "type");
        String traceId = parentSpanId.isPresent()
                ? assembler.lookup(parentSpanId.get()).traceId()
                : Ids.randomTraceId();
        LiveSpan span = new LiveSpan(
                traceId,
                Ids.nextSpanId(),
                parentSpanId,
                name,
                type,
                time.epochMicros(),
                time.nanoTime(),
                inputs);
        assembler.register(span);
        return span;
    }

    public void setAttribute(String spanId, String key, Value value) {
        LiveSpan span = assembler.lookup(spanId);
        span.setAttribute(key, Preconditions.checkNotNull(value, "value"));
        assembler.touch(span);
    }

    public void addEvent(String spanId, String name, Map<String, Value> payload) {
        LiveSpan span = assembler.lookup(spanId);
        span.addEvent(name, span.toEpochMicros(time.nanoTime()), ImmutableMap.copyOf(payload));
        assembler.touch(span);
    }

    public Span end(String spanId, Optional<Value> outputs, SpanStatus status) {
        return end(spanId, outputs, status, Optional.empty());
    }

    public Span end(String spanId, Optional<Value> outputs, SpanStatus status, Optional<String> statusMessage) {
        return assembler.end(assembler.lookup(spanId), outputs, status, statusMessage);
    }

    /** Finalizes the span as cancelled, together with its pending ancestors which have no other pending children. */
    public Span cancel(String spanId) {
        return assembler.cancel(assembler.lookup(spanId));
    }

    /** Returns the status of a span of an in-flight trace, which is {@link SpanStatus#IN_PROGRESS} until it ends. */
    public SpanStatus status(String spanId) {
        return assembler.lookup(spanId).status();
    }

    LiveSpan lookup(String spanId) {
        return assembler.lookup(spanId);
    }

    Span end(LiveSpan span, Optional<Value> outputs, SpanStatus status, Optional<String> statusMessage) {
        return assembler.end(span, outputs, status, statusMessage);
    }

    Span cancel(LiveSpan span) {
        return assembler.cancel(span);
    }

    void touch(LiveSpan span) {
        assembler.touch(span);
    }

    long epochMicrosFor(LiveSpan span) {
        return span.toEpochMicros(time.nanoTime());
    }
}
