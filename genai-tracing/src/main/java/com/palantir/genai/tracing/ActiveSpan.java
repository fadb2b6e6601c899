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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.MustBeClosed;
import com.palantir.genai.tracing.api.SpanStatus;
import com.palantir.genai.tracing.api.Value;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import javax.annotation.Nullable;

/**
 * Best-effort handle to a span started through {@link Tracer}. Failures to record are logged and never thrown, so
 * instrumentation cannot break the instrumented code.
 *
 * <p>Closing the handle ends the span with {@link SpanStatus#OK} unless it was ended explicitly before. Spans started
 * with {@link Tracer#startSpan} are active on the starting thread until they end and should be ended there; spans
 * started with {@link Tracer#startDetachedSpan} may be ended anywhere and are made active with {@link #attach()}.
 */
public final class ActiveSpan implements AutoCloseable {
    private static final SafeLogger log = SafeLoggerFactory.get(ActiveSpan.class);

    private static final ActiveSpan NOOP = new ActiveSpan(null, null, false);

    private static final int NOT_ENDED = 0;
    private static final int ENDED = 1;
    private static final AtomicIntegerFieldUpdater<ActiveSpan> endedUpdater =
            AtomicIntegerFieldUpdater.newUpdater(ActiveSpan.class, "ended");

    @Nullable
    private final SpanRecorder recorder;

    @Nullable
    private final LiveSpan span;

    private final boolean onThreadContext;
    private volatile int ended = NOT_ENDED;

    @Nullable
    private volatile Value outputs;

    ActiveSpan(@Nullable SpanRecorder recorder, @Nullable LiveSpan span, boolean onThreadContext) {
        this.recorder = recorder;
        this.span = span;
        this.onThreadContext = onThreadContext;
    }

    /** A handle which records nothing, returned when a span could not be started. */
    static ActiveSpan noop() {
        return NOOP;
    }

    /** False for handles of spans which could not be started. */
    public boolean isRecording() {
        return span != null;
    }

    public Optional<String> spanId() {
        return span == null ? Optional.empty() : Optional.of(span.spanId());
    }

    public Optional<String> traceId() {
        return span == null ? Optional.empty() : Optional.of(span.traceId());
    }

    public ActiveSpan setAttribute(String key, @Nullable Object value) {
        if (span != null) {
            try {
                span.setAttribute(key, Value.from(value));
                recorder.touch(span);
            } catch (RuntimeException e) {
                log.warn("Failed to set span attribute", SafeArg.of("spanId", span.spanId()), e);
            }
        }
        return this;
    }

    public ActiveSpan setAttributes(Map<String, ?> attributes) {
        attributes.forEach(this::setAttribute);
        return this;
    }

    public ActiveSpan addEvent(String name) {
        return addEvent(name, ImmutableMap.of());
    }

    public ActiveSpan addEvent(String name, Map<String, ?> payload) {
        if (span != null) {
            try {
                span.addEvent(name, recorder.epochMicrosFor(span), toValues(payload));
                recorder.touch(span);
            } catch (RuntimeException e) {
                log.warn("Failed to add span event", SafeArg.of("spanId", span.spanId()), e);
            }
        }
        return this;
    }

    /** Sets the outputs recorded when the span ends, unless other outputs are passed to {@link #end(Object)}. */
    public ActiveSpan setOutputs(@Nullable Object value) {
        this.outputs = value == null ? null : Value.from(value);
        return this;
    }

    public void end() {
        finish(Optional.ofNullable(outputs), SpanStatus.OK, Optional.empty(), true);
    }

    public void end(@Nullable Object value) {
        end(value, SpanStatus.OK);
    }

    public void end(@Nullable Object value, SpanStatus status) {
        Optional<Value> recorded = value == null ? Optional.ofNullable(outputs) : Optional.of(Value.from(value));
        finish(recorded, status, Optional.empty(), true);
    }

    /** Ends the span as failed, recording the error as an {@code exception} event. */
    public void fail(Throwable error) {
        if (span == null) {
            return;
        }
        if (span.isFinished()) {
            if (markEnded(true)) {
                leaveContext();
            }
            return;
        }
        addEvent(
                "exception",
                ImmutableMap.of(
                        "exception.type", error.getClass().getName(),
                        "exception.message", String.valueOf(error.getMessage()),
                        "exception.stacktrace", Throwables.getStackTraceAsString(error)));
        finish(Optional.ofNullable(outputs), SpanStatus.ERROR, Optional.of(error.toString()), true);
    }

    /**
     * Ends the span as cancelled, unless it already ended. Ancestors which have not ended and have no other children
     * pending are ended as cancelled too.
     */
    public void cancel() {
        if (span == null || !markEnded(false)) {
            return;
        }
        if (span.isFinished()) {
            leaveContext();
            return;
        }
        try {
            recorder.cancel(span);
        } catch (RuntimeException e) {
            log.warn("Failed to cancel span", SafeArg.of("spanId", span.spanId()), e);
        } finally {
            leaveContext();
        }
    }

    /**
     * Makes this span the active span of the calling thread until the returned scope is closed, so that spans started
     * on this thread become its children.
     */
    @MustBeClosed
    public ContextScope attach() {
        SpanContext current = ContextPropagator.current();
        return ContextPropagator.attach(span == null ? current : current.push(span));
    }

    @Override
    public void close() {
        finish(Optional.ofNullable(outputs), SpanStatus.OK, Optional.empty(), false);
    }

    /** Ends the span unless it already ended. Returns false if it had. */
    boolean finish(Optional<Value> value, SpanStatus status, Optional<String> statusMessage, boolean warnIfEnded) {
        if (span == null || !markEnded(warnIfEnded)) {
            return false;
        }
        if (!warnIfEnded && span.isFinished()) {
            // finalized elsewhere, e.g. by forced sealing
            leaveContext();
            return false;
        }
        try {
            recorder.end(span, value, status, statusMessage);
        } catch (RuntimeException e) {
            log.warn("Failed to end span", SafeArg.of("spanId", span.spanId()), e);
        } finally {
            leaveContext();
        }
        return true;
    }

    private boolean markEnded(boolean warnIfEnded) {
        if (endedUpdater.compareAndSet(this, NOT_ENDED, ENDED)) {
            return true;
        }
        if (warnIfEnded) {
            log.warn("Attempted to end a span which has already ended", SafeArg.of("spanId", span.spanId()));
        }
        return false;
    }

    private void leaveContext() {
        if (onThreadContext) {
            ContextPropagator.remove(span);
        }
    }

    private static Map<String, Value> toValues(Map<String, ?> payload) {
        Map<String, Value> values = new LinkedHashMap<>();
        payload.forEach((key, value) -> values.put(key, Value.from(value)));
        return values;
    }

    @Override
    public String toString() {
        return "ActiveSpan{" + span + ", ended=" + (ended == ENDED) + '}';
    }
}
