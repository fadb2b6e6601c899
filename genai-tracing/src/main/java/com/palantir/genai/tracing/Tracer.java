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

import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.MustBeClosed;
import com.palantir.genai.tracing.api.InvalidStateException;
import com.palantir.genai.tracing.api.NotFoundException;
import com.palantir.genai.tracing.api.SpanStatus;
import com.palantir.genai.tracing.api.SpanType;
import com.palantir.genai.tracing.api.Value;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * The static, best-effort entry point for instrumenting code. Spans started here become children of the span active
 * on the calling thread, or roots of new traces when none is active. Recording failures are logged and never thrown.
 *
 * <pre>{@code
 * try (ActiveSpan span = Tracer.startSpan("retrieve", SpanType.RETRIEVER, query)) {
 *     List<Document> documents = index.search(query);
 *     span.end(documents);
 * }
 * }</pre>
 *
 * <p>Spans are recorded by the engine installed with {@link #setEngine}; until one is installed a default engine
 * without sinks is created on first use.
 *
 * <p>This class is thread-safe.
 */
public final class Tracer {
    private static final SafeLogger log = SafeLoggerFactory.get(Tracer.class);

    @Nullable
    private static volatile TracingEngine engine;

    private Tracer() {}

    /** Installs the engine used by all static methods of this class. Returns the previously installed engine. */
    @Nullable
    public static synchronized TracingEngine setEngine(TracingEngine newEngine) {
        TracingEngine previous = engine;
        engine = Preconditions.checkNotNull(newEngine, "engine");
        return previous;
    }

    /** The installed engine, created with default settings if none was installed. */
    public static TracingEngine engine() {
        TracingEngine current = engine;
        if (current != null) {
            return current;
        }
        synchronized (Tracer.class) {
            if (engine == null) {
                log.info("No tracing engine installed, creating a default engine without sinks");
                engine = TracingEngine.builder().build();
            }
            return engine;
        }
    }

    /** Starts a span as a child of the thread's active span and makes it the active span until it ends. */
    @MustBeClosed
    public static ActiveSpan startSpan(String name, SpanType type) {
        return startSpan(name, type, null);
    }

    /** Starts a span as a child of the thread's active span and makes it the active span until it ends. */
    @MustBeClosed
    public static ActiveSpan startSpan(String name, SpanType type, @Nullable Object inputs) {
        return start(name, type, inputs, ContextPropagator.currentSpanId(), true);
    }

    /**
     * Starts a span under an explicitly given parent and makes it the thread's active span until it ends. If the
     * parent cannot be used, because it is unknown or its trace has been sealed, the span starts a new trace instead.
     */
    @MustBeClosed
    public static ActiveSpan startSpan(String name, SpanType type, @Nullable Object inputs, String parentSpanId) {
        return start(name, type, inputs, Optional.of(parentSpanId), true);
    }

    /**
     * Starts a span as a child of the thread's active span without making it active. Use this for work which
     * completes on another thread or in a callback; {@link ActiveSpan#attach()} makes it active where needed.
     */
    @CheckReturnValue
    public static ActiveSpan startDetachedSpan(String name, SpanType type, @Nullable Object inputs) {
        return start(name, type, inputs, ContextPropagator.currentSpanId(), false);
    }

    /** Returns a handle to the thread's active span. */
    public static Optional<ActiveSpan> currentSpan() {
        return ContextPropagator.currentSpan().map(span -> new ActiveSpan(engine().recorder(), span, true));
    }

    public static Optional<String> currentSpanId() {
        return ContextPropagator.currentSpanId();
    }

    public static Optional<String> currentTraceId() {
        return ContextPropagator.currentTraceId();
    }

    /** Sets an attribute on the thread's active span, if there is one. */
    public static void setAttribute(String key, @Nullable Object value) {
        Optional<ActiveSpan> current = currentSpan();
        if (current.isPresent()) {
            current.get().setAttribute(key, value);
        } else {
            log.debug("No active span to set attribute on", SafeArg.of("key", key));
        }
    }

    /** Adds an event to the thread's active span, if there is one. */
    public static void addEvent(String name, Map<String, ?> payload) {
        Optional<ActiveSpan> current = currentSpan();
        if (current.isPresent()) {
            current.get().addEvent(name, payload);
        } else {
            log.debug("No active span to add event to", SafeArg.of("event", name));
        }
    }

    /** Ends the thread's active span with the given outputs and status, making its parent the active span. */
    public static void endSpan(@Nullable Object outputs, SpanStatus status) {
        Optional<ActiveSpan> current = currentSpan();
        if (current.isPresent()) {
            current.get().end(outputs, status);
        } else {
            log.warn("Attempted to end a span when no span is active");
        }
    }

    public static void endSpan(@Nullable Object outputs) {
        endSpan(outputs, SpanStatus.OK);
    }

    /** Merges tags into a trace, in flight or stored. Failures are logged. */
    public static void updateTraceTags(String traceId, Map<String, String> tags) {
        try {
            engine().updateTraceTags(traceId, tags);
        } catch (RuntimeException e) {
            log.warn("Failed to update trace tags", SafeArg.of("traceId", traceId), e);
        }
    }

    /** Merges tags into the trace of the thread's active span, if there is one. */
    public static void updateCurrentTraceTags(Map<String, String> tags) {
        Optional<String> traceId = currentTraceId();
        if (traceId.isPresent()) {
            updateTraceTags(traceId.get(), tags);
        } else {
            log.debug("No active trace to update tags on");
        }
    }

    /**
     * Runs the operation in a new span which records its result as outputs. The span ends as failed if the operation
     * throws, and as cancelled if it is interrupted or cancelled.
     */
    public static <T> T traced(String name, SpanType type, @Nullable Object inputs, Callable<T> operation)
            throws Exception {
        try (ActiveSpan span = startSpan(name, type, inputs)) {
            T result;
            try {
                result = operation.call();
            } catch (InterruptedException | CancellationException e) {
                span.cancel();
                throw e;
            } catch (Exception | Error e) {
                span.fail(e);
                throw e;
            }
            span.end(result);
            return result;
        }
    }

    /**
     * Runs an asynchronous operation in a new span which ends when the returned future completes. Spans started by
     * the operation while it runs on the calling thread become children of the new span.
     *
     * <p>Cancelling the returned future ends the span as cancelled.
     */
    public static <T> CompletableFuture<T> tracedAsync(
            String name, SpanType type, @Nullable Object inputs, Supplier<? extends CompletionStage<T>> operation) {
        return runAsync(startDetachedSpan(name, type, inputs), operation, Function.identity());
    }

    static <T> CompletableFuture<T> runAsync(
            ActiveSpan span, Supplier<? extends CompletionStage<T>> operation, Function<? super T, ?> outputs) {
        CompletionStage<T> stage;
        try (ContextScope ignored = span.attach()) {
            stage = operation.get();
        } catch (RuntimeException | Error e) {
            span.fail(e);
            throw e;
        }

        CompletableFuture<T> traced = new CompletableFuture<>();
        traced.whenComplete((_value, error) -> {
            if (error instanceof CancellationException) {
                span.cancel();
            }
        });
        stage.whenComplete((value, error) -> {
            if (error == null) {
                Optional<Value> recorded = Optional.ofNullable(value).map(outputs).map(Value::from);
                span.finish(recorded, SpanStatus.OK, Optional.empty(), false);
                traced.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                span.cancel();
            } else {
                span.fail(cause);
            }
            traced.completeExceptionally(cause);
        });
        return traced;
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static ActiveSpan start(
            String name, SpanType type, @Nullable Object inputs, Optional<String> parentSpanId, boolean activate) {
        try {
            SpanRecorder recorder = engine().recorder();
            Optional<Value> recordedInputs = inputs == null ? Optional.empty() : Optional.of(Value.from(inputs));
            LiveSpan span;
            try {
                span = recorder.startSpan(name, type, parentSpanId, recordedInputs);
            } catch (InvalidStateException | NotFoundException e) {
                log.warn(
                        "Could not start span under its parent, starting a new trace instead",
                        SafeArg.of("name", name),
                        SafeArg.of("parentSpanId", parentSpanId),
                        e);
                span = recorder.startSpan(name, type, Optional.empty(), recordedInputs);
            }
            if (activate) {
                ContextPropagator.push(span);
            }
            return new ActiveSpan(recorder, span, activate);
        } catch (RuntimeException e) {
            log.warn("Failed to start span", SafeArg.of("name", name), e);
            return ActiveSpan.noop();
        }
    }
}
