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

import com.google.errorprone.annotations.MustBeClosed;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.Optional;
import org.slf4j.MDC;

/**
 * Tracks the {@link SpanContext} of the task running on each thread, and mirrors the innermost span into the SLF4J
 * {@link MDC} under {@link #TRACE_ID_KEY} and {@link #SPAN_ID_KEY} so that log lines carry their trace.
 *
 * <p>Contexts do not flow to other threads by themselves; capture {@link #current()} and {@link #attach} it in the
 * other task, or use the wrappers in {@link Tracers}.
 */
public final class ContextPropagator {
    private static final SafeLogger log = SafeLoggerFactory.get(ContextPropagator.class);

    /** Key under which the current trace id is stored in the MDC. */
    public static final String TRACE_ID_KEY = "traceId";

    /** Key under which the current span id is stored in the MDC. */
    public static final String SPAN_ID_KEY = "spanId";

    private static final ThreadLocal<SpanContext> currentContext = new ThreadLocal<>();

    private ContextPropagator() {}

    /** Returns the context of the calling task, which is {@link SpanContext#empty()} outside of any span. */
    public static SpanContext current() {
        SpanContext context = currentContext.get();
        return context == null ? SpanContext.empty() : context;
    }

    public static Optional<String> currentSpanId() {
        return current().currentSpanId();
    }

    public static Optional<String> currentTraceId() {
        return current().currentTraceId();
    }

    /**
     * Installs the given context for the calling thread until the returned scope is closed, at which point the
     * previously installed context is restored.
     */
    @MustBeClosed
    public static ContextScope attach(SpanContext context) {
        Preconditions.checkNotNull(context, "context");
        SpanContext previous = current();
        set(context);
        return new ContextScope(previous, context);
    }

    static Optional<LiveSpan> currentSpan() {
        return current().top();
    }

    static void push(LiveSpan span) {
        set(current().push(span));
    }

    /** Removes the span from the calling thread's context, wherever it sits on the stack. */
    static void remove(LiveSpan span) {
        SpanContext context = current();
        if (context.top().orElse(null) == span) {
            set(context.pop());
        } else if (context.contains(span)) {
            log.debug(
                    "Span ended while nested spans are still active on this thread",
                    SafeArg.of("spanId", span.spanId()),
                    SafeArg.of("depth", context.depth()));
            set(context.without(span));
        }
    }

    static void set(SpanContext context) {
        if (context.isEmpty()) {
            currentContext.remove();
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(SPAN_ID_KEY);
        } else {
            currentContext.set(context);
            LiveSpan top = context.top().get();
            MDC.put(TRACE_ID_KEY, top.traceId());
            MDC.put(SPAN_ID_KEY, top.spanId());
        }
    }
}
