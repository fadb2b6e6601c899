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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.palantir.genai.tracing.api.InvalidStateException;
import com.palantir.genai.tracing.api.NotFoundException;
import com.palantir.genai.tracing.api.Span;
import com.palantir.genai.tracing.api.SpanStatus;
import com.palantir.genai.tracing.api.TimeoutSealException;
import com.palantir.genai.tracing.api.Trace;
import com.palantir.genai.tracing.api.Value;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Owns the in-flight traces. Spans are registered with the accumulator of their trace when started and reported to
 * it when finalized; sealed traces are handed to the configured consumer exactly once.
 */
final class TraceAssembler {
    private static final SafeLogger log = SafeLoggerFactory.get(TraceAssembler.class);

    private final TracingConfig config;
    private final TimeSource time;
    private final Consumer<Trace> sealedTraces;

    private final ConcurrentMap<String, TraceAccumulator> traces = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LiveSpan> spans = new ConcurrentHashMap<>();
    private final Cache<String, String> sealedSpanIds;

    TraceAssembler(TracingConfig config, TimeSource time, Consumer<Trace> sealedTraces) {
        this.config = Preconditions.checkNotNull(config, "config");
        this.time = Preconditions.checkNotNull(time, "time");
        this.sealedTraces = Preconditions.checkNotNull(sealedTraces, "sealedTraces");
        this.sealedSpanIds =
                CacheBuilder.newBuilder().maximumSize(config.sealedSpanMemory()).build();
    }

    TimeSource time() {
        return time;
    }

    /**
     * Makes the span resolvable and adds it to the pending set of its trace. The span is published before it joins its
     * trace, so a concurrent seal of that trace always finds and retires it.
     */
    void register(LiveSpan span) {
        spans.put(span.spanId(), span);
        try {
            join(span, time.nanoTime());
        } catch (RuntimeException e) {
            spans.remove(span.spanId(), span);
            throw e;
        }
    }

    private void join(LiveSpan span, long now) {
        if (span.isRoot()) {
            TraceAccumulator accumulator = new TraceAccumulator(span, config.previewMaxLength(), now);
            if (traces.putIfAbsent(span.traceId(), accumulator) != null) {
                throw new InvalidStateException("Trace id is already in use", SafeArg.of("traceId", span.traceId()));
            }
            log.debug(
                    "Started new trace",
                    SafeArg.of("traceId", span.traceId()),
                    SafeArg.of("rootSpanId", span.spanId()),
                    SafeArg.of("name", span.name()));
        } else {
            TraceAccumulator accumulator = traces.get(span.traceId());
            if (accumulator == null) {
                throw new InvalidStateException(
                        "Cannot start a span in a trace which has been sealed",
                        SafeArg.of("traceId", span.traceId()),
                        SafeArg.of("parentSpanId", span.parentSpanId()));
            }
            accumulator.register(span, now);
        }
    }

    /**
     * Resolves a span which belongs to an in-flight trace.
     *
     * @throws InvalidStateException if the span belonged to a trace which has been sealed
     * @throws NotFoundException if the span is unknown
     */
    LiveSpan lookup(String spanId) {
        Preconditions.checkNotNull(spanId, "spanId");
        LiveSpan span = spans.get(spanId);
        if (span != null) {
            return span;
        }
        String sealedTraceId = sealedSpanIds.getIfPresent(spanId);
        if (sealedTraceId != null) {
            throw new InvalidStateException(
                    "Span belongs to a trace which has been sealed",
                    SafeArg.of("spanId", spanId),
                    SafeArg.of("traceId", sealedTraceId));
        }
        throw new NotFoundException("Unknown span", SafeArg.of("spanId", spanId));
    }

    void touch(LiveSpan span) {
        TraceAccumulator accumulator = traces.get(span.traceId());
        if (accumulator != null) {
            accumulator.touch(time.nanoTime());
        }
    }

    Span end(LiveSpan span, Optional<Value> outputs, SpanStatus status, Optional<String> statusMessage) {
        TraceAccumulator.Completion completion =
                accumulator(span).finish(span, outputs, status, statusMessage, time.nanoTime());
        completion.sealedTrace().ifPresent(this::onSealed);
        return completion.span();
    }

    Span cancel(LiveSpan span) {
        TraceAccumulator.Completion completion = accumulator(span).cancel(span, time.nanoTime());
        completion.sealedTrace().ifPresent(this::onSealed);
        return completion.span();
    }

    /** Seals every in-flight trace which has been idle for longer than the configured bound. */
    int sealExpired() {
        long maxPendingNanos = config.maxPendingTime().toNanos();
        int count = 0;
        for (TraceAccumulator accumulator : traces.values()) {
            Optional<TraceAccumulator.ForcedSeal> forced =
                    accumulator.sealIfExpired(time.nanoTime(), time.epochMicros(), maxPendingNanos);
            if (forced.isPresent()) {
                count++;
                TraceAccumulator.ForcedSeal seal = forced.get();
                log.warn(
                        "Sealed trace by force after it stopped making progress",
                        SafeArg.of("traceId", accumulator.traceId()),
                        SafeArg.of("unfinishedSpanIds", seal.unfinishedSpanIds()),
                        new TimeoutSealException(
                                "Trace exceeded the maximum pending time",
                                SafeArg.of("traceId", accumulator.traceId()),
                                SafeArg.of("idleMillis", seal.idleNanos() / 1_000_000),
                                SafeArg.of("maxPendingTime", config.maxPendingTime())));
                onSealed(seal.trace());
            }
        }
        return count;
    }

    /** Merges tags into an in-flight trace. Returns false if no such trace is in flight. */
    boolean putTags(String traceId, Map<String, String> tags) {
        TraceAccumulator accumulator = traces.get(traceId);
        return accumulator != null && accumulator.putTags(tags);
    }

    boolean deleteTag(String traceId, String key) {
        TraceAccumulator accumulator = traces.get(traceId);
        return accumulator != null && accumulator.deleteTag(key);
    }

    int inFlightTraceCount() {
        return traces.size();
    }

    /** Spans which can still be resolved by id, finalized or not. */
    @VisibleForTesting
    int liveSpanCount() {
        return spans.size();
    }

    private TraceAccumulator accumulator(LiveSpan span) {
        TraceAccumulator accumulator = traces.get(span.traceId());
        if (accumulator == null) {
            throw new InvalidStateException(
                    "Span belongs to a trace which has been sealed",
                    SafeArg.of("spanId", span.spanId()),
                    SafeArg.of("traceId", span.traceId()));
        }
        return accumulator;
    }

    private void onSealed(Trace trace) {
        traces.remove(trace.getTraceId());
        for (Span span : trace.getData().getSpans()) {
            sealedSpanIds.put(span.getSpanId(), trace.getTraceId());
            spans.remove(span.getSpanId());
        }
        log.debug(
                "Sealed trace",
                SafeArg.of("traceId", trace.getTraceId()),
                SafeArg.of("spanCount", trace.getData().getSpans().size()),
                SafeArg.of("status", trace.getInfo().getStatus()));
        try {
            sealedTraces.accept(trace);
        } catch (RuntimeException e) {
            log.error("Failed to hand over sealed trace for export", SafeArg.of("traceId", trace.getTraceId()), e);
        }
    }
}
