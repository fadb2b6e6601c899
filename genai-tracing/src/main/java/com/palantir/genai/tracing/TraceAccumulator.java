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
import com.palantir.genai.tracing.api.Serialization;
import com.palantir.genai.tracing.api.Span;
import com.palantir.genai.tracing.api.SpanEvent;
import com.palantir.genai.tracing.api.SpanStatus;
import com.palantir.genai.tracing.api.Trace;
import com.palantir.genai.tracing.api.TraceData;
import com.palantir.genai.tracing.api.TraceInfo;
import com.palantir.genai.tracing.api.Value;
import com.palantir.logsafe.SafeArg;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the spans of one trace until it can be sealed. A trace seals once its root span has ended and no span of
 * the trace is still pending, or by force once it has seen no span activity for too long.
 *
 * <p>All state is guarded by the accumulator's monitor. Spans of this trace are finalized while holding it, which
 * keeps the pending set, the finished list and the spans themselves consistent with one another.
 */
final class TraceAccumulator {
    static final String FORCED_CLOSURE_EVENT = "forced_closure";

    private final String traceId;
    private final String rootSpanId;
    private final int previewMaxLength;

    private final Map<String, LiveSpan> pending = new LinkedHashMap<>();
    private final List<Span> finished = new ArrayList<>();
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final List<SpanEvent> events = new ArrayList<>();
    private long lastActivityNanos;
    private boolean sealed;

    TraceAccumulator(LiveSpan root, int previewMaxLength, long nowNanos) {
        this.traceId = root.traceId();
        this.rootSpanId = root.spanId();
        this.previewMaxLength = previewMaxLength;
        this.pending.put(root.spanId(), root);
        this.lastActivityNanos = nowNanos;
    }

    String traceId() {
        return traceId;
    }

    synchronized boolean isSealed() {
        return sealed;
    }

    synchronized int pendingCount() {
        return pending.size();
    }

    synchronized void register(LiveSpan span, long nowNanos) {
        checkNotSealed(span.spanId());
        pending.put(span.spanId(), span);
        lastActivityNanos = nowNanos;
    }

    synchronized void touch(long nowNanos) {
        if (!sealed) {
            lastActivityNanos = nowNanos;
        }
    }

    synchronized Completion finish(
            LiveSpan span,
            Optional<Value> outputs,
            SpanStatus status,
            Optional<String> statusMessage,
            long nowNanos) {
        checkNotSealed(span.spanId());
        Span result = span.finish(outputs, status, statusMessage, nowNanos);
        recordFinished(result, nowNanos);
        return new Completion(result, maybeSeal());
    }

    /**
     * Finalizes the span as cancelled, then walks up its ancestors and cancels each one which is still pending and
     * has no other pending child, stopping at the first ancestor which does.
     */
    synchronized Completion cancel(LiveSpan span, long nowNanos) {
        checkNotSealed(span.spanId());
        Span result = span.finish(Optional.empty(), SpanStatus.ERROR, Optional.of(SpanStatus.CANCELLED), nowNanos);
        recordFinished(result, nowNanos);

        Optional<String> ancestorId = span.parentSpanId();
        while (ancestorId.isPresent()) {
            LiveSpan ancestor = pending.get(ancestorId.get());
            if (ancestor == null || hasPendingChildren(ancestor.spanId())) {
                break;
            }
            recordFinished(
                    ancestor.finish(Optional.empty(), SpanStatus.ERROR, Optional.of(SpanStatus.CANCELLED), nowNanos),
                    nowNanos);
            ancestorId = ancestor.parentSpanId();
        }
        return new Completion(result, maybeSeal());
    }

    /**
     * Seals the trace by force if it has seen no span activity for at least {@code maxPendingNanos}. Pending spans are
     * finalized as timed out and a {@value #FORCED_CLOSURE_EVENT} event naming them is added to the trace.
     */
    synchronized Optional<ForcedSeal> sealIfExpired(long nowNanos, long nowMicros, long maxPendingNanos) {
        long idleNanos = nowNanos - lastActivityNanos;
        if (sealed || idleNanos < maxPendingNanos) {
            return Optional.empty();
        }
        List<String> unfinished = ImmutableList.copyOf(pending.keySet());
        for (LiveSpan span : ImmutableList.copyOf(pending.values())) {
            recordFinished(
                    span.finish(Optional.empty(), SpanStatus.ERROR, Optional.of(SpanStatus.TIMEOUT), nowNanos),
                    nowNanos);
        }
        events.add(SpanEvent.of(
                FORCED_CLOSURE_EVENT,
                nowMicros,
                ImmutableMap.of(
                        "reason", Value.of(SpanStatus.TIMEOUT),
                        "idleMillis", Value.of(idleNanos / 1_000_000),
                        "unfinishedSpanIds", Value.from(unfinished))));
        return Optional.of(new ForcedSeal(seal(), unfinished, idleNanos));
    }

    /** Merges tags into the trace. Returns false if the trace was sealed already. */
    synchronized boolean putTags(Map<String, String> newTags) {
        if (sealed) {
            return false;
        }
        tags.putAll(newTags);
        return true;
    }

    synchronized boolean deleteTag(String key) {
        if (sealed) {
            return false;
        }
        tags.remove(key);
        return true;
    }

    private void recordFinished(Span span, long nowNanos) {
        pending.remove(span.getSpanId());
        finished.add(span);
        lastActivityNanos = nowNanos;
    }

    private boolean hasPendingChildren(String spanId) {
        for (LiveSpan candidate : pending.values()) {
            if (candidate.parentSpanId().map(spanId::equals).orElse(false)) {
                return true;
            }
        }
        return false;
    }

    private Optional<Trace> maybeSeal() {
        if (pending.isEmpty()) {
            return Optional.of(seal());
        }
        return Optional.empty();
    }

    private Trace seal() {
        sealed = true;
        Span root = finished.stream()
                .filter(span -> span.getSpanId().equals(rootSpanId))
                .findFirst()
                .orElseThrow(() -> new InvalidStateException(
                        "Cannot seal a trace whose root span has not ended", SafeArg.of("traceId", traceId)));
        boolean failed = finished.stream().anyMatch(span -> span.getStatus() == SpanStatus.ERROR);
        TraceInfo info = TraceInfo.builder()
                .traceId(traceId)
                .name(root.getName())
                .startTimeMicroSeconds(root.getStartTimeMicroSeconds())
                .durationNanoSeconds(root.getDurationNanoSeconds())
                .status(failed ? SpanStatus.ERROR : SpanStatus.OK)
                .requestPreview(root.getInputs().map(this::preview))
                .responsePreview(root.getOutputs().map(this::preview))
                .tags(tags)
                .events(events)
                .build();
        List<Span> spans = new ArrayList<>(finished);
        spans.sort(Comparator.comparingLong(Span::getStartTimeMicroSeconds));
        return Trace.of(info, TraceData.of(spans));
    }

    private String preview(Value value) {
        return truncate(Serialization.toJson(value), previewMaxLength);
    }

    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        int end = maxLength - 3;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + "...";
    }

    private void checkNotSealed(String spanId) {
        if (sealed) {
            throw new InvalidStateException(
                    "Trace has already been sealed", SafeArg.of("traceId", traceId), SafeArg.of("spanId", spanId));
        }
    }

    /** The span finalized by a call, plus the trace if that call sealed it. */
    static final class Completion {
        private final Span span;
        private final Optional<Trace> sealedTrace;

        Completion(Span span, Optional<Trace> sealedTrace) {
            this.span = span;
            this.sealedTrace = sealedTrace;
        }

        Span span() {
            return span;
        }

        Optional<Trace> sealedTrace() {
            return sealedTrace;
        }
    }

    static final class ForcedSeal {
        private final Trace trace;
        private final List<String> unfinishedSpanIds;
        private final long idleNanos;

        ForcedSeal(Trace trace, List<String> unfinishedSpanIds, long idleNanos) {
            this.trace = trace;
            this.unfinishedSpanIds = unfinishedSpanIds;
            this.idleNanos = idleNanos;
        }

        Trace trace() {
            return trace;
        }

        List<String> unfinishedSpanIds() {
            return unfinishedSpanIds;
        }

        long idleNanos() {
            return idleNanos;
        }
    }
}
