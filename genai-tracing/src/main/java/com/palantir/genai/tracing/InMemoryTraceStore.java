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
import com.palantir.genai.tracing.api.NotFoundException;
import com.palantir.genai.tracing.api.Trace;
import com.palantir.genai.tracing.api.TraceInfo;
import com.palantir.genai.tracing.query.TracePage;
import com.palantir.genai.tracing.query.TraceQueryEngine;
import com.palantir.genai.tracing.query.TraceSearchRequest;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/** A {@link TraceStore} keeping every trace in memory. Searches run over a snapshot taken when the search starts. */
public final class InMemoryTraceStore implements TraceStore {
    private static final SafeLogger log = SafeLoggerFactory.get(InMemoryTraceStore.class);

    static final String LOCATION_PREFIX = "memory:";

    private final ConcurrentMap<String, Trace> traces = new ConcurrentHashMap<>();

    @Override
    public void write(Trace trace) {
        Preconditions.checkNotNull(trace, "trace");
        Trace located = Trace.of(
                TraceInfo.builder()
                        .from(trace.getInfo())
                        .location(LOCATION_PREFIX + trace.getTraceId())
                        .build(),
                trace.getData());
        if (traces.putIfAbsent(trace.getTraceId(), located) != null) {
            log.info("Ignoring repeated write of stored trace", SafeArg.of("traceId", trace.getTraceId()));
        }
    }

    @Override
    public Trace get(String traceId) {
        Trace trace = traces.get(Preconditions.checkNotNull(traceId, "traceId"));
        if (trace == null) {
            throw new NotFoundException("Trace not found", SafeArg.of("traceId", traceId));
        }
        return trace;
    }

    @Override
    public TracePage search(TraceSearchRequest request) {
        List<TraceInfo> snapshot =
                traces.values().stream().map(Trace::getInfo).collect(ImmutableList.toImmutableList());
        return TraceQueryEngine.search(snapshot, request);
    }

    @Override
    public void setTags(String traceId, Map<String, String> tags) {
        updateTags(traceId, current -> {
            Map<String, String> merged = new LinkedHashMap<>(current);
            merged.putAll(tags);
            return merged;
        });
    }

    @Override
    public void deleteTag(String traceId, String key) {
        updateTags(traceId, current -> current.entrySet().stream()
                .filter(entry -> !entry.getKey().equals(key))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, _b) -> a, LinkedHashMap::new)));
    }

    private void updateTags(String traceId, UnaryOperator<Map<String, String>> update) {
        Trace updated = traces.computeIfPresent(traceId, (_id, trace) -> Trace.of(
                TraceInfo.builder()
                        .from(trace.getInfo())
                        .tags(update.apply(trace.getInfo().getTags()))
                        .build(),
                trace.getData()));
        if (updated == null) {
            throw new NotFoundException("Trace not found", SafeArg.of("traceId", traceId));
        }
    }

    @Override
    public int size() {
        return traces.size();
    }
}
