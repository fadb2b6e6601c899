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

package com.palantir.genai.tracing.query;

import com.google.common.collect.ImmutableMap;
import com.palantir.genai.tracing.api.TraceInfo;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;

/** The {@link TraceInfo} fields which traces can be filtered and ordered by. */
public enum TraceField {
    TRACE_ID("trace_id", false, TraceInfo::getTraceId),
    NAME("name", false, TraceInfo::getName),
    STATUS("status", false, info -> info.getStatus().name()),
    TIMESTAMP_MS("timestamp_ms", true, TraceInfo::getTimestampMillis),
    EXECUTION_TIME_MS("execution_time_ms", true, TraceInfo::getExecutionTimeMillis),
    REQUEST_PREVIEW("request_preview", false, info -> info.getRequestPreview().orElse(null)),
    RESPONSE_PREVIEW("response_preview", false, info -> info.getResponsePreview().orElse(null));

    private static final ImmutableMap<String, TraceField> BY_NAME = ImmutableMap.<String, TraceField>builder()
            .put("trace_id", TRACE_ID)
            .put("name", NAME)
            .put("status", STATUS)
            .put("timestamp_ms", TIMESTAMP_MS)
            .put("timestamp", TIMESTAMP_MS)
            .put("execution_time_ms", EXECUTION_TIME_MS)
            .put("execution_time", EXECUTION_TIME_MS)
            .put("request_preview", REQUEST_PREVIEW)
            .put("response_preview", RESPONSE_PREVIEW)
            .buildOrThrow();

    private final String fieldName;
    private final boolean numeric;
    private final Function<TraceInfo, Object> extractor;

    TraceField(String fieldName, boolean numeric, Function<TraceInfo, Object> extractor) {
        this.fieldName = fieldName;
        this.numeric = numeric;
        this.extractor = extractor;
    }

    /** Resolves a field by its name, ignoring case. A few short aliases such as {@code timestamp} are accepted. */
    public static Optional<TraceField> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }

    public String fieldName() {
        return fieldName;
    }

    /** Numeric fields extract {@link Long} values, all others extract {@link String} values. */
    public boolean isNumeric() {
        return numeric;
    }

    /** Returns the value of this field on the given trace, or null for an absent preview. */
    @Nullable
    public Object extract(TraceInfo info) {
        return extractor.apply(info);
    }

    @Override
    public String toString() {
        return fieldName;
    }
}
