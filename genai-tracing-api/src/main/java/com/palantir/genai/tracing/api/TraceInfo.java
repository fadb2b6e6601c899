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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;

/**
 * Summary metadata of a sealed trace. Everything except {@link #getTags() tags} and {@link #getLocation() location}
 * is fixed at sealing time; the search API filters and orders over these fields.
 */
@Immutable
@Style(visibility = Style.ImplementationVisibility.PACKAGE)
@JsonSerialize(as = ImmutableTraceInfo.class)
@JsonDeserialize(as = ImmutableTraceInfo.class)
public abstract class TraceInfo {

    public abstract String getTraceId();

    /** Name of the root span. */
    public abstract String getName();

    public abstract long getStartTimeMicroSeconds();

    /** Root span end minus root span start. */
    public abstract long getDurationNanoSeconds();

    /** {@link SpanStatus#ERROR} if any span of the trace errored, {@link SpanStatus#OK} otherwise. */
    public abstract SpanStatus getStatus();

    /** Truncated JSON rendering of the root span inputs. */
    public abstract Optional<String> getRequestPreview();

    /** Truncated JSON rendering of the root span outputs. */
    public abstract Optional<String> getResponsePreview();

    public abstract Map<String, String> getTags();

    /** Where a sink persisted the trace, if it reports one. */
    public abstract Optional<String> getLocation();

    /** Trace-level events, such as the record of a forced closure. */
    public abstract List<SpanEvent> getEvents();

    @JsonIgnore
    public final long getTimestampMillis() {
        return getStartTimeMicroSeconds() / 1000;
    }

    @JsonIgnore
    public final long getExecutionTimeMillis() {
        return getDurationNanoSeconds() / 1_000_000;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableTraceInfo.Builder {}
}
