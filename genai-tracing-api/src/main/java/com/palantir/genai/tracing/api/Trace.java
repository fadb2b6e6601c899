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

import static com.palantir.logsafe.Preconditions.checkState;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.palantir.logsafe.SafeArg;
import org.immutables.value.Value.Check;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Parameter;
import org.immutables.value.Value.Style;

/** A sealed trace: its summary plus every span recorded for it. */
@Immutable
@Style(visibility = Style.ImplementationVisibility.PACKAGE)
@JsonSerialize(as = ImmutableTrace.class)
@JsonDeserialize(as = ImmutableTrace.class)
public abstract class Trace {

    @Parameter
    public abstract TraceInfo getInfo();

    @Parameter
    public abstract TraceData getData();

    @JsonIgnore
    public final String getTraceId() {
        return getInfo().getTraceId();
    }

    @Check
    protected void check() {
        for (Span span : getData().getSpans()) {
            checkState(
                    span.getTraceId().equals(getInfo().getTraceId()),
                    "span belongs to a different trace",
                    SafeArg.of("traceId", getInfo().getTraceId()),
                    SafeArg.of("spanId", span.getSpanId()),
                    SafeArg.of("spanTraceId", span.getTraceId()));
        }
    }

    public static Trace of(TraceInfo info, TraceData data) {
        return ImmutableTrace.of(info, data);
    }
}
