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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;

/**
 * The spans of one trace, ordered by start time with ties in the order they were finalized. The tree is
 * reconstructed through {@link Span#getParentSpanId()}.
 */
@Immutable
@Style(visibility = Style.ImplementationVisibility.PACKAGE)
@JsonSerialize(as = ImmutableTraceData.class)
@JsonDeserialize(as = ImmutableTraceData.class)
public abstract class TraceData {

    public abstract List<Span> getSpans();

    public final Optional<Span> rootSpan() {
        return getSpans().stream().filter(Span::isRoot).findFirst();
    }

    public final List<Span> children(String spanId) {
        return getSpans().stream()
                .filter(span -> span.getParentSpanId().filter(spanId::equals).isPresent())
                .collect(ImmutableList.toImmutableList());
    }

    public static TraceData of(Iterable<? extends Span> spans) {
        return builder().spans(spans).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableTraceData.Builder {}
}
