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

import com.palantir.genai.tracing.api.TraceInfo;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/** One page of search results. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class TracePage {

    public abstract List<TraceInfo> traces();

    /** Present if more traces match; pass it as {@link TraceSearchRequest#pageToken()} to fetch them. */
    public abstract Optional<String> nextPageToken();

    static TracePage of(List<TraceInfo> traces, Optional<String> nextPageToken) {
        return ImmutableTracePage.builder()
                .traces(traces)
                .nextPageToken(nextPageToken)
                .build();
    }
}
