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
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Filters, orders and pages over a snapshot of {@link TraceInfo}s. */
public final class TraceQueryEngine {

    private TraceQueryEngine() {}

    /**
     * Returns the page of traces matching the request.
     *
     * @throws com.palantir.logsafe.exceptions.SafeIllegalArgumentException for a malformed filter, order or token
     */
    public static TracePage search(Collection<TraceInfo> traces, TraceSearchRequest request) {
        FilterExpression filter = FilterExpression.parse(request.filter().orElse(null));
        OrderBy order = OrderBy.parse(request.orderBy());

        Stream<TraceInfo> candidates = traces.stream().filter(filter::matches);
        if (request.pageToken().isPresent()) {
            List<Object> after = PageToken.decode(request.pageToken().get(), order);
            candidates = candidates.filter(info -> order.compareToKey(info, after) > 0);
        }
        List<TraceInfo> window = candidates
                .sorted(order.comparator())
                .limit(request.maxResults() + 1L)
                .collect(Collectors.toList());

        if (window.size() <= request.maxResults()) {
            return TracePage.of(window, Optional.empty());
        }
        List<TraceInfo> page = window.subList(0, request.maxResults());
        return TracePage.of(page, Optional.of(PageToken.encode(order, page.get(page.size() - 1))));
    }
}
