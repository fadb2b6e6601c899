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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.palantir.genai.tracing.api.TraceInfo;
import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/** A parsed trace filter: a conjunction of {@link Comparison comparisons}. The empty filter matches every trace. */
public final class FilterExpression {
    private static final FilterExpression MATCH_ALL = new FilterExpression(ImmutableList.of());

    private final ImmutableList<Comparison> comparisons;

    FilterExpression(List<Comparison> comparisons) {
        this.comparisons = ImmutableList.copyOf(comparisons);
    }

    /**
     * Parses a filter such as {@code name = 'chat' AND tags.`user id` = '42' AND timestamp_ms > 1700000000000}.
     *
     * @throws com.palantir.logsafe.exceptions.SafeIllegalArgumentException if the filter is malformed
     */
    public static FilterExpression parse(@Nullable String filter) {
        if (Strings.isNullOrEmpty(filter) || filter.isBlank()) {
            return MATCH_ALL;
        }
        return new FilterParser(filter).parse();
    }

    public static FilterExpression matchAll() {
        return MATCH_ALL;
    }

    public List<Comparison> comparisons() {
        return comparisons;
    }

    public boolean matches(TraceInfo info) {
        for (Comparison comparison : comparisons) {
            if (!comparison.matches(info)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return comparisons.stream().map(Comparison::toString).collect(Collectors.joining(" AND "));
    }
}
