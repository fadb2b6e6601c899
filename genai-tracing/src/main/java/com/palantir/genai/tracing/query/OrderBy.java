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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.palantir.genai.tracing.api.TraceInfo;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * A total order over traces. Built from clauses such as {@code "execution_time_ms DESC"}; without clauses traces are
 * ordered newest first. {@code trace_id ASC} is always appended as the final tie-breaker unless the clauses already
 * order by trace id, so no two distinct traces ever compare as equal.
 */
public final class OrderBy {
    private static final Splitter WHITESPACE = Splitter.onPattern("\\s+").omitEmptyStrings().trimResults();
    private static final SortKey DEFAULT_KEY = new SortKey(TraceField.TIMESTAMP_MS, false);
    private static final SortKey TIE_BREAKER = new SortKey(TraceField.TRACE_ID, true);

    private final ImmutableList<SortKey> keys;

    private OrderBy(List<SortKey> keys) {
        this.keys = ImmutableList.copyOf(keys);
    }

    /** @throws SafeIllegalArgumentException if a clause names an unknown field or direction */
    public static OrderBy parse(List<String> clauses) {
        List<SortKey> keys = new ArrayList<>();
        for (String clause : clauses) {
            keys.add(parseClause(clause));
        }
        if (keys.isEmpty()) {
            keys.add(DEFAULT_KEY);
        }
        if (keys.stream().noneMatch(key -> key.field() == TraceField.TRACE_ID)) {
            keys.add(TIE_BREAKER);
        }
        return new OrderBy(keys);
    }

    public static OrderBy defaultOrder() {
        return parse(ImmutableList.of());
    }

    private static SortKey parseClause(String clause) {
        List<String> parts = WHITESPACE.splitToList(clause);
        if (parts.isEmpty() || parts.size() > 2) {
            throw new SafeIllegalArgumentException("Invalid order_by clause", UnsafeArg.of("clause", clause));
        }
        String fieldName = parts.get(0);
        String lower = fieldName.toLowerCase(Locale.ROOT);
        if (lower.startsWith("attributes.")) {
            fieldName = fieldName.substring("attributes.".length());
        }
        String name = fieldName;
        TraceField field = TraceField.fromName(name)
                .orElseThrow(() -> new SafeIllegalArgumentException(
                        "Unknown order_by field", UnsafeArg.of("field", name)));
        boolean ascending = true;
        if (parts.size() == 2) {
            String direction = parts.get(1).toUpperCase(Locale.ROOT);
            if (direction.equals("DESC")) {
                ascending = false;
            } else if (!direction.equals("ASC")) {
                throw new SafeIllegalArgumentException(
                        "Invalid order_by direction", SafeArg.of("field", field), UnsafeArg.of("direction", direction));
            }
        }
        return new SortKey(field, ascending);
    }

    public List<SortKey> keys() {
        return keys;
    }

    /** Returns the values of the sort fields of a trace, in key order. */
    List<Object> keyOf(TraceInfo info) {
        List<Object> values = new ArrayList<>(keys.size());
        for (SortKey key : keys) {
            values.add(key.field().extract(info));
        }
        return values;
    }

    /** Compares a trace against the sort key values of another trace. */
    int compareToKey(TraceInfo info, List<Object> keyValues) {
        for (int i = 0; i < keys.size(); i++) {
            SortKey key = keys.get(i);
            int result = compareValues(key.field(), key.field().extract(info), keyValues.get(i));
            if (result != 0) {
                return key.ascending() ? result : -result;
            }
        }
        return 0;
    }

    Comparator<TraceInfo> comparator() {
        return (left, right) -> compareToKey(left, keyOf(right));
    }

    private static int compareValues(TraceField field, @Nullable Object left, @Nullable Object right) {
        if (left == null || right == null) {
            // absent values sort first
            return left == right ? 0 : (left == null ? -1 : 1);
        }
        if (field.isNumeric()) {
            return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
        }
        return ((String) left).compareTo((String) right);
    }

    @Override
    public String toString() {
        return keys.stream().map(SortKey::toString).collect(Collectors.joining(", "));
    }

    public static final class SortKey {
        private final TraceField field;
        private final boolean ascending;

        SortKey(TraceField field, boolean ascending) {
            this.field = field;
            this.ascending = ascending;
        }

        public TraceField field() {
            return field;
        }

        public boolean ascending() {
            return ascending;
        }

        @Override
        public String toString() {
            return field.fieldName() + (ascending ? " ASC" : " DESC");
        }
    }
}
