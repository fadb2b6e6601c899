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
import java.util.Locale;
import java.util.Optional;
import java.util.function.IntPredicate;

public enum ComparisonOperator {
    EQUALS("=", result -> result == 0),
    NOT_EQUALS("!=", result -> result != 0),
    LESS_THAN("<", result -> result < 0),
    LESS_THAN_OR_EQUAL("<=", result -> result <= 0),
    GREATER_THAN(">", result -> result > 0),
    GREATER_THAN_OR_EQUAL(">=", result -> result >= 0),
    LIKE("LIKE", result -> result == 0),
    ILIKE("ILIKE", result -> result == 0);

    private static final ImmutableMap<String, ComparisonOperator> BY_SYMBOL =
            ImmutableMap.<String, ComparisonOperator>builder()
                    .put("=", EQUALS)
                    .put("==", EQUALS)
                    .put("!=", NOT_EQUALS)
                    .put("<>", NOT_EQUALS)
                    .put("<", LESS_THAN)
                    .put("<=", LESS_THAN_OR_EQUAL)
                    .put(">", GREATER_THAN)
                    .put(">=", GREATER_THAN_OR_EQUAL)
                    .put("LIKE", LIKE)
                    .put("ILIKE", ILIKE)
                    .buildOrThrow();

    private final String symbol;
    private final IntPredicate acceptsComparison;

    ComparisonOperator(String symbol, IntPredicate acceptsComparison) {
        this.symbol = symbol;
        this.acceptsComparison = acceptsComparison;
    }

    static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol.toUpperCase(Locale.ROOT)));
    }

    public String symbol() {
        return symbol;
    }

    boolean isPattern() {
        return this == LIKE || this == ILIKE;
    }

    /** Interprets the result of {@code actual.compareTo(literal)}. */
    boolean accepts(int comparisonResult) {
        return acceptsComparison.test(comparisonResult);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
