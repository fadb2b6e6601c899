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
import com.palantir.logsafe.Preconditions;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * One {@code field op literal} term of a filter. The field is either a {@link TraceField} or a tag key. Comparisons
 * against absent values, such as a missing tag or preview, never match.
 */
public final class Comparison {
    private final Optional<TraceField> field;
    private final Optional<String> tagKey;
    private final ComparisonOperator operator;
    private final String literal;

    @Nullable
    private final BigDecimal numericLiteral;

    @Nullable
    private final Pattern pattern;

    private Comparison(
            Optional<TraceField> field,
            Optional<String> tagKey,
            ComparisonOperator operator,
            String literal,
            @Nullable BigDecimal numericLiteral) {
        this.field = field;
        this.tagKey = tagKey;
        this.operator = Preconditions.checkNotNull(operator, "operator");
        this.literal = Preconditions.checkNotNull(literal, "literal");
        this.numericLiteral = numericLiteral;
        this.pattern = operator.isPattern() ? likePattern(literal, operator == ComparisonOperator.ILIKE) : null;
    }

    static Comparison onField(
            TraceField field, ComparisonOperator operator, String literal, @Nullable BigDecimal numericLiteral) {
        return new Comparison(Optional.of(field), Optional.empty(), operator, literal, numericLiteral);
    }

    static Comparison onTag(
            String tagKey, ComparisonOperator operator, String literal, @Nullable BigDecimal numericLiteral) {
        return new Comparison(Optional.empty(), Optional.of(tagKey), operator, literal, numericLiteral);
    }

    public Optional<TraceField> field() {
        return field;
    }

    public Optional<String> tagKey() {
        return tagKey;
    }

    public ComparisonOperator operator() {
        return operator;
    }

    public String literal() {
        return literal;
    }

    public boolean matches(TraceInfo info) {
        Object actual = field.isPresent()
                ? field.get().extract(info)
                : info.getTags().get(tagKey.get());
        if (actual == null) {
            return false;
        }
        if (pattern != null) {
            return pattern.matcher(actual.toString()).matches();
        }
        return operator.accepts(compare(actual));
    }

    private int compare(Object actual) {
        if (actual instanceof Long) {
            // numeric fields only admit numeric literals, see FilterParser
            return BigDecimal.valueOf((Long) actual).compareTo(numericLiteral);
        }
        String text = actual.toString();
        if (numericLiteral != null) {
            Optional<BigDecimal> number = parseNumber(text);
            if (number.isPresent()) {
                return number.get().compareTo(numericLiteral);
            }
        }
        return text.compareTo(literal);
    }

    private static Optional<BigDecimal> parseNumber(String text) {
        try {
            return Optional.of(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Translates SQL {@code LIKE} wildcards: {@code %} matches any run of characters and {@code _} exactly one. */
    static Pattern likePattern(String like, boolean caseInsensitive) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literalRun = new StringBuilder();
        for (int i = 0; i < like.length(); i++) {
            char ch = like.charAt(i);
            if (ch == '%' || ch == '_') {
                if (literalRun.length() > 0) {
                    regex.append(Pattern.quote(literalRun.toString()));
                    literalRun.setLength(0);
                }
                regex.append(ch == '%' ? ".*" : ".");
            } else {
                literalRun.append(ch);
            }
        }
        if (literalRun.length() > 0) {
            regex.append(Pattern.quote(literalRun.toString()));
        }
        int flags = Pattern.DOTALL;
        if (caseInsensitive) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        return Pattern.compile(regex.toString(), flags);
    }

    @Override
    public String toString() {
        String target = field.map(TraceField::fieldName).orElseGet(() -> "tags.`" + tagKey.get() + '`');
        String value = numericLiteral != null ? literal : "'" + literal + "'";
        return target + ' ' + operator.symbol() + ' ' + value;
    }
}
