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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.palantir.logsafe.Arg;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive descent parser for trace filters.
 *
 * <pre>
 * filter     := comparison ( AND comparison )*
 * comparison := field operator literal
 * field      := segment ( '.' segment )*       segment is a bare word or a `backquoted` word
 * operator   := '=' | '!=' | '&lt;&gt;' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=' | LIKE | ILIKE
 * literal    := 'string' | "string" | number
 * </pre>
 *
 * <p>Keywords are case-insensitive. Fields prefixed with {@code attributes.} or bare names refer to
 * {@link TraceField}s, fields prefixed with {@code tags.} to trace tags.
 */
final class FilterParser {
    private static final CharMatcher WORD = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('A', 'Z'))
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf("_-"))
            .precomputed();
    private static final CharMatcher OPERATOR = CharMatcher.anyOf("=!<>");
    private static final Set<String> ATTRIBUTE_PREFIXES = Set.of("attributes", "attribute", "attr");
    private static final Set<String> TAG_PREFIXES = Set.of("tags", "tag");

    private final String filter;
    private int position;

    FilterParser(String filter) {
        this.filter = filter;
    }

    FilterExpression parse() {
        List<Comparison> comparisons = new ArrayList<>();
        comparisons.add(comparison());
        skipWhitespace();
        while (!atEnd()) {
            expectKeyword("AND");
            comparisons.add(comparison());
            skipWhitespace();
        }
        return new FilterExpression(comparisons);
    }

    private Comparison comparison() {
        skipWhitespace();
        int fieldStart = position;
        List<String> segments = field();
        ComparisonOperator operator = operator();
        skipWhitespace();
        boolean quoted = peek() == '\'' || peek() == '"';
        String literal = quoted ? quotedString() : number();
        BigDecimal number = quoted ? null : new BigDecimal(literal);

        String head = segments.get(0).toLowerCase(Locale.ROOT);
        if (segments.size() > 1 && TAG_PREFIXES.contains(head)) {
            return Comparison.onTag(
                    Joiner.on('.').join(segments.subList(1, segments.size())), operator, literal, number);
        }
        List<String> fieldSegments = segments.size() > 1 && ATTRIBUTE_PREFIXES.contains(head)
                ? segments.subList(1, segments.size())
                : segments;
        String fieldName = Joiner.on('.').join(fieldSegments);
        TraceField field = TraceField.fromName(fieldName)
                .orElseThrow(() -> error("Unknown trace field", fieldStart, SafeArg.of("field", fieldName)));
        if (field.isNumeric() && (number == null || operator.isPattern())) {
            throw error(
                    "Numeric field requires a numeric literal and a comparison operator",
                    fieldStart,
                    SafeArg.of("field", field.fieldName()),
                    SafeArg.of("operator", operator.symbol()));
        }
        if (field == TraceField.STATUS && !operator.isPattern()) {
            literal = literal.toUpperCase(Locale.ROOT);
        }
        return Comparison.onField(field, operator, literal, number);
    }

    private List<String> field() {
        List<String> segments = new ArrayList<>();
        segments.add(segment());
        while (!atEnd() && peek() == '.') {
            position++;
            segments.add(segment());
        }
        return segments;
    }

    private String segment() {
        if (!atEnd() && peek() == '`') {
            int start = ++position;
            int end = filter.indexOf('`', start);
            if (end < 0) {
                throw error("Unterminated backquoted name", start - 1);
            }
            position = end + 1;
            return filter.substring(start, end);
        }
        String word = word();
        if (word.isEmpty()) {
            throw error("Expected a field name", position);
        }
        return word;
    }

    private ComparisonOperator operator() {
        skipWhitespace();
        int start = position;
        String symbol;
        if (!atEnd() && OPERATOR.matches(peek())) {
            while (!atEnd() && OPERATOR.matches(peek())) {
                position++;
            }
            symbol = filter.substring(start, position);
        } else {
            symbol = word();
        }
        String found = symbol;
        return ComparisonOperator.fromSymbol(symbol)
                .orElseThrow(() -> error("Expected a comparison operator", start, UnsafeArg.of("found", found)));
    }

    private String quotedString() {
        char quote = filter.charAt(position);
        int start = position++;
        StringBuilder value = new StringBuilder();
        while (!atEnd()) {
            char ch = filter.charAt(position++);
            if (ch == quote) {
                return value.toString();
            }
            if (ch == '\\' && !atEnd()) {
                ch = filter.charAt(position++);
            }
            value.append(ch);
        }
        throw error("Unterminated string literal", start);
    }

    private String number() {
        int start = position;
        if (!atEnd() && (peek() == '-' || peek() == '+')) {
            position++;
        }
        while (!atEnd() && (CharMatcher.inRange('0', '9').matches(peek()) || peek() == '.')) {
            position++;
        }
        if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
            position++;
            if (!atEnd() && (peek() == '-' || peek() == '+')) {
                position++;
            }
            while (!atEnd() && CharMatcher.inRange('0', '9').matches(peek())) {
                position++;
            }
        }
        String text = filter.substring(start, position);
        try {
            new BigDecimal(text);
            return text;
        } catch (NumberFormatException e) {
            throw error("Expected a quoted string or a number", start);
        }
    }

    private void expectKeyword(String keyword) {
        int start = position;
        String word = word();
        if (!word.equalsIgnoreCase(keyword)) {
            throw error("Expected keyword", start, SafeArg.of("keyword", keyword), UnsafeArg.of("found", word));
        }
    }

    private String word() {
        int start = position;
        while (!atEnd() && WORD.matches(peek())) {
            position++;
        }
        return filter.substring(start, position);
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            position++;
        }
    }

    private boolean atEnd() {
        return position >= filter.length();
    }

    private char peek() {
        return atEnd() ? '\0' : filter.charAt(position);
    }

    private SafeIllegalArgumentException error(String message, int at, Arg<?>... extra) {
        Arg<?>[] args = new Arg<?>[extra.length + 2];
        args[0] = SafeArg.of("position", at);
        args[1] = UnsafeArg.of("filter", filter);
        System.arraycopy(extra, 0, args, 2, extra.length);
        return new SafeIllegalArgumentException("Invalid trace filter: " + message, args);
    }
}
