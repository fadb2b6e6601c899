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

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.genai.tracing.api.SpanStatus;
import com.palantir.genai.tracing.api.TraceInfo;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import org.junit.jupiter.api.Test;

public final class FilterExpressionTest {
    private static final String NUMERIC_FIELD_MESSAGE =
            "Numeric field requires a numeric literal and a comparison operator";

    private static final TraceInfo CHAT = TraceInfo.builder()
            .traceId("0af7651916cd43dd8448eb211c80319c")
            .name("chat_completion")
            .startTimeMicroSeconds(1_700_000_000_123_000L)
            .durationNanoSeconds(2_500_000_000L)
            .status(SpanStatus.ERROR)
            .requestPreview("{\"question\":\"What is MLflow?\"}")
            .putTags("user id", "42")
            .putTags("env", "prod")
            .build();

    @Test
    public void testBlankFilterMatchesEverything() {
        assertThat(FilterExpression.parse(null).comparisons()).isEmpty();
        assertThat(FilterExpression.parse("   ").matches(CHAT)).isTrue();
        assertThat(FilterExpression.matchAll().matches(CHAT)).isTrue();
    }

    @Test
    public void testFieldComparisons() {
        assertThat(matches("name = 'chat_completion'")).isTrue();
        assertThat(matches("attributes.name = \"chat_completion\"")).isTrue();
        assertThat(matches("name != 'chat_completion'")).isFalse();
        assertThat(matches("status = 'error'")).isTrue();
        assertThat(matches("timestamp_ms = 1700000000123")).isTrue();
        assertThat(matches("timestamp > 1700000000000 AND execution_time_ms >= 2500")).isTrue();
        assertThat(matches("execution_time < 2500")).isFalse();
        assertThat(matches("`trace_id` = '0af7651916cd43dd8448eb211c80319c'")).isTrue();
    }

    @Test
    public void testPatternComparisons() {
        assertThat(matches("name LIKE 'chat%'")).isTrue();
        assertThat(matches("name LIKE 'CHAT%'")).isFalse();
        assertThat(matches("name ILIKE 'CHAT%'")).isTrue();
        assertThat(matches("name like 'chat_completio_'")).isTrue();
        assertThat(matches("request_preview LIKE '%MLflow%'")).isTrue();
        assertThat(matches("request_preview LIKE '%.*%'")).isFalse();
        assertThat(matches("response_preview LIKE '%'")).isFalse();
    }

    @Test
    public void testTagComparisons() {
        assertThat(matches("tags.`user id` = '42'")).isTrue();
        assertThat(matches("tags.`user id` > 9")).isTrue();
        assertThat(matches("tag.env = 'prod' AND tags.env != 'dev'")).isTrue();
        assertThat(matches("tags.missing = 'x'")).isFalse();
        assertThat(matches("tags.missing != 'x'")).isFalse();
    }

    @Test
    public void testQuotedStringEscapes() {
        TraceInfo quoted = TraceInfo.builder().from(CHAT).name("it's").build();
        assertThat(FilterExpression.parse("name = 'it\\'s'").matches(quoted)).isTrue();
        assertThat(FilterExpression.parse("name = \"it's\"").matches(quoted)).isTrue();
    }

    @Test
    public void testToStringRoundTrips() {
        FilterExpression expression = FilterExpression.parse("name = 'a' AND tags.env != 'b' AND timestamp >= 5");
        assertThat(expression.toString()).isEqualTo("name = 'a' AND tags.`env` != 'b' AND timestamp_ms >= 5");
        assertThat(FilterExpression.parse(expression.toString()).toString()).isEqualTo(expression.toString());
    }

    @Test
    public void testUnknownFieldIsRejected() {
        assertThatLoggableExceptionThrownBy(() -> FilterExpression.parse("colour = 'red'"))
                .isInstanceOf(SafeIllegalArgumentException.class)
                .hasLogMessage("Invalid trace filter: Unknown trace field")
                .containsArgs(SafeArg.of("position", 0), SafeArg.of("field", "colour"));
    }

    @Test
    public void testMalformedFiltersAreRejected() {
        assertRejected("name", "Expected a comparison operator");
        assertRejected("name = ", "Expected a quoted string or a number");
        assertRejected("name = 'open", "Unterminated string literal");
        assertRejected("tags.`open = 'x'", "Unterminated backquoted name");
        assertRejected("name = 'a' OR name = 'b'", "Expected keyword");
        assertRejected("= 'a'", "Expected a field name");
        assertRejected("timestamp_ms = 'yesterday'", NUMERIC_FIELD_MESSAGE);
        assertRejected("execution_time_ms LIKE '1%'", NUMERIC_FIELD_MESSAGE);
    }

    private static boolean matches(String filter) {
        return FilterExpression.parse(filter).matches(CHAT);
    }

    private static void assertRejected(String filter, String message) {
        assertThatLoggableExceptionThrownBy(() -> FilterExpression.parse(filter))
                .isInstanceOf(SafeIllegalArgumentException.class)
                .hasLogMessage("Invalid trace filter: " + message);
    }
}
