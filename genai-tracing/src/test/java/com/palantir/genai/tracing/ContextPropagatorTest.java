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

package com.palantir.genai.tracing;

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.genai.tracing.api.SpanType;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

public final class ContextPropagatorTest {

    private final LiveSpan root = span("root", Optional.empty());
    private final LiveSpan child = span("child", Optional.of(root.spanId()));
    private final LiveSpan grandchild = span("grandchild", Optional.of(child.spanId()));

    @BeforeEach
    public void before() {
        MDC.clear();
        ContextPropagator.set(SpanContext.empty());
    }

    @AfterEach
    public void after() {
        ContextPropagator.set(SpanContext.empty());
    }

    @Test
    public void testEmptyContext() {
        SpanContext context = ContextPropagator.current();
        assertThat(context.isEmpty()).isTrue();
        assertThat(context.depth()).isZero();
        assertThat(context.currentSpanId()).isEmpty();
        assertThat(context.currentTraceId()).isEmpty();
        assertThat(context.pop()).isSameAs(SpanContext.empty());
    }

    @Test
    public void testPushIsPersistent() {
        SpanContext first = SpanContext.empty().push(root);
        SpanContext second = first.push(child);

        assertThat(first.depth()).isOne();
        assertThat(first.currentSpanId()).hasValue(root.spanId());
        assertThat(second.depth()).isEqualTo(2);
        assertThat(second.currentSpanId()).hasValue(child.spanId());
        assertThat(second.pop()).isSameAs(first);
        assertThat(second.contains(root)).isTrue();
        assertThat(first.contains(child)).isFalse();
    }

    @Test
    public void testWithoutRemovesSpanFromTheMiddle() {
        SpanContext full = SpanContext.empty().push(root).push(child).push(grandchild);

        SpanContext withoutChild = full.without(child);
        assertThat(withoutChild.depth()).isEqualTo(2);
        assertThat(withoutChild.currentSpanId()).hasValue(grandchild.spanId());
        assertThat(withoutChild.pop().currentSpanId()).hasValue(root.spanId());
        assertThat(full.without(span("unrelated", Optional.empty()))).isSameAs(full);
        assertThat(full.without(grandchild)).isEqualTo(SpanContext.empty().push(root).push(child));
    }

    @Test
    public void testPushAndRemoveMaintainMdc() {
        ContextPropagator.push(root);
        assertThat(MDC.get(ContextPropagator.TRACE_ID_KEY)).isEqualTo("trace");
        assertThat(MDC.get(ContextPropagator.SPAN_ID_KEY)).isEqualTo(root.spanId());

        ContextPropagator.push(child);
        assertThat(MDC.get(ContextPropagator.SPAN_ID_KEY)).isEqualTo(child.spanId());

        ContextPropagator.remove(child);
        assertThat(MDC.get(ContextPropagator.SPAN_ID_KEY)).isEqualTo(root.spanId());

        ContextPropagator.remove(root);
        assertThat(ContextPropagator.current().isEmpty()).isTrue();
        assertThat(MDC.get(ContextPropagator.SPAN_ID_KEY)).isNull();
        assertThat(MDC.get(ContextPropagator.TRACE_ID_KEY)).isNull();
    }

    @Test
    public void testRemovingOuterSpanKeepsInnerActive() {
        ContextPropagator.push(root);
        ContextPropagator.push(child);

        ContextPropagator.remove(root);
        assertThat(ContextPropagator.currentSpanId()).hasValue(child.spanId());
        assertThat(ContextPropagator.current().depth()).isOne();

        ContextPropagator.remove(root);
        assertThat(ContextPropagator.current().depth()).isOne();
    }

    @Test
    public void testAttachRestoresPreviousContext() {
        ContextPropagator.push(root);
        SpanContext captured = ContextPropagator.current().push(child);

        try (ContextScope ignored = ContextPropagator.attach(SpanContext.empty())) {
            assertThat(ContextPropagator.currentSpanId()).isEmpty();
            assertThat(MDC.get(ContextPropagator.SPAN_ID_KEY)).isNull();
            try (ContextScope nested = ContextPropagator.attach(captured)) {
                assertThat(ContextPropagator.currentSpanId()).hasValue(child.spanId());
                ContextPropagator.push(grandchild);
            }
            assertThat(ContextPropagator.currentSpanId()).isEmpty();
        }

        assertThat(ContextPropagator.currentSpanId()).hasValue(root.spanId());
        assertThat(MDC.get(ContextPropagator.SPAN_ID_KEY)).isEqualTo(root.spanId());
    }

    @Test
    public void testClosingScopeTwiceRestoresOnce() {
        ContextScope scope = ContextPropagator.attach(SpanContext.empty().push(root));
        scope.close();
        ContextPropagator.push(child);
        scope.close();
        assertThat(ContextPropagator.currentSpanId()).hasValue(child.spanId());
    }

    private static LiveSpan span(String name, Optional<String> parentSpanId) {
        return new LiveSpan("trace", Ids.nextSpanId(), parentSpanId, name, SpanType.CHAIN, 0, 0, Optional.empty());
    }
}
