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

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class SerializationTest {

    private static final String TRACE_ID = "0123456789abcdef0123456789abcdef";

    @Test
    public void testTraceRoundTrip() {
        Trace trace = sampleTrace();

        String json = Serialization.toJson(trace);

        assertThat(Serialization.traceFromJson(json)).isEqualTo(trace);
    }

    @Test
    public void testSpanJsonShape() {
        String json = Serialization.toJson(sampleTrace());

        assertThat(json)
                .contains("\"traceId\":\"" + TRACE_ID + "\"")
                .contains("\"type\":\"RETRIEVER\"")
                .contains("\"type\":\"my-custom-kind\"")
                .contains("\"inputs\":{\"question\":\"why?\",\"k\":3}")
                .doesNotContain("endTimeMicroSeconds")
                .doesNotContain("timestampMillis");
    }

    @Test
    public void testValueRoundTripPreservesKinds() {
        Value value = Value.from(ImmutableMap.of(
                "int", 1L,
                "double", 1.5d,
                "bool", true,
                "list", ImmutableList.of("a", ImmutableMap.of("nested", 2L)),
                "text", "quote \" and unicode é"));

        assertThat(Serialization.valueFromJson(Serialization.toJson(value))).isEqualTo(value);
    }

    @Test
    public void testNullValue() {
        assertThat(Serialization.toJson(Value.ofNull())).isEqualTo("null");
        assertThat(Serialization.valueFromJson("null")).isEqualTo(Value.ofNull());
    }

    @Test
    public void testAbsentAndNullPayloadsStayDistinct() {
        Trace trace = sampleTrace();
        Span withNullOutputs = Span.builder()
                .from(trace.getData().getSpans().get(1))
                .outputs(Value.ofNull())
                .build();
        Trace updated = Trace.of(
                trace.getInfo(), TraceData.of(ImmutableList.of(trace.getData().getSpans().get(0), withNullOutputs)));

        Trace roundTripped = Serialization.traceFromJson(Serialization.toJson(updated));

        assertThat(roundTripped.getData().getSpans().get(1).getOutputs()).hasValue(Value.ofNull());
        assertThat(Serialization.traceFromJson(Serialization.toJson(trace))
                        .getData()
                        .getSpans()
                        .get(1)
                        .getOutputs())
                .isEmpty();
    }

    @Test
    public void testUnknownPropertiesAreIgnored() {
        String json = Serialization.toJson(sampleTrace()).replaceFirst("\\{", "{\"futureField\":1,");

        assertThat(Serialization.traceFromJson(json)).isEqualTo(sampleTrace());
    }

    @Test
    public void testJsonLinesFile(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("nested").resolve("traces.jsonl");
        Trace first = sampleTrace();
        Trace second = Trace.of(
                TraceInfo.builder()
                        .from(first.getInfo())
                        .putTags("run", "2")
                        .build(),
                first.getData());

        Serialization.serialize(file, ImmutableList.of(first));
        Serialization.append(file, second);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        assertThat(Serialization.deserialize(file)).containsExactly(first, second);
    }

    private static Trace sampleTrace() {
        Span root = Span.builder()
                .traceId(TRACE_ID)
                .spanId("00000000000000a1")
                .name("answer")
                .type(SpanType.of("my-custom-kind"))
                .startTimeMicroSeconds(1_700_000_000_000_000L)
                .durationNanoSeconds(5_000_000L)
                .status(SpanStatus.OK)
                .inputs(Value.from(ImmutableMap.of("question", "why?", "k", 3)))
                .outputs(Value.of("because"))
                .build();
        Span retrieve = Span.builder()
                .traceId(TRACE_ID)
                .spanId("00000000000000b2")
                .parentSpanId(root.getSpanId())
                .name("retrieve")
                .type(SpanType.RETRIEVER)
                .startTimeMicroSeconds(1_700_000_000_001_000L)
                .durationNanoSeconds(2_000_000L)
                .status(SpanStatus.ERROR)
                .statusMessage("index unavailable")
                .inputs(Value.of("why?"))
                .putAttributes("index", Value.of("docs"))
                .addEvents(SpanEvent.of(
                        "retry", 1_700_000_000_001_500L, ImmutableMap.of("attempt", Value.of(1L))))
                .build();
        TraceInfo info = TraceInfo.builder()
                .traceId(TRACE_ID)
                .name(root.getName())
                .startTimeMicroSeconds(root.getStartTimeMicroSeconds())
                .durationNanoSeconds(root.getDurationNanoSeconds())
                .status(SpanStatus.ERROR)
                .requestPreview("{\"question\":\"why?\",\"k\":3}")
                .responsePreview("\"because\"")
                .putTags("env", "test")
                .location(Optional.of("memory:" + TRACE_ID))
                .build();
        return Trace.of(info, TraceData.of(ImmutableList.of(root, retrieve)));
    }

    @Test
    public void testNonFiniteDoublesStayNumbers() {
        Value value = Value.ofList(ImmutableList.of(
                Value.of(Double.NaN),
                Value.of(Double.POSITIVE_INFINITY),
                Value.of(Double.NEGATIVE_INFINITY),
                Value.of("NaN")));

        Value roundTripped = Serialization.valueFromJson(Serialization.toJson(value));

        assertThat(roundTripped).isEqualTo(value);
        assertThat(roundTripped.toJavaObject())
                .isEqualTo(Arrays.asList(Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, "NaN"));
    }
}
