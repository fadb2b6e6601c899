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
import java.math.BigInteger;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public final class ValueTest {

    @Test
    public void testFromConvertsNestedStructures() {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", "gpt");
        request.put("temperature", 0.5f);
        request.put("maxTokens", 256);
        request.put("stream", false);
        request.put("stop", Arrays.asList("\n", null));
        request.put("metadata", ImmutableMap.of("user", Optional.of("alice")));

        Value value = Value.from(request);

        assertThat(value.toJavaObject())
                .isEqualTo(ImmutableMap.of(
                        "model", "gpt",
                        "temperature", 0.5d,
                        "maxTokens", 256L,
                        "stream", false,
                        "stop", Arrays.asList("\n", null),
                        "metadata", ImmutableMap.of("user", "alice")));
    }

    @Test
    public void testFromNumbers() {
        assertThat(Value.from(7)).isEqualTo(Value.of(7L));
        assertThat(Value.from((short) 3)).isEqualTo(Value.of(3L));
        assertThat(Value.from(1.25d)).isEqualTo(Value.of(1.25d));
        assertThat(Value.from(BigInteger.valueOf(42))).isEqualTo(Value.of(42L));
        assertThat(Value.from(BigInteger.ONE.shiftLeft(80)).toJavaObject()).isInstanceOf(Double.class);
    }

    @Test
    public void testFromArraysAndEnums() {
        assertThat(Value.from(new int[] {1, 2})).isEqualTo(Value.ofList(ImmutableList.of(Value.of(1L), Value.of(2L))));
        assertThat(Value.from(SpanStatus.ERROR)).isEqualTo(Value.of("ERROR"));
        assertThat(Value.from('x')).isEqualTo(Value.of("x"));
    }

    @Test
    public void testFromNullAndEmptyOptional() {
        assertThat(Value.from(null).isNull()).isTrue();
        assertThat(Value.from(Optional.empty())).isEqualTo(Value.ofNull());
    }

    @Test
    public void testFromUnknownObjectUsesToString() {
        Object custom = new Object() {
            @Override
            public String toString() {
                return "custom-object";
            }
        };
        assertThat(Value.from(custom)).isEqualTo(Value.of("custom-object"));
    }

    @Test
    public void testFromExistingValueIsIdentity() {
        Value value = Value.of("hello");
        assertThat(Value.from(value)).isSameAs(value);
    }

    @Test
    public void testMapKeysAreStringified() {
        Map<Integer, String> byRank = ImmutableMap.of(1, "first", 2, "second");
        assertThat(Value.from(byRank).toJavaObject()).isEqualTo(ImmutableMap.of("1", "first", "2", "second"));
    }

    @Test
    public void testVisitor() {
        Value value = Value.ofList(ImmutableList.of(Value.of(1L), Value.of("two"), Value.ofNull()));
        List<String> visited = value.accept(new Value.Visitor<List<String>>() {
            @Override
            public List<String> visitString(String string) {
                return ImmutableList.of("string");
            }

            @Override
            public List<String> visitInteger(long number) {
                return ImmutableList.of("integer");
            }

            @Override
            public List<String> visitDouble(double number) {
                return ImmutableList.of("double");
            }

            @Override
            public List<String> visitBoolean(boolean bool) {
                return ImmutableList.of("boolean");
            }

            @Override
            public List<String> visitNull() {
                return ImmutableList.of("null");
            }

            @Override
            public List<String> visitList(List<Value> values) {
                ImmutableList.Builder<String> kinds = ImmutableList.builder();
                values.forEach(element -> kinds.addAll(element.accept(this)));
                return kinds.build();
            }

            @Override
            public List<String> visitMap(Map<String, Value> values) {
                return ImmutableList.of("map");
            }
        });
        assertThat(visited).containsExactly("integer", "string", "null");
    }

    @Test
    public void testToString() {
        assertThat(Value.of("text")).hasToString("text");
        assertThat(Value.ofNull()).hasToString("null");
    }

    @Test
    public void testFromPathUsesToString() {
        Path path = Paths.get("data.txt");

        assertThat(Value.from(path)).isEqualTo(Value.of("data.txt"));
        assertThat(Value.from(ImmutableList.of(Paths.get("in", "a.txt"))))
                .isEqualTo(Value.ofList(ImmutableList.of(Value.of(Paths.get("in", "a.txt").toString()))));
    }

    @Test
    public void testFromSelfContainingListStops() {
        List<Object> cyclic = new ArrayList<>();
        cyclic.add("head");
        cyclic.add(cyclic);

        assertThat(Value.from(cyclic))
                .isEqualTo(Value.ofList(ImmutableList.of(Value.of("head"), Value.of(Value.TRUNCATED))));
    }

    @Test
    public void testFromCutsOffDeepNesting() {
        Object nested = "bottom";
        for (int i = 0; i < 2 * Value.MAX_DEPTH; i++) {
            nested = ImmutableList.of(nested);
        }

        Object converted = Value.from(nested).toJavaObject();
        for (int i = 0; i < Value.MAX_DEPTH; i++) {
            converted = ((List<?>) converted).get(0);
        }
        assertThat(converted).isEqualTo(Value.TRUNCATED);
    }
}
