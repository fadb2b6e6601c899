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

import static com.palantir.logsafe.Preconditions.checkNotNull;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A structured payload: a string, an integer, a floating point number, a boolean, null, an ordered list of values or
 * a mapping from strings to values. Span inputs, outputs, attributes and event payloads are all values; the tracing
 * core stores them without interpreting their content.
 *
 * <p>Values are immutable and serialize to the natural JSON representation.
 */
@JsonSerialize(using = Value.ValueSerializer.class)
@JsonDeserialize(using = Value.ValueDeserializer.class)
public abstract class Value {

    /** Nesting depth beyond which {@link #from(Object)} stops converting. */
    public static final int MAX_DEPTH = 64;

    /** Stands in for content {@link #from(Object)} did not convert. */
    public static final String TRUNCATED = "...";

    private static final Value NULL = new NullValue();
    private static final Value TRUE = new BooleanValue(true);
    private static final Value FALSE = new BooleanValue(false);

    private Value() {}

    public interface Visitor<T> {
        T visitString(String value);

        T visitInteger(long value);

        T visitDouble(double value);

        T visitBoolean(boolean value);

        T visitNull();

        T visitList(List<Value> values);

        T visitMap(Map<String, Value> values);
    }

    public abstract <T> T accept(Visitor<T> visitor);

    public static Value of(String value) {
        return new StringValue(checkNotNull(value, "value"));
    }

    public static Value of(long value) {
        return new IntegerValue(value);
    }

    public static Value of(double value) {
        return new DoubleValue(value);
    }

    public static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Value ofNull() {
        return NULL;
    }

    public static Value ofList(List<Value> values) {
        return new ListValue(ImmutableList.copyOf(values));
    }

    public static Value ofMap(Map<String, Value> values) {
        return new MapValue(ImmutableMap.copyOf(values));
    }

    /**
     * Converts an arbitrary Java object into a value. Maps, iterables, arrays, optionals, numbers, booleans, strings
     * and enums are converted structurally; paths and any other object are represented by their
     * {@link Object#toString()}. Structures nested deeper than {@value #MAX_DEPTH} levels, including cyclic ones, are
     * cut off with {@value #TRUNCATED}.
     */
    public static Value from(@Nullable Object object) {
        return from(object, 0);
    }

    private static Value from(@Nullable Object object, int depth) {
        if (object == null) {
            return NULL;
        }
        if (object instanceof Value) {
            return (Value) object;
        }
        if (object instanceof CharSequence || object instanceof Character) {
            return new StringValue(object.toString());
        }
        if (object instanceof Boolean) {
            return of((Boolean) object);
        }
        if (object instanceof Number) {
            return fromNumber((Number) object);
        }
        if (object instanceof Enum) {
            return new StringValue(((Enum<?>) object).name());
        }
        if (object instanceof Path) {
            // a path iterates over its own name elements, which are paths again
            return new StringValue(object.toString());
        }
        if (depth >= MAX_DEPTH) {
            return new StringValue(TRUNCATED);
        }
        if (object instanceof Optional) {
            return from(((Optional<?>) object).orElse(null), depth + 1);
        }
        if (object instanceof Map) {
            ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) object).entrySet()) {
                builder.put(String.valueOf(entry.getKey()), from(entry.getValue(), depth + 1));
            }
            return new MapValue(builder.buildKeepingLast());
        }
        if (object instanceof Iterable) {
            ImmutableList.Builder<Value> builder = ImmutableList.builder();
            for (Object element : (Iterable<?>) object) {
                builder.add(element == object ? new StringValue(TRUNCATED) : from(element, depth + 1));
            }
            return new ListValue(builder.build());
        }
        if (object.getClass().isArray()) {
            int length = Array.getLength(object);
            ImmutableList.Builder<Value> builder = ImmutableList.builderWithExpectedSize(length);
            for (int i = 0; i < length; i++) {
                builder.add(from(Array.get(object, i), depth + 1));
            }
            return new ListValue(builder.build());
        }
        return new StringValue(object.toString());
    }

    private static Value fromNumber(Number number) {
        if (number instanceof Double || number instanceof Float || number instanceof BigDecimal) {
            return new DoubleValue(number.doubleValue());
        }
        if (number instanceof BigInteger && ((BigInteger) number).bitLength() >= Long.SIZE) {
            return new DoubleValue(number.doubleValue());
        }
        return new IntegerValue(number.longValue());
    }

    /** Converts this value back into plain Java objects: strings, longs, doubles, booleans, lists and maps. */
    @Nullable
    public final Object toJavaObject() {
        return accept(ToJavaObject.INSTANCE);
    }

    public final boolean isNull() {
        return this == NULL;
    }

    @Override
    public final String toString() {
        return String.valueOf(toJavaObject());
    }

    private static final class StringValue extends Value {
        private final String value;

        StringValue(String value) {
            this.value = value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitString(value);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof StringValue && value.equals(((StringValue) other).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    private static final class IntegerValue extends Value {
        private final long value;

        IntegerValue(long value) {
            this.value = value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitInteger(value);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof IntegerValue && value == ((IntegerValue) other).value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }
    }

    private static final class DoubleValue extends Value {
        private final double value;

        DoubleValue(double value) {
            this.value = value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitDouble(value);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof DoubleValue
                    && Double.doubleToLongBits(value) == Double.doubleToLongBits(((DoubleValue) other).value);
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }
    }

    private static final class BooleanValue extends Value {
        private final boolean value;

        BooleanValue(boolean value) {
            this.value = value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitBoolean(value);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof BooleanValue && value == ((BooleanValue) other).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }
    }

    private static final class NullValue extends Value {
        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitNull();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof NullValue;
        }

        @Override
        public int hashCode() {
            return 0;
        }
    }

    private static final class ListValue extends Value {
        private final ImmutableList<Value> values;

        ListValue(ImmutableList<Value> values) {
            this.values = values;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitList(values);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof ListValue && values.equals(((ListValue) other).values);
        }

        @Override
        public int hashCode() {
            return values.hashCode();
        }
    }

    private static final class MapValue extends Value {
        private final ImmutableMap<String, Value> values;

        MapValue(ImmutableMap<String, Value> values) {
            this.values = values;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitMap(values);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof MapValue && values.equals(((MapValue) other).values);
        }

        @Override
        public int hashCode() {
            return values.hashCode();
        }
    }

    private enum ToJavaObject implements Visitor<Object> {
        INSTANCE;

        @Override
        public Object visitString(String value) {
            return value;
        }

        @Override
        public Object visitInteger(long value) {
            return value;
        }

        @Override
        public Object visitDouble(double value) {
            return value;
        }

        @Override
        public Object visitBoolean(boolean value) {
            return value;
        }

        @Override
        @Nullable
        public Object visitNull() {
            return null;
        }

        @Override
        public Object visitList(List<Value> values) {
            List<Object> result = new ArrayList<>(values.size());
            for (Value value : values) {
                result.add(value.toJavaObject());
            }
            return result;
        }

        @Override
        public Object visitMap(Map<String, Value> values) {
            Map<String, Object> result = new LinkedHashMap<>();
            values.forEach((key, value) -> result.put(key, value.toJavaObject()));
            return result;
        }
    }

    static final class ValueSerializer extends JsonSerializer<Value> {
        @Override
        public void serialize(Value value, JsonGenerator generator, SerializerProvider provider) throws IOException {
            try {
                value.accept(new Writer(generator, provider));
            } catch (JsonWriteFailure e) {
                throw e.getCause();
            }
        }

        private final class Writer implements Visitor<Void> {
            private final JsonGenerator generator;
            private final SerializerProvider provider;

            Writer(JsonGenerator generator, SerializerProvider provider) {
                this.generator = generator;
                this.provider = provider;
            }

            @Override
            public Void visitString(String string) {
                return write(() -> generator.writeString(string));
            }

            @Override
            public Void visitInteger(long number) {
                return write(() -> generator.writeNumber(number));
            }

            @Override
            public Void visitDouble(double number) {
                return write(() -> generator.writeNumber(number));
            }

            @Override
            public Void visitBoolean(boolean bool) {
                return write(() -> generator.writeBoolean(bool));
            }

            @Override
            public Void visitNull() {
                return write(generator::writeNull);
            }

            @Override
            public Void visitList(List<Value> values) {
                return write(() -> {
                    generator.writeStartArray();
                    for (Value element : values) {
                        serialize(element, generator, provider);
                    }
                    generator.writeEndArray();
                });
            }

            @Override
            public Void visitMap(Map<String, Value> values) {
                return write(() -> {
                    generator.writeStartObject();
                    for (Map.Entry<String, Value> entry : values.entrySet()) {
                        generator.writeFieldName(entry.getKey());
                        serialize(entry.getValue(), generator, provider);
                    }
                    generator.writeEndObject();
                });
            }
        }

        private static Void write(IoAction action) {
            try {
                action.run();
            } catch (IOException e) {
                throw new JsonWriteFailure(e);
            }
            return null;
        }

        private interface IoAction {
            void run() throws IOException;
        }
    }

    static final class ValueDeserializer extends JsonDeserializer<Value> {
        @Override
        public Value deserialize(JsonParser parser, DeserializationContext _context) throws IOException {
            return fromNode(parser.readValueAsTree());
        }

        @Override
        public Value getNullValue(DeserializationContext _context) {
            return NULL;
        }

        private static Value fromNode(JsonNode node) {
            if (node == null || node.isNull() || node.isMissingNode()) {
                return NULL;
            }
            if (node.isTextual()) {
                return new StringValue(node.textValue());
            }
            if (node.isBoolean()) {
                return of(node.booleanValue());
            }
            if (node.isIntegralNumber() && node.canConvertToLong()) {
                return new IntegerValue(node.longValue());
            }
            if (node.isNumber()) {
                return new DoubleValue(node.doubleValue());
            }
            if (node.isArray()) {
                ImmutableList.Builder<Value> builder = ImmutableList.builderWithExpectedSize(node.size());
                for (JsonNode element : node) {
                    builder.add(fromNode(element));
                }
                return new ListValue(builder.build());
            }
            if (node.isObject()) {
                ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    builder.put(field.getKey(), fromNode(field.getValue()));
                }
                return new MapValue(builder.buildKeepingLast());
            }
            return new StringValue(node.asText());
        }
    }

    /** Carries an {@link IOException} out of a visitor, unwrapped again by {@link ValueSerializer}. */
    static final class JsonWriteFailure extends RuntimeException {
        private static final long serialVersionUID = 1L;

        JsonWriteFailure(IOException cause) {
            super(cause);
        }

        @Override
        public synchronized IOException getCause() {
            return (IOException) super.getCause();
        }
    }
}
