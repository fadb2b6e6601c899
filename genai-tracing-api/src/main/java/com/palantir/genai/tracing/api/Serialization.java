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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * JSON representation of traces. Every field of {@link Trace}, including nested {@link Value} payloads and event
 * lists, survives a round trip. Files hold one trace per line.
 */
public final class Serialization {

    private static final ObjectMapper mapper = newObjectMapper();

    private Serialization() {}

    public static ObjectMapper newObjectMapper() {
        return JsonMapper.builder()
                // non-finite doubles are written as bare NaN / Infinity tokens so they read back as numbers
                .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .build()
                .registerModule(new Jdk8Module())
                .registerModule(new GuavaModule())
                // empty optionals are omitted, so an explicit null payload stays distinguishable from no payload
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static String toJson(Trace trace) {
        return write(trace, "trace");
    }

    public static String toJson(Value value) {
        return write(value, "value");
    }

    public static Trace traceFromJson(String json) {
        try {
            return mapper.readValue(json, Trace.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to JSON deserialize trace", e);
        }
    }

    public static Value valueFromJson(String json) {
        try {
            return mapper.readValue(json, Value.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to JSON deserialize value", e);
        }
    }

    public static List<Trace> deserialize(Path file) throws IOException {
        try (Stream<String> lines = Files.lines(file)) {
            return lines.filter(line -> !line.isBlank())
                    .map(Serialization::traceFromJson)
                    .collect(ImmutableList.toImmutableList());
        }
    }

    public static void serialize(Path file, Collection<Trace> traces) throws IOException {
        createParentDirectories(file);
        try (OutputStream outputStream = Files.newOutputStream(file)) {
            for (Trace trace : traces) {
                writeLine(outputStream, trace);
            }
        }
    }

    /** Appends a single trace to a JSON-lines file, creating the file if necessary. */
    public static void append(Path file, Trace trace) throws IOException {
        createParentDirectories(file);
        try (OutputStream outputStream =
                Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writeLine(outputStream, trace);
        }
    }

    private static void writeLine(OutputStream outputStream, Trace trace) throws IOException {
        outputStream.write(mapper.writeValueAsBytes(trace));
        outputStream.write('\n');
    }

    private static void createParentDirectories(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static String write(Object object, String description) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to JSON serialize " + description, e);
        }
    }
}
