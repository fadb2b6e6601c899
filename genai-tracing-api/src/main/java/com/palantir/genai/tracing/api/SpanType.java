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

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * The kind of operation a span represents. The well-known GenAI kinds are exposed as constants; applications may
 * supply their own kinds through {@link #of(String)}, which are carried verbatim.
 */
public final class SpanType {
    public static final SpanType CHAIN = new SpanType("CHAIN", false);
    public static final SpanType LLM = new SpanType("LLM", false);
    public static final SpanType CHAT_MODEL = new SpanType("CHAT_MODEL", false);
    public static final SpanType RETRIEVER = new SpanType("RETRIEVER", false);
    public static final SpanType EMBEDDING = new SpanType("EMBEDDING", false);
    public static final SpanType PARSER = new SpanType("PARSER", false);
    public static final SpanType AGENT = new SpanType("AGENT", false);
    public static final SpanType TOOL = new SpanType("TOOL", false);
    public static final SpanType RERANKER = new SpanType("RERANKER", false);
    public static final SpanType UNKNOWN = new SpanType("UNKNOWN", false);

    private static final ImmutableMap<String, SpanType> KNOWN = Stream.of(
                    CHAIN, LLM, CHAT_MODEL, RETRIEVER, EMBEDDING, PARSER, AGENT, TOOL, RERANKER, UNKNOWN)
            .collect(ImmutableMap.toImmutableMap(SpanType::value, Function.identity()));

    private final String value;
    private final boolean custom;

    private SpanType(String value, boolean custom) {
        this.value = value;
        this.custom = custom;
    }

    /**
     * Returns the span type for the given name. Names of the well-known kinds are matched case-insensitively and
     * resolve to the constants; any other non-empty name becomes a custom type.
     */
    @JsonCreator
    public static SpanType of(String value) {
        checkArgument(!Strings.isNullOrEmpty(value), "span type must be non-empty");
        SpanType known = KNOWN.get(value.toUpperCase(Locale.ROOT));
        return known != null ? known : new SpanType(value, true);
    }

    public static Collection<SpanType> knownTypes() {
        return KNOWN.values();
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** True if this type was supplied by the application rather than being one of the well-known kinds. */
    public boolean isCustom() {
        return custom;
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof SpanType && value.equals(((SpanType) other).value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
