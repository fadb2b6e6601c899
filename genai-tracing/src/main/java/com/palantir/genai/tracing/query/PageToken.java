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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import com.palantir.genai.tracing.api.Serialization;
import com.palantir.genai.tracing.api.TraceInfo;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Opaque keyset pagination cursor. A token records the order it was issued for and the sort key of the last trace on
 * the page; the next page resumes strictly after that key, so traces inserted between requests neither shift nor
 * repeat the traces already paged through.
 */
final class PageToken {
    private static final ObjectMapper mapper = Serialization.newObjectMapper();
    private static final BaseEncoding ENCODING = BaseEncoding.base64Url().omitPadding();

    private final String order;
    private final List<Object> key;

    @JsonCreator
    PageToken(@JsonProperty("order") String order, @JsonProperty("key") List<Object> key) {
        this.order = order;
        this.key = key;
    }

    @JsonProperty("order")
    String order() {
        return order;
    }

    @JsonProperty("key")
    List<Object> key() {
        return key;
    }

    static String encode(OrderBy orderBy, TraceInfo last) {
        try {
            byte[] json = mapper.writeValueAsBytes(new PageToken(orderBy.toString(), orderBy.keyOf(last)));
            return ENCODING.encode(json);
        } catch (JsonProcessingException e) {
            throw new SafeIllegalStateException("Failed to encode page token", e);
        }
    }

    /**
     * Decodes the sort key stored in a token.
     *
     * @throws SafeIllegalArgumentException if the token is malformed or was issued for a different order
     */
    static List<Object> decode(String token, OrderBy orderBy) {
        PageToken decoded;
        try {
            decoded = mapper.readValue(ENCODING.decode(token), PageToken.class);
        } catch (IllegalArgumentException | IOException e) {
            throw new SafeIllegalArgumentException("Malformed page token", e, UnsafeArg.of("pageToken", token));
        }
        if (!orderBy.toString().equals(decoded.order)
                || decoded.key == null
                || decoded.key.size() != orderBy.keys().size()) {
            throw new SafeIllegalArgumentException(
                    "Page token was issued for a different order",
                    SafeArg.of("requestedOrder", orderBy.toString()),
                    UnsafeArg.of("pageToken", token));
        }
        List<Object> values = new ArrayList<>(decoded.key.size());
        for (int i = 0; i < decoded.key.size(); i++) {
            values.add(normalize(orderBy.keys().get(i).field(), decoded.key.get(i), token));
        }
        return values;
    }

    @Nullable
    private static Object normalize(TraceField field, @Nullable Object value, String token) {
        if (value == null) {
            return null;
        }
        if (field.isNumeric() && value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (!field.isNumeric() && value instanceof String) {
            return value;
        }
        throw new SafeIllegalArgumentException(
                "Malformed page token", SafeArg.of("field", field), UnsafeArg.of("pageToken", token));
    }
}
