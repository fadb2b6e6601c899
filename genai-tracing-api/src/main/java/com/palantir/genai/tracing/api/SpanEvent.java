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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Map;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;

/** A named, timestamped occurrence recorded during the lifetime of a span or on a trace as a whole. */
@Immutable
@Style(visibility = Style.ImplementationVisibility.PACKAGE)
@JsonSerialize(as = ImmutableSpanEvent.class)
@JsonDeserialize(as = ImmutableSpanEvent.class)
public abstract class SpanEvent {

    public abstract String getName();

    /** Microseconds since epoch at which the event occurred. */
    public abstract long getTimestampMicroSeconds();

    public abstract Map<String, Value> getAttributes();

    public static SpanEvent of(String name, long timestampMicroSeconds, Map<String, Value> attributes) {
        return builder()
                .name(name)
                .timestampMicroSeconds(timestampMicroSeconds)
                .attributes(attributes)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableSpanEvent.Builder {}
}
