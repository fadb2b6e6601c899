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

import com.google.common.collect.ImmutableMap;
import com.palantir.genai.tracing.api.SpanType;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * The default {@link Instrumentation}: runs each operation in a span of a fixed name and type. Inputs are captured
 * when the operation starts and the result, optionally mapped, is recorded as outputs. The span ends as failed when
 * the operation throws and as cancelled when it is interrupted or cancelled.
 *
 * <pre>{@code
 * Instrumentation chat = SpanInstrumentation.builder("chat", SpanType.CHAT_MODEL)
 *         .inputs(() -> request)
 *         .outputs(response -> ((ChatResponse) response).text())
 *         .build();
 * ChatResponse response = chat.wrap(() -> client.complete(request)).call();
 * }</pre>
 */
public final class SpanInstrumentation implements Instrumentation {
    private static final SafeLogger log = SafeLoggerFactory.get(SpanInstrumentation.class);

    private final String name;
    private final SpanType type;
    private final Supplier<?> inputs;
    private final Function<Object, ?> outputs;
    private final ImmutableMap<String, Object> attributes;

    private SpanInstrumentation(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.inputs = builder.inputs;
        this.outputs = builder.outputs;
        this.attributes = ImmutableMap.copyOf(builder.attributes);
    }

    public static Builder builder(String name, SpanType type) {
        return new Builder(name, type);
    }

    @Override
    public <T> Callable<T> wrap(Callable<T> operation) {
        Preconditions.checkNotNull(operation, "operation");
        return () -> {
            try (ActiveSpan span = Tracer.startSpan(name, type, captureInputs())) {
                span.setAttributes(attributes);
                T result;
                try {
                    result = operation.call();
                } catch (InterruptedException | CancellationException e) {
                    span.cancel();
                    throw e;
                } catch (Exception | Error e) {
                    span.fail(e);
                    throw e;
                }
                span.end(mapOutputs(result));
                return result;
            }
        };
    }

    /** Like {@link #wrap(Callable)}, for operations which complete asynchronously. */
    public <T> Supplier<CompletableFuture<T>> wrapAsync(Supplier<? extends CompletionStage<T>> operation) {
        Preconditions.checkNotNull(operation, "operation");
        return () -> {
            ActiveSpan span = Tracer.startDetachedSpan(name, type, captureInputs());
            span.setAttributes(attributes);
            return Tracer.runAsync(span, operation, this::mapOutputs);
        };
    }

    @Nullable
    private Object captureInputs() {
        try {
            return inputs.get();
        } catch (RuntimeException e) {
            log.warn("Failed to capture span inputs", SafeArg.of("name", name), e);
            return null;
        }
    }

    @Nullable
    private Object mapOutputs(@Nullable Object result) {
        if (result == null) {
            return null;
        }
        try {
            return outputs.apply(result);
        } catch (RuntimeException e) {
            log.warn("Failed to map span outputs", SafeArg.of("name", name), e);
            return null;
        }
    }

    public static final class Builder {
        private final String name;
        private final SpanType type;
        private Supplier<?> inputs = () -> null;
        private Function<Object, ?> outputs = Function.identity();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(String name, SpanType type) {
            this.name = Preconditions.checkNotNull(name, "name");
            this.type = Preconditions.checkNotNull(type, "type");
        }

        /** Captures the span inputs each time a wrapped operation starts. */
        public Builder inputs(Supplier<?> value) {
            this.inputs = Preconditions.checkNotNull(value, "inputs");
            return this;
        }

        /** Maps a non-null result of a wrapped operation to the recorded span outputs. */
        public Builder outputs(Function<Object, ?> value) {
            this.outputs = Preconditions.checkNotNull(value, "outputs");
            return this;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(Preconditions.checkNotNull(key, "key"), Preconditions.checkNotNull(value, "value"));
            return this;
        }

        public SpanInstrumentation build() {
            return new SpanInstrumentation(this);
        }
    }
}
