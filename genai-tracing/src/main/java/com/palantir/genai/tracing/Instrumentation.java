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

import java.util.concurrent.Callable;

/**
 * Adapts an operation of some library so that running it records spans. Integrations implement this interface and
 * are applied by wrapping operations before they run; they never need access to the span recorder itself.
 */
@FunctionalInterface
public interface Instrumentation {

    /** Returns an operation which behaves like the given one and records its execution. */
    <T> Callable<T> wrap(Callable<T> operation);

    /** Applies this instrumentation inside the other: the other's span encloses the span of this one. */
    default Instrumentation within(Instrumentation outer) {
        Instrumentation inner = this;
        return new Instrumentation() {
            @Override
            public <T> Callable<T> wrap(Callable<T> operation) {
                return outer.wrap(inner.wrap(operation));
            }
        };
    }

    /** An instrumentation which records nothing. */
    static Instrumentation none() {
        return new Instrumentation() {
            @Override
            public <T> Callable<T> wrap(Callable<T> operation) {
                return operation;
            }
        };
    }
}
