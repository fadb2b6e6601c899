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

import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;

/**
 * Restores the previously installed {@link SpanContext} when closed. Obtained from {@link ContextPropagator#attach}.
 */
public final class ContextScope implements AutoCloseable {
    private static final SafeLogger log = SafeLoggerFactory.get(ContextScope.class);

    private final SpanContext previous;
    private final SpanContext attached;
    private boolean closed;

    ContextScope(SpanContext previous, SpanContext attached) {
        this.previous = previous;
        this.attached = attached;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        SpanContext current = ContextPropagator.current();
        if (!current.equals(attached)) {
            log.debug(
                    "Context changed while attached, spans started in this scope were not ended",
                    SafeArg.of("attachedDepth", attached.depth()),
                    SafeArg.of("currentDepth", current.depth()));
        }
        ContextPropagator.set(previous);
    }
}
