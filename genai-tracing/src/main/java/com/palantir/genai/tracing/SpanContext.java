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

import com.palantir.logsafe.Preconditions;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * An immutable stack of the spans which are active in one logical task. The innermost span is the implicit parent
 * of any span started in that task.
 *
 * <p>Pushing or popping returns a new context and leaves the receiver untouched, so a context captured when a task is
 * handed to another thread stays valid no matter what the submitting thread does afterwards.
 */
public final class SpanContext {
    private static final SpanContext EMPTY = new SpanContext(null, null, 0);

    @Nullable
    private final LiveSpan span;

    @Nullable
    private final SpanContext parent;

    private final int depth;

    private SpanContext(@Nullable LiveSpan span, @Nullable SpanContext parent, int depth) {
        this.span = span;
        this.parent = parent;
        this.depth = depth;
    }

    public static SpanContext empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return span == null;
    }

    /** Number of spans on this stack. */
    public int depth() {
        return depth;
    }

    /** Id of the innermost active span. */
    public Optional<String> currentSpanId() {
        return top().map(LiveSpan::spanId);
    }

    /** Id of the trace the innermost active span belongs to. */
    public Optional<String> currentTraceId() {
        return top().map(LiveSpan::traceId);
    }

    Optional<LiveSpan> top() {
        return Optional.ofNullable(span);
    }

    SpanContext push(LiveSpan newSpan) {
        Preconditions.checkNotNull(newSpan, "span");
        return new SpanContext(newSpan, this, depth + 1);
    }

    SpanContext pop() {
        return parent == null ? EMPTY : parent;
    }

    /**
     * Returns this context with the given span removed. Spans are usually ended innermost first, in which case this is
     * equivalent to {@link #pop()}; otherwise the spans above the removed one are kept in order.
     */
    SpanContext without(LiveSpan target) {
        if (span == null) {
            return this;
        }
        if (span == target) {
            return pop();
        }
        SpanContext rest = pop().without(target);
        return rest == parent ? this : rest.push(span);
    }

    boolean contains(LiveSpan target) {
        for (SpanContext current = this; current.span != null; current = current.pop()) {
            if (current.span == target) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SpanContext)) {
            return false;
        }
        SpanContext that = (SpanContext) other;
        return depth == that.depth && span == that.span && Objects.equals(parent, that.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(span), depth);
    }

    @Override
    public String toString() {
        return "SpanContext{traceId=" + currentTraceId().orElse(null) + ", spanId="
                + currentSpanId().orElse(null) + ", depth=" + depth + '}';
    }
}
