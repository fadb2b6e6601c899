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

import com.google.common.util.concurrent.ForwardingExecutorService;
import com.google.common.util.concurrent.FutureCallback;
import com.palantir.genai.tracing.api.SpanType;
import com.palantir.logsafe.Preconditions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Utilities for carrying the {@link SpanContext} of the submitting task into work that runs elsewhere. Each wrapper
 * captures {@link ContextPropagator#current()} when it is created and attaches that context for the duration of every
 * execution, so spans started by the work become children of the span which was active at submission.
 */
public final class Tracers {
    private Tracers() {}

    /** Wraps the executor service such that every submitted task is {@link #wrap(Callable) wrapped}. */
    public static ExecutorService wrap(ExecutorService executorService) {
        return new ContextPropagatingExecutorService(executorService);
    }

    /** Like {@link #wrap(ExecutorService)}, but for plain executors. */
    public static Executor wrap(Executor executor) {
        Preconditions.checkNotNull(executor, "executor");
        return command -> executor.execute(wrap(command));
    }

    /** Wraps the callable such that it runs with the calling task's context at the time of this call. */
    public static <V> Callable<V> wrap(Callable<V> delegate) {
        SpanContext captured = ContextPropagator.current();
        return () -> {
            try (ContextScope ignored = ContextPropagator.attach(captured)) {
                return delegate.call();
            }
        };
    }

    /** Like {@link #wrap(Callable)}, but for Runnables. */
    public static Runnable wrap(Runnable delegate) {
        SpanContext captured = ContextPropagator.current();
        return () -> {
            try (ContextScope ignored = ContextPropagator.attach(captured)) {
                delegate.run();
            }
        };
    }

    /** Like {@link #wrap(Callable)}, but for Suppliers. */
    public static <V> Supplier<V> wrap(Supplier<V> delegate) {
        SpanContext captured = ContextPropagator.current();
        return () -> {
            try (ContextScope ignored = ContextPropagator.attach(captured)) {
                return delegate.get();
            }
        };
    }

    /** Like {@link #wrap(Callable)}, but for Guava's FutureCallback. */
    public static <V> FutureCallback<V> wrap(FutureCallback<V> delegate) {
        SpanContext captured = ContextPropagator.current();
        return new FutureCallback<V>() {
            @Override
            public void onSuccess(V result) {
                try (ContextScope ignored = ContextPropagator.attach(captured)) {
                    delegate.onSuccess(result);
                }
            }

            @Override
            public void onFailure(Throwable throwable) {
                try (ContextScope ignored = ContextPropagator.attach(captured)) {
                    delegate.onFailure(throwable);
                }
            }
        };
    }

    /**
     * Wraps the callable such that each execution runs as the root span of a fresh trace, regardless of the context of
     * the thread it runs on.
     */
    public static <V> Callable<V> wrapWithNewTrace(String name, SpanType type, Callable<V> delegate) {
        return () -> {
            try (ContextScope ignored = ContextPropagator.attach(SpanContext.empty())) {
                return Tracer.traced(name, type, null, delegate);
            }
        };
    }

    /** Like {@link #wrapWithNewTrace(String, SpanType, Callable)}, but for Runnables. */
    public static Runnable wrapWithNewTrace(String name, SpanType type, Runnable delegate) {
        return () -> {
            try (ContextScope ignored = ContextPropagator.attach(SpanContext.empty());
                    ActiveSpan span = Tracer.startSpan(name, type)) {
                try {
                    delegate.run();
                } catch (RuntimeException | Error e) {
                    span.fail(e);
                    throw e;
                }
            }
        };
    }

    private static final class ContextPropagatingExecutorService extends ForwardingExecutorService {
        private final ExecutorService delegate;

        ContextPropagatingExecutorService(ExecutorService delegate) {
            this.delegate = Preconditions.checkNotNull(delegate, "executorService");
        }

        @Override
        protected ExecutorService delegate() {
            return delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrap(command));
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public Future<?> submit(Runnable task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(wrap(task), result);
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks));
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks), timeout, unit);
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
                throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapAll(tasks));
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapAll(tasks), timeout, unit);
        }

        private static <T> List<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
            List<Callable<T>> wrapped = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                wrapped.add(wrap(task));
            }
            return wrapped;
        }
    }
}
