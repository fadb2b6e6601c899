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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.palantir.genai.tracing.api.Trace;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * Bounded queue between trace sealing and sink delivery. Producers {@link #submit} sealed traces at a bounded cost; a
 * single background thread drains the queue and hands each trace to the dispatcher.
 */
final class ExportBuffer implements Closeable {
    private static final SafeLogger log = SafeLoggerFactory.get(ExportBuffer.class);

    private final int capacity;
    private final QueueFullPolicy policy;
    private final long enqueueTimeoutNanos;
    private final Consumer<Trace> dispatcher;
    private final ExecutorService drainer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Condition idle = lock.newCondition();

    // Only access while holding lock
    private final ArrayDeque<Trace> queue = new ArrayDeque<>();
    private boolean dispatching;
    private boolean closed;

    private final AtomicLong dropped = new AtomicLong();

    ExportBuffer(TracingConfig config, Consumer<Trace> dispatcher) {
        this.capacity = config.queueCapacity();
        this.policy = config.queueFullPolicy();
        this.enqueueTimeoutNanos = config.enqueueTimeout().toNanos();
        this.dispatcher = Preconditions.checkNotNull(dispatcher, "dispatcher");
        this.drainer = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("genai-tracing-export-%d")
                .setDaemon(true)
                .build());
        this.drainer.execute(this::drain);
    }

    /**
     * Enqueues a sealed trace. Returns false if the trace was dropped, either because the buffer is closed or because
     * the queue-full policy rejected it.
     */
    boolean submit(Trace trace) {
        Preconditions.checkNotNull(trace, "trace");
        lock.lock();
        try {
            if (closed) {
                recordDrop(trace, "closed");
                return false;
            }
            if (queue.size() >= capacity && !makeRoom(trace)) {
                return false;
            }
            queue.addLast(trace);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean makeRoom(Trace trace) {
        switch (policy) {
            case DROP_OLDEST:
                recordDrop(queue.pollFirst(), "evicted");
                return true;
            case DROP_NEWEST:
                recordDrop(trace, "queueFull");
                return false;
            case BLOCK_WITH_TIMEOUT:
                long remaining = enqueueTimeoutNanos;
                try {
                    while (queue.size() >= capacity && !closed && remaining > 0) {
                        remaining = notFull.awaitNanos(remaining);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    recordDrop(trace, "interrupted");
                    return false;
                }
                if (closed || queue.size() >= capacity) {
                    recordDrop(trace, closed ? "closed" : "timeout");
                    return false;
                }
                return true;
        }
        throw new IllegalStateException("Unknown queue-full policy: " + policy);
    }

    private void recordDrop(@Nullable Trace trace, String reason) {
        long total = dropped.incrementAndGet();
        log.warn(
                "Dropped sealed trace before export",
                SafeArg.of("traceId", trace == null ? null : trace.getTraceId()),
                SafeArg.of("reason", reason),
                SafeArg.of("policy", policy),
                SafeArg.of("capacity", capacity),
                SafeArg.of("droppedTotal", total));
    }

    private void drain() {
        while (true) {
            Trace next;
            lock.lock();
            try {
                while (queue.isEmpty() && !closed) {
                    notEmpty.awaitUninterruptibly();
                }
                if (queue.isEmpty()) {
                    idle.signalAll();
                    return;
                }
                next = queue.pollFirst();
                dispatching = true;
                notFull.signal();
            } finally {
                lock.unlock();
            }

            try {
                dispatcher.accept(next);
            } catch (RuntimeException e) {
                log.error("Failed to dispatch trace", SafeArg.of("traceId", next.getTraceId()), e);
            } finally {
                lock.lock();
                try {
                    dispatching = false;
                    if (queue.isEmpty()) {
                        idle.signalAll();
                    }
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    /** Waits until every queued trace has been handed to the dispatcher. Returns false on timeout. */
    boolean awaitDrained(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!queue.isEmpty() || dispatching) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    long droppedCount() {
        return dropped.get();
    }

    /** Stops accepting traces, lets the background thread drain what is queued and waits briefly for it to exit. */
    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
        drainer.shutdown();
        try {
            if (!drainer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Export buffer did not drain in time", SafeArg.of("remaining", size()));
                drainer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drainer.shutdownNow();
        }
    }
}
