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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.palantir.genai.tracing.api.SinkWriteException;
import com.palantir.genai.tracing.api.Trace;
import com.palantir.genai.tracing.api.TraceSink;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;

/**
 * Fans sealed traces out to the registered {@link TraceSink sinks}. Each sink has its own worker thread and a bounded
 * backlog, so a slow or failing sink delays only its own deliveries. When a backlog is full the configured
 * {@link QueueFullPolicy} decides which trace that sink loses, and the loss is counted as a drop. Failed writes are
 * retried with exponential backoff; once the attempts are exhausted the trace is logged as undelivered for that sink
 * and counted.
 */
final class SinkDispatcher implements Closeable {
    private static final SafeLogger log = SafeLoggerFactory.get(SinkDispatcher.class);

    private final int capacity;
    private final QueueFullPolicy policy;
    private final long enqueueTimeoutNanos;
    private final int maxAttempts;
    private final long initialBackoffNanos;
    private final long maxBackoffNanos;
    private final AtomicLong undelivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    // Only access in a synchronized fashion
    private final Map<String, SinkWorker> workers = new LinkedHashMap<>();
    // Replaced or removed workers which may still be finishing queued deliveries
    private final List<SinkWorker> retiring = new ArrayList<>();
    // Iterated on every dispatch, so replaced as a whole whenever the sinks change
    private volatile ImmutableList<SinkWorker> activeWorkers = ImmutableList.of();

    SinkDispatcher(TracingConfig config) {
        this.capacity = config.queueCapacity();
        this.policy = config.queueFullPolicy();
        this.enqueueTimeoutNanos = config.enqueueTimeout().toNanos();
        this.maxAttempts = config.sinkMaxAttempts();
        this.initialBackoffNanos = config.sinkInitialBackoff().toNanos();
        this.maxBackoffNanos = config.sinkMaxBackoff().toNanos();
    }

    /**
     * Registers a sink under the given name, replacing and returning any sink registered under that name before.
     * Deliveries already queued for a replaced sink still complete.
     */
    @Nullable
    synchronized TraceSink register(String name, TraceSink sink) {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkNotNull(sink, "sink");
        if (workers.containsKey(name)) {
            log.warn("Overwriting existing trace sink", SafeArg.of("name", name));
        }
        SinkWorker previous = workers.put(name, new SinkWorker(name, sink));
        activeWorkers = ImmutableList.copyOf(workers.values());
        return previous == null ? null : retire(previous);
    }

    /** Removes the sink registered under the given name. Returns it, or null if there was none. */
    @Nullable
    synchronized TraceSink unregister(String name) {
        SinkWorker removed = workers.remove(name);
        activeWorkers = ImmutableList.copyOf(workers.values());
        return removed == null ? null : retire(removed);
    }

    private TraceSink retire(SinkWorker worker) {
        worker.shutdown();
        retiring.add(worker);
        return worker.sink;
    }

    synchronized ImmutableSet<String> sinkNames() {
        return ImmutableSet.copyOf(workers.keySet());
    }

    /**
     * Queues the trace for delivery to every registered sink. Returns without waiting for the writes; waits at most
     * {@link TracingConfig#enqueueTimeout()} per full backlog under {@link QueueFullPolicy#BLOCK_WITH_TIMEOUT}.
     */
    void dispatch(Trace trace) {
        for (SinkWorker worker : activeWorkers) {
            worker.deliver(trace);
        }
    }

    /** Waits until no delivery is outstanding on any sink, including replaced ones. Returns false on timeout. */
    boolean awaitDelivered(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        ImmutableList<SinkWorker> toAwait;
        synchronized (this) {
            toAwait = ImmutableList.<SinkWorker>builder()
                    .addAll(retiring)
                    .addAll(workers.values())
                    .build();
        }
        for (SinkWorker worker : toAwait) {
            if (!worker.awaitIdle(deadline)) {
                return false;
            }
        }
        synchronized (this) {
            retiring.removeIf(SinkWorker::isIdle);
        }
        return true;
    }

    long undeliveredCount() {
        return undelivered.get();
    }

    /** Traces which some sink lost because its backlog was full. */
    long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        ImmutableList<SinkWorker> toClose;
        synchronized (this) {
            toClose = ImmutableList.copyOf(workers.values());
            workers.clear();
            retiring.clear();
            activeWorkers = ImmutableList.of();
        }
        for (SinkWorker worker : toClose) {
            worker.shutdown();
        }
    }

    long backoffNanos(int failedAttempts) {
        long backoff = initialBackoffNanos;
        for (int i = 1; i < failedAttempts && backoff < maxBackoffNanos; i++) {
            backoff *= 2;
        }
        return Math.min(backoff, maxBackoffNanos);
    }

    private final class SinkWorker {
        private final String name;
        private final TraceSink sink;
        private final ScheduledExecutorService executor;

        // Only access while holding this worker's monitor
        private final ArrayDeque<Trace> backlog = new ArrayDeque<>();
        // Traces taken from the backlog whose write has neither succeeded nor been given up on
        private int writing;
        private boolean shutdown;

        SinkWorker(String name, TraceSink sink) {
            this.name = name;
            this.sink = sink;
            ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(
                    1,
                    new ThreadFactoryBuilder()
                            .setNameFormat("genai-tracing-sink-" + name + "-%d")
                            .setDaemon(true)
                            .build());
            scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(true);
            this.executor = scheduler;
        }

        void deliver(Trace trace) {
            synchronized (this) {
                if (shutdown) {
                    giveUp(trace, 0, null);
                    return;
                }
                if (backlog.size() + writing >= capacity && !makeRoom(trace)) {
                    return;
                }
                backlog.addLast(trace);
            }
            try {
                executor.execute(this::writeNext);
            } catch (RejectedExecutionException e) {
                synchronized (this) {
                    if (!backlog.removeLastOccurrence(trace)) {
                        return;
                    }
                }
                giveUp(trace, 0, e);
            }
        }

        // Called holding this worker's monitor
        private boolean makeRoom(Trace trace) {
            switch (policy) {
                case DROP_OLDEST:
                    Trace oldest = backlog.pollFirst();
                    if (oldest == null) {
                        // every slot is taken by a write in progress
                        recordDrop(trace, "queueFull");
                        return false;
                    }
                    recordDrop(oldest, "evicted");
                    return true;
                case DROP_NEWEST:
                    recordDrop(trace, "queueFull");
                    return false;
                case BLOCK_WITH_TIMEOUT:
                    long deadline = System.nanoTime() + enqueueTimeoutNanos;
                    try {
                        while (backlog.size() + writing >= capacity && !shutdown) {
                            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                            if (remainingMillis <= 0) {
                                break;
                            }
                            wait(remainingMillis);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        recordDrop(trace, "interrupted");
                        return false;
                    }
                    if (shutdown || backlog.size() + writing >= capacity) {
                        recordDrop(trace, shutdown ? "closed" : "timeout");
                        return false;
                    }
                    return true;
            }
            throw new SafeIllegalStateException("Unknown queue-full policy", SafeArg.of("policy", policy));
        }

        private void recordDrop(Trace trace, String reason) {
            long total = dropped.incrementAndGet();
            log.warn(
                    "Dropped sealed trace for a sink with a full backlog",
                    SafeArg.of("sink", name),
                    SafeArg.of("traceId", trace.getTraceId()),
                    SafeArg.of("reason", reason),
                    SafeArg.of("policy", policy),
                    SafeArg.of("capacity", capacity),
                    SafeArg.of("droppedTotal", total));
        }

        private void writeNext() {
            Trace trace;
            synchronized (this) {
                trace = backlog.pollFirst();
                if (trace == null) {
                    // evicted before its turn
                    notifyAll();
                    return;
                }
                writing++;
            }
            attempt(trace, 1);
        }

        private void attempt(Trace trace, int attempt) {
            try {
                sink.write(trace);
                completed();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts) {
                    giveUp(trace, attempt, e);
                    completed();
                    return;
                }
                long backoff = backoffNanos(attempt);
                log.warn(
                        "Trace sink write failed, retrying",
                        SafeArg.of("sink", name),
                        SafeArg.of("traceId", trace.getTraceId()),
                        SafeArg.of("attempt", attempt),
                        SafeArg.of("backoffMillis", TimeUnit.NANOSECONDS.toMillis(backoff)),
                        e);
                try {
                    executor.schedule(() -> attempt(trace, attempt + 1), backoff, TimeUnit.NANOSECONDS);
                } catch (RejectedExecutionException rejected) {
                    giveUp(trace, attempt, rejected);
                    completed();
                }
            }
        }

        private void giveUp(Trace trace, int attempts, @Nullable Throwable cause) {
            long total = undelivered.incrementAndGet();
            log.error(
                    "Trace could not be delivered to sink",
                    SafeArg.of("sink", name),
                    SafeArg.of("traceId", trace.getTraceId()),
                    SafeArg.of("undeliveredTotal", total),
                    new SinkWriteException(
                            "Exhausted attempts to write trace",
                            cause,
                            SafeArg.of("sink", name),
                            SafeArg.of("traceId", trace.getTraceId()),
                            SafeArg.of("attempts", attempts)));
        }

        private synchronized void completed() {
            writing--;
            notifyAll();
        }

        synchronized boolean isIdle() {
            return backlog.isEmpty() && writing == 0;
        }

        synchronized boolean awaitIdle(long deadlineNanos) throws InterruptedException {
            while (!isIdle()) {
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
                if (remainingMillis <= 0) {
                    return false;
                }
                wait(remainingMillis);
            }
            return true;
        }

        void shutdown() {
            synchronized (this) {
                shutdown = true;
                notifyAll();
            }
            executor.shutdown();
        }
    }
}
