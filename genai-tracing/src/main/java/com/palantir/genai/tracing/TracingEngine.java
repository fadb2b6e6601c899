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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.palantir.genai.tracing.api.NotFoundException;
import com.palantir.genai.tracing.api.Trace;
import com.palantir.genai.tracing.api.TraceSink;
import com.palantir.genai.tracing.query.TracePage;
import com.palantir.genai.tracing.query.TraceSearchRequest;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;

/**
 * Wires span recording, trace assembly, export and an optional searchable store into one unit.
 *
 * <pre>{@code
 * try (TracingEngine engine = TracingEngine.builder()
 *         .store(new InMemoryTraceStore())
 *         .sink("jsonl", new JsonLinesTraceSink(path))
 *         .build()) {
 *     Tracer.setEngine(engine);
 *     ...
 * }
 * }</pre>
 *
 * <p>Sealed traces pass through a bounded export buffer to the sinks. A background task seals traces which stopped
 * making progress, every {@link TracingConfig#sealCheckInterval()}.
 */
public final class TracingEngine implements Closeable {
    private static final SafeLogger log = SafeLoggerFactory.get(TracingEngine.class);

    static final String STORE_SINK_NAME = "store";

    private final TracingConfig config;
    private final SinkDispatcher dispatcher;
    private final ExportBuffer buffer;
    private final TraceAssembler assembler;
    private final SpanRecorder recorder;
    private final Optional<TraceStore> store;
    private final ScheduledExecutorService sweeper;
    private final AtomicBoolean closed = new AtomicBoolean();

    private TracingEngine(Builder builder) {
        this.config = builder.config;
        this.dispatcher = new SinkDispatcher(config);
        this.store = Optional.ofNullable(builder.store);
        store.ifPresent(traceStore -> dispatcher.register(STORE_SINK_NAME, traceStore));
        builder.sinks.forEach(dispatcher::register);
        this.buffer = new ExportBuffer(config, dispatcher::dispatch);
        this.assembler = new TraceAssembler(config, new TimeSource(builder.ticker, builder.clock), buffer::submit);
        this.recorder = new SpanRecorder(assembler);
        this.sweeper = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("genai-tracing-seal-sweep-%d")
                .setDaemon(true)
                .build());
        long interval = config.sealCheckInterval().toNanos();
        sweeper.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.NANOSECONDS);
    }

    public static Builder builder() {
        return new Builder();
    }

    public TracingConfig config() {
        return config;
    }

    /** The strict, id-based recording API of this engine. */
    public SpanRecorder recorder() {
        return recorder;
    }

    public Optional<TraceStore> store() {
        return store;
    }

    /**
     * Registers a sink under the given name, replacing and returning any sink previously registered under that name.
     * The name {@code "store"} is reserved for the store.
     */
    @Nullable
    public TraceSink registerSink(String name, TraceSink sink) {
        checkNotReserved(name);
        return dispatcher.register(name, sink);
    }

    /** Removes the sink registered under the given name. Returns it, or null if there was none. */
    @Nullable
    public TraceSink unregisterSink(String name) {
        checkNotReserved(name);
        return dispatcher.unregister(name);
    }

    private static void checkNotReserved(String name) {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkArgument(!name.equals(STORE_SINK_NAME), "sink name is reserved", SafeArg.of("name", name));
    }

    public ImmutableSet<String> sinkNames() {
        return dispatcher.sinkNames();
    }

    /**
     * Merges tags into a trace. Tags of an in-flight trace become part of it when it is sealed; tags of a sealed trace
     * are updated in the store.
     *
     * @throws NotFoundException if the trace is neither in flight nor stored
     */
    public void updateTraceTags(String traceId, Map<String, String> tags) {
        Preconditions.checkNotNull(traceId, "traceId");
        Preconditions.checkNotNull(tags, "tags");
        if (assembler.putTags(traceId, tags)) {
            return;
        }
        if (store.isEmpty()) {
            throw new NotFoundException(
                    "Trace is not in flight and no store is configured", SafeArg.of("traceId", traceId));
        }
        // the trace may be sealed but not yet stored
        if (!awaitStored(traceId)) {
            throw new NotFoundException("Trace not found", SafeArg.of("traceId", traceId));
        }
        store.get().setTags(traceId, tags);
    }

    /**
     * Removes a tag from a trace, in flight or stored.
     *
     * @throws NotFoundException if the trace is neither in flight nor stored
     */
    public void deleteTraceTag(String traceId, String key) {
        if (assembler.deleteTag(traceId, key)) {
            return;
        }
        requireStore().deleteTag(traceId, key);
    }

    /** @throws NotFoundException if no trace with this id is stored */
    public Trace getTrace(String traceId) {
        return requireStore().get(traceId);
    }

    public TracePage search(TraceSearchRequest request) {
        return requireStore().search(request);
    }

    /** Seals every in-flight trace which exceeded {@link TracingConfig#maxPendingTime()}. Returns how many. */
    public int sealExpiredTraces() {
        return assembler.sealExpired();
    }

    public int inFlightTraceCount() {
        return assembler.inFlightTraceCount();
    }

    @VisibleForTesting
    int liveSpanCount() {
        return assembler.liveSpanCount();
    }

    /** Sealed traces lost to a full export buffer, a full sink backlog or a closed engine. */
    public long droppedTraceCount() {
        return buffer.droppedCount() + dispatcher.droppedCount();
    }

    public long undeliveredTraceCount() {
        return dispatcher.undeliveredCount();
    }

    /**
     * Waits until every sealed trace has been delivered to every sink, or given up on. Returns false on timeout.
     * Traces still in flight are not affected.
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            return buffer.awaitDrained(timeout)
                    && dispatcher.awaitDelivered(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stops the seal sweep, flushes sealed traces for up to five seconds and stops the export threads. Traces still in
     * flight are discarded.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        sweeper.shutdownNow();
        if (!flush(Duration.ofSeconds(5))) {
            log.warn("Closed tracing engine before all traces were delivered");
        }
        int inFlight = assembler.inFlightTraceCount();
        if (inFlight > 0) {
            log.info("Discarding unsealed traces on close", SafeArg.of("count", inFlight));
        }
        buffer.close();
        dispatcher.close();
    }

    private void sweep() {
        try {
            int sealed = assembler.sealExpired();
            if (sealed > 0) {
                log.debug("Seal sweep closed stale traces", SafeArg.of("count", sealed));
            }
        } catch (RuntimeException e) {
            log.error("Seal sweep failed", e);
        }
    }

    private boolean awaitStored(String traceId) {
        TraceStore traceStore = requireStore();
        if (contains(traceStore, traceId)) {
            return true;
        }
        flush(config.enqueueTimeout());
        return contains(traceStore, traceId);
    }

    private static boolean contains(TraceStore traceStore, String traceId) {
        try {
            traceStore.get(traceId);
            return true;
        } catch (NotFoundException e) {
            return false;
        }
    }

    private TraceStore requireStore() {
        return store.orElseThrow(() -> new SafeIllegalStateException("No trace store is configured"));
    }

    public static final class Builder {
        private TracingConfig config = TracingConfig.defaults();
        private Ticker ticker = Ticker.systemTicker();
        private Clock clock = Clock.systemUTC();
        private final Map<String, TraceSink> sinks = new LinkedHashMap<>();

        @Nullable
        private TraceStore store;

        private Builder() {}

        public Builder config(TracingConfig value) {
            this.config = Preconditions.checkNotNull(value, "config");
            return this;
        }

        /** Monotonic time source for span durations and the forced sealing bound. */
        public Builder ticker(Ticker value) {
            this.ticker = Preconditions.checkNotNull(value, "ticker");
            return this;
        }

        /** Wall-clock source for span start timestamps. */
        public Builder clock(Clock value) {
            this.clock = Preconditions.checkNotNull(value, "clock");
            return this;
        }

        public Builder sink(String name, TraceSink sink) {
            checkNotReserved(name);
            Preconditions.checkNotNull(sink, "sink");
            Preconditions.checkArgument(
                    !sinks.containsKey(name), "sink name is already in use", SafeArg.of("name", name));
            sinks.put(name, sink);
            return this;
        }

        /** The store which keeps sealed traces searchable. It receives traces like any other sink. */
        public Builder store(TraceStore value) {
            this.store = Preconditions.checkNotNull(value, "store");
            return this;
        }

        public TracingEngine build() {
            return new TracingEngine(this);
        }
    }
}
