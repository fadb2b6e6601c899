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

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.genai.tracing.api.Trace;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public final class ExportBufferTest {

    private final List<Trace> dispatched = new CopyOnWriteArrayList<>();
    private final CountDownLatch dispatcherEntered = new CountDownLatch(1);
    private final CountDownLatch releaseDispatcher = new CountDownLatch(1);
    private ExportBuffer buffer;

    @AfterEach
    public void after() {
        releaseDispatcher.countDown();
        if (buffer != null) {
            buffer.close();
        }
    }

    @Test
    public void testDeliversInOrder() throws Exception {
        buffer = new ExportBuffer(TracingConfig.defaults(), dispatched::add);
        Trace first = TestTraces.trace("first");
        Trace second = TestTraces.trace("second");

        assertThat(buffer.submit(first)).isTrue();
        assertThat(buffer.submit(second)).isTrue();

        assertThat(buffer.awaitDrained(Duration.ofSeconds(5))).isTrue();
        assertThat(dispatched).containsExactly(first, second);
        assertThat(buffer.droppedCount()).isZero();
    }

    @Test
    public void testDropOldestEvictsQueuedTrace() throws Exception {
        buffer = blockedBuffer(QueueFullPolicy.DROP_OLDEST);
        Trace inFlight = submitAndAwaitDispatch();
        Trace t2 = TestTraces.trace("t2");
        Trace t3 = TestTraces.trace("t3");
        Trace t4 = TestTraces.trace("t4");

        assertThat(buffer.submit(t2)).isTrue();
        assertThat(buffer.submit(t3)).isTrue();
        assertThat(buffer.submit(t4)).isTrue();
        assertThat(buffer.size()).isEqualTo(2);
        assertThat(buffer.droppedCount()).isOne();

        releaseDispatcher.countDown();
        assertThat(buffer.awaitDrained(Duration.ofSeconds(5))).isTrue();
        assertThat(dispatched).containsExactly(inFlight, t3, t4);
    }

    @Test
    public void testDropNewestRejectsIncomingTrace() throws Exception {
        buffer = blockedBuffer(QueueFullPolicy.DROP_NEWEST);
        Trace inFlight = submitAndAwaitDispatch();
        Trace t2 = TestTraces.trace("t2");
        Trace t3 = TestTraces.trace("t3");

        assertThat(buffer.submit(t2)).isTrue();
        assertThat(buffer.submit(t3)).isTrue();
        assertThat(buffer.submit(TestTraces.trace("t4"))).isFalse();
        assertThat(buffer.droppedCount()).isOne();

        releaseDispatcher.countDown();
        assertThat(buffer.awaitDrained(Duration.ofSeconds(5))).isTrue();
        assertThat(dispatched).containsExactly(inFlight, t2, t3);
    }

    @Test
    public void testBlockWithTimeoutDropsAfterTimeout() throws Exception {
        buffer = blockedBuffer(QueueFullPolicy.BLOCK_WITH_TIMEOUT);
        submitAndAwaitDispatch();
        buffer.submit(TestTraces.trace("t2"));
        buffer.submit(TestTraces.trace("t3"));

        long start = System.nanoTime();
        assertThat(buffer.submit(TestTraces.trace("t4"))).isFalse();
        assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(50));
        assertThat(buffer.droppedCount()).isOne();
    }

    @Test
    public void testBlockWithTimeoutSucceedsOnceSpaceFrees() throws Exception {
        buffer = new ExportBuffer(
                config(QueueFullPolicy.BLOCK_WITH_TIMEOUT).withEnqueueTimeout(Duration.ofSeconds(10)),
                blockingDispatcher());
        submitAndAwaitDispatch();
        buffer.submit(TestTraces.trace("t2"));
        buffer.submit(TestTraces.trace("t3"));

        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> buffer.submit(TestTraces.trace("t4")));
        Thread.sleep(50);
        assertThat(blocked).isNotDone();

        releaseDispatcher.countDown();
        assertThat(blocked.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(buffer.awaitDrained(Duration.ofSeconds(5))).isTrue();
        assertThat(dispatched).hasSize(4);
        assertThat(buffer.droppedCount()).isZero();
    }

    @Test
    public void testClosedBufferRejects() {
        buffer = new ExportBuffer(TracingConfig.defaults(), dispatched::add);
        buffer.close();
        assertThat(buffer.submit(TestTraces.trace("late"))).isFalse();
        assertThat(buffer.droppedCount()).isOne();
    }

    @Test
    public void testDispatcherFailureDoesNotStopDraining() throws Exception {
        Trace poison = TestTraces.trace("poison");
        buffer = new ExportBuffer(TracingConfig.defaults(), trace -> {
            if (trace == poison) {
                throw new IllegalStateException("dispatch failed");
            }
            dispatched.add(trace);
        });
        Trace healthy = TestTraces.trace("healthy");
        buffer.submit(poison);
        buffer.submit(healthy);

        assertThat(buffer.awaitDrained(Duration.ofSeconds(5))).isTrue();
        assertThat(dispatched).containsExactly(healthy);
    }

    private ExportBuffer blockedBuffer(QueueFullPolicy policy) {
        return new ExportBuffer(config(policy), blockingDispatcher());
    }

    private static ImmutableTracingConfig config(QueueFullPolicy policy) {
        return ImmutableTracingConfig.builder()
                .queueCapacity(2)
                .queueFullPolicy(policy)
                .enqueueTimeout(Duration.ofMillis(50))
                .build();
    }

    private Consumer<Trace> blockingDispatcher() {
        return trace -> {
            dispatcherEntered.countDown();
            try {
                releaseDispatcher.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            dispatched.add(trace);
        };
    }

    private Trace submitAndAwaitDispatch() throws InterruptedException {
        Trace trace = TestTraces.trace("t1");
        assertThat(buffer.submit(trace)).isTrue();
        assertThat(dispatcherEntered.await(5, TimeUnit.SECONDS)).isTrue();
        return trace;
    }
}
