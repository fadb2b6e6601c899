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
import com.palantir.genai.tracing.api.TraceSink;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

public final class SinkDispatcherTest {

    private final SinkDispatcher dispatcher = new SinkDispatcher(TracingConfig.builder()
            .sinkMaxAttempts(3)
            .sinkInitialBackoff(Duration.ofMillis(10))
            .sinkMaxBackoff(Duration.ofMillis(25))
            .build());

    @AfterEach
    public void after() {
        dispatcher.close();
    }

    @Test
    public void testBackoffDoublesUpToMaximum() {
        assertThat(dispatcher.backoffNanos(1)).isEqualTo(TimeUnit.MILLISECONDS.toNanos(10));
        assertThat(dispatcher.backoffNanos(2)).isEqualTo(TimeUnit.MILLISECONDS.toNanos(20));
        assertThat(dispatcher.backoffNanos(3)).isEqualTo(TimeUnit.MILLISECONDS.toNanos(25));
        assertThat(dispatcher.backoffNanos(30)).isEqualTo(TimeUnit.MILLISECONDS.toNanos(25));
    }

    @Test
    public void testDeliversToEverySink() throws Exception {
        List<Trace> first = new CopyOnWriteArrayList<>();
        List<Trace> second = new CopyOnWriteArrayList<>();
        dispatcher.register("first", first::add);
        dispatcher.register("second", second::add);
        Trace trace = TestTraces.trace("trace");

        dispatcher.dispatch(trace);

        assertThat(dispatcher.awaitDelivered(Duration.ofSeconds(5))).isTrue();
        assertThat(first).containsExactly(trace);
        assertThat(second).containsExactly(trace);
        assertThat(dispatcher.sinkNames()).containsExactly("first", "second");
    }

    @Test
    public void testRetriesUntilWriteSucceeds() throws Exception {
        TraceSink sink = Mockito.mock(TraceSink.class);
        Trace trace = TestTraces.trace("flaky");
        Mockito.doThrow(new IllegalStateException("unavailable"))
                .doThrow(new IllegalStateException("still unavailable"))
                .doNothing()
                .when(sink)
                .write(trace);
        dispatcher.register("flaky", sink);

        dispatcher.dispatch(trace);

        assertThat(dispatcher.awaitDelivered(Duration.ofSeconds(5))).isTrue();
        Mockito.verify(sink, Mockito.times(3)).write(trace);
        assertThat(dispatcher.undeliveredCount()).isZero();
    }

    @Test
    public void testGivesUpAfterMaxAttempts() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        dispatcher.register("broken", _trace -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("always failing");
        });

        dispatcher.dispatch(TestTraces.trace("lost"));

        assertThat(dispatcher.awaitDelivered(Duration.ofSeconds(5))).isTrue();
        assertThat(attempts).hasValue(3);
        assertThat(dispatcher.undeliveredCount()).isOne();
    }

    @Test
    public void testSlowOrFailingSinkDoesNotDelayOthers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<Trace> healthy = new CopyOnWriteArrayList<>();
        dispatcher.register("slow", _trace -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        dispatcher.register("broken", _trace -> {
            throw new IllegalStateException("always failing");
        });
        dispatcher.register("healthy", healthy::add);

        for (int i = 0; i < 10; i++) {
            dispatcher.dispatch(TestTraces.trace("trace-" + i));
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (healthy.size() < 10 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(healthy).hasSize(10);
        assertThat(dispatcher.awaitDelivered(Duration.ofMillis(50))).isFalse();

        release.countDown();
        assertThat(dispatcher.awaitDelivered(Duration.ofSeconds(5))).isTrue();
        assertThat(dispatcher.undeliveredCount()).isEqualTo(10);
    }

    @Test
    public void testRegisterReplacesAndUnregisterRemoves() throws Exception {
        List<Trace> original = new CopyOnWriteArrayList<>();
        List<Trace> replacement = new CopyOnWriteArrayList<>();
        TraceSink originalSink = original::add;

        assertThat(dispatcher.register("sink", originalSink)).isNull();
        assertThat(dispatcher.register("sink", replacement::add)).isSameAs(originalSink);
        dispatcher.dispatch(TestTraces.trace("trace"));
        assertThat(dispatcher.awaitDelivered(Duration.ofSeconds(5))).isTrue();
        assertThat(original).isEmpty();
        assertThat(replacement).hasSize(1);

        assertThat(dispatcher.unregister("sink")).isNotNull();
        assertThat(dispatcher.unregister("sink")).isNull();
        dispatcher.dispatch(TestTraces.trace("unrouted"));
        assertThat(replacement).hasSize(1);
        assertThat(dispatcher.sinkNames()).isEmpty();
    }

    @Test
    public void testFullBacklogEvictsOldestQueuedTrace() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<Trace> delivered = new CopyOnWriteArrayList<>();
        SinkDispatcher bounded = boundedDispatcher(QueueFullPolicy.DROP_OLDEST);
        try {
            CountDownLatch writing = registerBlockedSink(bounded, delivered, release);
            Trace first = TestTraces.trace("first");
            bounded.dispatch(first);
            assertThat(writing.await(5, TimeUnit.SECONDS)).isTrue();

            Trace t2 = TestTraces.trace("t2");
            Trace t3 = TestTraces.trace("t3");
            Trace t4 = TestTraces.trace("t4");
            bounded.dispatch(t2);
            bounded.dispatch(t3);
            bounded.dispatch(t4);
            assertThat(bounded.droppedCount()).isEqualTo(2);

            release.countDown();
            assertThat(bounded.awaitDelivered(Duration.ofSeconds(5))).isTrue();
            assertThat(delivered).containsExactly(first, t4);
        } finally {
            release.countDown();
            bounded.close();
        }
    }

    @Test
    public void testFullBacklogRejectsNewestTrace() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<Trace> delivered = new CopyOnWriteArrayList<>();
        SinkDispatcher bounded = boundedDispatcher(QueueFullPolicy.DROP_NEWEST);
        try {
            CountDownLatch writing = registerBlockedSink(bounded, delivered, release);
            Trace first = TestTraces.trace("first");
            bounded.dispatch(first);
            assertThat(writing.await(5, TimeUnit.SECONDS)).isTrue();

            Trace t2 = TestTraces.trace("t2");
            bounded.dispatch(t2);
            bounded.dispatch(TestTraces.trace("t3"));
            bounded.dispatch(TestTraces.trace("t4"));
            assertThat(bounded.droppedCount()).isEqualTo(2);

            release.countDown();
            assertThat(bounded.awaitDelivered(Duration.ofSeconds(5))).isTrue();
            assertThat(delivered).containsExactly(first, t2);
            assertThat(bounded.undeliveredCount()).isZero();
        } finally {
            release.countDown();
            bounded.close();
        }
    }

    @Test
    public void testAwaitDeliveredWaitsForReplacedSink() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<Trace> original = new CopyOnWriteArrayList<>();
        CountDownLatch writing = registerBlockedSink(dispatcher, original, release);
        Trace trace = TestTraces.trace("pending");
        dispatcher.dispatch(trace);
        assertThat(writing.await(5, TimeUnit.SECONDS)).isTrue();

        dispatcher.register("blocked", _trace -> {});
        assertThat(dispatcher.awaitDelivered(Duration.ofMillis(50))).isFalse();

        release.countDown();
        assertThat(dispatcher.awaitDelivered(Duration.ofSeconds(5))).isTrue();
        assertThat(original).containsExactly(trace);
    }

    private static SinkDispatcher boundedDispatcher(QueueFullPolicy policy) {
        return new SinkDispatcher(TracingConfig.builder()
                .queueCapacity(2)
                .queueFullPolicy(policy)
                .build());
    }

    private static CountDownLatch registerBlockedSink(
            SinkDispatcher target, List<Trace> delivered, CountDownLatch release) {
        CountDownLatch writing = new CountDownLatch(1);
        target.register("blocked", trace -> {
            writing.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delivered.add(trace);
        });
        return writing;
    }
}
