package com.vsensor.tracker.liveness;

import com.vsensor.core.hash.Hashers;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedMutationQueueTest {

    private KeyedMutationQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.close();
        }
    }

    @Test
    @DisplayName("Mutations of one key never overlap and run in submission order")
    void testSameKeySerialized() {
        // Given
        queue = new KeyedMutationQueue(4, new SimpleMeterRegistry(), "test-node");
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Integer> order = new CopyOnWriteArrayList<>();

        // When: 20 asynchronous mutations are submitted for the same sensor
        List<Mono<Integer>> results = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int n = i;
            results.add(queue.submit("H1", () -> Mono.fromRunnable(() ->
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max))
                .then(Mono.delay(Duration.ofMillis(2)))
                .then(Mono.fromCallable(() -> {
                    order.add(n);
                    running.decrementAndGet();
                    return n;
                }))));
        }
        Flux.merge(results).blockLast(Duration.ofSeconds(10));

        // Then
        assertEquals(1, maxRunning.get());
        for (int i = 0; i < 20; i++) {
            assertEquals(i, order.get(i));
        }
    }

    @Test
    @DisplayName("Keys on different lanes proceed in parallel")
    void testDifferentLanesConcurrent() {
        // Given: two keys that hash onto different lanes
        int lanes = 2;
        queue = new KeyedMutationQueue(lanes, new SimpleMeterRegistry(), "test-node");
        String first = "H1";
        String second = null;
        for (int i = 2; second == null; i++) {
            String candidate = "H" + i;
            if (Hashers.laneFor(candidate, lanes) != Hashers.laneFor(first, lanes)) {
                second = candidate;
            }
        }
        CountDownLatch latch = new CountDownLatch(1);

        // When: the first mutation waits for the second one
        Mono<Boolean> waiting = queue.submit(first, () -> Mono.fromCallable(() -> latch.await(5, TimeUnit.SECONDS)));
        queue.submit(second, () -> Mono.fromRunnable(latch::countDown));

        // Then: it did not have to wait for its own lane to free up
        assertEquals(Boolean.TRUE, waiting.block(Duration.ofSeconds(10)));
    }

    @Test
    @DisplayName("Failed mutation fails its result but not the lane")
    void testFailureDoesNotStopLane() {
        queue = new KeyedMutationQueue(1, new SimpleMeterRegistry(), "test-node");

        StepVerifier.create(queue.submit("H1", () -> Mono.error(new IllegalStateException("boom"))))
            .expectErrorMessage("boom")
            .verify(Duration.ofSeconds(5));

        StepVerifier.create(queue.submit("H1", () -> {
                throw new IllegalArgumentException("thrown by supplier");
            }))
            .expectError(IllegalArgumentException.class)
            .verify(Duration.ofSeconds(5));

        StepVerifier.create(queue.submit("H1", () -> Mono.just("ok")))
            .expectNext("ok")
            .verifyComplete();
    }

    @Test
    @DisplayName("Mutation is enqueued on submit even if nobody subscribes to its result")
    void testSubmitIsEager() {
        queue = new KeyedMutationQueue(1, new SimpleMeterRegistry(), "test-node");
        AtomicBoolean ran = new AtomicBoolean();

        queue.submit("H1", () -> Mono.fromRunnable(() -> ran.set(true)));
        queue.submit("H1", () -> Mono.just(1)).block(Duration.ofSeconds(5));

        assertTrue(ran.get());
    }

    @Test
    @DisplayName("Closed queue rejects new mutations")
    void testClosedQueueRejects() {
        queue = new KeyedMutationQueue(2, new SimpleMeterRegistry(), "test-node");
        queue.close();

        StepVerifier.create(queue.submit("H1", () -> Mono.just(1)))
            .expectError(IllegalStateException.class)
            .verify(Duration.ofSeconds(5));
        assertEquals(0, queue.pendingCount());
    }

    @Test
    @DisplayName("Drained signal fires only after close and the queued mutations ran")
    void testWhenDrainedAfterQueuedMutations() {
        // Given: a mutation held on its lane
        queue = new KeyedMutationQueue(2, new SimpleMeterRegistry(), "test-node");
        CountDownLatch gate = new CountDownLatch(1);
        AtomicBoolean ran = new AtomicBoolean();
        queue.submit("H1", () -> Mono.fromRunnable(() -> {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ran.set(true);
        }));

        // When / Then: not drained while open, nor while the held mutation runs
        StepVerifier.create(queue.whenDrained())
            .expectSubscription()
            .expectNoEvent(Duration.ofMillis(100))
            .thenCancel()
            .verify();
        queue.close();
        assertFalse(ran.get());

        gate.countDown();
        StepVerifier.create(queue.whenDrained())
            .expectComplete()
            .verify(Duration.ofSeconds(5));
        assertTrue(ran.get());
    }
}
