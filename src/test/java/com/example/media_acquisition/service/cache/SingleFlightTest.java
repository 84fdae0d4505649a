package com.example.media_acquisition.service.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SingleFlightTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final SingleFlight<String, String> singleFlight = new SingleFlight<>();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void concurrentCallersShareOneExecution() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger invocations = new AtomicInteger();

        List<CompletableFuture<String>> waiters = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            waiters.add(singleFlight.execute("key", executor, () -> {
                invocations.incrementAndGet();
                await(release);
                return "result";
            }));
        }
        assertThat(singleFlight.inFlightCount()).isEqualTo(1);
        release.countDown();

        for (CompletableFuture<String> waiter : waiters) {
            assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo("result");
        }
        assertThat(invocations.get()).isEqualTo(1);
    }

    @Test
    void completedFlightIsRemovedSoTheNextCallRunsFresh() throws Exception {
        AtomicInteger invocations = new AtomicInteger();

        String first = singleFlight.execute("key", executor, () -> "run-" + invocations.incrementAndGet()).get(5, TimeUnit.SECONDS);
        waitUntilIdle();
        String second = singleFlight.execute("key", executor, () -> "run-" + invocations.incrementAndGet()).get(5, TimeUnit.SECONDS);

        assertThat(first).isEqualTo("run-1");
        assertThat(second).isEqualTo("run-2");
    }

    @Test
    void failureReachesEveryWaiterAndIsNotRemembered() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> a = singleFlight.execute("key", executor, () -> {
            await(release);
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> b = singleFlight.execute("key", executor, () -> "never");
        release.countDown();

        ExecutionException ea = assertThrows(ExecutionException.class, () -> a.get(5, TimeUnit.SECONDS));
        ExecutionException eb = assertThrows(ExecutionException.class, () -> b.get(5, TimeUnit.SECONDS));
        assertThat(ea.getCause()).hasMessage("boom");
        assertThat(eb.getCause()).hasMessage("boom");

        waitUntilIdle();
        assertThat(singleFlight.execute("key", executor, () -> "fresh").get(5, TimeUnit.SECONDS)).isEqualTo("fresh");
    }

    @Test
    void differentKeysDoNotWaitForEachOther() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> slow = singleFlight.execute("slow", executor, () -> {
            await(release);
            return "slow";
        });

        assertThat(singleFlight.execute("fast", executor, () -> "fast").get(5, TimeUnit.SECONDS)).isEqualTo("fast");
        assertThat(slow).isNotDone();
        release.countDown();
        assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
    }

    @Test
    void cancellingOneWaiterLeavesTheOthersServed() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();

        CompletableFuture<String> leaving = singleFlight.execute("key", executor, () -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
                return "interrupted";
            }
            return "done";
        });
        CompletableFuture<String> staying = singleFlight.execute("key", executor, () -> "never");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        leaving.cancel(true);
        release.countDown();

        assertThat(staying.get(5, TimeUnit.SECONDS)).isEqualTo("done");
        assertThat(interrupted).isFalse();
    }

    @Test
    void lastWaiterLeavingInterruptsTheWork() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        CompletableFuture<String> only = singleFlight.execute("key", executor, () -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return "unused";
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        only.cancel(true);

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        assertThat(singleFlight.inFlightCount()).isZero();
    }

    private void waitUntilIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (singleFlight.inFlightCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
