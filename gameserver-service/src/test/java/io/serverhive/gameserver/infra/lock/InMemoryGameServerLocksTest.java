package io.serverhive.gameserver.infra.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InMemoryGameServerLocksTest {

    private final InMemoryGameServerLocks locks = new InMemoryGameServerLocks();

    @Test
    void serialisesWorkOnTheSameId() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[16];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> locks.withLock("gs-1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    sleepQuietly(2);
                    inside.decrementAndGet();
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.size()).isZero();
    }

    @Test
    void differentIdsDoNotBlockEachOther() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = pool.submit(() -> locks.withLock("gs-1", () -> {
                holding.countDown();
                awaitQuietly(release);
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            String result = locks.withLock("gs-2", () -> "done");

            assertThat(result).isEqualTo("done");
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void isReentrantAndReleasedOnFailure() {
        String nested = locks.withLock("gs-1", () -> locks.withLock("gs-1", () -> "inner"));
        assertThat(nested).isEqualTo("inner");

        assertThatThrownBy(() -> locks.withLock("gs-1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(locks.size()).isZero();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
