package com.insurance.claims.adapters.out.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LocalInFlightGuard Unit Tests")
class LocalInFlightGuardTest {

    private final LocalInFlightGuard guard = new LocalInFlightGuard();

    @Test
    @DisplayName("Should hold the actor until the owner releases")
    void shouldHoldUntilOwnerReleases() {
        assertThat(guard.tryAcquire("actor-1", "a")).isTrue();
        assertThat(guard.tryAcquire("actor-1", "b")).isFalse();

        guard.release("actor-1", "b");
        assertThat(guard.isHeld("actor-1")).isTrue();

        guard.release("actor-1", "a");
        assertThat(guard.isHeld("actor-1")).isFalse();
        assertThat(guard.tryAcquire("actor-1", "b")).isTrue();
    }

    @Test
    @DisplayName("Should keep actors independent")
    void shouldKeepActorsIndependent() {
        assertThat(guard.tryAcquire("actor-1", "a")).isTrue();
        assertThat(guard.tryAcquire("actor-2", "b")).isTrue();
    }

    @Test
    @DisplayName("Should grant exactly one of many simultaneous acquires")
    void shouldGrantOneOfManyConcurrentAcquires() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String token = "token-" + i;
                Callable<Boolean> acquire = () -> {
                    start.await();
                    return guard.tryAcquire("actor-1", token);
                };
                results.add(pool.submit(acquire));
            }
            start.countDown();

            int granted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
