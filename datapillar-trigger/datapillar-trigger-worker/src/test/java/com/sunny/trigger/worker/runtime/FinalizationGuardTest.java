package com.sunny.trigger.worker.runtime;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FinalizationGuardTest {

    @Test
    void tryClaim_shouldHaveExactlyOneWinnerUnderContention() throws Exception {
        FinalizationGuard guard = new FinalizationGuard();
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return guard.tryClaim();
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertTrue(guard.isClaimed());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void awaitRecorded_shouldTimeOutUntilMarked() throws Exception {
        FinalizationGuard guard = new FinalizationGuard();
        guard.tryClaim();

        assertFalse(guard.awaitRecorded(Duration.ofMillis(20)));

        guard.markRecorded();
        assertTrue(guard.awaitRecorded(Duration.ZERO));
    }
}
