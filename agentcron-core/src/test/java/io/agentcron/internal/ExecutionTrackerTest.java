package io.agentcron.internal;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionTrackerTest {

    @Test
    void executingJobShouldNotBeReservedUntilReleased() {
        ExecutionTracker tracker = new ExecutionTracker();

        assertTrue(tracker.tryReserve(1L, "2024-01-01-06"));
        assertTrue(tracker.isExecuting(1L));

        assertFalse(tracker.tryReserve(1L, "2024-01-01-07"));
        assertFalse(tracker.tryReserveUnscheduled(1L));

        tracker.release(1L);
        assertFalse(tracker.isExecuting(1L));
        assertTrue(tracker.tryReserve(1L, "2024-01-01-07"));
    }

    @Test
    void jobShouldFireAtMostOncePerWindow() {
        ExecutionTracker tracker = new ExecutionTracker();

        assertTrue(tracker.tryReserve(7L, "2024-01-01-06"));
        tracker.release(7L);

        assertFalse(tracker.tryReserve(7L, "2024-01-01-06"));
        assertFalse(tracker.isExecuting(7L));

        assertTrue(tracker.tryReserve(7L, "2024-01-01-07"));
        assertEquals("2024-01-01-07", tracker.lastWindow(7L));
    }

    @Test
    void failedReservationShouldHaveNoSideEffects() {
        ExecutionTracker tracker = new ExecutionTracker();
        assertTrue(tracker.tryReserve(3L, "2024-01-01-06"));

        assertFalse(tracker.tryReserve(3L, "2024-01-01-09"));

        assertEquals("2024-01-01-06", tracker.lastWindow(3L));
        assertEquals(1, tracker.executingCount());
    }

    @Test
    void unscheduledReservationShouldLeaveWindowUntouched() {
        ExecutionTracker tracker = new ExecutionTracker();

        assertTrue(tracker.tryReserveUnscheduled(5L));
        assertNull(tracker.lastWindow(5L));
        tracker.release(5L);

        assertTrue(tracker.tryReserve(5L, "2024-01-01-06"));
    }

    @Test
    void jobsShouldBeTrackedIndependently() {
        ExecutionTracker tracker = new ExecutionTracker();

        assertTrue(tracker.tryReserve(1L, "2024-01-01-06"));
        assertTrue(tracker.tryReserve(2L, "2024-01-01-06"));
        assertEquals(2, tracker.executingCount());
    }

    @Test
    void windowKeyShouldHaveHourGranularity() {
        assertEquals("2024-01-01-06", ExecutionTracker.windowKey(LocalDateTime.of(2024, 1, 1, 6, 59, 59)));
        assertEquals("2024-12-31-23", ExecutionTracker.windowKey(LocalDateTime.of(2024, 12, 31, 23, 0)));
    }

    @Test
    void concurrentReservationsShouldHaveSingleWinner() throws Exception {
        ExecutionTracker tracker = new ExecutionTracker();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);

        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String window = "2024-01-01-" + (i % 2 == 0 ? "06" : "07");
                results.add(pool.submit(() -> {
                    go.await();
                    return tracker.tryReserve(42L, window);
                }));
            }
            go.countDown();

            int winners = 0;
            for (Future<Boolean> r : results) {
                if (r.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }
}
