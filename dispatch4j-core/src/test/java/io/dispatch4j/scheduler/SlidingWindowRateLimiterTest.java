package io.dispatch4j.scheduler;

import io.dispatch4j.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlidingWindowRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
    private final SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2, Duration.ofMinutes(10), clock);

    @Test
    void shouldRejectOnceWindowIsFull() {
        assertTrue(limiter.tryAcquire("s1"));
        clock.advance(Duration.ofMinutes(3));
        assertTrue(limiter.tryAcquire("s1"));

        assertFalse(limiter.tryAcquire("s1"));
        assertFalse(limiter.canExecute("s1"));
        assertEquals(0, limiter.getRemainingCapacity("s1"));
        assertEquals(Duration.ofMinutes(7), limiter.getWaitTime("s1"));
    }

    @Test
    void slotShouldFreeWhenOldestLeavesWindow() {
        limiter.recordExecution("s1");
        clock.advance(Duration.ofMinutes(1));
        limiter.recordExecution("s1");

        clock.advance(Duration.ofMinutes(9));
        assertTrue(limiter.canExecute("s1"));
        assertEquals(1, limiter.getRemainingCapacity("s1"));
        assertEquals(Duration.ZERO, limiter.getWaitTime("s1"));
    }

    @Test
    void releaseShouldGiveBackNewestSlot() {
        assertTrue(limiter.tryAcquire("s1"));
        clock.advance(Duration.ofMinutes(3));
        assertTrue(limiter.tryAcquire("s1"));

        limiter.release("s1");
        assertEquals(1, limiter.getRemainingCapacity("s1"));
        assertTrue(limiter.tryAcquire("s1"));
        assertEquals(Duration.ofMinutes(7), limiter.getWaitTime("s1"));
        limiter.release("unknown");
    }

    @Test
    void keysShouldBeIndependent() {
        limiter.recordExecution("s1");
        limiter.recordExecution("s1");

        assertTrue(limiter.canExecute("s2"));
        limiter.reset("s1");
        assertTrue(limiter.canExecute("s1"));
    }

    @Test
    void invalidLimitShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowRateLimiter(0, Duration.ofMinutes(1), clock));
    }
}
