package io.dispatch4j.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Allows at most {@code maxExecutions} executions per key within any window of length {@code window}.
 */
public class SlidingWindowRateLimiter {
    private final int maxExecutions;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Instant>> executions = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SlidingWindowRateLimiter(int maxExecutions, Duration window, Clock clock) {
        if (maxExecutions <= 0) {
            throw new IllegalArgumentException("maxExecutions must be a positive number");
        }
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxExecutions = maxExecutions;
    }

    public boolean canExecute(String key) {
        lock.lock();
        try {
            return entries(key).size() < maxExecutions;
        } finally {
            lock.unlock();
        }
    }

    public void recordExecution(String key) {
        lock.lock();
        try {
            entries(key).addLast(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check and record in one step.
     *
     * @return false when the window is full
     */
    public boolean tryAcquire(String key) {
        lock.lock();
        try {
            Deque<Instant> q = entries(key);
            if (q.size() >= maxExecutions) {
                return false;
            }
            q.addLast(clock.instant());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Give back the most recent slot taken by {@link #tryAcquire} when the execution did not happen.
     */
    public void release(String key) {
        lock.lock();
        try {
            Deque<Instant> q = executions.get(key);
            if (q != null) {
                q.pollLast();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time until the oldest execution leaves the window, zero when a slot is free.
     */
    public Duration getWaitTime(String key) {
        lock.lock();
        try {
            Deque<Instant> q = entries(key);
            if (q.size() < maxExecutions) {
                return Duration.ZERO;
            }
            Duration wait = Duration.between(clock.instant(), q.peekFirst().plus(window));
            return wait.isNegative() ? Duration.ZERO : wait;
        } finally {
            lock.unlock();
        }
    }

    public int getRemainingCapacity(String key) {
        lock.lock();
        try {
            return Math.max(0, maxExecutions - entries(key).size());
        } finally {
            lock.unlock();
        }
    }

    public void reset(String key) {
        lock.lock();
        try {
            executions.remove(key);
        } finally {
            lock.unlock();
        }
    }

    // Drops entries at or before now - window; caller holds the lock.
    private Deque<Instant> entries(String key) {
        Deque<Instant> q = executions.computeIfAbsent(key, k -> new ArrayDeque<>());
        Instant cutoff = clock.instant().minus(window);
        while (!q.isEmpty() && !q.peekFirst().isAfter(cutoff)) {
            q.pollFirst();
        }
        return q;
    }
}
