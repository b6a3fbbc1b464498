package io.dispatch4j.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Completion history of schedules, used to decide when dependent schedules may run.
 * Records older than the TTL are dropped.
 */
public class DependencyTracker {
    private static final Logger log = LoggerFactory.getLogger(DependencyTracker.class);

    public record CompletionRecord(String scheduleId, Instant completedAt, boolean success, Object result) {
    }

    public record DependencyCheck(boolean satisfied, List<String> unsatisfied) {
        public DependencyCheck {
            unsatisfied = List.copyOf(unsatisfied);
        }
    }

    private final Duration ttl;
    private final Clock clock;
    private final Map<String, List<CompletionRecord>> completions = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition completed = lock.newCondition();

    public DependencyTracker(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DependencyTracker(Clock clock) {
        this(Duration.ofDays(1), clock);
    }

    public void recordCompletion(String scheduleId, boolean success, Object result) {
        CompletionRecord record = new CompletionRecord(scheduleId, clock.instant(), success, result);
        lock.lock();
        try {
            records(scheduleId).add(record);
            completed.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Recorded completion. schedule={} success={}", scheduleId, success);
    }

    /**
     * @param since only completions after this instant count, null for any within the TTL
     */
    public boolean isDependencySatisfied(String dependencyId, Instant since, boolean requireSuccess) {
        lock.lock();
        try {
            List<CompletionRecord> list = records(dependencyId);
            for (int i = list.size() - 1; i >= 0; i--) {
                CompletionRecord r = list.get(i);
                if (since != null && !r.completedAt().isAfter(since)) {
                    continue;
                }
                if (requireSuccess && !r.success()) {
                    continue;
                }
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public DependencyCheck areDependenciesSatisfied(List<String> dependencyIds, boolean waitForAll, Instant since,
                                                    boolean requireSuccess) {
        List<String> unsatisfied = new ArrayList<>();
        int satisfied = 0;
        for (String id : dependencyIds) {
            if (isDependencySatisfied(id, since, requireSuccess)) {
                satisfied++;
            } else {
                unsatisfied.add(id);
            }
        }
        boolean ok = waitForAll ? unsatisfied.isEmpty() : satisfied > 0;
        return new DependencyCheck(ok, unsatisfied);
    }

    /**
     * Block until the dependency has a successful completion or the timeout elapses.
     *
     * @return false on timeout
     */
    public boolean waitForDependency(String dependencyId, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!isDependencySatisfied(dependencyId, null, true)) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = completed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<CompletionRecord> getLatestCompletion(String scheduleId) {
        lock.lock();
        try {
            List<CompletionRecord> list = records(scheduleId);
            return list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
        } finally {
            lock.unlock();
        }
    }

    public void forget(String scheduleId) {
        lock.lock();
        try {
            completions.remove(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private List<CompletionRecord> records(String scheduleId) {
        List<CompletionRecord> list = completions.computeIfAbsent(scheduleId, k -> new ArrayList<>());
        Instant cutoff = clock.instant().minus(ttl);
        list.removeIf(r -> !r.completedAt().isAfter(cutoff));
        return list;
    }
}
