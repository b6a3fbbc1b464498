package io.dispatch4j.scheduler;

import io.dispatch4j.core.SlaBreachHandler;
import io.dispatch4j.core.SlaConfig;
import io.dispatch4j.core.SlaStatus;
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
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-schedule execution metrics and SLA breach detection.
 * Keeps at most {@code retention} metrics per schedule, trimming to the newest half when exceeded.
 */
public class SlaMonitor {
    private static final Logger log = LoggerFactory.getLogger(SlaMonitor.class);

    /** Success rate this far below the threshold counts as breached rather than at risk. */
    static final double BREACH_MARGIN = 5.0;

    public record ExecutionMetrics(
            String executionId,
            String scheduleId,
            Instant scheduledTime,
            Instant startedAt,
            Instant completedAt,
            boolean success,
            long durationMs,
            long startDelayMs
    ) {
    }

    private final Clock clock;
    private final int retention;
    private final Map<String, List<ExecutionMetrics>> metrics = new HashMap<>();
    private final Map<String, ExecutionMetrics> active = new HashMap<>();
    private final List<SlaBreachHandler> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SlaMonitor(Clock clock, int retention) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (retention < 2) {
            throw new IllegalArgumentException("retention must be at least 2");
        }
        this.retention = retention;
    }

    public void addAlertListener(SlaBreachHandler listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * @param scheduledTime planned fire time, null when unknown (manual or event runs)
     * @return execution id for {@link #recordCompletion}
     */
    public String recordStart(String scheduleId, Instant scheduledTime) {
        String executionId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        long delay = scheduledTime == null ? 0 : Math.max(0, Duration.between(scheduledTime, now).toMillis());
        ExecutionMetrics m = new ExecutionMetrics(executionId, scheduleId, scheduledTime, now, null, false, 0, delay);
        lock.lock();
        try {
            active.put(executionId, m);
        } finally {
            lock.unlock();
        }
        return executionId;
    }

    /**
     * Close an execution and check it against {@code sla}, alerting listeners on breach.
     */
    public Optional<ExecutionMetrics> recordCompletion(String executionId, boolean success, SlaConfig sla) {
        ExecutionMetrics done;
        lock.lock();
        try {
            ExecutionMetrics started = active.remove(executionId);
            if (started == null) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            done = new ExecutionMetrics(executionId, started.scheduleId(), started.scheduledTime(), started.startedAt(),
                    now, success, Duration.between(started.startedAt(), now).toMillis(), started.startDelayMs());
            List<ExecutionMetrics> list = metrics.computeIfAbsent(done.scheduleId(), k -> new ArrayList<>());
            list.add(done);
            if (list.size() > retention) {
                list.subList(0, list.size() - retention / 2).clear();
            }
        } finally {
            lock.unlock();
        }
        if (sla != null) {
            checkSla(done, sla);
        }
        return Optional.of(done);
    }

    private void checkSla(ExecutionMetrics m, SlaConfig sla) {
        List<String> breaches = new ArrayList<>();
        if (sla.maxDuration() != null && m.durationMs() > sla.maxDuration().toMillis()) {
            breaches.add("Duration " + m.durationMs() + "ms exceeded limit " + sla.maxDuration().toMillis() + "ms");
        }
        if (sla.maxStartDelay() != null && m.startDelayMs() > sla.maxStartDelay().toMillis()) {
            breaches.add("Start delay " + m.startDelayMs() + "ms exceeded limit " + sla.maxStartDelay().toMillis() + "ms");
        }
        if (breaches.isEmpty()) {
            return;
        }
        String message = String.join("; ", breaches);
        log.warn("SLA breach. schedule={} msg={}", m.scheduleId(), message);
        alert(m.scheduleId(), message, sla.onBreach());
    }

    void alert(String scheduleId, String message, SlaBreachHandler scheduleHandler) {
        for (SlaBreachHandler listener : listeners) {
            notify(listener, scheduleId, message);
        }
        if (scheduleHandler != null) {
            notify(scheduleHandler, scheduleId, message);
        }
    }

    private static void notify(SlaBreachHandler handler, String scheduleId, String message) {
        try {
            handler.onBreach(scheduleId, SlaStatus.BREACHED, message);
        } catch (RuntimeException e) {
            log.error("SLA alert handler failed. schedule={} msg={}", scheduleId, e.getMessage(), e);
        }
    }

    /**
     * Newest first.
     *
     * @param since null for all retained metrics
     */
    public List<ExecutionMetrics> getMetrics(String scheduleId, Instant since, int limit) {
        lock.lock();
        try {
            List<ExecutionMetrics> list = metrics.getOrDefault(scheduleId, List.of());
            List<ExecutionMetrics> result = new ArrayList<>();
            for (int i = list.size() - 1; i >= 0 && result.size() < limit; i--) {
                ExecutionMetrics m = list.get(i);
                if (since == null || !m.startedAt().isBefore(since)) {
                    result.add(m);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Success rate in percent over the window, 100 when there is no data.
     */
    public double getSuccessRate(String scheduleId, int windowHours) {
        List<ExecutionMetrics> window = window(scheduleId, windowHours);
        if (window.isEmpty()) {
            return 100.0;
        }
        long ok = window.stream().filter(ExecutionMetrics::success).count();
        return (double) ok / window.size() * 100.0;
    }

    public long getAverageDurationMs(String scheduleId, int windowHours) {
        List<ExecutionMetrics> window = window(scheduleId, windowHours);
        if (window.isEmpty()) {
            return 0;
        }
        long total = 0;
        for (ExecutionMetrics m : window) {
            total += m.durationMs();
        }
        return total / window.size();
    }

    /**
     * Successes since the most recent failure.
     */
    public int getSuccessStreak(String scheduleId) {
        int streak = 0;
        for (ExecutionMetrics m : getMetrics(scheduleId, null, retention)) {
            if (!m.success()) {
                break;
            }
            streak++;
        }
        return streak;
    }

    /**
     * SLA status over the window: BREACHED at the consecutive-failure limit or when the success rate
     * is more than {@link #BREACH_MARGIN} points under the threshold, AT_RISK when it is under the
     * threshold by less, OK otherwise.
     */
    public SlaStatus evaluate(String scheduleId, SlaConfig sla, int consecutiveFailures, int windowHours) {
        if (sla == null) {
            return SlaStatus.UNKNOWN;
        }
        if (consecutiveFailures >= sla.consecutiveFailureLimit()) {
            return SlaStatus.BREACHED;
        }
        double rate = getSuccessRate(scheduleId, windowHours);
        if (rate < sla.successRateThreshold() - BREACH_MARGIN) {
            return SlaStatus.BREACHED;
        }
        if (rate < sla.successRateThreshold()) {
            return SlaStatus.AT_RISK;
        }
        return SlaStatus.OK;
    }

    public void forget(String scheduleId) {
        lock.lock();
        try {
            metrics.remove(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    private List<ExecutionMetrics> window(String scheduleId, int windowHours) {
        return getMetrics(scheduleId, clock.instant().minus(Duration.ofHours(windowHours)), Integer.MAX_VALUE);
    }
}
