package io.dispatch4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a schedule's definition together with its runtime state.
 */
public record ScheduleInfo(
        Schedule schedule,
        ScheduleStatus status,
        Instant lastRun,
        Instant nextRun,
        long runCount,
        long successCount,
        long failureCount,
        int consecutiveFailures,
        Instant createdAt,
        Instant updatedAt
) {
    public ScheduleInfo {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static ScheduleInfo fresh(Schedule schedule, Instant now) {
        return new ScheduleInfo(schedule, schedule.enabled() ? ScheduleStatus.ACTIVE : ScheduleStatus.DISABLED,
                null, null, 0, 0, 0, 0, now, now);
    }

    public String id() {
        return schedule.id();
    }

    /**
     * Lifetime success rate in percent, 100 before the first run.
     */
    public double successRate() {
        if (runCount == 0) {
            return 100.0;
        }
        return (double) successCount / runCount * 100.0;
    }
}
