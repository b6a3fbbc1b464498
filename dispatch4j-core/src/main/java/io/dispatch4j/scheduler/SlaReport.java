package io.dispatch4j.scheduler;

import io.dispatch4j.core.SlaStatus;

import java.time.Instant;
import java.util.List;

/**
 * SLA compliance of schedules over a rolling window. Schedules without an SLA are not listed.
 */
public record SlaReport(Instant generatedAt, int windowHours, List<Entry> schedules) {
    public SlaReport {
        schedules = List.copyOf(schedules);
    }

    /**
     * @param maxDurationMs         configured limit, null when unlimited
     * @param consecutiveSuccesses  current success streak
     */
    public record Entry(
            String scheduleId,
            String scheduleName,
            SlaStatus status,
            double successRate,
            double successRateThreshold,
            long averageDurationMs,
            Long maxDurationMs,
            int consecutiveFailures,
            int consecutiveFailureLimit,
            int consecutiveSuccesses,
            long runCount
    ) {
    }
}
