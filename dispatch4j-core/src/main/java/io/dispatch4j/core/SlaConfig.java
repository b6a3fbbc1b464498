package io.dispatch4j.core;

import java.time.Duration;

/**
 * SLA thresholds for a schedule.
 *
 * @param maxDuration             longest allowed run, null for no limit
 * @param maxStartDelay           longest allowed delay between planned and actual start, null for no limit
 * @param successRateThreshold    minimum success rate in percent
 * @param consecutiveFailureLimit failures in a row that move the schedule to {@link ScheduleStatus#ERROR}
 * @param onBreach                called on every breach, not persisted
 */
public record SlaConfig(
        Duration maxDuration,
        Duration maxStartDelay,
        double successRateThreshold,
        int consecutiveFailureLimit,
        SlaBreachHandler onBreach
) {
    public SlaConfig {
        if (successRateThreshold < 0 || successRateThreshold > 100) {
            throw new IllegalArgumentException("successRateThreshold must be between 0 and 100");
        }
        if (consecutiveFailureLimit <= 0) {
            throw new IllegalArgumentException("consecutiveFailureLimit must be a positive number");
        }
    }

    public static SlaConfig defaults() {
        return new SlaConfig(null, Duration.ofMinutes(5), 95.0, 3, null);
    }

    public SlaConfig withMaxDuration(Duration maxDuration) {
        return new SlaConfig(maxDuration, maxStartDelay, successRateThreshold, consecutiveFailureLimit, onBreach);
    }

    public SlaConfig withConsecutiveFailureLimit(int limit) {
        return new SlaConfig(maxDuration, maxStartDelay, successRateThreshold, limit, onBreach);
    }

    public SlaConfig withSuccessRateThreshold(double threshold) {
        return new SlaConfig(maxDuration, maxStartDelay, threshold, consecutiveFailureLimit, onBreach);
    }

    public SlaConfig withOnBreach(SlaBreachHandler handler) {
        return new SlaConfig(maxDuration, maxStartDelay, successRateThreshold, consecutiveFailureLimit, handler);
    }
}
