package io.dispatch4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Conditional execution. The condition lives in memory only and is not persisted.
 *
 * @param retryOnConditionFail re-check up to {@code maxConditionRetries} times, {@code retryInterval} apart
 */
public record ConditionalConfig(ScheduleCondition condition, boolean retryOnConditionFail, Duration retryInterval,
                                int maxConditionRetries) {
    public ConditionalConfig {
        Objects.requireNonNull(condition, "condition must not be null");
        retryInterval = retryInterval == null ? Duration.ofSeconds(60) : retryInterval;
        if (maxConditionRetries < 0) {
            throw new IllegalArgumentException("maxConditionRetries must not be negative");
        }
    }

    public static ConditionalConfig of(ScheduleCondition condition) {
        return new ConditionalConfig(condition, false, Duration.ofSeconds(60), 5);
    }
}
