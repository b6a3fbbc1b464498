package io.dispatch4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Sliding-window execution limit.
 *
 * @param queueOverflow wait for the next free slot instead of skipping the tick
 */
public record RateLimitConfig(int maxExecutions, Duration window, boolean queueOverflow) {
    public RateLimitConfig {
        Objects.requireNonNull(window, "window must not be null");
        if (maxExecutions <= 0) {
            throw new IllegalArgumentException("maxExecutions must be a positive number");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be a positive duration");
        }
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(10, Duration.ofHours(1), true);
    }
}
