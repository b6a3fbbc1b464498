package io.dispatch4j.core;

/**
 * Replay of missed runs after downtime.
 */
public record CatchUpConfig(boolean enabled, int maxCatchUpRuns, int catchUpWindowHours, boolean runSequentially) {
    public CatchUpConfig {
        if (maxCatchUpRuns < 0 || catchUpWindowHours < 0) {
            throw new IllegalArgumentException("catch-up limits must not be negative");
        }
    }

    public static CatchUpConfig defaults() {
        return new CatchUpConfig(true, 5, 24, true);
    }
}
