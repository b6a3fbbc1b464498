package io.dispatch4j.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fires every {@code interval}, aligned on {@code start}.
 */
public final class IntervalTrigger implements Trigger {
    private final Duration interval;
    private final Instant start;

    public IntervalTrigger(Duration interval, Instant start) {
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.start = Objects.requireNonNull(start, "start must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }
    }

    @Override
    public Instant nextFireTime(Instant after) {
        if (after.isBefore(start)) {
            return start;
        }
        long elapsed = Duration.between(start, after).toMillis();
        long step = interval.toMillis();
        long periods = elapsed / step + 1;
        return start.plusMillis(periods * step);
    }

    public Duration interval() {
        return interval;
    }

    @Override
    public String toString() {
        return "interval[" + interval + "]";
    }
}
