package io.dispatch4j.scheduler;

import java.time.Instant;
import java.util.Objects;

/**
 * Fires once. A run time slightly in the past still fires on registration; the scheduler's misfire
 * grace period decides whether it is too late.
 */
public final class DateTrigger implements Trigger {
    private final Instant runAt;

    public DateTrigger(Instant runAt) {
        this.runAt = Objects.requireNonNull(runAt, "runAt must not be null");
    }

    @Override
    public Instant nextFireTime(Instant after) {
        return runAt.isAfter(after) ? runAt : null;
    }

    @Override
    public Instant firstFireTime(Instant now) {
        return runAt;
    }

    @Override
    public String toString() {
        return "date[" + runAt + "]";
    }
}
