package io.dispatch4j.scheduler;

import java.time.Instant;

/**
 * Fire-time calculation for timed schedules.
 */
public interface Trigger {

    /**
     * Next fire time strictly after {@code after}, or null when the trigger is exhausted.
     */
    Instant nextFireTime(Instant after);

    /**
     * Fire time to arm when the schedule is registered at {@code now}.
     */
    default Instant firstFireTime(Instant now) {
        return nextFireTime(now);
    }
}
