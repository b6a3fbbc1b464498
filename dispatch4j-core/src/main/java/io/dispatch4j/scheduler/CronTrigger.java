package io.dispatch4j.scheduler;

import io.dispatch4j.utils.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Fires on a cron expression evaluated in a fixed time zone.
 */
public final class CronTrigger implements Trigger {
    private final CronExpression expression;
    private final ZoneId zone;

    public CronTrigger(CronExpression expression, ZoneId zone) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * @throws IllegalArgumentException for a malformed expression or unknown zone
     */
    public static CronTrigger parse(String expression, String timezone) {
        return new CronTrigger(CronExpression.parse(expression), ZoneId.of(timezone));
    }

    @Override
    public Instant nextFireTime(Instant after) {
        ZonedDateTime next = expression.nextAfter(after.atZone(zone));
        return next == null ? null : next.toInstant();
    }

    public CronExpression expression() {
        return expression;
    }

    @Override
    public String toString() {
        return "cron[" + expression.expression() + " " + zone + "]";
    }
}
