package io.dispatch4j;

import io.dispatch4j.core.CatchUpConfig;
import io.dispatch4j.core.ConditionalConfig;
import io.dispatch4j.core.DependencyConfig;
import io.dispatch4j.core.EventTriggerConfig;
import io.dispatch4j.core.Priority;
import io.dispatch4j.core.RateLimitConfig;
import io.dispatch4j.core.Schedule;
import io.dispatch4j.core.SlaConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for configuring a schedule before registering it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an immutable schedule definition</li>
 *   <li>save(): build() + {@link FleetScheduler#addSchedule(Schedule)}</li>
 * </ul>
 * Exactly one of {@code cron}, {@code every}, {@code at}, {@code onEvent} or {@code afterCompletionOf}
 * selects the schedule type; the last call wins.
 */
public interface ScheduleBuilder {

    ScheduleBuilder workflowName(String workflowName);

    /**
     * Cron expression (5 or 6 fields) or alias such as {@code "daily"} or {@code "@business_hours"}.
     */
    ScheduleBuilder cron(String expression);

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "5 minutes", "2 hours", "30s").
     */
    ScheduleBuilder every(String interval);

    ScheduleBuilder every(Duration interval);

    /**
     * Repeat every N seconds.
     */
    ScheduleBuilder every(Number seconds);

    /**
     * Run once at an absolute time.
     */
    ScheduleBuilder at(Instant time);

    ScheduleBuilder onEvent(EventTriggerConfig eventTrigger);

    /**
     * Fire whenever the given dependency condition becomes satisfied.
     */
    ScheduleBuilder afterCompletionOf(DependencyConfig dependency);

    /**
     * Gate a timed or event schedule on other schedules having completed.
     */
    ScheduleBuilder dependency(DependencyConfig dependency);

    /**
     * IANA time zone id used for cron evaluation and business-hour checks.
     */
    ScheduleBuilder timezone(String timezone);

    ScheduleBuilder businessCalendar(String calendarId);

    ScheduleBuilder sla(SlaConfig sla);

    ScheduleBuilder rateLimit(RateLimitConfig rateLimit);

    ScheduleBuilder conditional(ConditionalConfig conditional);

    ScheduleBuilder catchUp(CatchUpConfig catchUp);

    ScheduleBuilder priority(Priority priority);

    ScheduleBuilder priority(int priority);

    ScheduleBuilder maxInstances(int maxInstances);

    ScheduleBuilder robotId(String robotId);

    ScheduleBuilder variables(Map<String, Object> variables);

    ScheduleBuilder tags(List<String> tags);

    ScheduleBuilder metadata(Map<String, Object> metadata);

    ScheduleBuilder createdBy(String createdBy);

    ScheduleBuilder enabled(boolean enabled);

    /**
     * Build an immutable schedule definition (not registered).
     */
    Schedule build();

    /**
     * Build + register. Returns false when the scheduler rejects the definition.
     */
    boolean save();
}
