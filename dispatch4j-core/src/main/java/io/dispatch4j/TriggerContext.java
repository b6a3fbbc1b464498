package io.dispatch4j;

import io.dispatch4j.core.ScheduleInfo;

import java.time.Instant;
import java.util.Map;

/**
 * What a {@link ScheduleTrigger} gets for one run.
 *
 * @param eventData payload of the triggering event, empty for timed runs
 * @param catchUp   true when the run replays a missed execution
 */
public record TriggerContext(
        String executionId,
        ScheduleInfo schedule,
        Instant firedAt,
        Map<String, Object> eventData,
        boolean catchUp
) {
    public TriggerContext {
        eventData = eventData == null ? Map.of() : Map.copyOf(eventData);
    }
}
