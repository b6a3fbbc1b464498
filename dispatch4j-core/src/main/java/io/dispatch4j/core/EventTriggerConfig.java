package io.dispatch4j.core;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Event subscription of an EVENT schedule.
 *
 * @param eventFilter key to expected value, or to an operator map using {@code $eq $ne $gt $lt $in $regex}
 * @param debounce    minimum time between two triggers
 */
public record EventTriggerConfig(EventType eventType, String eventSource, Map<String, Object> eventFilter, Duration debounce) {
    public EventTriggerConfig {
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(eventSource, "eventSource must not be null");
        eventFilter = eventFilter == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(eventFilter));
        debounce = debounce == null ? Duration.ZERO : debounce;
    }

    public static EventTriggerConfig of(EventType eventType, String eventSource) {
        return new EventTriggerConfig(eventType, eventSource, Map.of(), Duration.ZERO);
    }
}
