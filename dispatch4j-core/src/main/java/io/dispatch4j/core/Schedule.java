package io.dispatch4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable schedule definition produced by {@code ScheduleBuilder.build()}.
 * Runtime counters live in {@link ScheduleInfo}; this is a pure data object.
 */
public record Schedule(

        // identity
        String id,
        String name,
        String workflowId,
        String workflowName,
        ScheduleType type,
        boolean enabled,

        // trigger
        String timezone,
        String cronExpression,
        Duration interval,
        Instant runAt,
        EventTriggerConfig eventTrigger,

        // gates
        String calendarId,
        boolean respectBusinessHours,
        RateLimitConfig rateLimit,
        DependencyConfig dependency,
        ConditionalConfig conditional,

        // monitoring
        SlaConfig sla,
        CatchUpConfig catchUp,

        // execution metadata
        int priority,
        int maxInstances,
        String robotId,
        Map<String, Object> variables,
        List<String> tags,
        Map<String, Object> metadata,
        String createdBy
) {
    public Schedule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (maxInstances <= 0) {
            throw new IllegalArgumentException("maxInstances must be a positive number");
        }
        workflowName = workflowName != null ? workflowName : "";
        timezone = timezone != null ? timezone : "UTC";
        variables = copy(variables);
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = copy(metadata);
    }

    private static Map<String, Object> copy(Map<String, Object> m) {
        return m == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }
}
