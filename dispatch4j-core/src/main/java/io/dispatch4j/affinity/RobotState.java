package io.dispatch4j.affinity;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recoverable state a robot holds for a workflow, such as a browser session, downloaded files or an
 * in-memory cache. Instances are immutable; {@link StateAffinityManager} replaces them on touch.
 *
 * @param expiresAt null when the state never expires
 */
public record RobotState(
        String robotId,
        String workflowId,
        String stateType,
        Instant createdAt,
        Instant lastAccessed,
        Instant expiresAt,
        Map<String, Object> metadata,
        long sizeBytes,
        boolean migratable
) {
    public RobotState {
        Objects.requireNonNull(robotId, "robotId must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(stateType, "stateType must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(lastAccessed, "lastAccessed must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must not be negative");
        }
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public Duration idle(Instant now) {
        return Duration.between(lastAccessed, now);
    }

    RobotState touchedAt(Instant now) {
        return new RobotState(robotId, workflowId, stateType, createdAt, now, expiresAt, metadata, sizeBytes, migratable);
    }
}
