package io.dispatch4j.affinity;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A chain of related jobs pinned to one robot. The session ends once it has been idle for longer
 * than {@code timeout}.
 */
public record WorkflowSession(
        String sessionId,
        String workflowId,
        String robotId,
        String chainId,
        Instant startedAt,
        Instant lastJobAt,
        int jobCount,
        Duration timeout
) {
    public WorkflowSession {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(robotId, "robotId must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(lastJobAt, "lastJobAt must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
    }

    public boolean isExpired(Instant now) {
        return Duration.between(lastJobAt, now).compareTo(timeout) > 0;
    }

    WorkflowSession withJobRecorded(Instant now) {
        return new WorkflowSession(sessionId, workflowId, robotId, chainId, startedAt, now, jobCount + 1, timeout);
    }
}
