package io.dispatch4j.affinity;

/**
 * A job cannot be placed without breaking its affinity: the pinned session robot is unavailable,
 * or a HARD-affinity job ran out of queue attempts. Not retried by the affinity manager.
 */
public class SessionAffinityException extends RuntimeException {
    private final String workflowId;
    private final String requiredRobotId;

    public SessionAffinityException(String message, String workflowId, String requiredRobotId) {
        super(message);
        this.workflowId = workflowId;
        this.requiredRobotId = requiredRobotId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /**
     * Robot the job is bound to, or null when several robots hold the state.
     */
    public String getRequiredRobotId() {
        return requiredRobotId;
    }
}
