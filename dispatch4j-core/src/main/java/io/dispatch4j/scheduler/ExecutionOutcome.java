package io.dispatch4j.scheduler;

/**
 * How one pass through the gate pipeline ended.
 */
public enum ExecutionOutcome {
    SUCCEEDED,
    FAILED,
    NOT_FOUND,
    NOT_ACTIVE,
    RATE_LIMITED,
    BLOCKED_BY_CALENDAR,
    CONDITION_NOT_MET,
    DEPENDENCIES_PENDING,
    MAX_INSTANCES_REACHED,
    SCHEDULER_STOPPED;

    /**
     * Whether the trigger callback was invoked.
     */
    public boolean executed() {
        return this == SUCCEEDED || this == FAILED;
    }
}
