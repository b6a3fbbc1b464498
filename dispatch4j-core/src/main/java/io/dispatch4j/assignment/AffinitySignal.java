package io.dispatch4j.assignment;

/**
 * Tells the assignment engine whether a robot still holds usable state for a workflow.
 */
@FunctionalInterface
public interface AffinitySignal {

    AffinitySignal NONE = (workflowId, robotId) -> false;

    boolean hasValidState(String workflowId, String robotId);
}
