package io.dispatch4j.affinity;

import java.time.Duration;
import java.util.List;

/**
 * Result of an affinity-aware robot selection.
 *
 * @param selectedRobotId      null when no robot was chosen (queue, or nothing available)
 * @param stateRobots          robots known to hold valid state for the workflow
 * @param fallbackUsed         true when the selection ignored state because none was usable
 * @param shouldQueue          the caller should retry after {@code queueDelay}
 * @param migrationRequired    an unavailable robot holds migratable state that could be moved to the selection
 * @param migrationSourceRobot that robot, when {@code migrationRequired}
 * @param session              the session the decision is bound to, for {@link AffinityLevel#SESSION}
 */
public record AffinityDecision(
        String selectedRobotId,
        AffinityLevel level,
        String reason,
        boolean hasState,
        List<String> stateRobots,
        boolean fallbackUsed,
        boolean shouldQueue,
        Duration queueDelay,
        boolean migrationRequired,
        String migrationSourceRobot,
        WorkflowSession session
) {
    public AffinityDecision {
        stateRobots = List.copyOf(stateRobots);
        queueDelay = queueDelay == null ? Duration.ZERO : queueDelay;
    }

    public boolean isSelected() {
        return selectedRobotId != null;
    }

    static AffinityDecision selected(String robotId, AffinityLevel level, String reason, boolean hasState,
                                     List<String> stateRobots, boolean fallbackUsed) {
        return new AffinityDecision(robotId, level, reason, hasState, stateRobots, fallbackUsed, false,
                Duration.ZERO, false, null, null);
    }

    static AffinityDecision queued(AffinityLevel level, String reason, List<String> stateRobots, Duration delay) {
        return new AffinityDecision(null, level, reason, false, stateRobots, false, true, delay, false, null, null);
    }
}
