package io.dispatch4j.assignment;

import java.util.List;
import java.util.Objects;

/**
 * Assignment decision as a value: either {@link Assigned} or {@link Rejected}.
 * Returned by {@link JobAssignmentEngine#tryAssign}.
 */
public sealed interface AssignmentOutcome permits AssignmentOutcome.Assigned, AssignmentOutcome.Rejected {

    boolean isAssigned();

    record Assigned(AssignmentResult result) implements AssignmentOutcome {
        public Assigned {
            Objects.requireNonNull(result, "result must not be null");
        }

        @Override
        public boolean isAssigned() {
            return true;
        }
    }

    /**
     * @param candidates number of robots that were offered before filtering
     */
    record Rejected(String jobName, List<String> requiredCapabilities, String environment, int candidates)
            implements AssignmentOutcome {
        public Rejected {
            requiredCapabilities = List.copyOf(requiredCapabilities);
        }

        @Override
        public boolean isAssigned() {
            return false;
        }

        public NoCapableRobotException toException() {
            return new NoCapableRobotException(jobName, requiredCapabilities);
        }
    }
}
