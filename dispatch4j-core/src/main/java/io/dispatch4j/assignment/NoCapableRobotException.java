package io.dispatch4j.assignment;

import java.util.List;

/**
 * No robot in the supplied snapshot passed the hard constraints for a job.
 * The caller decides whether to retry, queue or surface the failure.
 */
public class NoCapableRobotException extends RuntimeException {
    private final String jobName;
    private final List<String> requiredCapabilities;

    public NoCapableRobotException(String jobName, List<String> requiredCapabilities) {
        super("No capable robot found for job '" + jobName + "'. Required capabilities: " + requiredCapabilities);
        this.jobName = jobName;
        this.requiredCapabilities = List.copyOf(requiredCapabilities);
    }

    public String getJobName() {
        return jobName;
    }

    public List<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }
}
