package io.dispatch4j.assignment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * What a job needs from the robot that runs it. Capabilities, environment and minimum resources
 * are hard constraints. Tags only influence scoring: a required tag earns the full tag bonus,
 * a preferred tag half of it.
 */
public final class JobRequirements {
    private final String workflowId;
    private final String workflowName;
    private final List<RobotCapability> requiredCapabilities;
    private final List<String> requiredTags;
    private final List<String> preferredTags;
    private final boolean requiresState;
    private final double minMemoryGb;
    private final int minCpuCores;
    private final String environment;
    private final int timeoutSeconds;
    private final int priority;

    private JobRequirements(Builder b) {
        this.workflowId = b.workflowId;
        this.workflowName = b.workflowName != null ? b.workflowName : b.workflowId;
        this.requiredCapabilities = List.copyOf(b.requiredCapabilities);
        this.requiredTags = List.copyOf(b.requiredTags);
        this.preferredTags = List.copyOf(b.preferredTags);
        this.requiresState = b.requiresState;
        this.minMemoryGb = b.minMemoryGb;
        this.minCpuCores = b.minCpuCores;
        this.environment = b.environment;
        this.timeoutSeconds = b.timeoutSeconds;
        this.priority = b.priority;
    }

    public static Builder builder(String workflowId) {
        return new Builder(workflowId);
    }

    public String workflowId() {
        return workflowId;
    }

    public String workflowName() {
        return workflowName;
    }

    public List<RobotCapability> requiredCapabilities() {
        return requiredCapabilities;
    }

    public List<String> requiredCapabilityNames() {
        return requiredCapabilities.stream().map(RobotCapability::name).toList();
    }

    public List<String> requiredTags() {
        return requiredTags;
    }

    public List<String> preferredTags() {
        return preferredTags;
    }

    public boolean requiresState() {
        return requiresState;
    }

    public double minMemoryGb() {
        return minMemoryGb;
    }

    public int minCpuCores() {
        return minCpuCores;
    }

    public String environment() {
        return environment;
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    public int priority() {
        return priority;
    }

    public static final class Builder {
        private final String workflowId;
        private String workflowName;
        private final List<RobotCapability> requiredCapabilities = new ArrayList<>();
        private final List<String> requiredTags = new ArrayList<>();
        private final List<String> preferredTags = new ArrayList<>();
        private boolean requiresState;
        private double minMemoryGb;
        private int minCpuCores;
        private String environment = RobotInfo.DEFAULT_ENVIRONMENT;
        private int timeoutSeconds = 3600;
        private int priority = 1;

        private Builder(String workflowId) {
            this.workflowId = Objects.requireNonNull(workflowId, "workflowId must not be null");
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder requireCapability(RobotCapability capability) {
            requiredCapabilities.add(Objects.requireNonNull(capability, "capability must not be null"));
            return this;
        }

        public Builder requireCapability(CapabilityType type, String name) {
            return requireCapability(RobotCapability.of(type, name));
        }

        public Builder requireCapability(CapabilityType type, String name, String version) {
            return requireCapability(RobotCapability.of(type, name, version));
        }

        public Builder requiredTags(String... tags) {
            requiredTags.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder preferredTags(String... tags) {
            preferredTags.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder requiresState(boolean requiresState) {
            this.requiresState = requiresState;
            return this;
        }

        public Builder minMemoryGb(double minMemoryGb) {
            if (minMemoryGb < 0) {
                throw new IllegalArgumentException("minMemoryGb must not be negative");
            }
            this.minMemoryGb = minMemoryGb;
            return this;
        }

        public Builder minCpuCores(int minCpuCores) {
            if (minCpuCores < 0) {
                throw new IllegalArgumentException("minCpuCores must not be negative");
            }
            this.minCpuCores = minCpuCores;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = Objects.requireNonNull(environment, "environment must not be null");
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            if (timeoutSeconds <= 0) {
                throw new IllegalArgumentException("timeoutSeconds must be positive");
            }
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public JobRequirements build() {
            return new JobRequirements(this);
        }
    }
}
