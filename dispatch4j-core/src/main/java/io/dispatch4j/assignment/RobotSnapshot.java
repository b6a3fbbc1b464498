package io.dispatch4j.assignment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable {@link RobotInfo} value.
 */
public record RobotSnapshot(
        String robotId,
        String name,
        String status,
        double cpuPercent,
        double memoryPercent,
        double diskPercent,
        int currentJobs,
        int maxConcurrentJobs,
        List<String> tags,
        String environment,
        Map<String, Object> capabilities,
        String networkZone,
        Instant lastHeartbeat
) implements RobotInfo {

    public RobotSnapshot {
        Objects.requireNonNull(robotId, "robotId must not be null");
        name = name == null ? robotId : name;
        status = status == null ? STATUS_ONLINE : status;
        tags = tags == null ? List.of() : List.copyOf(tags);
        environment = environment == null ? DEFAULT_ENVIRONMENT : environment;
        capabilities = capabilities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(capabilities));
        networkZone = networkZone == null ? DEFAULT_ZONE : networkZone;
        if (currentJobs < 0 || maxConcurrentJobs < 0) {
            throw new IllegalArgumentException("job counts must not be negative");
        }
    }

    public static Builder builder(String robotId) {
        return new Builder(robotId);
    }

    public Builder toBuilder() {
        Builder b = new Builder(robotId)
                .name(name)
                .status(status)
                .cpuPercent(cpuPercent)
                .memoryPercent(memoryPercent)
                .diskPercent(diskPercent)
                .jobs(currentJobs, maxConcurrentJobs)
                .tags(tags)
                .environment(environment)
                .networkZone(networkZone)
                .lastHeartbeat(lastHeartbeat);
        capabilities.forEach(b::capability);
        return b;
    }

    public static final class Builder {
        private final String robotId;
        private String name;
        private String status = STATUS_ONLINE;
        private double cpuPercent;
        private double memoryPercent;
        private double diskPercent;
        private int currentJobs;
        private int maxConcurrentJobs = 1;
        private final List<String> tags = new ArrayList<>();
        private String environment = DEFAULT_ENVIRONMENT;
        private final Map<String, Object> capabilities = new LinkedHashMap<>();
        private String networkZone = DEFAULT_ZONE;
        private Instant lastHeartbeat;

        private Builder(String robotId) {
            this.robotId = Objects.requireNonNull(robotId, "robotId must not be null");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder cpuPercent(double cpuPercent) {
            this.cpuPercent = cpuPercent;
            return this;
        }

        public Builder memoryPercent(double memoryPercent) {
            this.memoryPercent = memoryPercent;
            return this;
        }

        public Builder diskPercent(double diskPercent) {
            this.diskPercent = diskPercent;
            return this;
        }

        public Builder jobs(int current, int max) {
            this.currentJobs = current;
            this.maxConcurrentJobs = max;
            return this;
        }

        public Builder tags(String... tags) {
            return tags(Arrays.asList(tags));
        }

        public Builder tags(List<String> tags) {
            this.tags.clear();
            this.tags.addAll(tags);
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder capability(String key, Object value) {
            capabilities.put(Objects.requireNonNull(key, "key must not be null"), value);
            return this;
        }

        public Builder networkZone(String networkZone) {
            this.networkZone = networkZone;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public RobotSnapshot build() {
            return new RobotSnapshot(robotId, name, status, cpuPercent, memoryPercent, diskPercent,
                    currentJobs, maxConcurrentJobs, tags, environment, capabilities, networkZone, lastHeartbeat);
        }
    }
}
