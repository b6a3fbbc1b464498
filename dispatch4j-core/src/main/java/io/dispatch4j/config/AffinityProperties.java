package io.dispatch4j.config;

import java.time.Duration;

/**
 * Runtime configuration for state and session affinity.
 */
public class AffinityProperties {
    private Duration defaultStateTtl = Duration.ofHours(1);
    private Duration sessionTimeout = Duration.ofHours(1);
    private Duration hardAffinityQueueDelay = Duration.ofSeconds(30);
    private Duration maxQueueDelay = Duration.ofMinutes(15);
    private int maxQueueAttempts = 10;
    private Duration cleanupInterval = Duration.ofMinutes(5);

    public Duration getDefaultStateTtl() {
        return defaultStateTtl;
    }

    public void setDefaultStateTtl(Duration defaultStateTtl) {
        this.defaultStateTtl = defaultStateTtl;
    }

    public Duration getSessionTimeout() {
        return sessionTimeout;
    }

    public void setSessionTimeout(Duration sessionTimeout) {
        this.sessionTimeout = sessionTimeout;
    }

    public Duration getHardAffinityQueueDelay() {
        return hardAffinityQueueDelay;
    }

    public void setHardAffinityQueueDelay(Duration hardAffinityQueueDelay) {
        this.hardAffinityQueueDelay = hardAffinityQueueDelay;
    }

    public Duration getMaxQueueDelay() {
        return maxQueueDelay;
    }

    public void setMaxQueueDelay(Duration maxQueueDelay) {
        this.maxQueueDelay = maxQueueDelay;
    }

    public int getMaxQueueAttempts() {
        return maxQueueAttempts;
    }

    public void setMaxQueueAttempts(int maxQueueAttempts) {
        this.maxQueueAttempts = maxQueueAttempts;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }
}
