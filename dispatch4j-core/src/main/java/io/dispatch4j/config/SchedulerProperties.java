package io.dispatch4j.config;

import java.time.Duration;

/**
 * Runtime configuration for the schedule trigger loop.
 */
public class SchedulerProperties {
    private int maxConcurrency = 20; // worker pool size
    private int defaultMaxInstances = 3; // per schedule
    private Duration misfireGracePeriod = Duration.ofMinutes(5);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private Duration catchUpSpacing = Duration.ofSeconds(1);
    private int slaMetricsRetention = 1000;
    private String defaultTimezone = "UTC";

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getDefaultMaxInstances() {
        return defaultMaxInstances;
    }

    public void setDefaultMaxInstances(int defaultMaxInstances) {
        this.defaultMaxInstances = defaultMaxInstances;
    }

    public Duration getMisfireGracePeriod() {
        return misfireGracePeriod;
    }

    public void setMisfireGracePeriod(Duration misfireGracePeriod) {
        this.misfireGracePeriod = misfireGracePeriod;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getCatchUpSpacing() {
        return catchUpSpacing;
    }

    public void setCatchUpSpacing(Duration catchUpSpacing) {
        this.catchUpSpacing = catchUpSpacing;
    }

    public int getSlaMetricsRetention() {
        return slaMetricsRetention;
    }

    public void setSlaMetricsRetention(int slaMetricsRetention) {
        this.slaMetricsRetention = slaMetricsRetention;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }
}
