package io.dispatch4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring-bound configuration of every dispatch4j component.
 */
@ConfigurationProperties(prefix = "dispatch4j")
public class Dispatch4jProperties {
    private boolean enabled = true;
    private boolean ensureIndexesOnStartup = false;

    @NestedConfigurationProperty
    private SchedulerProperties scheduler = new SchedulerProperties();

    @NestedConfigurationProperty
    private AffinityProperties affinity = new AffinityProperties();

    @NestedConfigurationProperty
    private AssignmentProperties assignment = new AssignmentProperties();

    /**
     * Calendars registered with the scheduler at startup, keyed by calendar id.
     */
    private Map<String, Calendar> calendars = new LinkedHashMap<>();

    public enum Preset {
        US,
        UK,
        ALWAYS_OPEN
    }

    public static class Calendar {
        private Preset preset = Preset.US;
        private String timezone = "UTC";
        private boolean includeHolidays = true;

        public Preset getPreset() {
            return preset;
        }

        public void setPreset(Preset preset) {
            this.preset = preset;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public boolean isIncludeHolidays() {
            return includeHolidays;
        }

        public void setIncludeHolidays(boolean includeHolidays) {
            this.includeHolidays = includeHolidays;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    public AffinityProperties getAffinity() {
        return affinity;
    }

    public void setAffinity(AffinityProperties affinity) {
        this.affinity = affinity;
    }

    public AssignmentProperties getAssignment() {
        return assignment;
    }

    public void setAssignment(AssignmentProperties assignment) {
        this.assignment = assignment;
    }

    public Map<String, Calendar> getCalendars() {
        return calendars;
    }

    public void setCalendars(Map<String, Calendar> calendars) {
        this.calendars = calendars;
    }
}
