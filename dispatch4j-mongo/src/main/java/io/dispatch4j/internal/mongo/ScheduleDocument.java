package io.dispatch4j.internal.mongo;

import io.dispatch4j.core.ScheduleStatus;
import io.dispatch4j.core.ScheduleType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for persisted schedules: the definition plus its runtime counters.
 * Nested configs are stored as plain maps.
 */
@Document(collection = "dispatch_schedules")
public class ScheduleDocument {

    @Id
    private String id;

    private String name;
    private String workflowId;
    private String workflowName;
    private ScheduleType type;
    private boolean enabled;
    private String timezone;
    private String cronExpression;
    private Long intervalMillis;
    private Instant runAt;
    private Map<String, Object> eventTrigger;
    private String calendarId;
    private boolean respectBusinessHours;
    private Map<String, Object> rateLimit;
    private Map<String, Object> dependency;
    private Map<String, Object> sla;
    private Map<String, Object> catchUp;
    private int priority;
    private int maxInstances;
    private String robotId;
    private Map<String, Object> variables;
    private List<String> tags;
    private Map<String, Object> metadata;
    private String createdBy;

    private ScheduleStatus status;
    private Instant lastRun;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRun;

    private long runCount;
    private long successCount;
    private long failureCount;
    private int consecutiveFailures;
    private Instant createdAt;
    private Instant updatedAt;

    public ScheduleDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public void setWorkflowId(String workflowId) {
        this.workflowId = workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public void setWorkflowName(String workflowName) {
        this.workflowName = workflowName;
    }

    public ScheduleType getType() {
        return type;
    }

    public void setType(ScheduleType type) {
        this.type = type;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public Long getIntervalMillis() {
        return intervalMillis;
    }

    public void setIntervalMillis(Long intervalMillis) {
        this.intervalMillis = intervalMillis;
    }

    public Instant getRunAt() {
        return runAt;
    }

    public void setRunAt(Instant runAt) {
        this.runAt = runAt;
    }

    public Map<String, Object> getEventTrigger() {
        return eventTrigger;
    }

    public void setEventTrigger(Map<String, Object> eventTrigger) {
        this.eventTrigger = eventTrigger;
    }

    public String getCalendarId() {
        return calendarId;
    }

    public void setCalendarId(String calendarId) {
        this.calendarId = calendarId;
    }

    public boolean isRespectBusinessHours() {
        return respectBusinessHours;
    }

    public void setRespectBusinessHours(boolean respectBusinessHours) {
        this.respectBusinessHours = respectBusinessHours;
    }

    public Map<String, Object> getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(Map<String, Object> rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Map<String, Object> getDependency() {
        return dependency;
    }

    public void setDependency(Map<String, Object> dependency) {
        this.dependency = dependency;
    }

    public Map<String, Object> getSla() {
        return sla;
    }

    public void setSla(Map<String, Object> sla) {
        this.sla = sla;
    }

    public Map<String, Object> getCatchUp() {
        return catchUp;
    }

    public void setCatchUp(Map<String, Object> catchUp) {
        this.catchUp = catchUp;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public int getMaxInstances() {
        return maxInstances;
    }

    public void setMaxInstances(int maxInstances) {
        this.maxInstances = maxInstances;
    }

    public String getRobotId() {
        return robotId;
    }

    public void setRobotId(String robotId) {
        this.robotId = robotId;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public void setVariables(Map<String, Object> variables) {
        this.variables = variables;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public ScheduleStatus getStatus() {
        return status;
    }

    public void setStatus(ScheduleStatus status) {
        this.status = status;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    public Instant getNextRun() {
        return nextRun;
    }

    public void setNextRun(Instant nextRun) {
        this.nextRun = nextRun;
    }

    public long getRunCount() {
        return runCount;
    }

    public void setRunCount(long runCount) {
        this.runCount = runCount;
    }

    public long getSuccessCount() {
        return successCount;
    }

    public void setSuccessCount(long successCount) {
        this.successCount = successCount;
    }

    public long getFailureCount() {
        return failureCount;
    }

    public void setFailureCount(long failureCount) {
        this.failureCount = failureCount;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
