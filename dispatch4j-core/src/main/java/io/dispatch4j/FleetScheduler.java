package io.dispatch4j;

import io.dispatch4j.calendar.BusinessCalendar;
import io.dispatch4j.core.EventType;
import io.dispatch4j.core.Schedule;
import io.dispatch4j.core.ScheduleInfo;
import io.dispatch4j.core.ScheduleStatus;
import io.dispatch4j.core.SlaBreachHandler;
import io.dispatch4j.scheduler.ExecutionOutcome;
import io.dispatch4j.scheduler.GraphValidation;
import io.dispatch4j.scheduler.SlaReport;
import io.dispatch4j.scheduler.UpcomingRun;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Owns schedule definitions of five kinds (cron, interval, one-time, event, dependency) and fires
 * the {@link ScheduleTrigger} for each run that passes the gate pipeline: status, rate limit,
 * business calendar, condition and dependencies.
 */
public interface FleetScheduler {
    void start();

    /**
     * Stop and wait for in-flight runs.
     */
    void stop();

    /**
     * @param wait false interrupts in-flight runs instead of waiting for them
     */
    void stop(boolean wait);

    boolean isRunning();

    ScheduleBuilder create(String id, String name, String workflowId);

    /**
     * Register a schedule, replacing one with the same id.
     *
     * @return false (with the reason logged) for an invalid trigger definition or a dependency cycle
     */
    boolean addSchedule(Schedule schedule);

    boolean removeSchedule(String scheduleId);

    /**
     * Replace the definition and keep the runtime counters.
     */
    boolean updateSchedule(Schedule schedule);

    boolean pauseSchedule(String scheduleId);

    boolean resumeSchedule(String scheduleId);

    boolean disableSchedule(String scheduleId);

    Optional<ScheduleInfo> getSchedule(String scheduleId);

    List<ScheduleInfo> getAllSchedules();

    List<ScheduleInfo> getSchedulesByStatus(ScheduleStatus status);

    /**
     * Run the gate pipeline for a schedule now, on the calling thread.
     */
    ExecutionOutcome triggerNow(String scheduleId);

    /**
     * Fire every EVENT schedule subscribed to this type and source whose filter matches.
     *
     * @return ids of the schedules that were triggered
     */
    List<String> triggerEvent(EventType eventType, String eventSource, Map<String, Object> eventData);

    /**
     * Record a completion and fire the DEPENDENCY schedules it satisfies.
     */
    void notifyCompletion(String scheduleId, boolean success, Object result);

    GraphValidation validateDependencyGraph();

    /**
     * Dependency id to the ids of schedules that depend on it.
     */
    Map<String, List<String>> getDependencyGraph();

    List<ScheduleInfo> checkMissedRuns();

    /**
     * @return number of catch-up runs performed
     */
    int executeCatchUp(String scheduleId);

    /**
     * @param scheduleId one schedule, or null for all schedules with an SLA
     */
    SlaReport getSlaReport(String scheduleId, int windowHours);

    void addSlaAlertListener(SlaBreachHandler listener);

    List<UpcomingRun> getUpcomingRuns(int limit, String workflowId);

    void registerCalendar(String calendarId, BusinessCalendar calendar);

    Optional<BusinessCalendar> getCalendar(String calendarId);
}
