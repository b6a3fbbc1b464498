package io.dispatch4j.scheduler;

import io.dispatch4j.core.ScheduleStatus;
import io.dispatch4j.core.ScheduleType;

import java.time.Instant;

public record UpcomingRun(
        String scheduleId,
        String scheduleName,
        String workflowId,
        String workflowName,
        Instant nextRun,
        ScheduleType type,
        ScheduleStatus status
) {
}
