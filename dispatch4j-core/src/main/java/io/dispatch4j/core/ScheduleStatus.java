package io.dispatch4j.core;

public enum ScheduleStatus {
    ACTIVE,
    PAUSED,
    DISABLED,
    COMPLETED,
    ERROR
}
