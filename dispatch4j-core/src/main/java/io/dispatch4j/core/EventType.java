package io.dispatch4j.core;

public enum EventType {
    FILE_ARRIVAL,
    WEBHOOK,
    DATABASE_CHANGE,
    QUEUE_MESSAGE,
    WORKFLOW_COMPLETED,
    CUSTOM
}
