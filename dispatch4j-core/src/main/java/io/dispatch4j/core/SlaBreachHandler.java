package io.dispatch4j.core;

@FunctionalInterface
public interface SlaBreachHandler {
    void onBreach(String scheduleId, SlaStatus status, String message);
}
