package io.dispatch4j.core;

/**
 * Gate evaluated before each run of a conditional schedule. Thrown exceptions count as "not met".
 */
@FunctionalInterface
public interface ScheduleCondition {
    boolean test(ScheduleInfo schedule) throws Exception;
}
