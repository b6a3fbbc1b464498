package io.dispatch4j.core;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of schedule definitions and runtime counters. Conditional predicates and SLA breach
 * handlers are in-memory only and come back empty from {@link #findAll()}.
 */
public interface ScheduleStore {

    PersistResult save(ScheduleInfo schedule);

    Optional<ScheduleInfo> findById(String scheduleId);

    List<ScheduleInfo> findAll();

    boolean delete(String scheduleId);
}
