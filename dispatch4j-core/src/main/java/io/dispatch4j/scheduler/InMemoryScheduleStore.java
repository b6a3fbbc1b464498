package io.dispatch4j.scheduler;

import io.dispatch4j.core.PersistResult;
import io.dispatch4j.core.ScheduleInfo;
import io.dispatch4j.core.ScheduleStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link ScheduleStore}: keeps snapshots in memory for the life of the process.
 */
public class InMemoryScheduleStore implements ScheduleStore {
    private final Map<String, ScheduleInfo> schedules = new ConcurrentHashMap<>();

    @Override
    public PersistResult save(ScheduleInfo schedule) {
        ScheduleInfo previous = schedules.put(schedule.id(), schedule);
        if (previous == null) {
            return PersistResult.createdResult();
        }
        return previous.equals(schedule) ? PersistResult.noop() : PersistResult.updatedResult();
    }

    @Override
    public Optional<ScheduleInfo> findById(String scheduleId) {
        return Optional.ofNullable(schedules.get(scheduleId));
    }

    @Override
    public List<ScheduleInfo> findAll() {
        return new ArrayList<>(schedules.values());
    }

    @Override
    public boolean delete(String scheduleId) {
        return schedules.remove(scheduleId) != null;
    }
}
