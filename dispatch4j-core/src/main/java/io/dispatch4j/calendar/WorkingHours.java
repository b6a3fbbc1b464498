package io.dispatch4j.calendar;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Working window for one weekday. Both ends are inclusive.
 */
public record WorkingHours(LocalTime start, LocalTime end, boolean enabled) {

    public static final LocalTime DEFAULT_START = LocalTime.of(9, 0);
    public static final LocalTime DEFAULT_END = LocalTime.of(17, 0);

    public WorkingHours {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start: " + start + " > " + end);
        }
    }

    public static WorkingHours of(LocalTime start, LocalTime end) {
        return new WorkingHours(start, end, true);
    }

    public static WorkingHours standard() {
        return new WorkingHours(DEFAULT_START, DEFAULT_END, true);
    }

    public static WorkingHours closed() {
        return new WorkingHours(DEFAULT_START, DEFAULT_END, false);
    }

    public static WorkingHours allDay() {
        return new WorkingHours(LocalTime.MIDNIGHT, LocalTime.of(23, 59), true);
    }

    public boolean contains(LocalTime time) {
        return enabled && !time.isBefore(start) && !time.isAfter(end);
    }

    /**
     * Whole minutes left in the window from {@code from}; the full window if {@code from} is before it.
     */
    public long minutesRemaining(LocalTime from) {
        if (!enabled || !from.isBefore(end)) {
            return 0;
        }
        LocalTime effective = from.isBefore(start) ? start : from;
        return Duration.between(effective.withSecond(0).withNano(0), end.withSecond(0).withNano(0)).toMinutes();
    }
}
