package io.dispatch4j.calendar;

public enum HolidayType {
    /** Same month/day every year, e.g. January 1st. */
    FIXED,
    /** Nth weekday of a month, e.g. fourth Thursday of November. */
    FLOATING,
    /** One-off date pinned to an explicit year. */
    CUSTOM
}
