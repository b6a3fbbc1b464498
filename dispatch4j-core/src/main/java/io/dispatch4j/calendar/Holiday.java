package io.dispatch4j.calendar;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;
import java.util.Optional;

/**
 * A holiday rule. Dates are computed per year from the rule; only {@link HolidayType#CUSTOM}
 * holidays carry a literal date (month, day and year).
 *
 * @param occurrence for FLOATING holidays: 1..5 counts from the start of the month, -1..-5 from the end
 * @param year       restricts the rule to a single year; {@code null} means every year
 * @param observance move a Saturday holiday to Friday and a Sunday holiday to Monday
 */
public record Holiday(
        String name,
        HolidayType type,
        int month,
        Integer day,
        DayOfWeek weekday,
        Integer occurrence,
        Integer year,
        boolean observance
) {
    public Holiday {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be 1-12: " + month);
        }
        if (type == HolidayType.FLOATING) {
            Objects.requireNonNull(weekday, "weekday must not be null for FLOATING holidays");
            Objects.requireNonNull(occurrence, "occurrence must not be null for FLOATING holidays");
            if (occurrence == 0 || Math.abs(occurrence) > 5) {
                throw new IllegalArgumentException("occurrence must be 1..5 or -1..-5: " + occurrence);
            }
        } else {
            Objects.requireNonNull(day, "day must not be null for " + type + " holidays");
        }
        if (type == HolidayType.CUSTOM) {
            Objects.requireNonNull(year, "year must not be null for CUSTOM holidays");
        }
    }

    public static Holiday fixed(String name, int month, int day, boolean observance) {
        return new Holiday(name, HolidayType.FIXED, month, day, null, null, null, observance);
    }

    public static Holiday floating(String name, int month, DayOfWeek weekday, int occurrence) {
        return new Holiday(name, HolidayType.FLOATING, month, null, weekday, occurrence, null, false);
    }

    public static Holiday custom(String name, LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return new Holiday(name, HolidayType.CUSTOM, date.getMonthValue(), date.getDayOfMonth(), null, null, date.getYear(), false);
    }

    /**
     * Date this holiday falls on in {@code year}, after observance shifting. Empty when the rule
     * does not apply that year (year-restricted, Feb 29 in a common year, no fifth weekday).
     */
    public Optional<LocalDate> dateIn(int year) {
        if (this.year != null && this.year != year) {
            return Optional.empty();
        }

        LocalDate date;
        if (type == HolidayType.FLOATING) {
            date = floatingDate(year);
            if (date == null) {
                return Optional.empty();
            }
        } else {
            try {
                date = LocalDate.of(year, month, day);
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }

        return Optional.of(observance ? observed(date) : date);
    }

    private LocalDate floatingDate(int year) {
        LocalDate first = LocalDate.of(year, month, 1);
        LocalDate candidate;
        if (occurrence > 0) {
            candidate = first.with(TemporalAdjusters.firstInMonth(weekday)).plusWeeks(occurrence - 1L);
        } else {
            candidate = first.with(TemporalAdjusters.lastInMonth(weekday)).minusWeeks(-occurrence - 1L);
        }
        return candidate.getMonthValue() == month ? candidate : null;
    }

    private static LocalDate observed(LocalDate date) {
        return switch (date.getDayOfWeek()) {
            case SATURDAY -> date.minusDays(1);
            case SUNDAY -> date.plusDays(1);
            default -> date;
        };
    }
}
