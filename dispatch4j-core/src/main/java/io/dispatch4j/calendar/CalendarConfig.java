package io.dispatch4j.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable calendar definition. Days without explicit hours default to 09:00-17:00 on
 * Monday to Friday and closed on weekends.
 */
public final class CalendarConfig {
    private final ZoneId zone;
    private final Map<DayOfWeek, WorkingHours> workingHours;
    private final List<Holiday> holidays;
    private final List<BlackoutPeriod> blackouts;
    private final Set<LocalDate> customDates;
    private final boolean allowWeekends;
    private final boolean allowOutsideHours;

    private CalendarConfig(Builder b) {
        this.zone = b.zone;
        EnumMap<DayOfWeek, WorkingHours> hours = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            WorkingHours configured = b.workingHours.get(day);
            hours.put(day, configured != null ? configured : defaultHours(day));
        }
        this.workingHours = Collections.unmodifiableMap(hours);
        this.holidays = List.copyOf(b.holidays);
        this.blackouts = List.copyOf(b.blackouts);
        this.customDates = Collections.unmodifiableSet(new LinkedHashSet<>(b.customDates));
        this.allowWeekends = b.allowWeekends;
        this.allowOutsideHours = b.allowOutsideHours;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CalendarConfig defaults() {
        return builder().build();
    }

    static WorkingHours defaultHours(DayOfWeek day) {
        return (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) ? WorkingHours.closed() : WorkingHours.standard();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .zone(zone)
                .allowWeekends(allowWeekends)
                .allowOutsideHours(allowOutsideHours);
        workingHours.forEach(b::workingHours);
        holidays.forEach(b::holiday);
        blackouts.forEach(b::blackout);
        customDates.forEach(b::customDate);
        return b;
    }

    public ZoneId zone() {
        return zone;
    }

    public Map<DayOfWeek, WorkingHours> workingHours() {
        return workingHours;
    }

    public List<Holiday> holidays() {
        return holidays;
    }

    public List<BlackoutPeriod> blackouts() {
        return blackouts;
    }

    public Set<LocalDate> customDates() {
        return customDates;
    }

    public boolean allowWeekends() {
        return allowWeekends;
    }

    public boolean allowOutsideHours() {
        return allowOutsideHours;
    }

    public static final class Builder {
        private ZoneId zone = ZoneOffset.UTC;
        private final Map<DayOfWeek, WorkingHours> workingHours = new EnumMap<>(DayOfWeek.class);
        private final List<Holiday> holidays = new ArrayList<>();
        private final List<BlackoutPeriod> blackouts = new ArrayList<>();
        private final Set<LocalDate> customDates = new LinkedHashSet<>();
        private boolean allowWeekends;
        private boolean allowOutsideHours;

        private Builder() {
        }

        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone must not be null");
            return this;
        }

        public Builder zone(String zoneId) {
            return zone(ZoneId.of(Objects.requireNonNull(zoneId, "zoneId must not be null")));
        }

        public Builder workingHours(DayOfWeek day, WorkingHours hours) {
            workingHours.put(Objects.requireNonNull(day, "day must not be null"),
                    Objects.requireNonNull(hours, "hours must not be null"));
            return this;
        }

        public Builder holiday(Holiday holiday) {
            holidays.add(Objects.requireNonNull(holiday, "holiday must not be null"));
            return this;
        }

        public Builder holidays(List<Holiday> holidays) {
            holidays.forEach(this::holiday);
            return this;
        }

        public Builder blackout(BlackoutPeriod blackout) {
            blackouts.add(Objects.requireNonNull(blackout, "blackout must not be null"));
            return this;
        }

        public Builder customDate(LocalDate date) {
            customDates.add(Objects.requireNonNull(date, "date must not be null"));
            return this;
        }

        public Builder allowWeekends(boolean allowWeekends) {
            this.allowWeekends = allowWeekends;
            return this;
        }

        public Builder allowOutsideHours(boolean allowOutsideHours) {
            this.allowOutsideHours = allowOutsideHours;
            return this;
        }

        public CalendarConfig build() {
            return new CalendarConfig(this);
        }
    }
}
