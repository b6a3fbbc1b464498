package io.dispatch4j.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Working-time rules for scheduled execution: weekly hours, computed holidays, blackout windows
 * and ad-hoc non-working dates, all evaluated in the calendar's zone.
 *
 * <p>Reads work on an immutable {@link CalendarConfig} snapshot. Mutators swap in a new snapshot
 * under a lock, together with a fresh per-year holiday cache, so a reader never mixes rules
 * from two versions.
 *
 * <p>Typical usage:
 * <pre>{@code
 * BusinessCalendar cal = BusinessCalendar.us(ZoneId.of("America/New_York"), true);
 * CalendarDecision d = cal.canExecute(ZonedDateTime.now(), "invoice-sync");
 * if (!d.allowed()) {
 *     Optional<ZonedDateTime> next = cal.getNextWorkingTime(ZonedDateTime.now(), "invoice-sync", 30);
 * }
 * }</pre>
 */
public class BusinessCalendar {
    private static final Logger log = LoggerFactory.getLogger(BusinessCalendar.class);

    public static final int DEFAULT_MAX_DAYS_AHEAD = 30;

    public static final List<Holiday> US_FEDERAL_HOLIDAYS = List.of(
            Holiday.fixed("New Year's Day", 1, 1, true),
            Holiday.floating("Martin Luther King Jr. Day", 1, DayOfWeek.MONDAY, 3),
            Holiday.floating("Presidents' Day", 2, DayOfWeek.MONDAY, 3),
            Holiday.floating("Memorial Day", 5, DayOfWeek.MONDAY, -1),
            Holiday.fixed("Independence Day", 7, 4, true),
            Holiday.floating("Labor Day", 9, DayOfWeek.MONDAY, 1),
            Holiday.floating("Columbus Day", 10, DayOfWeek.MONDAY, 2),
            Holiday.fixed("Veterans Day", 11, 11, true),
            Holiday.floating("Thanksgiving", 11, DayOfWeek.THURSDAY, 4),
            Holiday.fixed("Christmas Day", 12, 25, true)
    );

    public static final List<Holiday> UK_BANK_HOLIDAYS = List.of(
            Holiday.fixed("New Year's Day", 1, 1, true),
            Holiday.floating("Early May Bank Holiday", 5, DayOfWeek.MONDAY, 1),
            Holiday.floating("Spring Bank Holiday", 5, DayOfWeek.MONDAY, -1),
            Holiday.floating("Summer Bank Holiday", 8, DayOfWeek.MONDAY, -1),
            Holiday.fixed("Christmas Day", 12, 25, true),
            Holiday.fixed("Boxing Day", 12, 26, true)
    );

    /**
     * A holiday resolved to a concrete date.
     */
    public record ObservedHoliday(LocalDate date, String name) {
    }

    private record Snapshot(CalendarConfig config, ConcurrentHashMap<Integer, Set<LocalDate>> holidayCache) {
        Snapshot(CalendarConfig config) {
            this(config, new ConcurrentHashMap<>());
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private volatile Snapshot snapshot;

    public BusinessCalendar() {
        this(CalendarConfig.defaults());
    }

    public BusinessCalendar(CalendarConfig config) {
        this(config, Clock.systemUTC());
    }

    public BusinessCalendar(CalendarConfig config, Clock clock) {
        this.snapshot = new Snapshot(Objects.requireNonNull(config, "config must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /* ================= presets ================= */

    public static BusinessCalendar us(ZoneId zone, boolean includeFederalHolidays) {
        CalendarConfig.Builder b = CalendarConfig.builder().zone(zone);
        if (includeFederalHolidays) {
            b.holidays(US_FEDERAL_HOLIDAYS);
        }
        return new BusinessCalendar(b.build());
    }

    public static BusinessCalendar uk(ZoneId zone, boolean includeBankHolidays) {
        CalendarConfig.Builder b = CalendarConfig.builder().zone(zone);
        if (includeBankHolidays) {
            b.holidays(UK_BANK_HOLIDAYS);
        }
        return new BusinessCalendar(b.build());
    }

    /**
     * Calendar open around the clock on every day, still honoring the given holidays.
     */
    public static BusinessCalendar alwaysOpen(ZoneId zone, List<Holiday> holidays) {
        CalendarConfig.Builder b = CalendarConfig.builder()
                .zone(zone)
                .allowWeekends(true)
                .allowOutsideHours(true);
        for (DayOfWeek day : DayOfWeek.values()) {
            b.workingHours(day, WorkingHours.allDay());
        }
        if (holidays != null) {
            b.holidays(holidays);
        }
        return new BusinessCalendar(b.build());
    }

    public ZoneId zone() {
        return snapshot.config().zone();
    }

    public CalendarConfig config() {
        return snapshot.config();
    }

    /* ================= mutation ================= */

    public void addHoliday(Holiday holiday) {
        Objects.requireNonNull(holiday, "holiday must not be null");
        update(c -> c.toBuilder().holiday(holiday).build());
        log.debug("calendar holiday added name={} type={}", holiday.name(), holiday.type());
    }

    /**
     * Remove every holiday named {@code name}.
     *
     * @return true if at least one holiday was removed
     */
    public boolean removeHoliday(String name) {
        return removeMatching(c -> c.holidays().stream().anyMatch(h -> h.name().equals(name)),
                c -> rebuild(c, c.holidays().stream().filter(h -> !h.name().equals(name)).toList(), c.blackouts(), c.customDates()));
    }

    public void addBlackout(BlackoutPeriod blackout) {
        Objects.requireNonNull(blackout, "blackout must not be null");
        update(c -> c.toBuilder().blackout(blackout).build());
        log.debug("calendar blackout added name={} start={} end={} recurring={}",
                blackout.name(), blackout.start(), blackout.end(), blackout.recurring());
    }

    public boolean removeBlackout(String name) {
        return removeMatching(c -> c.blackouts().stream().anyMatch(b -> b.name().equals(name)),
                c -> rebuild(c, c.holidays(), c.blackouts().stream().filter(b -> !b.name().equals(name)).toList(), c.customDates()));
    }

    public void addCustomDate(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        update(c -> c.toBuilder().customDate(date).build());
    }

    public boolean removeCustomDate(LocalDate date) {
        return removeMatching(c -> c.customDates().contains(date),
                c -> rebuild(c, c.holidays(), c.blackouts(), c.customDates().stream().filter(d -> !d.equals(date)).toList()));
    }

    public void setWorkingHours(DayOfWeek day, WorkingHours hours) {
        update(c -> c.toBuilder().workingHours(day, hours).build());
        log.debug("calendar working hours set day={} start={} end={} enabled={}",
                day, hours.start(), hours.end(), hours.enabled());
    }

    private void update(UnaryOperator<CalendarConfig> change) {
        lock.lock();
        try {
            snapshot = new Snapshot(change.apply(snapshot.config()));
        } finally {
            lock.unlock();
        }
    }

    private boolean removeMatching(Predicate<CalendarConfig> present,
                                   UnaryOperator<CalendarConfig> change) {
        lock.lock();
        try {
            CalendarConfig current = snapshot.config();
            if (!present.test(current)) {
                return false;
            }
            snapshot = new Snapshot(change.apply(current));
            return true;
        } finally {
            lock.unlock();
        }
    }

    private static CalendarConfig rebuild(CalendarConfig c, List<Holiday> holidays, List<BlackoutPeriod> blackouts,
                                          Collection<LocalDate> customDates) {
        CalendarConfig.Builder b = CalendarConfig.builder()
                .zone(c.zone())
                .allowWeekends(c.allowWeekends())
                .allowOutsideHours(c.allowOutsideHours())
                .holidays(holidays);
        c.workingHours().forEach(b::workingHours);
        blackouts.forEach(b::blackout);
        customDates.forEach(b::customDate);
        return b.build();
    }

    /* ================= queries ================= */

    public List<ObservedHoliday> getHolidaysForYear(int year) {
        List<ObservedHoliday> result = new ArrayList<>();
        for (Holiday h : snapshot.config().holidays()) {
            h.dateIn(year).ifPresent(d -> result.add(new ObservedHoliday(d, h.name())));
        }
        result.sort(Comparator.comparing(ObservedHoliday::date));
        return result;
    }

    public boolean isHoliday(LocalDate date) {
        Snapshot s = snapshot;
        return s.holidayCache().computeIfAbsent(date.getYear(), year -> {
            Set<LocalDate> dates = new HashSet<>();
            for (Holiday h : s.config().holidays()) {
                h.dateIn(year).ifPresent(dates::add);
            }
            // observance can push Jan 1 of next year back into Dec 31 of this one
            for (Holiday h : s.config().holidays()) {
                h.dateIn(year + 1).filter(d -> d.getYear() == year).ifPresent(dates::add);
            }
            return Set.copyOf(dates);
        }).contains(date);
    }

    public boolean isCustomNonWorking(LocalDate date) {
        return snapshot.config().customDates().contains(date);
    }

    public boolean isWeekend(LocalDate date) {
        DayOfWeek d = date.getDayOfWeek();
        return d == DayOfWeek.SATURDAY || d == DayOfWeek.SUNDAY;
    }

    public boolean isWorkingDay(LocalDate date) {
        CalendarConfig c = snapshot.config();
        if (isHoliday(date) || isCustomNonWorking(date)) {
            return false;
        }
        if (isWeekend(date) && !c.allowWeekends()) {
            return false;
        }
        return c.workingHours().get(date.getDayOfWeek()).enabled();
    }

    public boolean isWithinWorkingHours(ZonedDateTime time) {
        ZonedDateTime local = toZone(time);
        if (!isWorkingDay(local.toLocalDate())) {
            return false;
        }
        CalendarConfig c = snapshot.config();
        if (c.allowOutsideHours()) {
            return true;
        }
        return c.workingHours().get(local.getDayOfWeek()).contains(local.toLocalTime());
    }

    /**
     * Reason of the first blackout covering {@code time} for {@code workflowId}, if any.
     */
    public Optional<String> isInBlackout(ZonedDateTime time, String workflowId) {
        for (BlackoutPeriod b : snapshot.config().blackouts()) {
            if (b.isActive(time, workflowId)) {
                return Optional.of(b.reason().isEmpty() ? b.name() : b.reason());
            }
        }
        return Optional.empty();
    }

    public CalendarDecision canExecute(ZonedDateTime time) {
        return canExecute(time, null, false, false);
    }

    public CalendarDecision canExecute(Instant time, String workflowId) {
        return canExecute(ZonedDateTime.ofInstant(time, zone()), workflowId, false, false);
    }

    public CalendarDecision canExecute(ZonedDateTime time, String workflowId) {
        return canExecute(time, workflowId, false, false);
    }

    /**
     * Checks, in order: blackout, holiday, custom non-working date, weekend, working hours.
     * The first failing check decides the reason.
     */
    public CalendarDecision canExecute(ZonedDateTime time, String workflowId, boolean ignoreHours, boolean ignoreBlackouts) {
        Objects.requireNonNull(time, "time must not be null");
        ZonedDateTime local = toZone(time);
        LocalDate date = local.toLocalDate();
        CalendarConfig c = snapshot.config();

        if (!ignoreBlackouts) {
            Optional<String> blackout = isInBlackout(local, workflowId);
            if (blackout.isPresent()) {
                return CalendarDecision.deny("Blackout: " + blackout.get());
            }
        }
        if (isHoliday(date)) {
            return CalendarDecision.deny("Holiday: " + date);
        }
        if (isCustomNonWorking(date)) {
            return CalendarDecision.deny("Non-working date: " + date);
        }
        if (isWeekend(date) && !c.allowWeekends()) {
            return CalendarDecision.deny("Weekend execution not allowed");
        }
        if (!ignoreHours && !c.allowOutsideHours() && !isWithinWorkingHours(local)) {
            return CalendarDecision.deny("Outside working hours");
        }
        return CalendarDecision.allow();
    }

    public Optional<ZonedDateTime> getNextWorkingTime() {
        return getNextWorkingTime(null, null, DEFAULT_MAX_DAYS_AHEAD);
    }

    public Optional<ZonedDateTime> getNextWorkingTime(ZonedDateTime from, String workflowId) {
        return getNextWorkingTime(from, workflowId, DEFAULT_MAX_DAYS_AHEAD);
    }

    /**
     * Earliest executable moment at or after {@code from} (now when null), searching at most
     * {@code maxDaysAhead} days. Walks day by day, jumping to each day's start of hours.
     */
    public Optional<ZonedDateTime> getNextWorkingTime(ZonedDateTime from, String workflowId, int maxDaysAhead) {
        if (maxDaysAhead <= 0) {
            throw new IllegalArgumentException("maxDaysAhead must be positive");
        }
        ZonedDateTime current = from == null ? ZonedDateTime.now(clock.withZone(zone())) : toZone(from);
        ZonedDateTime endSearch = current.plusDays(maxDaysAhead);
        CalendarConfig c = snapshot.config();

        while (current.isBefore(endSearch)) {
            if (canExecute(current, workflowId).allowed()) {
                return Optional.of(current);
            }

            WorkingHours hours = c.workingHours().get(current.getDayOfWeek());
            if (hours.enabled() && current.toLocalTime().isBefore(hours.start())) {
                ZonedDateTime dayStart = current.with(hours.start());
                if (canExecute(dayStart, workflowId).allowed()) {
                    return Optional.of(dayStart);
                }
            }

            LocalDate tomorrow = current.toLocalDate().plusDays(1);
            WorkingHours next = c.workingHours().get(tomorrow.getDayOfWeek());
            LocalTime startOfNext = next.enabled() ? next.start() : LocalTime.MIDNIGHT;
            current = ZonedDateTime.of(tomorrow, startOfNext, zone());
        }
        return Optional.empty();
    }

    /**
     * {@code time} if executable, otherwise the next working time, otherwise {@code time} unchanged.
     */
    public ZonedDateTime adjustToWorkingTime(ZonedDateTime time, String workflowId) {
        if (canExecute(time, workflowId).allowed()) {
            return time;
        }
        return getNextWorkingTime(time, workflowId).orElse(time);
    }

    /**
     * Working days between two dates, both inclusive, in either order.
     */
    public int countWorkingDays(LocalDate start, LocalDate end) {
        LocalDate from = start.isAfter(end) ? end : start;
        LocalDate to = start.isAfter(end) ? start : end;
        int count = 0;
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (isWorkingDay(d)) {
                count++;
            }
        }
        return count;
    }

    public LocalDate addWorkingDays(LocalDate start, int days) {
        int step = days >= 0 ? 1 : -1;
        int remaining = Math.abs(days);
        LocalDate current = start;
        while (remaining > 0) {
            current = current.plusDays(step);
            if (isWorkingDay(current)) {
                remaining--;
            }
        }
        return current;
    }

    public long getWorkingMinutesRemaining(ZonedDateTime time) {
        ZonedDateTime local = toZone(time);
        if (!isWorkingDay(local.toLocalDate())) {
            return 0;
        }
        return snapshot.config().workingHours().get(local.getDayOfWeek()).minutesRemaining(local.toLocalTime());
    }

    private ZonedDateTime toZone(ZonedDateTime time) {
        return time.withZoneSameInstant(zone());
    }
}
