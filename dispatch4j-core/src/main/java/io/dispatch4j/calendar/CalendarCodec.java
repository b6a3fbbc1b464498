package io.dispatch4j.calendar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * JSON form of a {@link BusinessCalendar}. Times and dates are written as ISO-8601 strings so the
 * payload does not depend on Jackson's java.time module.
 */
public final class CalendarCodec {

    public record HoursDto(String start, String end, boolean enabled) {
    }

    public record HolidayDto(String name, HolidayType type, int month, Integer day, DayOfWeek weekday,
                             Integer occurrence, Integer year, boolean observance) {
    }

    public record BlackoutDto(String name, String start, String end, String reason, boolean recurring,
                              List<String> affectedWorkflows) {
    }

    public record CalendarDto(String timezone, boolean allowWeekends, boolean allowOutsideHours,
                              Map<DayOfWeek, HoursDto> workingHours, List<HolidayDto> holidays,
                              List<BlackoutDto> blackouts, List<String> customDates) {
    }

    private final ObjectMapper objectMapper;

    public CalendarCodec() {
        this(new ObjectMapper());
    }

    public CalendarCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String toJson(BusinessCalendar calendar) {
        try {
            return objectMapper.writeValueAsString(toDto(calendar.config()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("calendar serialization failed", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the payload is not a valid calendar document
     */
    public BusinessCalendar fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        CalendarDto dto;
        try {
            dto = objectMapper.readValue(json, CalendarDto.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid calendar JSON: " + e.getOriginalMessage(), e);
        }
        try {
            return new BusinessCalendar(fromDto(dto));
        } catch (DateTimeException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid calendar JSON: " + e.getMessage(), e);
        }
    }

    private static CalendarDto toDto(CalendarConfig c) {
        Map<DayOfWeek, HoursDto> hours = new LinkedHashMap<>();
        c.workingHours().forEach((day, h) -> hours.put(day, new HoursDto(h.start().toString(), h.end().toString(), h.enabled())));

        List<HolidayDto> holidays = new ArrayList<>();
        for (Holiday h : c.holidays()) {
            holidays.add(new HolidayDto(h.name(), h.type(), h.month(), h.day(), h.weekday(), h.occurrence(), h.year(), h.observance()));
        }

        List<BlackoutDto> blackouts = new ArrayList<>();
        for (BlackoutPeriod b : c.blackouts()) {
            blackouts.add(new BlackoutDto(b.name(), b.start().toString(), b.end().toString(), b.reason(), b.recurring(),
                    List.copyOf(b.affectedWorkflows())));
        }

        return new CalendarDto(c.zone().getId(), c.allowWeekends(), c.allowOutsideHours(), hours, holidays, blackouts,
                c.customDates().stream().map(LocalDate::toString).toList());
    }

    private static CalendarConfig fromDto(CalendarDto dto) {
        CalendarConfig.Builder b = CalendarConfig.builder()
                .zone(dto.timezone() == null ? "UTC" : dto.timezone())
                .allowWeekends(dto.allowWeekends())
                .allowOutsideHours(dto.allowOutsideHours());

        if (dto.workingHours() != null) {
            dto.workingHours().forEach((day, h) ->
                    b.workingHours(day, new WorkingHours(LocalTime.parse(h.start()), LocalTime.parse(h.end()), h.enabled())));
        }
        if (dto.holidays() != null) {
            for (HolidayDto h : dto.holidays()) {
                b.holiday(new Holiday(h.name(), h.type(), h.month(), h.day(), h.weekday(), h.occurrence(), h.year(), h.observance()));
            }
        }
        if (dto.blackouts() != null) {
            for (BlackoutDto d : dto.blackouts()) {
                b.blackout(new BlackoutPeriod(d.name(), ZonedDateTime.parse(d.start()), ZonedDateTime.parse(d.end()),
                        d.reason(), d.recurring(), d.affectedWorkflows() == null ? Set.of() : Set.copyOf(d.affectedWorkflows())));
            }
        }
        if (dto.customDates() != null) {
            dto.customDates().forEach(d -> b.customDate(LocalDate.parse(d)));
        }
        return b.build();
    }
}
