package io.dispatch4j.calendar;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalendarCodecTest {

    private final CalendarCodec codec = new CalendarCodec();

    @Test
    void decodedCalendarShouldBehaveLikeTheOriginal() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        BusinessCalendar original = new BusinessCalendar(CalendarConfig.builder()
                .zone(berlin)
                .workingHours(DayOfWeek.FRIDAY, WorkingHours.of(LocalTime.of(8, 0), LocalTime.of(14, 0)))
                .holidays(BusinessCalendar.UK_BANK_HOLIDAYS)
                .holiday(Holiday.custom("Company day", LocalDate.of(2026, 6, 12)))
                .blackout(BlackoutPeriod.builder("migration",
                                ZonedDateTime.of(2026, 3, 2, 0, 0, 0, 0, berlin),
                                ZonedDateTime.of(2026, 3, 3, 23, 59, 0, 0, berlin))
                        .reason("DB migration")
                        .affects("wf-ledger")
                        .build())
                .customDate(LocalDate.of(2026, 4, 1))
                .build());

        BusinessCalendar decoded = codec.fromJson(codec.toJson(original));

        assertEquals(berlin, decoded.zone());
        assertEquals(original.config().workingHours(), decoded.config().workingHours());
        assertEquals(original.config().holidays(), decoded.config().holidays());
        assertEquals(original.config().customDates(), decoded.config().customDates());
        assertEquals(original.getHolidaysForYear(2026), decoded.getHolidaysForYear(2026));

        ZonedDateTime inBlackout = ZonedDateTime.of(2026, 3, 2, 10, 0, 0, 0, berlin);
        assertEquals("Blackout: DB migration", decoded.canExecute(inBlackout, "wf-ledger").reason());
        assertTrue(decoded.canExecute(inBlackout, "wf-other").allowed());
        assertFalse(decoded.canExecute(ZonedDateTime.of(2026, 3, 6, 15, 0, 0, 0, berlin)).allowed());
        assertTrue(decoded.isHoliday(LocalDate.of(2026, 6, 12)));
    }

    @Test
    void malformedPayloadShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.fromJson("{not json"));
        assertThrows(IllegalArgumentException.class, () -> codec.fromJson("{\"timezone\":\"Mars/Olympus\"}"));
        assertThrows(IllegalArgumentException.class,
                () -> codec.fromJson("{\"workingHours\":{\"MONDAY\":{\"start\":\"9am\",\"end\":\"17:00\",\"enabled\":true}}}"));
    }
}
