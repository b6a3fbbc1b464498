package io.dispatch4j.utils;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronExpressionTest {

    private static ZonedDateTime at(String isoLocal) {
        return ZonedDateTime.parse(isoLocal + "Z[UTC]");
    }

    @Test
    void nextAfterShouldSupportFiveFieldSteps() {
        ZonedDateTime next = CronExpression.parse("*/5 * * * *").nextAfter(at("2026-01-01T00:01:00"));
        assertEquals(at("2026-01-01T00:05:00"), next);
    }

    @Test
    void nextAfterShouldSupportSixFieldSeconds() {
        ZonedDateTime next = CronExpression.parse("30 * * * * *").nextAfter(at("2026-01-01T00:00:00"));
        assertEquals(at("2026-01-01T00:00:30"), next);
    }

    @Test
    void aliasesShouldExpandWithOrWithoutAtSign() {
        assertEquals("0 0 * * *", CronExpression.parse("@daily").expression());
        assertEquals("0 0 * * *", CronExpression.parse("daily").expression());
        assertEquals("0 9-17 * * 1-5", CronAliases.expand("@business_hours"));
        assertTrue(CronAliases.isAlias("EVERY_5_MINUTES"));
    }

    @Test
    void lastDayOfMonthShouldHandleFebruary() {
        ZonedDateTime next = CronExpression.parse("@end_of_month").nextAfter(at("2026-02-10T12:00:00"));
        assertEquals(at("2026-02-28T00:00:00"), next);
    }

    @Test
    void nthAndLastWeekdayShouldResolveWithinMonth() {
        // January 2026 starts on a Thursday
        assertEquals(at("2026-01-05T00:00:00"), CronExpression.parse("@first_monday").nextAfter(at("2026-01-01T00:00:00")));
        assertEquals(at("2026-01-30T17:00:00"), CronExpression.parse("@last_friday").nextAfter(at("2026-01-01T00:00:00")));
    }

    @Test
    void sevenShouldMeanSunday() {
        ZonedDateTime next = CronExpression.parse("0 9 * * 7").nextAfter(at("2026-01-01T00:00:00"));
        assertEquals(at("2026-01-04T09:00:00"), next);
        assertEquals(next, CronExpression.parse("0 9 * * SUN").nextAfter(at("2026-01-01T00:00:00")));
    }

    @Test
    void restrictedDayOfMonthAndDayOfWeekShouldMatchEither() {
        ZonedDateTime next = CronExpression.parse("0 0 15 * 1").nextAfter(at("2026-01-01T00:00:00"));
        assertEquals(at("2026-01-05T00:00:00"), next);
    }

    @Test
    void impossibleDateShouldYieldNull() {
        assertNull(CronExpression.parse("0 0 30 2 *").nextAfter(at("2026-01-01T00:00:00")));
    }

    @Test
    void nextAfterShouldKeepTheCallersZone() {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        ZonedDateTime next = CronExpression.parse("0 9 * * *").nextAfter(ZonedDateTime.of(2026, 1, 1, 10, 0, 0, 0, tokyo));
        assertEquals(ZonedDateTime.of(2026, 1, 2, 9, 0, 0, 0, tokyo), next);
    }

    @Test
    void invalidExpressionsShouldBeRejected() {
        assertFalse(CronExpression.isValid("61 * * * *"));
        assertFalse(CronExpression.isValid("* * * *"));
        assertFalse(CronExpression.isValid("@fortnightly"));
        assertFalse(CronExpression.isValid("0 0 * * 1#6"));
        assertThrows(IllegalArgumentException.class, () -> CronExpression.parse("*/0 * * * *"));
    }

    @Test
    void describeShouldPreferAliasDescriptions() {
        assertEquals("At 9 AM on weekdays", CronExpression.parse("0 9 * * 1-5").describe());
        assertEquals("At 2:30 on weekdays", CronExpression.parse("30 2 * * 1-5").describe());
    }
}
