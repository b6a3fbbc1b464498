package io.dispatch4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IntervalParserTest {

    @Test
    void parseHumanDurationShouldWork() {
        assertEquals(Duration.ofMinutes(5), IntervalParser.parse("5 minutes"));
        assertEquals(Duration.ofHours(27), IntervalParser.parse("1 day 3 hours"));
        assertEquals(Duration.ofSeconds(1), IntervalParser.parse("1 second"));
    }

    @Test
    void parseShouldAcceptPlainSecondsAndCompactUnits() {
        assertEquals(Duration.ofSeconds(300), IntervalParser.parse("300"));
        assertEquals(Duration.ofSeconds(30), IntervalParser.parse("30s"));
        assertEquals(Duration.ofHours(2), IntervalParser.parse("2h"));
        assertEquals(Duration.ofDays(14), IntervalParser.parse("2w"));
        assertEquals(Duration.ofMinutes(5), IntervalParser.parse(" 5M "));
    }

    @Test
    void parseSecondsShouldReturnWholeSeconds() {
        assertEquals(5400, IntervalParser.parseSeconds("1 hour 30 minutes"));
    }

    @Test
    void parseShouldRejectMalformedSpecs() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parse("0"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parse("5 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parse("minutes 5"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parse("1 day 2 days"));
    }
}
