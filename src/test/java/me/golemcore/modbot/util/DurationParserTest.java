package me.golemcore.modbot.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationParserTest {

    @Test
    void shouldParseSingleUnits() {
        assertEquals(Duration.ofSeconds(30), DurationParser.parse("30s"));
        assertEquals(Duration.ofMinutes(10), DurationParser.parse("10m"));
        assertEquals(Duration.ofHours(2), DurationParser.parse("2h"));
        assertEquals(Duration.ofDays(7), DurationParser.parse("7d"));
        assertEquals(Duration.ofDays(14), DurationParser.parse("2w"));
    }

    @Test
    void shouldParseCompoundDurations() {
        assertEquals(Duration.ofMinutes(90), DurationParser.parse("1h30m"));
        assertEquals(Duration.ofHours(27), DurationParser.parse("1D 3H"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "  ", "10", "m", "10x", "1h-30m", "0s", "0h0m" })
    void shouldRejectInvalidDurations(String value) {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse(value));
    }

    @Test
    void shouldRejectNull() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse(null));
    }

    @Test
    void shouldFormatDurations() {
        assertEquals("2d 3h 15m", DurationParser.format(Duration.ofDays(2).plusHours(3).plusMinutes(15)));
        assertEquals("10m", DurationParser.format(Duration.ofMinutes(10)));
        assertEquals("1w 1s", DurationParser.format(Duration.ofDays(7).plusSeconds(1)));
        assertEquals("0s", DurationParser.format(Duration.ZERO));
    }
}
