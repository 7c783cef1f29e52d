package io.yasched.timing;

import io.yasched.core.InvalidCalendarValueException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MomentTest {

    @Test
    void addingSecondsShouldCarryAcrossLeapDayAndYear() {
        assertEquals(Moment.of(2024, 2, 29, 0, 0, 0), Moment.of(2024, 2, 28, 23, 59, 59).plusSeconds(1));
        assertEquals(Moment.of(2024, 1, 1, 0, 0, 0), Moment.of(2023, 12, 31, 23, 59, 59).plusSeconds(1));
        assertEquals(Moment.of(2025, 10, 24, 15, 30, 0), Moment.of(2025, 10, 24, 14, 30, 0).plusSeconds(3600));
        assertEquals(Moment.of(2023, 3, 1, 0, 0, 0), Moment.of(2023, 2, 28, 0, 0, 0).plusSeconds(86_400));
    }

    @Test
    void addingMomentShouldDecodeItAsNaiveDuration() {
        Moment base = Moment.of(2025, 1, 1, 10, 30, 45);
        assertEquals(Moment.of(2025, 1, 2, 15, 46, 15), base.plusElapsed(Moment.of(1970, 1, 2, 5, 15, 30)));

        // one naive month is 30 days, one naive year 365 days
        assertEquals(Duration.ofDays(30), Moment.of(1970, 2, 1).toElapsedDuration());
        assertEquals(Duration.ofDays(365), Moment.of(1971, 1, 1).toElapsedDuration());
        assertEquals(Duration.ZERO, Moment.of(1970, 1, 1).toElapsedDuration());
    }

    @Test
    void invalidFieldsShouldBeRejected() {
        assertThrows(InvalidCalendarValueException.class, () -> Moment.of(2025, 2, 30, 0, 0, 0));
        assertThrows(InvalidCalendarValueException.class, () -> Moment.of(2025, 1, 1, 24, 0, 0));
        assertThrows(InvalidCalendarValueException.class, () -> Moment.parse("2025-01-01T10:00:00"));
    }

    @Test
    void dateOnlyPatternShouldParseToMidnight() {
        assertEquals(Moment.of(2025, 6, 1, 0, 0, 0), Moment.parse("2025-06-01", "uuuu-MM-dd"));
        assertEquals(Moment.of(2024, 2, 29, 0, 0, 0), Moment.parse("29/02/2024", "dd/MM/uuuu"));
        assertThrows(InvalidCalendarValueException.class, () -> Moment.parse("2025-02-30", "uuuu-MM-dd"));
    }

    @Test
    void parseOfFormatShouldBeIdentity() {
        Moment[] samples = {
                Moment.of(2025, 10, 24, 14, 30, 0),
                Moment.of(2024, 2, 29, 23, 59, 59),
                Moment.of(1999, 12, 31, 0, 0, 1)
        };
        for (Moment m : samples) {
            assertEquals(m, Moment.parse(m.format()));
            assertEquals(m, Moment.parse(m.format("dd.MM.uuuu HH:mm:ss"), "dd.MM.uuuu HH:mm:ss"));
        }
    }

    @Test
    void orderingAndDifference() {
        Moment a = Moment.of(2025, 1, 1, 9, 0, 0);
        Moment b = Moment.of(2025, 1, 2, 9, 0, 30);
        assertTrue(a.isBefore(b));
        assertEquals(86_430, a.secondsUntil(b));
        assertEquals(-86_430, b.secondsUntil(a));
        assertEquals(CalendarDate.of(2025, 1, 2), b.date());
        assertEquals(TimeOfDay.of(9, 0, 30), b.time());
        assertEquals(b, Moment.of(b.date(), b.time()));
    }

    @Test
    void nowShouldReadClockWithoutFractions() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T10:30:00.750Z"), ZoneOffset.UTC);
        assertEquals(Moment.of(2025, 6, 1, 10, 30, 0), Moment.now(clock));
    }
}
