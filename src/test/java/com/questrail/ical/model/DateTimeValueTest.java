package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.api.Parameters;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

final class DateTimeValueTest
{
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Test
    void utcSpellingsAreCollapsed() {
        LocalDateTime ldt = LocalDateTime.of(2023, 1, 1, 0, 0);
        assertEquals(DateTimeValue.utc(ldt), new DateTimeValue(ldt, ZoneId.of("UTC")));
        assertEquals(DateTimeValue.utc(ldt), new DateTimeValue(ldt, ZoneId.of("Etc/UTC")));
    }

    @Test
    void fractionalSecondsAreDropped() {
        LocalDateTime ldt = LocalDateTime.of(2023, 1, 1, 0, 0, 1, 999_000_000);
        assertEquals(LocalDateTime.of(2023, 1, 1, 0, 0, 1), DateTimeValue.naive(ldt).dateTime());
    }

    @Test
    void parametersCarryTzidOnlyForNonUtcZones() {
        LocalDateTime ldt = LocalDateTime.of(2023, 1, 1, 0, 0);

        Parameters zoned = new DateTimeValue(ldt, NEW_YORK).parameters();
        assertEquals("America/New_York", zoned.get("TZID"));
        assertEquals("DATE-TIME", zoned.get("VALUE"));

        assertFalse(DateTimeValue.utc(ldt).parameters().containsKey("TZID"));
        assertFalse(DateTimeValue.naive(ldt).parameters().containsKey("TZID"));
    }

    @Test
    void parametersAreNotShared() {
        DateTimeValue v = DateTimeValue.naive(LocalDateTime.of(2023, 1, 1, 0, 0));
        v.parameters().put("X-FOO", "bar");
        assertFalse(v.parameters().containsKey("X-FOO"));
    }

    @Test
    void zonedMomentsCompareByInstant() {
        DateTimeValue noonUtc = DateTimeValue.utc(LocalDateTime.of(2023, 1, 1, 12, 0));
        DateTimeValue eightNewYork = new DateTimeValue(LocalDateTime.of(2023, 1, 1, 8, 0), NEW_YORK);

        // 08:00 EST is 13:00 UTC
        assertTrue(noonUtc.compareMoment(eightNewYork) < 0);
    }

    @Test
    void naiveAndZonedCannotBeCompared() {
        DateTimeValue naive = DateTimeValue.naive(LocalDateTime.of(2023, 1, 1, 12, 0));
        DateTimeValue utc = DateTimeValue.utc(LocalDateTime.of(2023, 1, 1, 12, 0));
        assertThrows(InvalidValueException.class, () -> naive.compareMoment(utc));
    }

    @Test
    void wholeDaysAreNominalAcrossDstChange() {
        // DST starts in New York on 2023-03-12
        DateTimeValue start = new DateTimeValue(LocalDateTime.of(2023, 3, 11, 12, 0), NEW_YORK);

        assertEquals(LocalDateTime.of(2023, 3, 12, 12, 0), start.plus(Duration.ofDays(1)).dateTime());
        assertEquals(LocalDateTime.of(2023, 3, 11, 18, 0), start.plus(Duration.ofHours(6)).dateTime());
    }

    @Test
    void subDayRemainderIsExactElapsedTime() {
        // 2023-03-12 01:30 EST plus one hour skips the 02:00-03:00 gap
        DateTimeValue beforeGap = new DateTimeValue(LocalDateTime.of(2023, 3, 12, 1, 30), NEW_YORK);
        assertEquals(LocalDateTime.of(2023, 3, 12, 3, 30), beforeGap.plus(Duration.ofHours(1)).dateTime());
    }

    @Test
    void shiftBeyondRepresentableRangeIsInvalid() {
        DateTimeValue start = DateTimeValue.utc(LocalDateTime.of(2023, 1, 1, 0, 0));

        InvalidValueException e = assertThrows(InvalidValueException.class,
                () -> start.plus(Duration.ofDays(9_999_999_999_999L)));
        assertEquals("result is out of range", e.reason());
    }

    @Test
    void fiveDigitYearsAreRejected() {
        assertThrows(InvalidValueException.class,
                () -> DateTimeValue.naive(LocalDateTime.of(10000, 1, 1, 0, 0)));
    }
}
