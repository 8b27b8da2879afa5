package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

final class PeriodValueTest
{
    private static DateTimeValue utc(int day, int hour) {
        return DateTimeValue.utc(LocalDateTime.of(2023, 1, day, hour, 0));
    }

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    @Test
    void explicitFormDerivesDuration() {
        PeriodValue p = PeriodValue.between(utc(1, 0), utc(1, 6));

        assertEquals(Duration.ofHours(6), p.duration());
        assertFalse(p.byDuration());
    }

    @Test
    void durationFormDerivesEnd() {
        PeriodValue p = PeriodValue.of(utc(1, 0), Duration.ofDays(1));

        assertEquals(utc(2, 0), p.end());
        assertTrue(p.byDuration());
    }

    @Test
    void startAfterEndIsRejected() {
        assertThrows(InvalidValueException.class, () -> PeriodValue.between(utc(2, 0), utc(1, 0)));
    }

    @Test
    void negativeDurationIsRejected() {
        assertThrows(InvalidValueException.class, () -> PeriodValue.of(utc(1, 0), Duration.ofHours(-1)));
    }

    @Test
    void emptyPeriodIsAllowed() {
        PeriodValue p = PeriodValue.between(utc(1, 0), utc(1, 0));
        assertEquals(Duration.ZERO, p.duration());
    }

    @Test
    void mixedNaiveAndZonedIsRejected() {
        DateTimeValue naive = DateTimeValue.naive(LocalDateTime.of(2023, 1, 2, 0, 0));
        assertThrows(InvalidValueException.class, () -> PeriodValue.between(utc(1, 0), naive));
    }

    @Test
    void operandsMustBeOfOneKind() {
        assertThrows(InvalidValueException.class,
                () -> PeriodValue.of(utc(1, 0), (TemporalValue) DateValue.of(2023, 1, 2)));
        assertThrows(InvalidValueException.class,
                () -> PeriodValue.between(DateValue.of(2023, 1, 1), utc(2, 0)));
    }

    @Test
    void timeIsNotAPeriodAnchor() {
        assertThrows(InvalidValueException.class,
                () -> PeriodValue.of(TimeValue.naive(LocalTime.of(9, 0)), Duration.ofHours(1)));
    }

    @Test
    void datePeriodCountsWholeDays() {
        PeriodValue p = PeriodValue.between(DateValue.of(2023, 1, 1), DateValue.of(2023, 1, 5));

        assertEquals(Duration.ofDays(4), p.duration());
        assertTrue(p.parameters().isEmpty());
    }

    @Test
    void datePeriodShiftsByDays() {
        PeriodValue p = PeriodValue.of(DateValue.of(2023, 1, 30), DurationValue.ofDays(2));
        assertEquals(DateValue.of(2023, 2, 1), p.end());
    }

    @Test
    void datePeriodRejectsPartialDays() {
        assertThrows(InvalidValueException.class,
                () -> PeriodValue.of(DateValue.of(2023, 1, 1), Duration.ofHours(36)));
    }

    @Test
    void endOutOfRangeIsInvalid() {
        InvalidValueException e = assertThrows(InvalidValueException.class,
                () -> PeriodValue.of(utc(1, 0), Duration.ofDays(9_999_999_999_999L)));
        assertEquals("PERIOD", e.typeName());
        assertEquals("end is out of range", e.reason());

        assertThrows(InvalidValueException.class,
                () -> PeriodValue.of(DateValue.of(9999, 12, 31), Duration.ofDays(1)));
    }

    @Test
    void formTakesPartInEquality() {
        PeriodValue explicit = PeriodValue.between(utc(1, 0), utc(2, 0));
        PeriodValue byDuration = PeriodValue.of(utc(1, 0), Duration.ofDays(1));
        assertNotEquals(explicit, byDuration);
    }

    // ---------------------------------------------------------------------
    // Overlap
    // ---------------------------------------------------------------------

    @Test
    void overlappingPeriodsOverlapBothWays() {
        PeriodValue a = PeriodValue.between(utc(1, 0), utc(1, 10));
        PeriodValue b = PeriodValue.between(utc(1, 5), utc(1, 15));

        assertTrue(a.overlaps(b));
        assertTrue(b.overlaps(a));
    }

    @Test
    void adjacentPeriodsDoNotOverlap() {
        PeriodValue a = PeriodValue.between(utc(1, 0), utc(1, 10));
        PeriodValue b = PeriodValue.between(utc(1, 10), utc(1, 20));

        assertFalse(a.overlaps(b));
        assertFalse(b.overlaps(a));
    }

    @Test
    void datePeriodsOverlap() {
        PeriodValue week = PeriodValue.between(DateValue.of(2023, 1, 1), DateValue.of(2023, 1, 8));
        PeriodValue weekend = PeriodValue.of(DateValue.of(2023, 1, 7), DurationValue.ofDays(2));
        PeriodValue next = PeriodValue.of(DateValue.of(2023, 1, 8), DurationValue.ofDays(1));

        assertTrue(week.overlaps(weekend));
        assertTrue(weekend.overlaps(week));
        assertFalse(week.overlaps(next));
    }

    @Test
    void dateAndDateTimePeriodsCannotBeCompared() {
        PeriodValue dates = PeriodValue.between(DateValue.of(2023, 1, 1), DateValue.of(2023, 1, 2));
        PeriodValue moments = PeriodValue.between(utc(1, 0), utc(1, 1));
        assertThrows(InvalidValueException.class, () -> dates.overlaps(moments));
    }

    @Test
    void containedPeriodOverlaps() {
        PeriodValue outer = PeriodValue.between(utc(1, 0), utc(3, 0));
        PeriodValue inner = PeriodValue.of(utc(2, 0), Duration.ofHours(1));

        assertTrue(outer.overlaps(inner));
        assertTrue(inner.overlaps(outer));
    }
}
