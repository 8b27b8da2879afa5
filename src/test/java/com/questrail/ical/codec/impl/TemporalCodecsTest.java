package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.model.DateTimeValue;
import com.questrail.ical.model.DateValue;
import com.questrail.ical.model.DurationValue;
import com.questrail.ical.model.TimeValue;
import com.questrail.ical.model.UtcOffsetValue;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the fixed-form temporal codecs: DATE, TIME, DATE-TIME,
 * DURATION and UTC-OFFSET.
 */
final class TemporalCodecsTest
{
    private static final LocalDateTime NEW_YEAR = LocalDateTime.of(2023, 1, 1, 0, 0);

    // ---------------------------------------------------------------------
    // DATE
    // ---------------------------------------------------------------------

    @Test
    void dateUsesEightDigits() {
        assertEquals(DateValue.of(1997, 7, 14), ValueCodecs.DATE.decode("19970714"));
        assertEquals("00010203", ValueCodecs.DATE.encode(DateValue.of(1, 2, 3)));
    }

    @Test
    void dateRejectsImpossibleAndMalformedDates() {
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DATE.decode("20230230"));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DATE.decode("2023-01-01"));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DATE.decode("2023011"));
    }

    // ---------------------------------------------------------------------
    // TIME
    // ---------------------------------------------------------------------

    @Test
    void timeDecodesNaiveAndUtc() {
        assertEquals(TimeValue.naive(LocalTime.of(23, 0)), ValueCodecs.TIME.decode("230000"));
        assertEquals(TimeValue.utc(LocalTime.of(7, 0)), ValueCodecs.TIME.decode("070000Z"));
        assertEquals("070000Z", ValueCodecs.TIME.encode(TimeValue.utc(LocalTime.of(7, 0))));
    }

    @Test
    void leapSecondIsClamped() {
        assertEquals(LocalTime.of(23, 59, 59), ValueCodecs.TIME.decode("235960").time());
    }

    @Test
    void timeRejectsOutOfRangeFields() {
        assertThrows(InvalidValueException.class, () -> ValueCodecs.TIME.decode("250000"));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.TIME.decode("12000"));
    }

    // ---------------------------------------------------------------------
    // DATE-TIME
    // ---------------------------------------------------------------------

    @Test
    void trailingZMeansUtc() {
        DateTimeValue v = ValueCodecs.DATE_TIME.decode("20230101T000000Z");

        assertEquals(DateTimeValue.utc(NEW_YEAR), v);
        assertEquals("20230101T000000Z", ValueCodecs.DATE_TIME.encode(v));
    }

    @Test
    void noSuffixMeansFloating() {
        DateTimeValue v = ValueCodecs.DATE_TIME.decode("20230101T000000");

        assertFalse(v.isZoned());
        assertEquals("20230101T000000", ValueCodecs.DATE_TIME.encode(v));
    }

    @Test
    void tzidHintAttachesZone() {
        DateTimeValue v = ValueCodecs.DATE_TIME.decode("20230101T000000", "America/New_York");

        assertEquals(ZoneId.of("America/New_York"), v.zone());
        assertEquals("20230101T000000", ValueCodecs.DATE_TIME.encode(v));
        assertEquals("America/New_York", v.parameters().get("TZID"));
    }

    @Test
    void tzidHintWinsOverTrailingZ() {
        DateTimeValue v = ValueCodecs.DATE_TIME.decode("20230101T000000Z", "Europe/Paris");
        assertEquals(ZoneId.of("Europe/Paris"), v.zone());
    }

    @Test
    void unknownTzidIsIgnored() {
        DateTimeValue v = ValueCodecs.DATE_TIME.decode("20230101T000000", "Mars/Olympus_Mons");
        assertFalse(v.isZoned());
    }

    @Test
    void utcTzidEncodesWithZ() {
        DateTimeValue v = ValueCodecs.DATE_TIME.decode("20230101T000000", "UTC");

        assertEquals(ZoneOffset.UTC, v.zone());
        assertEquals("20230101T000000Z", ValueCodecs.DATE_TIME.encode(v));
    }

    @Test
    void numericOffsetSuffixIsRejected() {
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DATE_TIME.decode("20230101T000000+0100"));
    }

    @Test
    void dateTimeNeedsTheTSeparator() {
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DATE_TIME.decode("20230101 000000"));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DATE_TIME.decode("20230101"));
    }

    // ---------------------------------------------------------------------
    // DURATION
    // ---------------------------------------------------------------------

    @Test
    void negativeDay() {
        DurationValue v = ValueCodecs.DURATION.decode("-P1D");

        assertEquals(Duration.ofDays(-1), v.duration());
        assertEquals("-P1D", ValueCodecs.DURATION.encode(v));
    }

    @Test
    void mixedDurationKeepsZeroMinutesBetweenHoursAndSeconds() {
        Duration expected = Duration.ofDays(15).plusHours(5).plusSeconds(20);
        DurationValue v = ValueCodecs.DURATION.decode("P15DT5H0M20S");

        assertEquals(expected, v.duration());
        assertEquals("P15DT5H0M20S", ValueCodecs.DURATION.encode(v));
    }

    @Test
    void weeksBecomeDays() {
        DurationValue v = ValueCodecs.DURATION.decode("P7W");

        assertEquals(Duration.ofDays(49), v.duration());
        assertEquals("P49D", ValueCodecs.DURATION.encode(v));
    }

    @Test
    void timeOnlyDurations() {
        assertEquals("PT1H", ValueCodecs.DURATION.encode(new DurationValue(Duration.ofHours(1))));
        assertEquals("PT15M", ValueCodecs.DURATION.encode(new DurationValue(Duration.ofMinutes(15))));
        assertEquals(Duration.ofMinutes(90), ValueCodecs.DURATION.decode("+PT1H30M").duration());
    }

    @Test
    void zeroDurationIsP0D() {
        assertEquals("P0D", ValueCodecs.DURATION.encode(new DurationValue(Duration.ZERO)));
    }

    @Test
    void emptyDurationsAreRejected() {
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DURATION.decode("P"));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DURATION.decode("PT"));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DURATION.decode("P1W2D"));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.DURATION.decode("1D"));
    }

    // ---------------------------------------------------------------------
    // UTC-OFFSET
    // ---------------------------------------------------------------------

    @Test
    void negativeOffset() {
        UtcOffsetValue v = ValueCodecs.UTC_OFFSET.decode("-0500");

        assertEquals(Duration.ofHours(-5), v.offset());
        assertEquals("-0500", ValueCodecs.UTC_OFFSET.encode(v));
    }

    @Test
    void offsetWithSeconds() {
        UtcOffsetValue v = ValueCodecs.UTC_OFFSET.decode("+023000");

        assertEquals(Duration.ofHours(2).plusMinutes(30), v.offset());
        assertEquals("+0230", ValueCodecs.UTC_OFFSET.encode(v));
        assertEquals("+023015", ValueCodecs.UTC_OFFSET.encode(ValueCodecs.UTC_OFFSET.decode("+023015")));
    }

    @Test
    void zeroOffsetIsPositive() {
        assertEquals("+0000", ValueCodecs.UTC_OFFSET.encode(new UtcOffsetValue(Duration.ZERO)));
    }

    @Test
    void twentyFourHoursIsRejected() {
        InvalidValueException e = assertThrows(InvalidValueException.class,
                () -> ValueCodecs.UTC_OFFSET.decode("+2400"));
        assertEquals("offset must be less than 24 hours", e.reason());
    }

    @Test
    void unsignedOrMalformedOffsetsAreRejected() {
        assertThrows(InvalidValueException.class, () -> ValueCodecs.UTC_OFFSET.decode("0500"));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.UTC_OFFSET.decode("+05:00"));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.UTC_OFFSET.decode("+0560"));
    }
}
