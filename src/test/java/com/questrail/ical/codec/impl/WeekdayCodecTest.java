package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.model.Frequency;
import com.questrail.ical.model.FrequencyValue;
import com.questrail.ical.model.Weekday;
import com.questrail.ical.model.WeekdayValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the WEEKDAY and FREQUENCY rule-part codecs.
 */
final class WeekdayCodecTest
{
    private final WeekdayCodec codec = ValueCodecs.WEEKDAY;

    @Test
    void plainWeekday() {
        assertEquals(WeekdayValue.of(Weekday.SU), codec.decode("SU"));
        assertEquals("SU", codec.encode(WeekdayValue.of(Weekday.SU)));
    }

    @Test
    void positiveAndNegativeOrdinals() {
        assertEquals(WeekdayValue.of(2, Weekday.MO), codec.decode("2MO"));
        assertEquals(WeekdayValue.of(-1, Weekday.FR), codec.decode("-1FR"));
        assertEquals(WeekdayValue.of(20, Weekday.TU), codec.decode("+20TU"));

        assertEquals("2MO", codec.encode(WeekdayValue.of(2, Weekday.MO)));
        assertEquals("-1FR", codec.encode(WeekdayValue.of(-1, Weekday.FR)));
    }

    @Test
    void codeIsCaseInsensitive() {
        assertEquals(WeekdayValue.of(Weekday.WE), codec.decode("we"));
    }

    @Test
    void invalidWeekdaysAreRejected() {
        assertThrows(InvalidValueException.class, () -> codec.decode("XX"));
        assertThrows(InvalidValueException.class, () -> codec.decode("0MO"));
        assertThrows(InvalidValueException.class, () -> codec.decode("54MO"));
        assertThrows(InvalidValueException.class, () -> codec.decode("-MO"));
        assertThrows(InvalidValueException.class, () -> codec.decode("MONDAY"));
    }

    @Test
    void frequencyNames() {
        assertEquals(new FrequencyValue(Frequency.WEEKLY), ValueCodecs.FREQUENCY.decode("weekly"));
        assertEquals("SECONDLY", ValueCodecs.FREQUENCY.encode(new FrequencyValue(Frequency.SECONDLY)));
        assertThrows(InvalidValueException.class, () -> ValueCodecs.FREQUENCY.decode("FORTNIGHTLY"));
    }
}
