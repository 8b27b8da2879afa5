package com.questrail.ical.codec.impl;

import com.questrail.ical.codec.ValueCodec;

import java.util.List;

/**
 * Shared, stateless instances of every value codec.
 */
public final class ValueCodecs
{
    public static final BinaryCodec BINARY = new BinaryCodec();
    public static final BooleanCodec BOOLEAN = new BooleanCodec();
    public static final CalAddressCodec CAL_ADDRESS = new CalAddressCodec();
    public static final DateCodec DATE = new DateCodec();
    public static final DateTimeCodec DATE_TIME = new DateTimeCodec();
    public static final DateTimeListCodec DATE_TIME_LIST = new DateTimeListCodec();
    public static final DurationCodec DURATION = new DurationCodec();
    public static final FloatCodec FLOAT = new FloatCodec();
    public static final FrequencyCodec FREQUENCY = new FrequencyCodec();
    public static final GeoCodec GEO = new GeoCodec();
    public static final InlineCodec INLINE = new InlineCodec();
    public static final IntegerCodec INTEGER = new IntegerCodec();
    public static final PeriodCodec PERIOD = new PeriodCodec();
    public static final RecurCodec RECUR = new RecurCodec();
    public static final TemporalCodec TEMPORAL = new TemporalCodec();
    public static final TextCodec TEXT = new TextCodec();
    public static final TimeCodec TIME = new TimeCodec();
    public static final UriCodec URI = new UriCodec();
    public static final UtcOffsetCodec UTC_OFFSET = new UtcOffsetCodec();
    public static final WeekdayCodec WEEKDAY = new WeekdayCodec();

    private ValueCodecs() {}

    public static List<ValueCodec<?>> all() {
        return List.of(BINARY, BOOLEAN, CAL_ADDRESS, DATE, DATE_TIME, DATE_TIME_LIST,
                DURATION, FLOAT, FREQUENCY, GEO, INLINE, INTEGER, PERIOD, RECUR,
                TEMPORAL, TEXT, TIME, URI, UTC_OFFSET, WEEKDAY);
    }
}
