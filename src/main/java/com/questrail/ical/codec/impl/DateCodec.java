package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.DateValue;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * DATE: {@code YYYYMMDD}.
 */
public final class DateCodec implements ValueCodec<DateValue>
{
    @Override
    public String typeName() {
        return "DATE";
    }

    @Override
    public Class<DateValue> valueClass() {
        return DateValue.class;
    }

    @Override
    public String encode(DateValue value) {
        return format(value.date());
    }

    @Override
    public DateValue decode(String text) {
        Objects.requireNonNull(text, "text");
        if (text.length() != 8) {
            throw new InvalidValueException(text, typeName(), "expected YYYYMMDD");
        }
        return new DateValue(parse(text, typeName()));
    }

    static String format(LocalDate date)
    {
        return String.format(Locale.ROOT, "%04d%02d%02d",
                date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Parses the leading {@code YYYYMMDD} of {@code text}.
     */
    static LocalDate parse(String text, String typeName)
    {
        int year = FixedWidthFields.digits(text, 0, 4, typeName);
        int month = FixedWidthFields.digits(text, 4, 2, typeName);
        int day = FixedWidthFields.digits(text, 6, 2, typeName);
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new InvalidValueException(text, typeName, e.getMessage(), e);
        }
    }
}
