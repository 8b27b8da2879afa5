package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.api.Parameters;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 3.3.4 Date: a calendar date with a four-digit year.
 */
public record DateValue(LocalDate date) implements TemporalValue
{
    public DateValue {
        Objects.requireNonNull(date, "date");
        if (date.getYear() < 0 || date.getYear() > 9999) {
            throw new InvalidValueException(date.toString(), "DATE", "year must have four digits");
        }
    }

    public static DateValue of(int year, int month, int day) {
        return new DateValue(LocalDate.of(year, month, day));
    }

    @Override
    public String typeName() {
        return "DATE";
    }

    @Override
    public Parameters parameters() {
        return Parameters.of(Parameters.VALUE, "DATE");
    }
}
