package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;

import java.util.Objects;

/**
 * A {@code BYDAY}/{@code WKST} selector: a weekday, optionally qualified by a
 * signed ordinal ({@code 2MO} = second Monday, {@code -1FR} = last Friday).
 *
 * <p>{@code ordinal == 0} means "every such weekday". Otherwise the ordinal
 * lies in {@code [-53, -1]} or {@code [1, 53]}.</p>
 */
public record WeekdayValue(Weekday weekday, int ordinal) implements PropertyValue
{
    public static final int MAX_ORDINAL = 53;

    public WeekdayValue {
        Objects.requireNonNull(weekday, "weekday");
        if (Math.abs(ordinal) > MAX_ORDINAL) {
            throw new InvalidValueException(ordinal + weekday.code(), "WEEKDAY",
                    "ordinal must be within -" + MAX_ORDINAL + ".." + MAX_ORDINAL);
        }
    }

    public static WeekdayValue of(Weekday weekday) {
        return new WeekdayValue(weekday, 0);
    }

    public static WeekdayValue of(int ordinal, Weekday weekday) {
        if (ordinal == 0) {
            throw new InvalidValueException("0" + weekday.code(), "WEEKDAY", "ordinal must not be zero");
        }
        return new WeekdayValue(weekday, ordinal);
    }

    public boolean hasOrdinal() {
        return ordinal != 0;
    }

    @Override
    public String typeName() {
        return "WEEKDAY";
    }
}
