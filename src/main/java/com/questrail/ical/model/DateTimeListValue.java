package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.api.Parameters;

import java.util.List;
import java.util.Objects;

/**
 * A non-empty, ordered list of temporal values of one variant, as used by
 * {@code RDATE} and {@code EXDATE}.
 *
 * <p>The list publishes a single {@code TZID} parameter: that of the last
 * element carrying one. Consistency of the zones across elements is not
 * checked.</p>
 */
public record DateTimeListValue(List<TemporalValue> values) implements PropertyValue
{
    public DateTimeListValue {
        Objects.requireNonNull(values, "values");
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new InvalidValueException("", "DATE-TIME-LIST", "list must not be empty");
        }
        Class<?> variant = values.get(0).getClass();
        for (TemporalValue v : values) {
            if (v.getClass() != variant) {
                throw new InvalidValueException(values.toString(), "DATE-TIME-LIST",
                        "all elements must be of one type, found "
                                + values.get(0).typeName() + " and " + v.typeName());
            }
        }
    }

    public static DateTimeListValue of(TemporalValue... values) {
        return new DateTimeListValue(List.of(values));
    }

    @Override
    public String typeName() {
        return "DATE-TIME-LIST";
    }

    @Override
    public Parameters parameters() {
        Parameters p = new Parameters();
        for (TemporalValue v : values) {
            String tzid = v.parameters().get(Parameters.TZID);
            if (tzid != null) {
                p.put(Parameters.TZID, tzid);
            }
        }
        return p;
    }
}
