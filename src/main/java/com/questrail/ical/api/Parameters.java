package com.questrail.ical.api;

import java.util.StringJoiner;

/**
 * Property parameters attached to a value (e.g. {@code TZID}, {@code VALUE},
 * {@code ENCODING}).
 *
 * <p>Parameters are a side channel: they never take part in the equality of
 * the value they accompany. Every value hands out its own fresh instance, so
 * mutating one never affects another.</p>
 */
public final class Parameters extends CaselessMap<String>
{
    public static final String TZID = "TZID";
    public static final String VALUE = "VALUE";
    public static final String ENCODING = "ENCODING";

    public Parameters() {
    }

    public Parameters(Parameters other) {
        super(other);
    }

    /**
     * Convenience factory taking alternating name/value pairs.
     *
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public static Parameters of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Parameters.of requires name/value pairs");
        }
        Parameters p = new Parameters();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            p.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return p;
    }

    /**
     * Renders the parameters as they appear between a property name and its
     * value, without the leading semicolon: {@code ENCODING=BASE64;VALUE=BINARY}.
     * Quoting of parameter values is the caller's concern.
     */
    public String toIcal() {
        StringJoiner joiner = new StringJoiner(";");
        forEach((k, v) -> joiner.add(k + "=" + v));
        return joiner.toString();
    }
}
