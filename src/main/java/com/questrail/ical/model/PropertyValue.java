package com.questrail.ical.model;

import com.questrail.ical.api.Parameters;

/**
 * Canonical decoded representation of a single RFC 5545 property value.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code PropertyValue} is a closed sum type: every decoded value is exactly
 * one of the permitted records, and the active variant is visible through the
 * Java type system rather than through an untyped slot.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * All variants are immutable. Construction performs full validation, so an
 * instance that exists is a valid value; there is no mutation API beyond
 * constructing a new instance.
 * </p>
 *
 * <h2>Parameters</h2>
 * <p>
 * {@link #parameters()} exposes the property parameters implied by the value
 * (for example {@code VALUE=DATE} or a {@code TZID}). Parameters are a side
 * channel and never take part in {@code equals}/{@code hashCode}. Every call
 * returns a new, caller-owned {@link Parameters} instance.
 * </p>
 */
public sealed interface PropertyValue
        permits BinaryValue, BooleanValue, CalAddressValue, DateTimeListValue,
                FloatValue, FrequencyValue, GeoValue, InlineValue, IntegerValue,
                PeriodValue, RecurValue, TemporalValue, TextValue, UriValue,
                UtcOffsetValue, WeekdayValue {

    /**
     * Returns the RFC 5545 value-type name of this variant, e.g.
     * {@code DATE-TIME}.
     *
     * @return upper-case value-type name
     */
    String typeName();

    /**
     * Returns the parameters implied by this value.
     *
     * @return a fresh parameter container owned by the caller
     */
    default Parameters parameters() {
        return new Parameters();
    }
}
