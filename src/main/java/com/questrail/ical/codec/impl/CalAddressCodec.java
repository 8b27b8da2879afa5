package com.questrail.ical.codec.impl;

import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.CalAddressValue;

import java.util.Objects;

/**
 * CAL-ADDRESS: carried as plain text. {@link CalAddressValue} adds the
 * {@code mailto:} scheme to bare mail addresses.
 */
public final class CalAddressCodec implements ValueCodec<CalAddressValue>
{
    @Override
    public String typeName() {
        return "CAL-ADDRESS";
    }

    @Override
    public Class<CalAddressValue> valueClass() {
        return CalAddressValue.class;
    }

    @Override
    public String encode(CalAddressValue value) {
        return value.address();
    }

    @Override
    public CalAddressValue decode(String text) {
        return new CalAddressValue(Objects.requireNonNull(text, "text"));
    }
}
