package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;

/**
 * Fixed-width numeric field extraction shared by the date, time and offset
 * codecs. Only ASCII digits are accepted; signs and whitespace are not.
 */
final class FixedWidthFields
{
    private FixedWidthFields() {}

    static int digits(String text, int from, int width, String typeName)
    {
        if (from + width > text.length()) {
            throw new InvalidValueException(text, typeName, "value is truncated");
        }
        int v = 0;
        for (int i = from; i < from + width; i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw new InvalidValueException(text, typeName,
                        "expected a digit at position " + i + ", found '" + c + "'");
            }
            v = v * 10 + (c - '0');
        }
        return v;
    }
}
