package com.questrail.ical.model;

import java.util.Objects;

/**
 * Raw, unparsed property text carried verbatim. Used where the value is
 * interpreted by a higher layer rather than by a value codec.
 */
public record InlineValue(String text) implements PropertyValue
{
    public InlineValue {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String typeName() {
        return "INLINE";
    }
}
