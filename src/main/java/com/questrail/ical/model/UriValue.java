package com.questrail.ical.model;

import java.util.Objects;

/**
 * 3.3.13 URI. Held as text; no URI syntax is enforced.
 */
public record UriValue(String uri) implements PropertyValue
{
    public UriValue {
        Objects.requireNonNull(uri, "uri");
    }

    @Override
    public String typeName() {
        return "URI";
    }
}
