package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;

/**
 * Geographic position ({@code GEO} property): latitude and longitude in
 * decimal degrees.
 */
public record GeoValue(double latitude, double longitude) implements PropertyValue
{
    public GeoValue {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new InvalidValueException(latitude + ";" + longitude, "GEO",
                    "latitude and longitude must be finite numbers");
        }
    }

    @Override
    public String typeName() {
        return "GEO";
    }
}
