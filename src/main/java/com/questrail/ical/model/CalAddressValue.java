package com.questrail.ical.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 3.3.3 Calendar User Address.
 *
 * <p>Calendar user addresses must be {@code mailto:} URIs when they denote a
 * mail address. A bare {@code local@domain.tld} is therefore prefixed with
 * {@code mailto:} at construction; anything else is kept verbatim.</p>
 */
public record CalAddressValue(String address) implements PropertyValue
{
    private static final String MAILTO = "mailto:";
    private static final Pattern BARE_MAIL = Pattern.compile("[^@]+@[^@]+\\.[^@]+");

    public CalAddressValue {
        Objects.requireNonNull(address, "address");
        if (!address.toLowerCase(Locale.ROOT).startsWith(MAILTO)
                && BARE_MAIL.matcher(address).matches()) {
            address = MAILTO + address;
        }
    }

    @Override
    public String typeName() {
        return "CAL-ADDRESS";
    }
}
