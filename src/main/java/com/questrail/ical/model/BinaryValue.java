package com.questrail.ical.model;

import com.questrail.ical.api.Parameters;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * 3.3.1 Binary: inline binary data, carried on the wire as base64.
 *
 * <p>The byte array is copied on the way in and on the way out.</p>
 */
public final class BinaryValue implements PropertyValue
{
    private final byte[] data;

    public BinaryValue(byte[] data) {
        this.data = Objects.requireNonNull(data, "data").clone();
    }

    /**
     * Creates a binary value holding the UTF-8 bytes of {@code text}.
     */
    public static BinaryValue ofText(String text) {
        return new BinaryValue(Objects.requireNonNull(text, "text").getBytes(StandardCharsets.UTF_8));
    }

    public byte[] data() {
        return data.clone();
    }

    /**
     * @return the payload interpreted as UTF-8 text
     */
    public String asText() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public String typeName() {
        return "BINARY";
    }

    @Override
    public Parameters parameters() {
        return Parameters.of(Parameters.ENCODING, "BASE64", Parameters.VALUE, "BINARY");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryValue that)) return false;
        return Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "BinaryValue[" + data.length + " bytes]";
    }
}
