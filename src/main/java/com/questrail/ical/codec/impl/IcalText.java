package com.questrail.ical.codec.impl;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * IcalText
 * -----------------------------------------------------------------------------
 * Tolerant conversion of foreign bytes into text.
 *
 * <p>Bytes are decoded strictly with the hinted charset first. If that fails,
 * they are decoded with the fallback charset and malformed sequences are
 * replaced with U+FFFD. This never fails.</p>
 */
public final class IcalText
{
    private static final Logger log = LoggerFactory.getLogger(IcalText.class);

    public static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_8;

    private IcalText() {}

    public static String normalize(byte[] data, @Nullable Charset hint)
    {
        return normalize(data, hint, DEFAULT_CHARSET);
    }

    public static String normalize(byte[] data, @Nullable Charset hint, Charset fallback)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(fallback, "fallback");

        Charset charset = hint != null ? hint : fallback;
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("Bytes are not valid {}; decoding as {} with replacement", charset, fallback);
            return new String(data, fallback);
        }
    }
}
