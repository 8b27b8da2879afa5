package com.questrail.ical.codec.impl;

import java.util.Objects;

/**
 * IcalEscaping
 * -----------------------------------------------------------------------------
 * Implements the TEXT escaping rules of RFC 5545 section 3.3.11.
 *
 * <p>The four special characters are written as two-character sequences:</p>
 * <ul>
 *   <li>backslash → {@code \\}</li>
 *   <li>semicolon → {@code \;}</li>
 *   <li>comma → {@code \,}</li>
 *   <li>line break → {@code \n} (CRLF, LF and bare CR all collapse to one)</li>
 * </ul>
 */
public final class IcalEscaping
{
    private IcalEscaping() {}

    public static String escape(String text)
    {
        Objects.requireNonNull(text, "text");

        StringBuilder out = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case ';' -> out.append("\\;");
                case ',' -> out.append("\\,");
                case '\r' -> {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                        i++;
                    }
                    out.append("\\n");
                }
                case '\n' -> out.append("\\n");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Reverses {@link #escape(String)}.
     *
     * <p>Decoding is lenient: an unknown escape sequence, or a backslash at the
     * very end of the input, is kept verbatim.</p>
     */
    public static String unescape(String escaped)
    {
        Objects.requireNonNull(escaped, "escaped");
        if (escaped.indexOf('\\') < 0) {
            return escaped;
        }

        StringBuilder out = new StringBuilder(escaped.length());
        for (int r = 0; r < escaped.length(); r++) {
            char c = escaped.charAt(r);
            if (c != '\\' || r + 1 >= escaped.length()) {
                out.append(c);
                continue;
            }

            char next = escaped.charAt(++r);
            switch (next) {
                case '\\', ';', ',' -> out.append(next);
                case 'n', 'N' -> out.append('\n');
                default -> out.append('\\').append(next);
            }
        }
        return out.toString();
    }
}
