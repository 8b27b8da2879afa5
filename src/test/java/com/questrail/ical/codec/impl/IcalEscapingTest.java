package com.questrail.ical.codec.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class IcalEscapingTest
{
    @Test
    void specialCharactersAreEscaped() {
        assertEquals("a\\;b\\,c\\\\d", IcalEscaping.escape("a;b,c\\d"));
    }

    @Test
    void allLineBreakFormsCollapseToOne() {
        assertEquals("one\\ntwo\\nthree\\nfour", IcalEscaping.escape("one\r\ntwo\nthree\rfour"));
    }

    @Test
    void unescapeReversesEscape() {
        String raw = "Meeting; room 4, floor \\2\nbring notes";
        assertEquals(raw, IcalEscaping.unescape(IcalEscaping.escape(raw)));
    }

    @Test
    void uppercaseNewlineEscapeIsAccepted() {
        assertEquals("a\nb", IcalEscaping.unescape("a\\Nb"));
    }

    @Test
    void unknownEscapesAndTrailingBackslashAreKept() {
        assertEquals("a\\tb", IcalEscaping.unescape("a\\tb"));
        assertEquals("end\\", IcalEscaping.unescape("end\\"));
    }

    @Test
    void escapedBackslashBeforeNIsNotANewline() {
        // "\\n" on the wire is a backslash followed by the letter n
        assertEquals("\\n", IcalEscaping.unescape("\\\\n"));
    }
}
