package com.animcurve.event;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StringHashTest {

    @Test
    void sdbmValues() {
        assertEquals(0, StringHash.of("").value());
        assertEquals(97, StringHash.of("a").value());
        assertEquals(6363201, StringHash.of("ab").value());
    }

    @Test
    void caseInsensitive() {
        assertEquals(StringHash.of("AnimationTrigger"), StringHash.of("animationtrigger"));
        assertNotEquals(StringHash.of("Start"), StringHash.of("Stop"));
    }

    @Test
    void unsignedTextRoundTrip() {
        StringHash h = new StringHash(-123456);
        assertEquals("4294843840", h.toString());
        assertEquals(h, StringHash.parse(h.toString()));
        assertThrows(NumberFormatException.class, () -> StringHash.parse("-1"));
    }
}
