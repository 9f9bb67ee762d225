package com.animcurve.event;

import java.nio.charset.StandardCharsets;

/**
 * 32-bit case-insensitive SDBM hash of a name, used as an event identifier.
 * Persisted as an unsigned decimal.
 */
public final class StringHash {

    public static final StringHash ZERO = new StringHash(0);

    private final int value;

    public StringHash(int value) {
        this.value = value;
    }

    public static StringHash of(String name) {
        int hash = 0;
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (c >= 'A' && c <= 'Z') c += 'a' - 'A';
            hash = c + (hash << 6) + (hash << 16) - hash;
        }
        return new StringHash(hash);
    }

    /** Parses the unsigned decimal form written by {@link #toString()}. */
    public static StringHash parse(String unsigned) {
        return new StringHash(Integer.parseUnsignedInt(unsigned.trim()));
    }

    public int value() { return value; }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StringHash && ((StringHash) obj).value == value;
    }

    @Override
    public int hashCode() { return value; }

    @Override
    public String toString() { return Integer.toUnsignedString(value); }
}
