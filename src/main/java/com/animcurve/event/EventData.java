package com.animcurve.event;

import com.animcurve.value.Value;
import com.animcurve.value.ValueKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, string-keyed payload carried by an {@link EventFrame}.
 * Entries may hold a {@code String}, {@code Integer}, {@code Float}, {@code Boolean} or
 * non-empty {@link Value}. A float {@code Value} is stored as a plain {@code Float}.
 *
 * <p>Payloads stored on an {@link EventTrack} are read-only snapshots; copy one with
 * {@link #EventData(EventData)} to edit it.</p>
 */
public final class EventData {

    private final Map<String, Object> entries = new LinkedHashMap<>();
    private boolean readOnly;

    public EventData() {}

    /** Editable copy of {@code other}, even when {@code other} is read-only. */
    public EventData(EventData other) {
        entries.putAll(other.entries);
    }

    /** Read-only snapshot of {@code other}. */
    static EventData readOnlyCopy(EventData other) {
        EventData copy = new EventData(other);
        copy.readOnly = true;
        return copy;
    }

    public boolean isReadOnly() { return readOnly; }

    // ── Mutation ──────────────────────────────────────────────────────────────

    public EventData put(String key, String value)  { return putChecked(key, value); }
    public EventData put(String key, int value)     { return putChecked(key, value); }
    public EventData put(String key, float value)   { return putChecked(key, value); }
    public EventData put(String key, boolean value) { return putChecked(key, value); }

    public EventData put(String key, Value value) {
        if (readOnly) throw new UnsupportedOperationException("Event data stored on a track is read-only");
        if (value.isEmpty()) throw new IllegalArgumentException("Cannot store an empty value under '" + key + "'");
        if (value.getKind() == ValueKind.FLOAT) return putChecked(key, value.getFloat());
        return putChecked(key, value);
    }

    private EventData putChecked(String key, Object value) {
        if (readOnly) throw new UnsupportedOperationException("Event data stored on a track is read-only");
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    // ── Access ────────────────────────────────────────────────────────────────

    public boolean contains(String key) { return entries.containsKey(key); }
    public Object get(String key)       { return entries.get(key); }
    public int size()                   { return entries.size(); }
    public boolean isEmpty()            { return entries.isEmpty(); }

    public String getString(String key, String fallback) {
        Object v = entries.get(key);
        return v instanceof String ? (String) v : fallback;
    }

    public int getInt(String key, int fallback) {
        Object v = entries.get(key);
        return v instanceof Integer ? (Integer) v : fallback;
    }

    public float getFloat(String key, float fallback) {
        Object v = entries.get(key);
        return v instanceof Float ? (Float) v : fallback;
    }

    public boolean getBoolean(String key, boolean fallback) {
        Object v = entries.get(key);
        return v instanceof Boolean ? (Boolean) v : fallback;
    }

    /**
     * Returns the stored {@link Value} (floats are wrapped), or {@link Value#EMPTY} if absent or
     * of another type.
     */
    public Value getValue(String key) {
        Object v = entries.get(key);
        if (v instanceof Float) return Value.of((Float) v);
        return v instanceof Value ? (Value) v : Value.EMPTY;
    }

    /** Read-only view in insertion order. */
    public Map<String, Object> asMap() { return Collections.unmodifiableMap(entries); }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof EventData && entries.equals(((EventData) obj).entries);
    }

    @Override
    public int hashCode() { return entries.hashCode(); }

    @Override
    public String toString() { return entries.toString(); }
}
