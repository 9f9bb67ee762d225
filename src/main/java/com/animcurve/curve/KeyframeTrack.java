package com.animcurve.curve;

import com.animcurve.value.Value;
import com.animcurve.value.ValueKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Time-ordered keyframes that all share one {@link ValueKind}.
 *
 * <h3>Ordering</h3>
 * <p>Keyframes are kept sorted by ascending time. A keyframe whose time is at or past the last
 * one is appended directly; otherwise it goes in front of the first keyframe with a strictly
 * greater time. Keyframes with equal times therefore stay in insertion order, and re-inserting an
 * already sorted sequence reproduces it exactly.</p>
 *
 * <h3>Kind</h3>
 * <p>A fresh track is {@link ValueKind#UNSET}; the first insertion fixes the kind. Changing the
 * kind explicitly empties the track.</p>
 */
public final class KeyframeTrack {

    private final List<Keyframe> keyframes = new ArrayList<>();

    private ValueKind kind      = ValueKind.UNSET;
    private float     beginTime = Float.POSITIVE_INFINITY;
    private float     endTime   = Float.NEGATIVE_INFINITY;

    // ── Kind ──────────────────────────────────────────────────────────────────

    public ValueKind getKind() { return kind; }

    /**
     * Switches the track to {@code newKind}, discarding every keyframe.
     *
     * @return {@code false} if the track already had that kind (nothing is cleared)
     */
    public boolean setKind(ValueKind newKind) {
        if (newKind == kind) return false;
        kind = newKind;
        clear();
        return true;
    }

    // ── Mutation ──────────────────────────────────────────────────────────────

    /**
     * Inserts {@code value} at {@code time}.
     *
     * @return {@code false} if the value's kind disagrees with the track's kind, the value is
     *         {@link Value#EMPTY}, or {@code time} is NaN or infinite; the track is left untouched
     *         in that case
     */
    public boolean insert(float time, Value value) {
        if (value.isEmpty() || !Float.isFinite(time)) return false;
        if (kind == ValueKind.UNSET)
            setKind(value.getKind());
        else if (value.getKind() != kind)
            return false;

        beginTime = Math.min(time, beginTime);
        endTime   = Math.max(time, endTime);

        Keyframe keyframe = new Keyframe(time, value);
        int n = keyframes.size();
        if (n == 0 || time >= keyframes.get(n - 1).time) {
            keyframes.add(keyframe);
            return true;
        }
        int i = 0;
        while (time >= keyframes.get(i).time) i++;
        keyframes.add(i, keyframe);
        return true;
    }

    /** Removes every keyframe and resets the time bounds. The kind is kept. */
    public void clear() {
        keyframes.clear();
        beginTime = Float.POSITIVE_INFINITY;
        endTime   = Float.NEGATIVE_INFINITY;
    }

    /** Replaces this track's contents with a copy of {@code other}'s. */
    void copyFrom(KeyframeTrack other) {
        keyframes.clear();
        keyframes.addAll(other.keyframes);
        kind      = other.kind;
        beginTime = other.beginTime;
        endTime   = other.endTime;
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public boolean isValid(InterpolationMethod method) {
        return keyframes.size() >= method.minKeyframes;
    }

    public int size()                    { return keyframes.size(); }
    public boolean isEmpty()             { return keyframes.isEmpty(); }
    public Keyframe get(int index)       { return keyframes.get(index); }
    public List<Keyframe> getKeyframes() { return Collections.unmodifiableList(keyframes); }

    /** Smallest keyframe time, or {@code +Infinity} when empty. */
    public float getBeginTime() { return beginTime; }

    /** Largest keyframe time, or {@code -Infinity} when empty. */
    public float getEndTime()   { return endTime; }
}
