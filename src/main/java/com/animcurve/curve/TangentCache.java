package com.animcurve.curve;

import com.animcurve.value.Value;
import com.animcurve.value.ValueMath;

/**
 * Spline tangents, one per keyframe, in one of two states: <em>dirty</em> (nothing usable) or
 * <em>clean</em> (a full tangent array matching the current keyframes).
 *
 * <p>Interior tangents are the central difference {@code (k[i+1] - k[i-1]) * tension}. Both end
 * tangents are forced to zero, whatever the tension.</p>
 *
 * <p>Not thread-safe. A rebuild writes a fresh array and only publishes it once every tangent is
 * computed, but the dirty check and the rebuild are not atomic.</p>
 */
public final class TangentCache {

    private static final Value[] NONE = new Value[0];

    private Value[] tangents = NONE;
    private boolean dirty    = true;

    public boolean isDirty() { return dirty; }

    /** Number of cached tangents; zero unless clean. */
    public int size() { return dirty ? 0 : tangents.length; }

    /** Tangent at keyframe {@code index}. Only meaningful while clean. */
    public Value get(int index) {
        if (dirty) throw new IllegalStateException("Tangent cache is dirty");
        return tangents[index];
    }

    /** Invalidates after a structural edit; the next spline sample rebuilds. */
    public void markDirty() {
        dirty = true;
    }

    /** Drops the cached tangents entirely. */
    public void discard() {
        tangents = NONE;
        dirty    = true;
    }

    /**
     * Recomputes every tangent from {@code track}.
     *
     * @return {@code false} if the track has fewer than three keyframes or its kind has no spline
     *         arithmetic; the cache is left discarded in that case
     */
    public boolean rebuild(KeyframeTrack track, float tension) {
        int n = track.size();
        if (n < InterpolationMethod.SPLINE.minKeyframes || !track.getKind().supportsSpline()) {
            discard();
            return false;
        }

        Value[] fresh = new Value[n];
        for (int i = 1; i < n - 1; i++)
            fresh[i] = ValueMath.subtractAndScale(track.get(i + 1).value, track.get(i - 1).value, tension);

        Value first = track.get(0).value;
        fresh[0] = fresh[n - 1] = ValueMath.subtractAndScale(first, first, tension);

        tangents = fresh;
        dirty    = false;
        return true;
    }
}
