package com.animcurve.curve;

import com.animcurve.value.Value;
import com.animcurve.value.ValueKind;
import com.animcurve.value.ValueMath;

/**
 * Samples a {@link KeyframeTrack} at an arbitrary time.
 *
 * <h3>Bracketing</h3>
 * <p>The right end of the bracket is the first keyframe after index 0 whose time exceeds the query
 * time, found by a forward scan (tracks are authored by hand and stay small). Queries before the
 * first keyframe, at or past the last one, or on a kind without interpolation arithmetic return
 * the boundary keyframe's value unchanged. There is no extrapolation.</p>
 *
 * <h3>Failures</h3>
 * <p>A kind/method combination without arithmetic (rotations under {@link InterpolationMethod#SPLINE},
 * or a spline over fewer than three keyframes) is an interpolation error: it is logged and
 * {@link Value#EMPTY} is returned. Nothing is thrown.</p>
 *
 * <p>The engine holds no per-curve state; the only side effect of {@link #sample} is a lazy
 * rebuild of the supplied {@link TangentCache}.</p>
 */
public final class InterpolationEngine {

    private final boolean logErrors;

    public InterpolationEngine(boolean logErrors) {
        this.logErrors = logErrors;
    }

    // ── Evaluation ────────────────────────────────────────────────────────────

    /**
     * Returns the value of {@code track} at {@code time}.
     *
     * @param tangents spline tangent cache, rebuilt here if dirty and {@code method} is SPLINE
     * @param tension  spline tension used for a rebuild
     * @return the sampled value, or {@link Value#EMPTY} for an empty track or an interpolation error
     */
    public Value sample(KeyframeTrack track, InterpolationMethod method,
                        TangentCache tangents, float tension, float time) {
        int n = track.size();
        if (n == 0) return Value.EMPTY;
        if (time < track.get(0).time) return track.get(0).value;

        int index = 1;
        while (index < n && time >= track.get(index).time) index++;

        ValueKind kind = track.getKind();
        if (index >= n || !kind.supportsLinear())
            return track.get(index - 1).value;

        return switch (method) {
            case LINEAR -> linear(track, index - 1, index, time);
            case SPLINE -> spline(track, tangents, tension, index - 1, index, time);
        };
    }

    // ── Interpolation ─────────────────────────────────────────────────────────

    private Value linear(KeyframeTrack track, int lo, int hi, float time) {
        Keyframe k0 = track.get(lo);
        Keyframe k1 = track.get(hi);
        float u = (time - k0.time) / (k1.time - k0.time);

        Value result = ValueMath.lerp(k0.value, k1.value, u);
        if (result.isEmpty())
            error("Invalid value type for linear interpolation: " + track.getKind());
        return result;
    }

    private Value spline(KeyframeTrack track, TangentCache tangents, float tension,
                         int lo, int hi, float time) {
        if (!track.getKind().supportsSpline()) {
            error("Invalid value type for spline interpolation: " + track.getKind());
            return Value.EMPTY;
        }
        if (tangents.isDirty() && !tangents.rebuild(track, tension)) {
            error("Spline interpolation needs " + InterpolationMethod.SPLINE.minKeyframes
                + " keyframes, track has " + track.size());
            return Value.EMPTY;
        }

        Keyframe k0 = track.get(lo);
        Keyframe k1 = track.get(hi);
        float u = (time - k0.time) / (k1.time - k0.time);

        // Cubic Hermite basis
        float u2 = u * u, u3 = u2 * u;
        float h1 =  2f * u3 - 3f * u2 + 1f;
        float h2 = -2f * u3 + 3f * u2;
        float h3 =       u3 - 2f * u2 + u;
        float h4 =       u3 -      u2;

        Value result = ValueMath.hermite(k0.value, k1.value, tangents.get(lo), tangents.get(hi), h1, h2, h3, h4);
        if (result.isEmpty())
            error("Spline arithmetic failed for " + track.getKind());
        return result;
    }

    private void error(String message) {
        if (logErrors) System.err.println("[InterpolationEngine] " + message);
    }
}
