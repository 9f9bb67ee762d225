package com.animcurve.curve;

/** How a {@link Curve} fills the gap between two keyframes. */
public enum InterpolationMethod {
    /** Per-kind linear blend; spherical for rotations. Needs at least two keyframes. */
    LINEAR(2),
    /** Cubic Hermite spline over cached finite-difference tangents. Needs at least three keyframes. */
    SPLINE(3);

    /** Fewest keyframes for which this method can produce an interpolated value. */
    public final int minKeyframes;

    InterpolationMethod(int minKeyframes) {
        this.minKeyframes = minKeyframes;
    }
}
