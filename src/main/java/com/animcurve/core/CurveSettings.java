package com.animcurve.core;

import com.animcurve.curve.InterpolationMethod;

/**
 * Mutable defaults shared by every {@link com.animcurve.curve.Curve} built from it.
 * A curve copies these values at construction; later edits only affect new curves.
 */
public final class CurveSettings {

    /** Shared defaults used by the no-argument {@code Curve} constructor. */
    public static final CurveSettings DEFAULTS = new CurveSettings();

    // ── Interpolation ─────────────────────────────────────────────────────────
    public InterpolationMethod defaultMethod  = InterpolationMethod.LINEAR;
    public float               defaultTension = 0.5f;

    // ── Diagnostics ───────────────────────────────────────────────────────────
    /** Report interpolation errors and rejected keyframes on stderr. */
    public boolean logErrors = true;
    /** Print a one-line summary after each successful load. */
    public boolean logLoads  = false;
}
