package com.animcurve.curve;

import com.animcurve.value.Value;

/** A value anchored at a point on the curve's timeline. Immutable. */
public final class Keyframe {

    public final float time;
    public final Value value;

    public Keyframe(float time, Value value) {
        this.time  = time;
        this.value = value;
    }

    @Override
    public String toString() {
        return "Keyframe(" + time + ", " + value + ")";
    }
}
