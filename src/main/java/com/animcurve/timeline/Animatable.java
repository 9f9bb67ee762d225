package com.animcurve.timeline;

import com.animcurve.value.Value;

/**
 * Implemented by any object whose attributes can be driven by curves.
 * This is the sink sampled values are applied to.
 */
public interface Animatable {

    /** Attributes this object exposes for animation. Names must be stable. */
    AttributeInfo[] getAnimatableAttributes();

    /**
     * Returns the current value of {@code attribute}.
     * Called when capturing a keyframe from the live object.
     */
    Value getAttribute(AttributeInfo attribute);

    /**
     * Writes a sampled value to {@code attribute}. Called at most once per attribute per
     * {@link CurveTimeline#apply(float)}; never called with {@link Value#EMPTY}.
     */
    void onSetAttribute(AttributeInfo attribute, Value value);
}
