package com.animcurve.timeline;

/**
 * Connects one attribute of one {@link Animatable} to a curve.
 * The curve is named by id and looked up in a {@link CurveRegistry} on every use, so the binding
 * never keeps a curve alive.
 */
public final class CurveBinding {

    public final Animatable    target;
    public final AttributeInfo attribute;
    public final String        curveId;

    public CurveBinding(Animatable target, AttributeInfo attribute, String curveId) {
        this.target    = target;
        this.attribute = attribute;
        this.curveId   = curveId;
    }

    @Override
    public String toString() {
        return "CurveBinding(" + attribute + " <- " + curveId + ")";
    }
}
