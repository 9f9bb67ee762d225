package com.animcurve.timeline;

import com.animcurve.curve.Curve;
import com.animcurve.event.EventFrame;
import com.animcurve.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Drives a set of {@link CurveBinding}s from one clock.
 *
 * <h3>Applying values</h3>
 * <p>{@link #apply(float)} resolves each binding's curve through the {@link CurveRegistry}, samples
 * it, and hands the result to the target's {@link Animatable#onSetAttribute}. Bindings whose curve
 * is missing, not valid for its method, or of the wrong kind are skipped, as are empty samples.
 * The time passed in is already in the curves' own domain; this class does no looping, blending or
 * rate scaling.</p>
 *
 * <h3>Events</h3>
 * <p>{@link #dispatchEvents} forwards every event frame in a half-open time window, per binding, in
 * time order. Callers pass the previous and current tick times so each frame fires once.</p>
 *
 * <h3>Binding uniqueness</h3>
 * <p>Only one binding may exist per (target, attribute) pair. {@link #bind} returns the existing
 * binding rather than creating a duplicate.</p>
 */
public final class CurveTimeline {

    /** Identifier recorded as the owner of curves bound through this timeline. */
    public final String clipId;

    private final CurveRegistry      registry;
    private final List<CurveBinding> bindings = new ArrayList<>();

    public CurveTimeline(String clipId, CurveRegistry registry) {
        this.clipId   = clipId;
        this.registry = registry;
    }

    // ── Binding management ────────────────────────────────────────────────────

    /**
     * Binds {@code attribute} of {@code target} to the curve registered as {@code curveId}.
     * If that curve has no owner yet, this timeline's {@link #clipId} is recorded on it.
     */
    public CurveBinding bind(Animatable target, AttributeInfo attribute, String curveId) {
        CurveBinding existing = findBinding(target, attribute);
        if (existing != null) return existing;

        Curve curve = registry.get(curveId);
        if (curve != null && curve.getOwner() == null)
            curve.setOwner(clipId);

        CurveBinding binding = new CurveBinding(target, attribute, curveId);
        bindings.add(binding);
        return binding;
    }

    public void unbind(CurveBinding binding) {
        bindings.remove(binding);
    }

    public List<CurveBinding> getBindings() {
        return Collections.unmodifiableList(bindings);
    }

    /** Finds the binding for a given target + attribute, or null if none exists. */
    public CurveBinding findBinding(Animatable target, AttributeInfo attribute) {
        for (CurveBinding b : bindings)
            if (b.target == target && b.attribute.equals(attribute)) return b;
        return null;
    }

    // ── Evaluation ────────────────────────────────────────────────────────────

    /**
     * Samples every bound curve at {@code time} and applies the results.
     *
     * @return how many attributes were updated
     */
    public int apply(float time) {
        int applied = 0;
        for (CurveBinding b : bindings) {
            Curve curve = registry.get(b.curveId);
            if (curve == null || !curve.isValid()) continue;
            if (curve.getKind() != b.attribute.kind) {
                System.err.println("[CurveTimeline] Curve '" + b.curveId + "' is " + curve.getKind()
                    + ", attribute " + b.attribute + " skipped");
                continue;
            }
            Value value = curve.sample(time);
            if (value.isEmpty()) continue;
            b.target.onSetAttribute(b.attribute, value);
            applied++;
        }
        return applied;
    }

    /** Sends every event frame with {@code begin <= time < end} on each bound curve to {@code listener}. */
    public void dispatchEvents(float begin, float end, EventFrameListener listener) {
        for (CurveBinding b : bindings) {
            Curve curve = registry.get(b.curveId);
            if (curve == null) continue;
            for (EventFrame frame : curve.queryEvents(begin, end))
                listener.onEventFrame(b.target, frame);
        }
    }

    // ── Authoring ─────────────────────────────────────────────────────────────

    /**
     * Reads the target's current attribute value and inserts it as a keyframe at {@code time},
     * creating and registering the curve if needed.
     *
     * @return {@code false} if the current value is empty or its kind does not match the curve
     */
    public boolean captureKeyframe(CurveBinding binding, float time) {
        Value current = binding.target.getAttribute(binding.attribute);
        if (current == null || current.isEmpty()) return false;

        Curve curve = registry.get(binding.curveId);
        if (curve == null) {
            curve = new Curve();
            curve.setKind(binding.attribute.kind);
            curve.setOwner(clipId);
            registry.register(binding.curveId, curve);
        }
        return curve.insertKeyframe(time, current);
    }
}
