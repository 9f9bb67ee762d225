package com.animcurve.curve;

import com.animcurve.core.CurveSettings;
import com.animcurve.event.EventData;
import com.animcurve.event.EventFrame;
import com.animcurve.event.EventTrack;
import com.animcurve.event.StringHash;
import com.animcurve.value.Value;
import com.animcurve.value.ValueKind;

import java.util.List;
import java.util.Objects;

/**
 * A time-varying attribute value plus the event frames that share its timeline.
 *
 * <h3>Lifecycle</h3>
 * <p>A curve starts empty with kind {@link ValueKind#UNSET}. The first accepted keyframe fixes the
 * kind; later keyframes of another kind are rejected. {@link #setKind} to a different kind drops
 * every keyframe and resets the time bounds.</p>
 *
 * <h3>Sampling</h3>
 * <p>{@link #sample(float)} delegates to {@link InterpolationEngine}. The time passed in is already
 * in the curve's own domain: looping, warping and rate control belong to the caller. Sampling never
 * touches anything outside the curve; applying the result is the caller's job, and an
 * {@link Value#EMPTY} result means "skip this update".</p>
 *
 * <h3>Ownership</h3>
 * <p>The owning clip is recorded only as an identifier ({@link #getOwner()}), resolved through an
 * external registry. A curve never references the object it animates.</p>
 *
 * <h3>Threading</h3>
 * <p>Not thread-safe. The first spline sample after an edit rebuilds the tangent cache in place,
 * so edits and samples on one curve must not overlap.</p>
 */
public final class Curve {

    private final KeyframeTrack       keyframes = new KeyframeTrack();
    private final EventTrack          events    = new EventTrack();
    private final TangentCache        tangents  = new TangentCache();
    private final InterpolationEngine engine;
    private final boolean             logErrors;

    private InterpolationMethod method;
    private float               tension;
    private String              owner;

    // ── Construction ──────────────────────────────────────────────────────────

    public Curve() {
        this(CurveSettings.DEFAULTS);
    }

    public Curve(CurveSettings settings) {
        this.method    = settings.defaultMethod;
        this.tension   = settings.defaultTension;
        this.logErrors = settings.logErrors;
        this.engine    = new InterpolationEngine(settings.logErrors);
    }

    // ── Metadata ──────────────────────────────────────────────────────────────

    public ValueKind getKind() { return keyframes.getKind(); }

    /**
     * Sets the value kind. A different kind clears all keyframes, resets the time bounds and
     * discards the tangent cache; integer kinds also force {@link InterpolationMethod#LINEAR}.
     */
    public void setKind(ValueKind kind) {
        Objects.requireNonNull(kind, "kind");
        if (!keyframes.setKind(kind)) return;
        if (kind.isInteger()) method = InterpolationMethod.LINEAR;
        tangents.discard();
    }

    public InterpolationMethod getMethod() { return method; }

    /** Sets the interpolation method. Integer kinds silently stay {@link InterpolationMethod#LINEAR}. */
    public void setMethod(InterpolationMethod method) {
        Objects.requireNonNull(method, "method");
        if (getKind().isInteger()) method = InterpolationMethod.LINEAR;
        if (method == this.method) return;
        this.method = method;
        tangents.markDirty();
    }

    public float getTension() { return tension; }

    /** Sets the spline tension. Tangents are recomputed on the next spline sample. */
    public void setTension(float tension) {
        this.tension = tension;
        tangents.markDirty();
    }

    /** Identifier of the owning clip, or {@code null}. */
    public String getOwner() { return owner; }

    public void setOwner(String owner) { this.owner = owner; }

    /** Whether the current kind has any interpolation arithmetic. */
    public boolean isInterpolatable() { return getKind().supportsLinear(); }

    // ── Keyframes ─────────────────────────────────────────────────────────────

    /**
     * Inserts a keyframe, keeping time order.
     *
     * @return {@code false} if {@code value}'s kind differs from the curve's fixed kind or
     *         {@code time} is not finite; the curve is unchanged in that case
     */
    public boolean insertKeyframe(float time, Value value) {
        Objects.requireNonNull(value, "value");
        if (!keyframes.insert(time, value)) {
            if (logErrors)
                System.err.println("[Curve] Rejected " + value.getKind() + " keyframe at t=" + time
                    + " on " + getKind() + " curve");
            return false;
        }
        if (getKind().isInteger()) method = InterpolationMethod.LINEAR;
        tangents.markDirty();
        return true;
    }

    /** Whether the curve has enough keyframes for its current method. */
    public boolean isValid() { return keyframes.isValid(method); }

    public int getNumKeyframes()          { return keyframes.size(); }
    public List<Keyframe> getKeyframes()  { return keyframes.getKeyframes(); }
    public float getBeginTime()           { return keyframes.getBeginTime(); }
    public float getEndTime()             { return keyframes.getEndTime(); }

    /** Tangent cache, exposed for inspection. */
    public TangentCache getTangents()     { return tangents; }

    // ── Events ────────────────────────────────────────────────────────────────

    /**
     * Inserts an event frame carrying a read-only copy of {@code data}.
     *
     * @return {@code false} if {@code time} is not finite
     */
    public boolean insertEvent(float time, StringHash eventId, EventData data) {
        if (events.insert(time, Objects.requireNonNull(eventId, "eventId"), Objects.requireNonNull(data, "data")))
            return true;
        if (logErrors)
            System.err.println("[Curve] Rejected " + eventId + " event at t=" + time);
        return false;
    }

    /** Events with {@code begin <= time < end}, in time order. */
    public List<EventFrame> queryEvents(float begin, float end) {
        return events.query(begin, end);
    }

    public List<EventFrame> getEventFrames() { return events.getFrames(); }

    public void clearEvents() { events.clear(); }

    // ── Sampling ──────────────────────────────────────────────────────────────

    /**
     * Returns the curve's value at {@code time}, clamped to the first/last keyframe outside the
     * keyed range.
     *
     * @return the sampled value, or {@link Value#EMPTY} if the curve is empty or the kind/method
     *         combination cannot be interpolated
     */
    public Value sample(float time) {
        return engine.sample(keyframes, method, tangents, tension, time);
    }

    // ── Bulk replacement ──────────────────────────────────────────────────────

    /**
     * Replaces this curve's kind, method, tension, keyframes and events with {@code staged}'s.
     * Used to swap in a fully loaded curve in one step. The owner is kept.
     */
    public void assign(Curve staged) {
        keyframes.copyFrom(staged.keyframes);
        events.copyFrom(staged.events);
        method  = staged.method;
        tension = staged.tension;
        tangents.discard();
    }
}
