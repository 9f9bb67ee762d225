package com.animcurve.value;

import org.joml.Quaternionf;
import org.joml.Vector2f;
import org.joml.Vector2i;
import org.joml.Vector3f;
import org.joml.Vector4f;
import org.joml.primitives.Rectanglei;

/**
 * Per-kind arithmetic table for {@link Value}.
 *
 * <p>Every operation switches exhaustively over {@link ValueKind}. Where an operation has no
 * meaning for a kind (additive arithmetic on rotations, spline arithmetic on integer kinds) or the
 * operands disagree in kind, the result is {@link Value#EMPTY}. Nothing here throws.</p>
 */
public final class ValueMath {

    private ValueMath() {} // utility class

    // ── Additive arithmetic ───────────────────────────────────────────────────

    public static Value add(Value a, Value b) {
        if (!sameKind(a, b)) return Value.EMPTY;
        return switch (a.getKind()) {
            case FLOAT       -> Value.of(a.getFloat() + b.getFloat());
            case VECTOR2     -> Value.of(v2(a).add(v2(b), new Vector2f()));
            case VECTOR3     -> Value.of(v3(a).add(v3(b), new Vector3f()));
            case VECTOR4     -> Value.of(v4(a).add(v4(b), new Vector4f()));
            case COLOR       -> Value.of(a.getColor().add(b.getColor()));
            case INT_VECTOR2 -> Value.of(iv2(a).add(iv2(b), new Vector2i()));
            case INT_RECT    -> {
                Rectanglei r1 = rect(a), r2 = rect(b);
                yield Value.intRect(r1.minX + r2.minX, r1.minY + r2.minY, r1.maxX + r2.maxX, r1.maxY + r2.maxY);
            }
            case ROTATION, UNSET -> Value.EMPTY;
        };
    }

    public static Value subtract(Value a, Value b) {
        if (!sameKind(a, b)) return Value.EMPTY;
        return switch (a.getKind()) {
            case FLOAT       -> Value.of(a.getFloat() - b.getFloat());
            case VECTOR2     -> Value.of(v2(a).sub(v2(b), new Vector2f()));
            case VECTOR3     -> Value.of(v3(a).sub(v3(b), new Vector3f()));
            case VECTOR4     -> Value.of(v4(a).sub(v4(b), new Vector4f()));
            case COLOR       -> Value.of(a.getColor().sub(b.getColor()));
            case INT_VECTOR2 -> Value.of(iv2(a).sub(iv2(b), new Vector2i()));
            case INT_RECT    -> {
                Rectanglei r1 = rect(a), r2 = rect(b);
                yield Value.intRect(r1.minX - r2.minX, r1.minY - r2.minY, r1.maxX - r2.maxX, r1.maxY - r2.maxY);
            }
            case ROTATION, UNSET -> Value.EMPTY;
        };
    }

    /** Multiplies every component by {@code s}; integer kinds truncate toward zero. */
    public static Value scale(Value a, float s) {
        return switch (a.getKind()) {
            case FLOAT       -> Value.of(a.getFloat() * s);
            case VECTOR2     -> Value.of(v2(a).mul(s, new Vector2f()));
            case VECTOR3     -> Value.of(v3(a).mul(s, new Vector3f()));
            case VECTOR4     -> Value.of(v4(a).mul(s, new Vector4f()));
            case COLOR       -> Value.of(a.getColor().mul(s));
            case INT_VECTOR2 -> { Vector2i v = iv2(a); yield Value.intVector2((int) (v.x * s), (int) (v.y * s)); }
            case INT_RECT    -> {
                Rectanglei r = rect(a);
                yield Value.intRect((int) (r.minX * s), (int) (r.minY * s), (int) (r.maxX * s), (int) (r.maxY * s));
            }
            case ROTATION, UNSET -> Value.EMPTY;
        };
    }

    /**
     * {@code (a - b) * s}, the finite-difference tangent term. Defined only for kinds with
     * spline arithmetic.
     */
    public static Value subtractAndScale(Value a, Value b, float s) {
        if (!sameKind(a, b) || !a.getKind().supportsSpline()) return Value.EMPTY;
        return scale(subtract(a, b), s);
    }

    // ── Interpolation ─────────────────────────────────────────────────────────

    /**
     * Blends {@code a} toward {@code b} by {@code t}. Rotations use spherical interpolation;
     * integer kinds blend in floating point and truncate each component.
     */
    public static Value lerp(Value a, Value b, float t) {
        if (!sameKind(a, b)) return Value.EMPTY;
        return switch (a.getKind()) {
            case FLOAT       -> Value.of(lerp(a.getFloat(), b.getFloat(), t));
            case VECTOR2     -> Value.of(v2(a).lerp(v2(b), t, new Vector2f()));
            case VECTOR3     -> Value.of(v3(a).lerp(v3(b), t, new Vector3f()));
            case VECTOR4     -> Value.of(v4(a).lerp(v4(b), t, new Vector4f()));
            case ROTATION    -> Value.of(rot(a).slerp(rot(b), t, new Quaternionf()));
            case COLOR       -> Value.of(a.getColor().lerp(b.getColor(), t));
            case INT_RECT    -> {
                float s = 1f - t;
                Rectanglei r1 = rect(a), r2 = rect(b);
                yield Value.intRect((int) (r1.minX * s + r2.minX * t), (int) (r1.minY * s + r2.minY * t),
                                    (int) (r1.maxX * s + r2.maxX * t), (int) (r1.maxY * s + r2.maxY * t));
            }
            case INT_VECTOR2 -> {
                float s = 1f - t;
                Vector2i v1 = iv2(a), v2 = iv2(b);
                yield Value.intVector2((int) (v1.x * s + v2.x * t), (int) (v1.y * s + v2.y * t));
            }
            case UNSET       -> Value.EMPTY;
        };
    }

    /**
     * Cubic Hermite combination {@code v1*h1 + v2*h2 + t1*h3 + t2*h4}, summed left to right.
     * Returns {@link Value#EMPTY} for kinds without spline arithmetic.
     */
    public static Value hermite(Value v1, Value v2, Value t1, Value t2,
                                float h1, float h2, float h3, float h4) {
        ValueKind kind = v1.getKind();
        if (!kind.supportsSpline() || v2.getKind() != kind
                || t1.getKind() != kind || t2.getKind() != kind)
            return Value.EMPTY;

        if (kind == ValueKind.FLOAT)
            return Value.of(v1.getFloat() * h1 + v2.getFloat() * h2
                          + t1.getFloat() * h3 + t2.getFloat() * h4);

        Value sum = add(scale(v1, h1), scale(v2, h2));
        sum = add(sum, scale(t1, h3));
        return add(sum, scale(t2, h4));
    }

    /** The additive identity for {@code kind}, or {@link Value#EMPTY} if the kind has none. */
    public static Value zero(ValueKind kind) {
        return switch (kind) {
            case FLOAT       -> Value.of(0f);
            case VECTOR2     -> Value.vector2(0f, 0f);
            case VECTOR3     -> Value.vector3(0f, 0f, 0f);
            case VECTOR4     -> Value.vector4(0f, 0f, 0f, 0f);
            case COLOR       -> Value.of(Color.BLACK);
            case INT_RECT    -> Value.intRect(0, 0, 0, 0);
            case INT_VECTOR2 -> Value.intVector2(0, 0);
            case ROTATION, UNSET -> Value.EMPTY;
        };
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static float lerp(float a, float b, float t) { return a + (b - a) * t; }

    private static boolean sameKind(Value a, Value b) {
        return a.getKind() == b.getKind() && !a.isEmpty();
    }

    // Payload views without the defensive copy; results are always written to a new destination.
    private static Vector2f    v2(Value v)   { return (Vector2f) v.payload(); }
    private static Vector3f    v3(Value v)   { return (Vector3f) v.payload(); }
    private static Vector4f    v4(Value v)   { return (Vector4f) v.payload(); }
    private static Quaternionf rot(Value v)  { return (Quaternionf) v.payload(); }
    private static Vector2i    iv2(Value v)  { return (Vector2i) v.payload(); }
    private static Rectanglei  rect(Value v) { return (Rectanglei) v.payload(); }
}
