package com.animcurve.value;

import org.joml.Quaternionf;
import org.joml.Quaternionfc;
import org.joml.Vector2f;
import org.joml.Vector2fc;
import org.joml.Vector2i;
import org.joml.Vector2ic;
import org.joml.Vector3f;
import org.joml.Vector3fc;
import org.joml.Vector4f;
import org.joml.Vector4fc;
import org.joml.primitives.Rectanglei;

import java.util.Objects;

/**
 * Immutable tagged union over the animatable value kinds.
 *
 * <p>A value carries exactly one payload whose Java type is fixed by its {@link ValueKind}:</p>
 * <ul>
 *   <li>{@code FLOAT}       — {@code Float}</li>
 *   <li>{@code VECTOR2..4}  — JOML {@code Vector2f}, {@code Vector3f}, {@code Vector4f}</li>
 *   <li>{@code ROTATION}    — JOML {@code Quaternionf}</li>
 *   <li>{@code COLOR}       — {@link Color}</li>
 *   <li>{@code INT_RECT}    — JOML-primitives {@code Rectanglei} (left/top = min, right/bottom = max)</li>
 *   <li>{@code INT_VECTOR2} — JOML {@code Vector2i}</li>
 * </ul>
 *
 * <p>Mutable JOML payloads are copied on the way in and on the way out, so a {@code Value}
 * can be shared freely between keyframes, caches and sinks.</p>
 *
 * <p>{@link #EMPTY} is the "no value" sentinel returned when sampling fails. Sinks must treat
 * it as "skip this update".</p>
 */
public final class Value {

    public static final Value EMPTY = new Value(ValueKind.UNSET, null);

    private final ValueKind kind;
    private final Object    payload;

    private Value(ValueKind kind, Object payload) {
        this.kind    = kind;
        this.payload = payload;
    }

    // ── Factories ─────────────────────────────────────────────────────────────

    public static Value of(float f)          { return new Value(ValueKind.FLOAT, f); }
    public static Value of(Vector2fc v)      { return new Value(ValueKind.VECTOR2, new Vector2f(v)); }
    public static Value of(Vector3fc v)      { return new Value(ValueKind.VECTOR3, new Vector3f(v)); }
    public static Value of(Vector4fc v)      { return new Value(ValueKind.VECTOR4, new Vector4f(v)); }
    public static Value of(Quaternionfc q)   { return new Value(ValueKind.ROTATION, new Quaternionf(q)); }
    public static Value of(Color c)          { return new Value(ValueKind.COLOR, Objects.requireNonNull(c)); }
    public static Value of(Vector2ic v)      { return new Value(ValueKind.INT_VECTOR2, new Vector2i(v)); }

    public static Value of(Rectanglei r) {
        return new Value(ValueKind.INT_RECT, new Rectanglei(r.minX, r.minY, r.maxX, r.maxY));
    }

    public static Value vector2(float x, float y)                   { return of(new Vector2f(x, y)); }
    public static Value vector3(float x, float y, float z)          { return of(new Vector3f(x, y, z)); }
    public static Value vector4(float x, float y, float z, float w) { return of(new Vector4f(x, y, z, w)); }
    public static Value intVector2(int x, int y)                    { return of(new Vector2i(x, y)); }

    public static Value intRect(int left, int top, int right, int bottom) {
        return of(new Rectanglei(left, top, right, bottom));
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    public ValueKind getKind() { return kind; }

    public boolean isEmpty()   { return kind == ValueKind.UNSET; }

    public float getFloat()              { return (Float) require(ValueKind.FLOAT); }
    public Vector2f getVector2()         { return new Vector2f((Vector2f) require(ValueKind.VECTOR2)); }
    public Vector3f getVector3()         { return new Vector3f((Vector3f) require(ValueKind.VECTOR3)); }
    public Vector4f getVector4()         { return new Vector4f((Vector4f) require(ValueKind.VECTOR4)); }
    public Quaternionf getRotation()     { return new Quaternionf((Quaternionf) require(ValueKind.ROTATION)); }
    public Color getColor()              { return (Color) require(ValueKind.COLOR); }
    public Vector2i getIntVector2()      { return new Vector2i((Vector2i) require(ValueKind.INT_VECTOR2)); }

    public Rectanglei getIntRect() {
        Rectanglei r = (Rectanglei) require(ValueKind.INT_RECT);
        return new Rectanglei(r.minX, r.minY, r.maxX, r.maxY);
    }

    /** Package-private view of the payload for {@link ValueMath}; never exposed mutably. */
    Object payload() { return payload; }

    private Object require(ValueKind expected) {
        if (kind != expected)
            throw new IllegalStateException("Value is " + kind + ", not " + expected);
        return payload;
    }

    // ── Text encoding ─────────────────────────────────────────────────────────

    /**
     * Space-separated component list, e.g. {@code "1.0 2.0 3.0"} for a vector.
     * Floats use {@link Float#toString(float)} so {@link #parse} restores them exactly.
     */
    public String toValueString() {
        return switch (kind) {
            case FLOAT       -> Float.toString((Float) payload);
            case VECTOR2     -> { Vector2f v = (Vector2f) payload; yield join(v.x, v.y); }
            case VECTOR3     -> { Vector3f v = (Vector3f) payload; yield join(v.x, v.y, v.z); }
            case VECTOR4     -> { Vector4f v = (Vector4f) payload; yield join(v.x, v.y, v.z, v.w); }
            case ROTATION    -> { Quaternionf q = (Quaternionf) payload; yield join(q.w, q.x, q.y, q.z); }
            case COLOR       -> { Color c = (Color) payload; yield join(c.r, c.g, c.b, c.a); }
            case INT_RECT    -> { Rectanglei r = (Rectanglei) payload; yield r.minX + " " + r.minY + " " + r.maxX + " " + r.maxY; }
            case INT_VECTOR2 -> { Vector2i v = (Vector2i) payload; yield v.x + " " + v.y; }
            case UNSET       -> "";
        };
    }

    /**
     * Parses the output of {@link #toValueString()} for the given kind.
     * Rotations are written {@code w x y z}.
     *
     * @throws IllegalArgumentException if the component count is wrong or a number is malformed
     */
    public static Value parse(ValueKind kind, String text) {
        String[] p = text.trim().split("\\s+");
        expect(p, componentCount(kind), kind);
        return switch (kind) {
            case FLOAT       -> of(f(p[0]));
            case VECTOR2     -> vector2(f(p[0]), f(p[1]));
            case VECTOR3     -> vector3(f(p[0]), f(p[1]), f(p[2]));
            case VECTOR4     -> vector4(f(p[0]), f(p[1]), f(p[2]), f(p[3]));
            case ROTATION    -> of(new Quaternionf(f(p[1]), f(p[2]), f(p[3]), f(p[0])));
            case COLOR       -> of(new Color(f(p[0]), f(p[1]), f(p[2]), f(p[3])));
            case INT_RECT    -> intRect(i(p[0]), i(p[1]), i(p[2]), i(p[3]));
            case INT_VECTOR2 -> intVector2(i(p[0]), i(p[1]));
            case UNSET       -> throw new IllegalArgumentException("Cannot parse a value of kind " + kind);
        };
    }

    private static int componentCount(ValueKind kind) {
        return switch (kind) {
            case FLOAT                                  -> 1;
            case VECTOR2, INT_VECTOR2                   -> 2;
            case VECTOR3                                -> 3;
            case VECTOR4, ROTATION, COLOR, INT_RECT     -> 4;
            case UNSET                                  -> 0;
        };
    }

    private static void expect(String[] parts, int n, ValueKind kind) {
        if (parts.length != n)
            throw new IllegalArgumentException(kind.typeName + " needs " + n
                + " components, got " + parts.length);
    }

    private static float f(String s) { return Float.parseFloat(s); }
    private static int   i(String s) { return Integer.parseInt(s); }

    private static String join(float... comps) {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < comps.length; k++) {
            if (k > 0) sb.append(' ');
            sb.append(Float.toString(comps[k]));
        }
        return sb.toString();
    }

    // ── Object ────────────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Value)) return false;
        Value o = (Value) obj;
        if (kind != o.kind) return false;
        if (kind == ValueKind.UNSET) return true;
        if (kind == ValueKind.INT_RECT) {
            Rectanglei a = (Rectanglei) payload, b = (Rectanglei) o.payload;
            return a.minX == b.minX && a.minY == b.minY && a.maxX == b.maxX && a.maxY == b.maxY;
        }
        return payload.equals(o.payload);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + toValueString().hashCode();
    }

    @Override
    public String toString() {
        return isEmpty() ? "Value.EMPTY" : kind.typeName + "(" + toValueString() + ")";
    }
}
