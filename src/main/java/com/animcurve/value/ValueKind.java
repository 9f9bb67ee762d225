package com.animcurve.value;

/**
 * Discriminant of the {@link Value} union.
 *
 * <p>Each kind states up front which interpolation arithmetic it supports, so the sampler can
 * detect an unsupported kind/method combination without inspecting payload types.</p>
 */
public enum ValueKind {
    FLOAT      ("Float",      true,  true,  false),
    VECTOR2    ("Vector2",    true,  true,  false),
    VECTOR3    ("Vector3",    true,  true,  false),
    VECTOR4    ("Vector4",    true,  true,  false),
    /** Unit quaternion. Blended spherically; has no additive spline arithmetic. */
    ROTATION   ("Quaternion", true,  false, false),
    COLOR      ("Color",      true,  true,  false),
    /** Integer rectangle, always interpolated linearly with truncation. */
    INT_RECT   ("IntRect",    true,  false, true),
    INT_VECTOR2("IntVector2", true,  false, true),
    /** No keyframe has fixed the kind yet. */
    UNSET      ("None",       false, false, false);

    /** Name used in the persisted format. */
    public final String typeName;

    private final boolean linear;
    private final boolean spline;
    private final boolean integer;

    ValueKind(String typeName, boolean linear, boolean spline, boolean integer) {
        this.typeName = typeName;
        this.linear   = linear;
        this.spline   = spline;
        this.integer  = integer;
    }

    public boolean supportsLinear() { return linear; }
    public boolean supportsSpline() { return spline; }

    /** Integer kinds are restricted to linear interpolation. */
    public boolean isInteger()      { return integer; }

    /** Returns the kind persisted under {@code typeName}, or {@code null} if none matches. */
    public static ValueKind fromTypeName(String typeName) {
        for (ValueKind k : values())
            if (k != UNSET && k.typeName.equalsIgnoreCase(typeName)) return k;
        return null;
    }
}
