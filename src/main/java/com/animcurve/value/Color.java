package com.animcurve.value;

/**
 * Immutable RGBA colour with float channels. Channels are not clamped, so intermediate
 * spline results may leave the [0, 1] range.
 */
public final class Color {

    public static final Color BLACK = new Color(0f, 0f, 0f, 0f);

    public final float r, g, b, a;

    public Color(float r, float g, float b, float a) {
        this.r = r;
        this.g = g;
        this.b = b;
        this.a = a;
    }

    public Color(float r, float g, float b) {
        this(r, g, b, 1f);
    }

    public Color add(Color o)      { return new Color(r + o.r, g + o.g, b + o.b, a + o.a); }
    public Color sub(Color o)      { return new Color(r - o.r, g - o.g, b - o.b, a - o.a); }
    public Color mul(float s)      { return new Color(r * s, g * s, b * s, a * s); }

    public Color lerp(Color o, float t) {
        return new Color(r + (o.r - r) * t, g + (o.g - g) * t,
                         b + (o.b - b) * t, a + (o.a - a) * t);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Color)) return false;
        Color o = (Color) obj;
        return Float.compare(r, o.r) == 0 && Float.compare(g, o.g) == 0
            && Float.compare(b, o.b) == 0 && Float.compare(a, o.a) == 0;
    }

    @Override
    public int hashCode() {
        int h = Float.floatToIntBits(r);
        h = 31 * h + Float.floatToIntBits(g);
        h = 31 * h + Float.floatToIntBits(b);
        return 31 * h + Float.floatToIntBits(a);
    }

    @Override
    public String toString() {
        return "Color(" + r + ", " + g + ", " + b + ", " + a + ")";
    }
}
