package com.animcurve.value;

import org.joml.Quaternionf;
import org.joml.Vector2i;
import org.joml.Vector3f;
import org.joml.primitives.Rectanglei;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueMathTest {

    private static final float EPS = 1e-6f;

    @Test
    void lerpFloatIsExactAtMidpoint() {
        assertEquals(5f, ValueMath.lerp(Value.of(0f), Value.of(10f), 0.5f).getFloat());
    }

    @Test
    void lerpVector3IsComponentWise() {
        Vector3f v = ValueMath.lerp(Value.vector3(0f, 2f, -4f), Value.vector3(4f, 2f, 4f), 0.25f).getVector3();
        assertEquals(1f, v.x, EPS);
        assertEquals(2f, v.y, EPS);
        assertEquals(-2f, v.z, EPS);
    }

    @Test
    void lerpColorBlendsAlphaToo() {
        Color c = ValueMath.lerp(Value.of(new Color(0f, 0f, 0f, 0f)), Value.of(new Color(1f, 0.5f, 0f, 1f)), 0.5f).getColor();
        assertEquals(new Color(0.5f, 0.25f, 0f, 0.5f), c);
    }

    @Test
    void lerpRotationIsSpherical() {
        Quaternionf from = new Quaternionf();
        Quaternionf to   = new Quaternionf().rotateZ((float) Math.PI / 2);
        Quaternionf mid  = ValueMath.lerp(Value.of(from), Value.of(to), 0.5f).getRotation();
        Quaternionf expected = new Quaternionf().rotateZ((float) Math.PI / 4);

        assertEquals(expected.x, mid.x, 1e-5f);
        assertEquals(expected.y, mid.y, 1e-5f);
        assertEquals(expected.z, mid.z, 1e-5f);
        assertEquals(expected.w, mid.w, 1e-5f);
        assertEquals(1f, mid.lengthSquared(), 1e-5f);
    }

    @Test
    void lerpIntRectTruncatesEachComponent() {
        Rectanglei r = ValueMath.lerp(Value.intRect(0, 0, 10, 10), Value.intRect(5, 5, 15, 15), 0.25f).getIntRect();
        assertEquals(1, r.minX);
        assertEquals(1, r.minY);
        assertEquals(11, r.maxX);
        assertEquals(11, r.maxY);
    }

    @Test
    void lerpIntVector2TruncatesTowardZero() {
        Vector2i v = ValueMath.lerp(Value.intVector2(0, 0), Value.intVector2(-3, 3), 0.5f).getIntVector2();
        assertEquals(-1, v.x);
        assertEquals(1, v.y);
    }

    @Test
    void mismatchedKindsYieldEmpty() {
        assertTrue(ValueMath.lerp(Value.of(1f), Value.vector2(1f, 1f), 0.5f).isEmpty());
        assertTrue(ValueMath.add(Value.of(1f), Value.EMPTY).isEmpty());
        assertTrue(ValueMath.subtract(Value.EMPTY, Value.EMPTY).isEmpty());
    }

    @Test
    void rotationHasNoAdditiveArithmetic() {
        Value q = Value.of(new Quaternionf());
        assertTrue(ValueMath.add(q, q).isEmpty());
        assertTrue(ValueMath.subtract(q, q).isEmpty());
        assertTrue(ValueMath.scale(q, 2f).isEmpty());
        assertTrue(ValueMath.subtractAndScale(q, q, 0.5f).isEmpty());
        assertTrue(ValueMath.zero(ValueKind.ROTATION).isEmpty());
    }

    @Test
    void integerKindsHaveNoSplineArithmetic() {
        Value r = Value.intRect(1, 2, 3, 4);
        assertTrue(ValueMath.subtractAndScale(r, r, 0.5f).isEmpty());
        assertTrue(ValueMath.hermite(r, r, r, r, 1f, 0f, 0f, 0f).isEmpty());
        // plain additive arithmetic still works
        assertEquals(Value.intRect(2, 4, 6, 8), ValueMath.add(r, r));
    }

    @Test
    void subtractAndScaleProducesTangentTerm() {
        Value t = ValueMath.subtractAndScale(Value.vector3(4f, 2f, 0f), Value.vector3(0f, 0f, 2f), 0.5f);
        assertEquals(Value.vector3(2f, 1f, -1f), t);
    }

    @Test
    void hermiteCombinesVectorTerms() {
        Value v = ValueMath.hermite(Value.vector2(1f, 0f), Value.vector2(0f, 1f),
                                    Value.vector2(2f, 2f), Value.vector2(4f, 4f),
                                    0.5f, 0.5f, 0.25f, -0.25f);
        // 0.5 + 0 + 0.5 - 1 = 0 ; 0 + 0.5 + 0.5 - 1 = 0
        assertEquals(Value.vector2(0f, 0f), v);
    }

    @Test
    void zeroMatchesKind() {
        for (ValueKind k : ValueKind.values()) {
            Value z = ValueMath.zero(k);
            if (k == ValueKind.ROTATION || k == ValueKind.UNSET) assertTrue(z.isEmpty(), k.name());
            else assertEquals(k, z.getKind());
        }
    }
}
