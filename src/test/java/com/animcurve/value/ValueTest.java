package com.animcurve.value;

import org.joml.Quaternionf;
import org.joml.Vector3f;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    @Test
    void payloadIsCopiedInAndOut() {
        Vector3f source = new Vector3f(1f, 2f, 3f);
        Value v = Value.of(source);
        source.x = 99f;
        v.getVector3().y = 99f;

        assertEquals(new Vector3f(1f, 2f, 3f), v.getVector3());
    }

    @Test
    void accessorForWrongKindThrows() {
        Value v = Value.of(1f);
        assertThrows(IllegalStateException.class, v::getVector2);
        assertThrows(IllegalStateException.class, Value.EMPTY::getFloat);
    }

    @Test
    void textEncodingRoundTripsExactly() {
        Value[] values = {
            Value.of(0.1f),
            Value.vector2(-1.5f, 1e-7f),
            Value.vector3(1f / 3f, 2f, -0f),
            Value.vector4(1f, 2f, 3f, 4f),
            Value.of(new Quaternionf().rotateXYZ(0.3f, -0.2f, 1.1f)),
            Value.of(new Color(0.2f, 0.4f, 0.6f, 0.8f)),
            Value.intRect(-4, 0, 640, 480),
            Value.intVector2(Integer.MIN_VALUE, 7)
        };
        for (Value v : values)
            assertEquals(v, Value.parse(v.getKind(), v.toValueString()), v.toString());
    }

    @Test
    void rotationIsWrittenWFirst() {
        assertEquals("1.0 0.0 0.0 0.0", Value.of(new Quaternionf()).toValueString());
    }

    @Test
    void parseRejectsWrongComponentCount() {
        assertThrows(IllegalArgumentException.class, () -> Value.parse(ValueKind.VECTOR3, "1 2"));
        assertThrows(IllegalArgumentException.class, () -> Value.parse(ValueKind.FLOAT, "abc"));
        assertThrows(IllegalArgumentException.class, () -> Value.parse(ValueKind.UNSET, ""));
    }

    @Test
    void kindLookupByTypeName() {
        assertEquals(ValueKind.ROTATION, ValueKind.fromTypeName("Quaternion"));
        assertEquals(ValueKind.INT_RECT, ValueKind.fromTypeName("intrect"));
        assertNull(ValueKind.fromTypeName("None"));
        assertNull(ValueKind.fromTypeName("Matrix3"));
    }

    @Test
    void emptyEqualsOnlyItself() {
        assertTrue(Value.EMPTY.isEmpty());
        assertNotEquals(Value.EMPTY, Value.of(0f));
        assertEquals(Value.intRect(1, 2, 3, 4), Value.intRect(1, 2, 3, 4));
        assertEquals(Value.intRect(1, 2, 3, 4).hashCode(), Value.intRect(1, 2, 3, 4).hashCode());
    }
}
