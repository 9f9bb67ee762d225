package com.animcurve.timeline;

import com.animcurve.value.ValueKind;

/** Describes one animatable attribute of an {@link Animatable}: its stable name and value kind. */
public final class AttributeInfo {

    public final String    name;
    public final ValueKind kind;

    public AttributeInfo(String name, ValueKind kind) {
        this.name = name;
        this.kind = kind;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AttributeInfo)) return false;
        AttributeInfo o = (AttributeInfo) obj;
        return name.equals(o.name) && kind == o.kind;
    }

    @Override
    public int hashCode() { return 31 * name.hashCode() + kind.hashCode(); }

    @Override
    public String toString() { return name + ":" + kind.typeName; }
}
