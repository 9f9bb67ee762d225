package com.animcurve.timeline;

import com.animcurve.curve.Curve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Identifier-keyed lookup of curves. Clips and bindings hold ids, never curve references, so a
 * curve's lifetime is independent of any clip that uses it.
 */
public final class CurveRegistry {

    private final Map<String, Curve> curves = new LinkedHashMap<>();

    /**
     * Registers {@code curve} under {@code id}, replacing any previous entry.
     *
     * @return the curve previously registered under {@code id}, or {@code null}
     */
    public Curve register(String id, Curve curve) {
        return curves.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(curve, "curve"));
    }

    /** Returns the curve registered under {@code id}, or {@code null}. */
    public Curve get(String id)          { return curves.get(id); }

    public boolean contains(String id)   { return curves.containsKey(id); }

    public Curve remove(String id)       { return curves.remove(id); }

    public Set<String> ids()             { return Collections.unmodifiableSet(curves.keySet()); }

    public int size()                    { return curves.size(); }
}
