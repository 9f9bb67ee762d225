package com.animcurve.timeline;

import com.animcurve.curve.Curve;
import com.animcurve.event.EventData;
import com.animcurve.event.EventFrame;
import com.animcurve.event.StringHash;
import com.animcurve.value.Value;
import com.animcurve.value.ValueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CurveTimelineTest {

    /** Records every attribute write. */
    private static final class Light implements Animatable {
        static final AttributeInfo INTENSITY = new AttributeInfo("intensity", ValueKind.FLOAT);
        static final AttributeInfo POSITION  = new AttributeInfo("position", ValueKind.VECTOR3);

        final Map<AttributeInfo, Value> current = new HashMap<>();
        final List<String> writes = new ArrayList<>();

        @Override public AttributeInfo[] getAnimatableAttributes() { return new AttributeInfo[] { INTENSITY, POSITION }; }

        @Override public Value getAttribute(AttributeInfo attribute) {
            return current.getOrDefault(attribute, Value.EMPTY);
        }

        @Override public void onSetAttribute(AttributeInfo attribute, Value value) {
            current.put(attribute, value);
            writes.add(attribute.name);
        }
    }

    private CurveRegistry registry;
    private CurveTimeline timeline;
    private Light light;

    @BeforeEach
    void setUp() {
        registry = new CurveRegistry();
        timeline = new CurveTimeline("flicker", registry);
        light    = new Light();
    }

    private Curve ramp(String id) {
        Curve curve = new Curve();
        curve.insertKeyframe(0f, Value.of(0f));
        curve.insertKeyframe(2f, Value.of(1f));
        registry.register(id, curve);
        return curve;
    }

    @Test
    void applyWritesEachBoundAttributeOnce() {
        ramp("intensity");
        Curve pos = new Curve();
        pos.insertKeyframe(0f, Value.vector3(0f, 0f, 0f));
        pos.insertKeyframe(1f, Value.vector3(2f, 0f, 0f));
        registry.register("pos", pos);

        timeline.bind(light, Light.INTENSITY, "intensity");
        timeline.bind(light, Light.POSITION, "pos");

        assertEquals(2, timeline.apply(1f));
        assertEquals(List.of("intensity", "position"), light.writes);
        assertEquals(0.5f, light.current.get(Light.INTENSITY).getFloat());
        assertEquals(Value.vector3(2f, 0f, 0f), light.current.get(Light.POSITION));
    }

    @Test
    void bindingIsUniquePerTargetAndAttribute() {
        ramp("a");
        ramp("b");
        CurveBinding first = timeline.bind(light, Light.INTENSITY, "a");
        assertSame(first, timeline.bind(light, Light.INTENSITY, "b"));
        assertEquals(1, timeline.getBindings().size());

        timeline.unbind(first);
        assertNull(timeline.findBinding(light, Light.INTENSITY));
    }

    @Test
    void bindingRecordsOwnerWithoutReplacingExistingOne() {
        Curve unowned = ramp("free");
        Curve owned   = ramp("taken");
        owned.setOwner("other-clip");

        timeline.bind(light, Light.INTENSITY, "free");
        timeline.bind(light, Light.POSITION, "taken");
        assertEquals("flicker", unowned.getOwner());
        assertEquals("other-clip", owned.getOwner());
    }

    @Test
    void unusableCurvesAreSkipped() {
        timeline.bind(light, Light.INTENSITY, "missing");
        assertEquals(0, timeline.apply(0.5f));

        Curve single = new Curve();
        single.insertKeyframe(0f, Value.of(3f));
        registry.register("missing", single);
        assertEquals(0, timeline.apply(0.5f));

        Curve wrongKind = new Curve();
        wrongKind.insertKeyframe(0f, Value.of(3f));
        wrongKind.insertKeyframe(1f, Value.of(4f));
        registry.register("pos", wrongKind);
        timeline.bind(light, Light.POSITION, "pos");
        assertEquals(0, timeline.apply(0.5f));

        assertTrue(light.writes.isEmpty());
    }

    @Test
    void removingCurveFromRegistryDetachesIt() {
        ramp("intensity");
        timeline.bind(light, Light.INTENSITY, "intensity");
        assertEquals(1, timeline.apply(1f));

        registry.remove("intensity");
        assertEquals(0, timeline.apply(1f));
    }

    @Test
    void dispatchEventsForwardsWindow() {
        Curve curve = ramp("intensity");
        curve.insertEvent(0.5f, StringHash.of("Spark"), new EventData().put("n", 1));
        curve.insertEvent(1.5f, StringHash.of("Spark"), new EventData().put("n", 2));
        timeline.bind(light, Light.INTENSITY, "intensity");

        List<EventFrame> seen = new ArrayList<>();
        timeline.dispatchEvents(0f, 1f, (target, frame) -> {
            assertSame(light, target);
            seen.add(frame);
        });
        timeline.dispatchEvents(1f, 2f, (target, frame) -> seen.add(frame));

        assertEquals(2, seen.size());
        assertEquals(1, seen.get(0).data.getInt("n", 0));
        assertEquals(2, seen.get(1).data.getInt("n", 0));
    }

    @Test
    void captureKeyframeCreatesAndFillsCurve() {
        CurveBinding binding = timeline.bind(light, Light.INTENSITY, "captured");
        assertFalse(timeline.captureKeyframe(binding, 0f));

        light.current.put(Light.INTENSITY, Value.of(0.2f));
        assertTrue(timeline.captureKeyframe(binding, 0f));
        light.current.put(Light.INTENSITY, Value.of(0.8f));
        assertTrue(timeline.captureKeyframe(binding, 1f));

        Curve curve = registry.get("captured");
        assertNotNull(curve);
        assertEquals("flicker", curve.getOwner());
        assertEquals(ValueKind.FLOAT, curve.getKind());
        assertEquals(2, curve.getNumKeyframes());
        assertTrue(curve.isValid());
    }

    @Test
    void registryReplacesAndLists() {
        Curve a = ramp("x");
        Curve b = new Curve();
        assertSame(a, registry.register("x", b));
        assertSame(b, registry.get("x"));
        assertTrue(registry.contains("x"));
        assertEquals(1, registry.size());
        assertTrue(registry.ids().contains("x"));
    }
}
