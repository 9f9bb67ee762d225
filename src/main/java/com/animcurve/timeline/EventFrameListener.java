package com.animcurve.timeline;

import com.animcurve.event.EventFrame;

/** Receives event frames crossed by {@link CurveTimeline#dispatchEvents}. */
@FunctionalInterface
public interface EventFrameListener {
    void onEventFrame(Animatable target, EventFrame frame);
}
