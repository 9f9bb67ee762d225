package com.animcurve.event;

/** A discrete marker on the timeline: an event id plus its payload. */
public final class EventFrame {

    public final float      time;
    public final StringHash eventId;
    public final EventData  data;

    public EventFrame(float time, StringHash eventId, EventData data) {
        this.time    = time;
        this.eventId = eventId;
        this.data    = data;
    }

    @Override
    public String toString() {
        return "EventFrame(" + time + ", " + eventId + ", " + data + ")";
    }
}
