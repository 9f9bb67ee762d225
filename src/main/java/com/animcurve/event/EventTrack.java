package com.animcurve.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Time-ordered {@link EventFrame}s. Uses the same ordering rule as keyframes: equal times keep
 * insertion order.
 */
public final class EventTrack {

    private final List<EventFrame> frames = new ArrayList<>();

    /**
     * Inserts a frame, storing a read-only copy of {@code data}.
     *
     * @return {@code false} if {@code time} is NaN or infinite; the track is left untouched
     */
    public boolean insert(float time, StringHash eventId, EventData data) {
        if (!Float.isFinite(time)) return false;
        EventFrame frame = new EventFrame(time, eventId, EventData.readOnlyCopy(data));
        int n = frames.size();
        if (n == 0 || time >= frames.get(n - 1).time) {
            frames.add(frame);
            return true;
        }
        int i = 0;
        while (time >= frames.get(i).time) i++;
        frames.add(i, frame);
        return true;
    }

    /**
     * Returns every frame with {@code begin <= time < end}, in time order.
     * The scan stops at the first frame at or past {@code end}.
     */
    public List<EventFrame> query(float begin, float end) {
        List<EventFrame> out = new ArrayList<>();
        for (EventFrame f : frames) {
            if (f.time >= end) break;
            if (f.time >= begin) out.add(f);
        }
        return out;
    }

    public void clear()                  { frames.clear(); }
    public int size()                    { return frames.size(); }
    public EventFrame get(int index)     { return frames.get(index); }
    public List<EventFrame> getFrames()  { return Collections.unmodifiableList(frames); }

    /** Replaces this track's contents with copies of {@code other}'s frames. */
    public void copyFrom(EventTrack other) {
        frames.clear();
        for (EventFrame f : other.frames)
            frames.add(new EventFrame(f.time, f.eventId, EventData.readOnlyCopy(f.data)));
    }
}
