package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * Reports movement through the current track.
 */
@API(status = API.Status.STABLE)
public class PositionChangeEvent extends PlaybackEvent {

    /**
     * How far into the track playback has reached, in seconds.
     */
    @API(status = API.Status.STABLE)
    public final double position;

    /**
     * The length of the track in seconds, or zero when it is not known.
     */
    @API(status = API.Status.STABLE)
    public final double duration;

    /**
     * Create an event describing the playback position.
     *
     * @param position the elapsed time within the track, in seconds
     * @param duration the track length, in seconds
     */
    @API(status = API.Status.STABLE)
    public PositionChangeEvent(double position, double duration) {
        this.position = position;
        this.duration = duration;
    }

    @Override
    public EventType getType() {
        return EventType.POSITION_CHANGED;
    }

    @Override
    public void deliverTo(PlaybackListener listener) {
        listener.positionChanged(this);
    }

    @Override
    public String toString() {
        return "PositionChangeEvent[position:" + position + ", duration:" + duration + "]";
    }
}
