package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * Reports that the current track changed, either because a new one was started or staged, or because a source
 * reported it had moved on to a different track.
 */
@API(status = API.Status.STABLE)
public class TrackChangeEvent extends PlaybackEvent {

    /**
     * The name of the track that was current before the change, or {@code null} if there was none.
     */
    @API(status = API.Status.STABLE)
    public final String previousTrack;

    /**
     * The name of the track that is now current, or {@code null} if there is none.
     */
    @API(status = API.Status.STABLE)
    public final String newTrack;

    /**
     * Create an event describing a track change.
     *
     * @param previousTrack the name of the former track, if any
     * @param newTrack the name of the new track, if any
     */
    @API(status = API.Status.STABLE)
    public TrackChangeEvent(String previousTrack, String newTrack) {
        this.previousTrack = previousTrack;
        this.newTrack = newTrack;
    }

    @Override
    public EventType getType() {
        return EventType.TRACK_CHANGED;
    }

    @Override
    public void deliverTo(PlaybackListener listener) {
        listener.trackChanged(this);
    }

    @Override
    public String toString() {
        return "TrackChangeEvent[previousTrack:" + previousTrack + ", newTrack:" + newTrack + "]";
    }
}
