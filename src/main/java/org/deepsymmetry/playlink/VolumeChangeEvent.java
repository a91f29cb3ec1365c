package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * Reports that the playback volume was changed.
 */
@API(status = API.Status.STABLE)
public class VolumeChangeEvent extends PlaybackEvent {

    /**
     * The volume level before the change, from 0 to 100.
     */
    @API(status = API.Status.STABLE)
    public final int previousVolume;

    /**
     * The volume level now in effect, from 0 to 100.
     */
    @API(status = API.Status.STABLE)
    public final int newVolume;

    /**
     * Create an event describing a volume change.
     *
     * @param previousVolume the former volume level
     * @param newVolume the new volume level
     */
    @API(status = API.Status.STABLE)
    public VolumeChangeEvent(int previousVolume, int newVolume) {
        this.previousVolume = previousVolume;
        this.newVolume = newVolume;
    }

    @Override
    public EventType getType() {
        return EventType.VOLUME_CHANGED;
    }

    @Override
    public void deliverTo(PlaybackListener listener) {
        listener.volumeChanged(this);
    }

    @Override
    public String toString() {
        return "VolumeChangeEvent[previousVolume:" + previousVolume + ", newVolume:" + newVolume + "]";
    }
}
