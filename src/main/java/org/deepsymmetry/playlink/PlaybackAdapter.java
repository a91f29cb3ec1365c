package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * <p>An abstract adapter class for receiving typed playback updates.
 * The methods in this class are empty; it exists as a convenience for creating listener objects.</p>
 *
 * <p>Extend this class to create a {@link PlaybackListener} and override only the methods for events that you
 * care about. If you plan to implement all the methods in the interface, you might as well implement
 * {@link PlaybackListener} directly.</p>
 */
@API(status = API.Status.STABLE)
public abstract class PlaybackAdapter implements PlaybackListener {
    @Override
    public void stateChanged(StateChangeEvent event) {

    }

    @Override
    public void sourceChanged(SourceChangeEvent event) {

    }

    @Override
    public void trackChanged(TrackChangeEvent event) {

    }

    @Override
    public void positionChanged(PositionChangeEvent event) {

    }

    @Override
    public void volumeChanged(VolumeChangeEvent event) {

    }
}
