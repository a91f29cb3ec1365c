package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * <p>The listener interface for receiving typed updates about playback. Sources which implement this interface
 * are subscribed to every {@link EventType} when they are registered with the
 * {@link org.deepsymmetry.playlink.source.SourceRegistry}, and unsubscribed before they are unloaded.</p>
 *
 * <p>If you only care about some of these events, extend {@link PlaybackAdapter} instead.</p>
 *
 * <p>Each method is invoked on the delivery thread of the subscription, so it must return quickly and must not
 * assume it is running on any particular thread.</p>
 */
@API(status = API.Status.STABLE)
public interface PlaybackListener {

    /**
     * Invoked when the player changes between stopped, playing and paused.
     *
     * @param event describes the transition
     */
    @API(status = API.Status.STABLE)
    void stateChanged(StateChangeEvent event);

    /**
     * Invoked when a different source becomes the active one.
     *
     * @param event identifies the outgoing and incoming sources
     */
    @API(status = API.Status.STABLE)
    void sourceChanged(SourceChangeEvent event);

    /**
     * Invoked when the current track changes.
     *
     * @param event identifies the previous and new tracks
     */
    @API(status = API.Status.STABLE)
    void trackChanged(TrackChangeEvent event);

    /**
     * Invoked periodically as playback moves through a track.
     *
     * @param event the new position and the track duration
     */
    @API(status = API.Status.STABLE)
    void positionChanged(PositionChangeEvent event);

    /**
     * Invoked when the playback volume changes.
     *
     * @param event the previous and new volume levels
     */
    @API(status = API.Status.STABLE)
    void volumeChanged(VolumeChangeEvent event);
}
