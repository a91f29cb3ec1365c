package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * Identifies the kinds of playback events that can be subscribed to through the {@link EventBus}.
 */
@API(status = API.Status.STABLE)
public enum EventType {
    /**
     * The player state changed; delivered as a {@link StateChangeEvent}.
     */
    STATE_CHANGED,

    /**
     * A different source became active; delivered as a {@link SourceChangeEvent}.
     */
    SOURCE_CHANGED,

    /**
     * The current track changed; delivered as a {@link TrackChangeEvent}.
     */
    TRACK_CHANGED,

    /**
     * The playback position or track duration changed; delivered as a {@link PositionChangeEvent}.
     */
    POSITION_CHANGED,

    /**
     * The volume changed; delivered as a {@link VolumeChangeEvent}.
     */
    VOLUME_CHANGED
}
