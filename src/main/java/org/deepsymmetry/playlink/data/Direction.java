package org.deepsymmetry.playlink.data;

import org.apiguardian.api.API;

/**
 * The ways in which a {@link TrackNavigator} can move through a playlist.
 */
@API(status = API.Status.STABLE)
public enum Direction {
    /**
     * Move on to the following track, or to a random other track in shuffle mode.
     */
    NEXT,

    /**
     * Move back to the preceding track, or to the track that was playing before the last random pick in shuffle
     * mode.
     */
    PREVIOUS
}
