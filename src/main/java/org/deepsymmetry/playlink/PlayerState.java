package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * The transport states a player can be in. Exactly one of these is in effect for the active source at any moment.
 */
@API(status = API.Status.STABLE)
public enum PlayerState {
    /**
     * Nothing is loaded in the engine, or playback was stopped; this is the initial state.
     */
    STOPPED,

    /**
     * The engine is producing sound.
     */
    PLAYING,

    /**
     * A track is loaded but playback is suspended, and can be resumed where it left off.
     */
    PAUSED
}
