package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;

/**
 * The operations a {@link Source} can declare support for. Commands a source has not declared are never sent to it.
 */
@API(status = API.Status.STABLE)
public enum Capability {
    PLAY,
    PAUSE,
    STOP,
    NEXT,
    PREV,
    SET_VOLUME,
    /**
     * The source can report what it is playing through {@link Source#getCurrentPlayback()}.
     */
    QUERY_PLAYBACK,
    /**
     * The source wants {@link Source#shutdown()} called when it is disabled or the system shuts down.
     */
    SHUTDOWN
}
