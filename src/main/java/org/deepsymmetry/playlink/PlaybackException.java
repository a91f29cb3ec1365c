package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * The superclass of the checked exceptions that report a failure to play something, either because the engine
 * could not handle a track or because a source could not be found.
 */
@API(status = API.Status.STABLE)
public class PlaybackException extends Exception {

    /**
     * Report a playback failure.
     *
     * @param message describes what went wrong
     */
    @API(status = API.Status.STABLE)
    public PlaybackException(String message) {
        super(message);
    }

    /**
     * Report a playback failure that was caused by another exception.
     *
     * @param message describes what went wrong
     * @param cause the underlying problem
     */
    @API(status = API.Status.STABLE)
    public PlaybackException(String message, Throwable cause) {
        super(message, cause);
    }
}
