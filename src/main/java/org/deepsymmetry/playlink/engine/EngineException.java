package org.deepsymmetry.playlink.engine;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.PlaybackException;

/**
 * Thrown when an {@link AudioEngine} cannot play a track, because its format is not supported, it cannot be read,
 * or no audio output is available.
 */
@API(status = API.Status.STABLE)
public class EngineException extends PlaybackException {

    @API(status = API.Status.STABLE)
    public EngineException(String message) {
        super(message);
    }

    @API(status = API.Status.STABLE)
    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
