package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.PlaybackException;

/**
 * Thrown when a source is asked for by name but nothing is loaded, or able to be loaded, under that name.
 */
@API(status = API.Status.STABLE)
public class SourceUnavailableException extends PlaybackException {

    /**
     * The name of the source that could not be found.
     */
    @API(status = API.Status.STABLE)
    public final String sourceName;

    /**
     * Report that a source is unavailable.
     *
     * @param sourceName the name that was asked for
     * @param message describes why it is unavailable
     */
    @API(status = API.Status.STABLE)
    public SourceUnavailableException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    /**
     * Report that a source could not be created.
     *
     * @param sourceName the name that was asked for
     * @param message describes why it is unavailable
     * @param cause the failure that prevented it from being created
     */
    @API(status = API.Status.STABLE)
    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }
}
