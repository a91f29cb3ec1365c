package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;

/**
 * An action to be performed on a source once it has been made the active one.
 *
 * @see org.deepsymmetry.playlink.PlaybackOrchestrator#runExclusive(String, SourceCommand)
 */
@API(status = API.Status.STABLE)
@FunctionalInterface
public interface SourceCommand {

    /**
     * Perform the action.
     *
     * @param handle the source, which is now active
     *
     * @return {@code true} if the action succeeded
     */
    boolean execute(SourceHandle handle);
}
