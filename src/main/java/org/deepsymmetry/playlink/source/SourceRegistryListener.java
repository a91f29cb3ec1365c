package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;

/**
 * Receives news about sources being loaded into and unloaded from a {@link SourceRegistry}. Unlike most listeners,
 * these are called synchronously on the thread that is changing the registry, so that unloading cannot continue
 * until everyone has let go of the source.
 */
@API(status = API.Status.STABLE)
public interface SourceRegistryListener {

    /**
     * Called after a source has been registered.
     *
     * @param handle the newly loaded source
     */
    @API(status = API.Status.STABLE)
    void sourceLoaded(SourceHandle handle);

    /**
     * Called when a source is about to be unloaded, while it is still loaded and able to respond to commands.
     *
     * @param sourceName the name of the source that is going away
     */
    @API(status = API.Status.STABLE)
    void sourceUnloading(String sourceName);
}
