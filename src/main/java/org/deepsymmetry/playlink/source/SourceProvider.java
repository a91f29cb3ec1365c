package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.PlaybackCallback;

/**
 * The service interface through which sources are discovered. Implementations are listed in
 * {@code META-INF/services/org.deepsymmetry.playlink.source.SourceProvider} and found by
 * {@link SourceRegistry#scan()}, or added directly with {@link SourceRegistry#addProvider(SourceProvider)}.
 * Providers must have a public no-argument constructor, and should do no real work until
 * {@link #createSource(PlaybackCallback)} is called.
 */
@API(status = API.Status.STABLE)
public interface SourceProvider {

    /**
     * Get the name of the source this provider creates.
     *
     * @return the source name, which must match the name of the sources it creates
     */
    @API(status = API.Status.STABLE)
    String getName();

    /**
     * Create the source. Called when the source is enabled.
     *
     * @param callback how the new source can report on and claim playback
     *
     * @return the new source
     */
    @API(status = API.Status.STABLE)
    Source createSource(PlaybackCallback callback);
}
