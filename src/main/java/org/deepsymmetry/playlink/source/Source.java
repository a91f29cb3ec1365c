package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;

import java.util.List;
import java.util.Set;

/**
 * <p>Something that can produce sound: the local engine, or a remote or streaming service reached through a
 * plugin. Every source is controlled through the same transport commands, but only the ones named in
 * {@link #getCapabilities()} will ever be called.</p>
 *
 * <p>Commands take the arguments typed by the user, which each source interprets in its own way. They return
 * {@code true} when the command was carried out.</p>
 *
 * <p>A source that also implements {@link org.deepsymmetry.playlink.PlaybackListener} is told about every playback
 * event while it is loaded.</p>
 *
 * @see AbstractSource
 */
@API(status = API.Status.STABLE)
public interface Source {

    /**
     * Get the name which identifies this source. It must not change over the life of the source.
     *
     * @return the source name
     */
    @API(status = API.Status.STABLE)
    String getName();

    /**
     * Get the operations this source supports. This is read once, when the source is registered.
     *
     * @return the supported capabilities
     */
    @API(status = API.Status.STABLE)
    Set<Capability> getCapabilities();

    @API(status = API.Status.STABLE)
    boolean play(List<String> args);

    @API(status = API.Status.STABLE)
    boolean pause(List<String> args);

    @API(status = API.Status.STABLE)
    boolean stop(List<String> args);

    @API(status = API.Status.STABLE)
    boolean next(List<String> args);

    @API(status = API.Status.STABLE)
    boolean prev(List<String> args);

    /**
     * Change the volume of the sound this source produces.
     *
     * @param level the new level, from 0 to 100
     *
     * @return {@code true} if the level was applied
     */
    @API(status = API.Status.STABLE)
    boolean setVolume(int level);

    /**
     * Report what this source is playing.
     *
     * @return the current playback of the source, or {@code null} if it has nothing loaded
     */
    @API(status = API.Status.STABLE)
    SourcePlayback getCurrentPlayback();

    /**
     * Release any resources held by the source. Called when it is disabled, and when the system shuts down.
     */
    @API(status = API.Status.STABLE)
    void shutdown();
}
