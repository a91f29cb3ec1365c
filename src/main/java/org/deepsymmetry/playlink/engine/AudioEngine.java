package org.deepsymmetry.playlink.engine;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.data.TrackReference;

/**
 * <p>Plays one track at a time through the local audio output. The engine knows nothing about playlists or player
 * state; it just does what it is told and reports whether it is still producing sound.</p>
 *
 * <p>Implementations must be thread safe, because the command thread and the watchdog both use the engine.</p>
 */
@API(status = API.Status.STABLE)
public interface AudioEngine extends AutoCloseable {

    /**
     * Stop whatever is playing and start playing a track from the beginning.
     *
     * @param track the track to play
     *
     * @throws EngineException if the track cannot be played
     */
    @API(status = API.Status.STABLE)
    void play(TrackReference track) throws EngineException;

    /**
     * Suspend playback, keeping the position so it can be resumed.
     */
    @API(status = API.Status.STABLE)
    void pause();

    /**
     * Continue playback from where it was paused.
     */
    @API(status = API.Status.STABLE)
    void resume();

    /**
     * Stop playback and release the current track.
     */
    @API(status = API.Status.STABLE)
    void stop();

    /**
     * Check whether the engine is producing sound. This becomes {@code false} when the track reaches its end, as
     * well as when it is paused or stopped.
     *
     * @return {@code true} while audio is being played
     */
    @API(status = API.Status.STABLE)
    boolean isBusy();

    /**
     * Get the length of the current track.
     *
     * @return the length in seconds, or zero if unknown or nothing is loaded
     */
    @API(status = API.Status.STABLE)
    double getDuration();

    /**
     * Set the output volume.
     *
     * @param level the volume, from 0 (silent) to 100 (full)
     */
    @API(status = API.Status.STABLE)
    void setVolume(int level);

    /**
     * Release all audio resources. The engine cannot be used afterwards.
     */
    @Override
    void close();
}
