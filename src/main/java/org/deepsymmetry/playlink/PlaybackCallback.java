package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.data.Direction;
import org.deepsymmetry.playlink.data.PlaybackInfo;
import org.deepsymmetry.playlink.data.PlaybackUpdate;
import org.deepsymmetry.playlink.data.TrackReference;

import java.util.function.BooleanSupplier;

/**
 * The narrow view of the playback system that is handed to sources when they are created. It lets a source report
 * what it is doing and claim the right to produce sound, without giving it access to the rest of the machinery.
 */
@API(status = API.Status.STABLE)
public interface PlaybackCallback {

    /**
     * Report a change in what the source is playing. A report that names a source other than the active one is
     * discarded.
     *
     * @param update the fields that changed
     */
    @API(status = API.Status.STABLE)
    void updatePlaybackInfo(PlaybackUpdate update);

    /**
     * Find out what is currently playing, refreshed from the active source first.
     *
     * @return the current playback information
     */
    @API(status = API.Status.STABLE)
    PlaybackInfo getCurrentPlayback();

    /**
     * Make the named source the active one, silencing whichever source was active before. This only switches;
     * a source that wants to start producing sound on its own initiative must use
     * {@link #playExclusively(String, BooleanSupplier)}, since another source could claim playback between this
     * call returning and the sound starting.
     *
     * @param sourceName the source that wants to play
     *
     * @return {@code true} if the named source is now active
     */
    @API(status = API.Status.STABLE)
    boolean ensureExclusivePlayback(String sourceName);

    /**
     * Make the named source the active one and start it playing, with no other switch able to happen in between.
     *
     * @param sourceName the source that wants to play
     * @param start starts the sound, returning {@code true} if it did; called only once the source is active
     *
     * @return {@code false} if the source could not be made active, otherwise the result of {@code start}
     */
    @API(status = API.Status.STABLE)
    boolean playExclusively(String sourceName, BooleanSupplier start);

    /**
     * Move through the local playlist.
     *
     * @param direction which way to move
     *
     * @return the track that is now current, or {@code null} if the playlist is empty
     */
    @API(status = API.Status.STABLE)
    TrackReference navigateTrack(Direction direction);
}
