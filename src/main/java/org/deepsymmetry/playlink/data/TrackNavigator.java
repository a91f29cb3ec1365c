package org.deepsymmetry.playlink.data;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * <p>Keeps track of which playlist entry is current, and decides which one comes next or before it, either in
 * playlist order or, in shuffle mode, by random choice.</p>
 *
 * <p>The playlist may be changed by other threads at any time, so every operation re-reads its length and clamps the
 * stored indices into range before using them. Nothing here ever throws because of a stale index; navigating an
 * empty playlist simply returns {@code null}.</p>
 *
 * <p>Shuffle mode remembers only one step of history: {@link Direction#PREVIOUS} returns to the track that was
 * current before the last random pick, and asking for the previous track again stays there.</p>
 */
@API(status = API.Status.STABLE)
public class TrackNavigator {

    private static final Logger logger = LoggerFactory.getLogger(TrackNavigator.class);

    /**
     * The playlist being navigated.
     */
    private Playlist playlist;

    /**
     * The index of the current track.
     */
    private int currentIndex = 0;

    /**
     * The index that was current before the last move forward, or -1 if there has been none since the playlist
     * was loaded.
     */
    private int historyIndex = -1;

    /**
     * Whether forward navigation picks tracks at random.
     */
    private boolean shuffle;

    /**
     * The source of randomness for shuffle mode.
     */
    private final Random random;

    /**
     * Create a navigator over an empty playlist, in sequential mode.
     */
    @API(status = API.Status.STABLE)
    public TrackNavigator() {
        this(new Random());
    }

    /**
     * Create a navigator which uses a specific source of randomness, so shuffle order can be reproduced.
     *
     * @param random the random number generator used for shuffle picks
     */
    @API(status = API.Status.STABLE)
    public TrackNavigator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        this.random = random;
        playlist = new Playlist("empty");
    }

    /**
     * Start navigating a new playlist, with the first track current.
     *
     * @param newPlaylist the playlist to navigate
     */
    @API(status = API.Status.STABLE)
    public synchronized void setPlaylist(Playlist newPlaylist) {
        if (newPlaylist == null) {
            throw new IllegalArgumentException("playlist must not be null");
        }
        playlist = newPlaylist;
        currentIndex = 0;
        historyIndex = -1;
        logger.debug("Navigating {}", newPlaylist);
    }

    /**
     * Get the playlist being navigated.
     *
     * @return the current playlist
     */
    @API(status = API.Status.STABLE)
    public synchronized Playlist getPlaylist() {
        return playlist;
    }

    /**
     * Turn shuffle mode on or off.
     *
     * @param shuffle {@code true} to pick forward tracks at random
     */
    @API(status = API.Status.STABLE)
    public synchronized void setShuffle(boolean shuffle) {
        this.shuffle = shuffle;
    }

    /**
     * Check whether shuffle mode is on.
     *
     * @return {@code true} if forward navigation picks tracks at random
     */
    @API(status = API.Status.STABLE)
    public synchronized boolean isShuffle() {
        return shuffle;
    }

    /**
     * Bring an index into the valid range for a playlist of the specified size.
     *
     * @param index the index to check
     * @param size the current playlist length, which must be positive
     *
     * @return the index, clamped to {@code [0, size-1]}
     */
    private static int clamp(int index, int size) {
        return Math.max(0, Math.min(index, size - 1));
    }

    /**
     * Move to another track.
     *
     * @param direction which way to move
     *
     * @return the track that is now current, or {@code null} if the playlist is empty
     */
    @API(status = API.Status.STABLE)
    public synchronized TrackReference navigate(Direction direction) {
        final int size = playlist.size();
        if (size == 0) {
            logger.warn("Cannot navigate {}: playlist is empty", direction);
            return null;
        }
        final int current = clamp(currentIndex, size);
        if (direction == Direction.NEXT) {
            historyIndex = current;
            if (shuffle && size > 1) {
                int candidate = random.nextInt(size - 1);
                if (candidate >= current) {
                    candidate++;  // Skip over the current track.
                }
                currentIndex = candidate;
            } else {
                currentIndex = (current + 1) % size;
            }
        } else {
            if (shuffle && historyIndex >= 0) {
                currentIndex = clamp(historyIndex, size);
            } else {
                currentIndex = (current - 1 + size) % size;
            }
        }
        final TrackReference result = playlist.get(currentIndex);
        logger.debug("Navigated {} to index {}: {}", direction, currentIndex, result);
        return result;
    }

    /**
     * Make a specific playlist entry the current one.
     *
     * @param index the index of the track to select
     *
     * @return the selected track, or {@code null} if the playlist is empty
     */
    @API(status = API.Status.STABLE)
    public synchronized TrackReference select(int index) {
        final int size = playlist.size();
        if (size == 0) {
            logger.warn("Cannot select track {}: playlist is empty", index);
            return null;
        }
        historyIndex = clamp(currentIndex, size);
        currentIndex = clamp(index, size);
        return playlist.get(currentIndex);
    }

    /**
     * Remove a track from the playlist, keeping the same track current whenever it survives the removal.
     *
     * @param index the index of the track to remove
     *
     * @return the track that was removed, or {@code null} if the index was out of range
     */
    @API(status = API.Status.STABLE)
    public synchronized TrackReference removeTrack(int index) {
        final TrackReference removed = playlist.remove(index);
        if (removed != null) {
            if (index < currentIndex) {
                currentIndex--;
            }
            if (index == historyIndex) {
                historyIndex = -1;
            } else if (index < historyIndex) {
                historyIndex--;
            }
            final int size = playlist.size();
            if (size > 0) {
                currentIndex = clamp(currentIndex, size);
            } else {
                currentIndex = 0;
            }
        }
        return removed;
    }

    /**
     * Get the current track without moving.
     *
     * @return the current track, or {@code null} if the playlist is empty
     */
    @API(status = API.Status.STABLE)
    public synchronized TrackReference getCurrentTrack() {
        final int size = playlist.size();
        if (size == 0) {
            return null;
        }
        return playlist.get(clamp(currentIndex, size));
    }

    /**
     * Get the index of the current track, clamped against the live playlist length.
     *
     * @return the current index, zero when the playlist is empty
     */
    @API(status = API.Status.STABLE)
    public synchronized int getCurrentIndex() {
        final int size = playlist.size();
        return (size == 0) ? 0 : clamp(currentIndex, size);
    }

    /**
     * Take a snapshot of the navigation state, computed against the current playlist length.
     *
     * @return where the navigator stands and where it would move
     */
    @API(status = API.Status.STABLE)
    public synchronized NavigationCursor getCursor() {
        final int size = playlist.size();
        if (size == 0) {
            return new NavigationCursor(0, 0, 0, shuffle);
        }
        final int current = clamp(currentIndex, size);
        final int next = (current + 1) % size;
        final int prev;
        if (shuffle && historyIndex >= 0) {
            prev = clamp(historyIndex, size);
        } else {
            prev = (current - 1 + size) % size;
        }
        return new NavigationCursor(current, next, prev, shuffle);
    }
}
