package org.deepsymmetry.playlink.data;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of tracks which can be changed while it is being played. All methods are thread safe; readers
 * that need a consistent view of the whole list should work from {@link #getTracks()}.
 */
@API(status = API.Status.STABLE)
public class Playlist {

    /**
     * A name for the playlist, used only for reporting.
     */
    private final String name;

    /**
     * The tracks, guarded by synchronizing on the list itself.
     */
    private final List<TrackReference> tracks = new ArrayList<>();

    /**
     * Create an empty playlist.
     *
     * @param name the name used when reporting the playlist
     */
    @API(status = API.Status.STABLE)
    public Playlist(String name) {
        this.name = name;
    }

    /**
     * Create a playlist holding some initial tracks.
     *
     * @param name the name used when reporting the playlist
     * @param initialTracks the tracks to start out with, in order
     */
    @API(status = API.Status.STABLE)
    public Playlist(String name, Collection<TrackReference> initialTracks) {
        this(name);
        for (TrackReference track : initialTracks) {
            add(track);
        }
    }

    /**
     * Get the name of this playlist.
     *
     * @return the name given when the playlist was created
     */
    @API(status = API.Status.STABLE)
    public String getName() {
        return name;
    }

    /**
     * Append a track to the end of the playlist.
     *
     * @param track the track to add
     */
    @API(status = API.Status.STABLE)
    public void add(TrackReference track) {
        if (track == null) {
            throw new IllegalArgumentException("track must not be null");
        }
        synchronized (tracks) {
            tracks.add(track);
        }
    }

    /**
     * Insert a track at a specific position. Indices past the end append the track.
     *
     * @param index where the track should go
     * @param track the track to insert
     */
    @API(status = API.Status.STABLE)
    public void add(int index, TrackReference track) {
        if (track == null) {
            throw new IllegalArgumentException("track must not be null");
        }
        synchronized (tracks) {
            tracks.add(Math.max(0, Math.min(index, tracks.size())), track);
        }
    }

    /**
     * Remove the track at a specific position.
     *
     * @param index the position of the track to remove
     *
     * @return the track that was removed, or {@code null} if there was no track at that position
     */
    @API(status = API.Status.STABLE)
    public TrackReference remove(int index) {
        synchronized (tracks) {
            if (index < 0 || index >= tracks.size()) {
                return null;
            }
            return tracks.remove(index);
        }
    }

    /**
     * Remove the first occurrence of a track.
     *
     * @param track the track to remove
     *
     * @return {@code true} if the track was found and removed
     */
    @API(status = API.Status.STABLE)
    public boolean remove(TrackReference track) {
        synchronized (tracks) {
            return tracks.remove(track);
        }
    }

    /**
     * Get the track at a specific position.
     *
     * @param index the position of interest
     *
     * @return the track there, or {@code null} if the index is out of range
     */
    @API(status = API.Status.STABLE)
    public TrackReference get(int index) {
        synchronized (tracks) {
            if (index < 0 || index >= tracks.size()) {
                return null;
            }
            return tracks.get(index);
        }
    }

    /**
     * Find where a track appears in the playlist.
     *
     * @param track the track to look for
     *
     * @return the index of its first occurrence, or -1 if it is not present
     */
    @API(status = API.Status.STABLE)
    public int indexOf(TrackReference track) {
        synchronized (tracks) {
            return tracks.indexOf(track);
        }
    }

    /**
     * Check how many tracks are in the playlist right now.
     *
     * @return the number of tracks
     */
    @API(status = API.Status.STABLE)
    public int size() {
        synchronized (tracks) {
            return tracks.size();
        }
    }

    /**
     * Check whether the playlist has any tracks.
     *
     * @return {@code true} if there are no tracks
     */
    @API(status = API.Status.STABLE)
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Get a snapshot of the tracks.
     *
     * @return an unmodifiable copy of the current track list
     */
    @API(status = API.Status.STABLE)
    public List<TrackReference> getTracks() {
        synchronized (tracks) {
            return Collections.unmodifiableList(new ArrayList<>(tracks));
        }
    }

    @Override
    public String toString() {
        return "Playlist[name:" + name + ", size:" + size() + "]";
    }
}
