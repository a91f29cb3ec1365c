package org.deepsymmetry.playlink.data;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.PlayerState;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * <p>Describes a partial change to the shared {@link PlaybackInfo}. Only the fields that were explicitly set are
 * applied when the update is merged; everything else keeps its current value. Setting a text field to
 * {@code null} clears it.</p>
 *
 * <p>Updates are built fluently, for example
 * {@code new PlaybackUpdate().state(PlayerState.PLAYING).position(12.5)}, and are not thread safe; build one on the
 * thread that submits it.</p>
 */
@API(status = API.Status.STABLE)
public class PlaybackUpdate {

    /**
     * Identifies the fields of {@link PlaybackInfo} that an update can change.
     */
    @API(status = API.Status.STABLE)
    public enum Field {
        SOURCE,
        TRACK_NAME,
        TRACK_LOCATION,
        ARTIST,
        ALBUM,
        GENRE,
        POSITION,
        DURATION,
        STATE,
        VOLUME
    }

    private final Set<Field> present = EnumSet.noneOf(Field.class);

    private String source;
    private String trackName;
    private String trackLocation;
    private String artist;
    private String album;
    private String genre;
    private double position;
    private double duration;
    private PlayerState state;
    private int volume;

    /**
     * Set the name of the active source.
     *
     * @param source the source name
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate source(String source) {
        this.source = source;
        present.add(Field.SOURCE);
        return this;
    }

    /**
     * Set the name of the current track.
     *
     * @param trackName the track name, or {@code null} for none
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate trackName(String trackName) {
        this.trackName = trackName;
        present.add(Field.TRACK_NAME);
        return this;
    }

    /**
     * Set where the current track can be found. Sources that cannot say leave it unset.
     *
     * @param trackLocation the track location, or {@code null} for none
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate trackLocation(String trackLocation) {
        this.trackLocation = trackLocation;
        present.add(Field.TRACK_LOCATION);
        return this;
    }

    /**
     * Set the artist of the current track.
     *
     * @param artist the artist, or {@code null} if unknown
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate artist(String artist) {
        this.artist = artist;
        present.add(Field.ARTIST);
        return this;
    }

    /**
     * Set the album of the current track.
     *
     * @param album the album, or {@code null} if unknown
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate album(String album) {
        this.album = album;
        present.add(Field.ALBUM);
        return this;
    }

    /**
     * Set the genre of the current track.
     *
     * @param genre the genre, or {@code null} if unknown
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate genre(String genre) {
        this.genre = genre;
        present.add(Field.GENRE);
        return this;
    }

    /**
     * Set the playback position.
     *
     * @param position seconds into the current track
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate position(double position) {
        this.position = Math.max(0.0, position);
        present.add(Field.POSITION);
        return this;
    }

    /**
     * Set the length of the current track.
     *
     * @param duration the track length in seconds, zero when unknown
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate duration(double duration) {
        this.duration = Math.max(0.0, duration);
        present.add(Field.DURATION);
        return this;
    }

    /**
     * Set the player state.
     *
     * @param state the new state
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate state(PlayerState state) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        this.state = state;
        present.add(Field.STATE);
        return this;
    }

    /**
     * Set the volume level.
     *
     * @param volume the new level, clamped to the range 0 to 100
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate volume(int volume) {
        this.volume = Math.max(0, Math.min(100, volume));
        present.add(Field.VOLUME);
        return this;
    }

    /**
     * Clear everything known about the current track, as happens when switching sources.
     *
     * @return this update, for chaining
     */
    @API(status = API.Status.STABLE)
    public PlaybackUpdate clearTrack() {
        return trackName(null).trackLocation(null).artist(null).album(null).genre(null).position(0.0).duration(0.0);
    }

    /**
     * Check whether a field was set in this update.
     *
     * @param field the field of interest
     *
     * @return {@code true} if merging this update will change that field
     */
    @API(status = API.Status.STABLE)
    public boolean has(Field field) {
        return present.contains(field);
    }

    /**
     * Get the set of fields this update changes.
     *
     * @return an unmodifiable view of the fields that were set
     */
    @API(status = API.Status.STABLE)
    public Set<Field> getFields() {
        return Collections.unmodifiableSet(present);
    }

    public String getSource() {
        return source;
    }

    public String getTrackName() {
        return trackName;
    }

    public String getTrackLocation() {
        return trackLocation;
    }

    public String getArtist() {
        return artist;
    }

    public String getAlbum() {
        return album;
    }

    public String getGenre() {
        return genre;
    }

    public double getPosition() {
        return position;
    }

    public double getDuration() {
        return duration;
    }

    public PlayerState getState() {
        return state;
    }

    public int getVolume() {
        return volume;
    }

    @Override
    public String toString() {
        return "PlaybackUpdate[fields:" + present + ", source:" + source + ", trackName:" + trackName +
                ", position:" + position + ", duration:" + duration + ", state:" + state + ", volume:" + volume + "]";
    }
}
