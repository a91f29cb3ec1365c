package org.deepsymmetry.playlink.data;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.PlayerState;

/**
 * An immutable snapshot of everything known about what is currently playing. New snapshots are produced by merging
 * a {@link PlaybackUpdate} into the previous one.
 */
@API(status = API.Status.STABLE)
public class PlaybackInfo {

    /**
     * The name of the active source.
     */
    @API(status = API.Status.STABLE)
    public final String source;

    /**
     * The name of the current track, or {@code null} if there is none.
     */
    @API(status = API.Status.STABLE)
    public final String trackName;

    /**
     * Where the current track can be found, when the active source can say.
     */
    @API(status = API.Status.STABLE)
    public final String trackLocation;

    /**
     * The artist of the current track, if known.
     */
    @API(status = API.Status.STABLE)
    public final String artist;

    /**
     * The album of the current track, if known.
     */
    @API(status = API.Status.STABLE)
    public final String album;

    /**
     * The genre of the current track, if known.
     */
    @API(status = API.Status.STABLE)
    public final String genre;

    /**
     * How far into the current track playback has reached, in seconds.
     */
    @API(status = API.Status.STABLE)
    public final double position;

    /**
     * The length of the current track in seconds, zero when unknown.
     */
    @API(status = API.Status.STABLE)
    public final double duration;

    /**
     * Whether the active source is stopped, playing, or paused.
     */
    @API(status = API.Status.STABLE)
    public final PlayerState state;

    /**
     * The volume level, from 0 to 100.
     */
    @API(status = API.Status.STABLE)
    public final int volume;

    /**
     * The system millisecond time at which this snapshot was produced.
     */
    @API(status = API.Status.STABLE)
    public final long timestamp;

    /**
     * Constructor sets all the immutable fields.
     *
     * @param source the name of the active source
     * @param trackName the current track name, if any
     * @param trackLocation the current track location, if known
     * @param artist the track artist, if known
     * @param album the track album, if known
     * @param genre the track genre, if known
     * @param position the elapsed seconds in the track
     * @param duration the track length in seconds
     * @param state the player state
     * @param volume the volume level
     * @param timestamp when the snapshot was produced
     */
    @API(status = API.Status.STABLE)
    public PlaybackInfo(String source, String trackName, String trackLocation, String artist, String album,
                        String genre, double position, double duration, PlayerState state, int volume, long timestamp) {
        this.source = source;
        this.trackName = trackName;
        this.trackLocation = trackLocation;
        this.artist = artist;
        this.album = album;
        this.genre = genre;
        this.position = position;
        this.duration = duration;
        this.state = state;
        this.volume = volume;
        this.timestamp = timestamp;
    }

    /**
     * Create the snapshot that describes a freshly started system: nothing loaded, stopped.
     *
     * @param source the name of the default source
     * @param volume the initial volume level
     *
     * @return the initial playback information
     */
    @API(status = API.Status.STABLE)
    public static PlaybackInfo initial(String source, int volume) {
        return new PlaybackInfo(source, null, null, null, null, null, 0.0, 0.0, PlayerState.STOPPED, volume,
                System.currentTimeMillis());
    }

    /**
     * Produce a new snapshot in which the fields present in an update replace the corresponding fields of this
     * one.
     *
     * @param update the changes to apply
     * @param newTimestamp the timestamp to give the result
     *
     * @return the merged snapshot
     */
    @API(status = API.Status.STABLE)
    public PlaybackInfo merge(PlaybackUpdate update, long newTimestamp) {
        return new PlaybackInfo(
                update.has(PlaybackUpdate.Field.SOURCE) ? update.getSource() : source,
                update.has(PlaybackUpdate.Field.TRACK_NAME) ? update.getTrackName() : trackName,
                update.has(PlaybackUpdate.Field.TRACK_LOCATION) ? update.getTrackLocation() : trackLocation,
                update.has(PlaybackUpdate.Field.ARTIST) ? update.getArtist() : artist,
                update.has(PlaybackUpdate.Field.ALBUM) ? update.getAlbum() : album,
                update.has(PlaybackUpdate.Field.GENRE) ? update.getGenre() : genre,
                update.has(PlaybackUpdate.Field.POSITION) ? update.getPosition() : position,
                update.has(PlaybackUpdate.Field.DURATION) ? update.getDuration() : duration,
                update.has(PlaybackUpdate.Field.STATE) ? update.getState() : state,
                update.has(PlaybackUpdate.Field.VOLUME) ? update.getVolume() : volume,
                newTimestamp);
    }

    /**
     * Produce a copy of this snapshot with a different position, used to report interpolated positions without
     * going through an update.
     *
     * @param newPosition the position to report
     *
     * @return the adjusted snapshot
     */
    @API(status = API.Status.STABLE)
    public PlaybackInfo withPosition(double newPosition) {
        return new PlaybackInfo(source, trackName, trackLocation, artist, album, genre, newPosition, duration, state,
                volume, timestamp);
    }

    @Override
    public String toString() {
        return "PlaybackInfo[source:" + source + ", trackName:" + trackName + ", trackLocation:" + trackLocation +
                ", artist:" + artist +
                ", album:" + album + ", genre:" + genre + ", position:" + position + ", duration:" + duration +
                ", state:" + state + ", volume:" + volume + ", timestamp:" + timestamp + "]";
    }
}
