package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;

/**
 * What a source reports about its own playback when asked through {@link Source#getCurrentPlayback()}.
 */
@API(status = API.Status.STABLE)
public class SourcePlayback {

    /**
     * The name of the track being played, if known.
     */
    @API(status = API.Status.STABLE)
    public final String trackName;

    /**
     * The artist of the track, if known.
     */
    @API(status = API.Status.STABLE)
    public final String artist;

    /**
     * The album of the track, if known.
     */
    @API(status = API.Status.STABLE)
    public final String album;

    /**
     * How far into the track playback has reached, in seconds.
     */
    @API(status = API.Status.STABLE)
    public final double position;

    /**
     * The length of the track in seconds, zero if unknown.
     */
    @API(status = API.Status.STABLE)
    public final double duration;

    /**
     * Whether the source is producing sound right now. A source with a track loaded but not playing reports
     * {@code false}.
     */
    @API(status = API.Status.STABLE)
    public final boolean playing;

    /**
     * Constructor sets all the immutable fields.
     *
     * @param trackName the track name, if known
     * @param artist the artist, if known
     * @param album the album, if known
     * @param position seconds into the track
     * @param duration the track length in seconds
     * @param playing whether sound is being produced
     */
    @API(status = API.Status.STABLE)
    public SourcePlayback(String trackName, String artist, String album, double position, double duration, boolean playing) {
        this.trackName = trackName;
        this.artist = artist;
        this.album = album;
        this.position = position;
        this.duration = duration;
        this.playing = playing;
    }

    @Override
    public String toString() {
        return "SourcePlayback[trackName:" + trackName + ", artist:" + artist + ", album:" + album +
                ", position:" + position + ", duration:" + duration + ", playing:" + playing + "]";
    }
}
