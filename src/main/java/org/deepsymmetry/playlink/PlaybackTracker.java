package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.data.PlaybackInfo;
import org.deepsymmetry.playlink.data.PlaybackUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * <p>Holds the one shared {@link PlaybackInfo} record. Every change to what is playing, whether it comes from the
 * local player, the source orchestrator, the watchdog, or a source reporting on itself, goes through
 * {@link #updatePlaybackInfo(PlaybackUpdate)}, which merges the change, stamps it, and publishes the events it
 * implies.</p>
 *
 * <p>Events for a single update are published in a fixed order: source, state, track, position, then volume. They
 * are published while the record is still locked, so the order in which subscribers see changes matches the order
 * in which they were applied.</p>
 */
@API(status = API.Status.STABLE)
public class PlaybackTracker {

    private static final Logger logger = LoggerFactory.getLogger(PlaybackTracker.class);

    /**
     * Where change events are published.
     */
    private final EventBus eventBus;

    /**
     * The current playback information, guarded by synchronizing on this object.
     */
    private PlaybackInfo info;

    /**
     * Create a tracker describing a stopped player.
     *
     * @param eventBus where change events should be published
     * @param initialSource the name of the source that is active at startup
     * @param initialVolume the volume level at startup
     */
    @API(status = API.Status.STABLE)
    public PlaybackTracker(EventBus eventBus, String initialSource, int initialVolume) {
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus must not be null");
        }
        this.eventBus = eventBus;
        info = PlaybackInfo.initial(initialSource, initialVolume);
    }

    /**
     * Get the most recent playback information.
     *
     * @return the current snapshot
     */
    @API(status = API.Status.STABLE)
    public synchronized PlaybackInfo getPlaybackInfo() {
        return info;
    }

    /**
     * Apply a change to the shared playback information and publish the events it implies. An update which changes
     * nothing observable still refreshes the timestamp, but publishes no events.
     *
     * @param update the fields to be changed
     *
     * @return the resulting snapshot
     */
    @API(status = API.Status.STABLE)
    public synchronized PlaybackInfo updatePlaybackInfo(PlaybackUpdate update) {
        if (update == null) {
            throw new IllegalArgumentException("update must not be null");
        }
        final PlaybackInfo previous = info;
        final long timestamp = Math.max(System.currentTimeMillis(), previous.timestamp);
        final PlaybackInfo current = previous.merge(update, timestamp);
        info = current;
        logger.debug("Playback info updated to {}", current);

        if (!Objects.equals(previous.source, current.source)) {
            eventBus.publish(new SourceChangeEvent(previous.source, current.source));
        }
        if (previous.state != current.state) {
            eventBus.publish(new StateChangeEvent(previous.state, current.state, current.source));
        }
        if (!Objects.equals(previous.trackName, current.trackName) ||
                !Objects.equals(previous.trackLocation, current.trackLocation)) {
            eventBus.publish(new TrackChangeEvent(previous.trackName, current.trackName));
        }
        if (previous.position != current.position || previous.duration != current.duration) {
            eventBus.publish(new PositionChangeEvent(current.position, current.duration));
        }
        if (previous.volume != current.volume) {
            eventBus.publish(new VolumeChangeEvent(previous.volume, current.volume));
        }
        return current;
    }
}
