package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.data.Direction;
import org.deepsymmetry.playlink.data.PlaybackUpdate;
import org.deepsymmetry.playlink.data.Playlist;
import org.deepsymmetry.playlink.data.TrackNavigator;
import org.deepsymmetry.playlink.data.TrackReference;
import org.deepsymmetry.playlink.engine.AudioEngine;
import org.deepsymmetry.playlink.engine.EngineException;
import org.deepsymmetry.playlink.source.Capability;
import org.deepsymmetry.playlink.source.SourceHandle;
import org.deepsymmetry.playlink.source.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <p>The transport controls: play, pause, stop, next, previous and volume. When the local source is active these
 * drive the local engine through the stopped, playing and paused states; when a plugin source is active they are
 * passed on to it.</p>
 *
 * <p>The behavior of each state lives in a stateless {@link TransportState} object, while everything that changes
 * (the state itself, the current track and the timing needed to work out the elapsed position) lives here and is
 * only touched while holding the {@link PlaybackOrchestrator}'s lock.</p>
 *
 * <p>Every local start and explicit stop bumps a playback generation counter, which lets the {@link Watchdog} tell
 * a track that ended by itself apart from one that was stopped or replaced.</p>
 */
@API(status = API.Status.STABLE)
public class PlayerStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(PlayerStateMachine.class);

    private static final List<String> NO_ARGS = Collections.emptyList();

    private final PlaybackOrchestrator orchestrator;
    private final SourceRegistry registry;
    private final TrackNavigator navigator;
    private final AudioEngine engine;
    private final PlaybackTracker tracker;

    /**
     * The behavior associated with each state.
     */
    private final Map<PlayerState, TransportState> behaviors = new EnumMap<>(PlayerState.class);

    /**
     * Shared with the orchestrator so source switches and local transport changes are serialized.
     */
    private final ReentrantLock lock;

    /**
     * The local transport state. Written only while holding {@link #lock}.
     */
    private volatile PlayerState state = PlayerState.STOPPED;

    /**
     * The track loaded into the engine, or staged to be played next.
     */
    private TrackReference currentTrack;

    /**
     * The length of the current track in seconds, as reported by the engine.
     */
    private double trackLength;

    /**
     * The {@link System#nanoTime()} at which the current track would have started had it never been paused.
     */
    private long startNanos;

    /**
     * The elapsed position captured when playback was paused.
     */
    private double pausedPosition;

    /**
     * The {@link System#nanoTime()} at which playback was paused.
     */
    private long pausedAtNanos;

    /**
     * Changes whenever a track is started or explicitly stopped.
     */
    private final AtomicLong generation = new AtomicLong();

    /**
     * Create a state machine for the local engine.
     *
     * @param orchestrator decides which source is active, and provides the lock
     * @param registry where the active plugin source can be found
     * @param navigator chooses tracks from the playlist
     * @param engine plays local tracks
     * @param tracker records and publishes playback changes
     */
    @API(status = API.Status.STABLE)
    public PlayerStateMachine(PlaybackOrchestrator orchestrator, SourceRegistry registry, TrackNavigator navigator,
                              AudioEngine engine, PlaybackTracker tracker) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.navigator = navigator;
        this.engine = engine;
        this.tracker = tracker;
        lock = orchestrator.getLock();
        for (TransportState behavior : new TransportState[] { StoppedState.INSTANCE, PlayingState.INSTANCE, PausedState.INSTANCE }) {
            behaviors.put(behavior.getState(), behavior);
        }
    }

    private TransportState behavior() {
        return behaviors.get(state);
    }

    /**
     * Find the active plugin source, if a plugin rather than the local source is in control.
     *
     * @return the plugin's handle, or {@code null} when the local source is active
     */
    private SourceHandle activePlugin() {
        if (orchestrator.isLocalActive()) {
            return null;
        }
        final String name = orchestrator.getActiveSource();
        final SourceHandle handle = registry.get(name);
        if (handle == null) {
            logger.warn("Active source {} is not loaded", name);
        }
        return handle;
    }

    /**
     * Record a change in local playback, if the local source is the one being reported on.
     *
     * @param update the changes to record
     */
    private void report(PlaybackUpdate update) {
        if (orchestrator.isLocalActive()) {
            tracker.updatePlaybackInfo(update);
        }
    }

    /**
     * Start or resume local playback, taking control away from any plugin source first.
     *
     * @return {@code true} if the local engine is now playing
     */
    @API(status = API.Status.STABLE)
    public boolean play() {
        lock.lock();
        try {
            if (!orchestrator.ensureExclusive(SourceRegistry.LOCAL_SOURCE)) {
                return false;
            }
            return behavior().play(this);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start playback on a named source, making it the active one.
     *
     * @param sourceName the source to play
     * @param args source-specific arguments, such as a search query or a URL
     *
     * @return {@code true} if the source started playing
     */
    @API(status = API.Status.STABLE)
    public boolean play(String sourceName, List<String> args) {
        if (SourceRegistry.LOCAL_SOURCE.equals(sourceName)) {
            return play();
        }
        return orchestrator.runExclusive(sourceName, handle -> {
            final boolean started = handle.play(args == null ? NO_ARGS : args);
            if (started) {
                tracker.updatePlaybackInfo(new PlaybackUpdate().state(PlayerState.PLAYING));
            } else {
                logger.warn("Source {} did not start playing", sourceName);
            }
            return started;
        });
    }

    /**
     * Pause whatever is playing.
     *
     * @return {@code true} if playback is now paused
     */
    @API(status = API.Status.STABLE)
    public boolean pause() {
        lock.lock();
        try {
            final SourceHandle plugin = activePlugin();
            if (plugin == null) {
                return orchestrator.isLocalActive() && behavior().pause(this);
            }
            if (plugin.pause(NO_ARGS)) {
                tracker.updatePlaybackInfo(new PlaybackUpdate().state(PlayerState.PAUSED));
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop whatever is playing. A plugin source that cannot stop is paused instead.
     *
     * @return {@code true} if playback is now stopped (or paused, for such a plugin)
     */
    @API(status = API.Status.STABLE)
    public boolean stop() {
        lock.lock();
        try {
            final SourceHandle plugin = activePlugin();
            if (plugin == null) {
                return orchestrator.isLocalActive() && behavior().stop(this);
            }
            if (plugin.supports(Capability.STOP)) {
                if (plugin.stop(NO_ARGS)) {
                    tracker.updatePlaybackInfo(new PlaybackUpdate().state(PlayerState.STOPPED));
                    return true;
                }
                return false;
            }
            if (plugin.pause(NO_ARGS)) {
                tracker.updatePlaybackInfo(new PlaybackUpdate().state(PlayerState.PAUSED));
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move to the next track.
     *
     * @return {@code true} if the move succeeded
     */
    @API(status = API.Status.STABLE)
    public boolean next() {
        lock.lock();
        try {
            final SourceHandle plugin = activePlugin();
            if (plugin == null) {
                return orchestrator.isLocalActive() && behavior().next(this);
            }
            return plugin.next(NO_ARGS);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move to the previous track.
     *
     * @return {@code true} if the move succeeded
     */
    @API(status = API.Status.STABLE)
    public boolean previous() {
        lock.lock();
        try {
            final SourceHandle plugin = activePlugin();
            if (plugin == null) {
                return orchestrator.isLocalActive() && behavior().previous(this);
            }
            return plugin.prev(NO_ARGS);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Change the volume. The local engine always takes the new level, so it is in effect when local playback
     * resumes; an active plugin is asked to apply it too.
     *
     * @param level the new level, clamped to 0 through 100
     *
     * @return {@code true} if the level was applied by the active source
     */
    @API(status = API.Status.STABLE)
    public boolean setVolume(int level) {
        final int clamped = Math.max(0, Math.min(100, level));
        lock.lock();
        try {
            engine.setVolume(clamped);
            final SourceHandle plugin = activePlugin();
            if (plugin != null && !plugin.setVolume(clamped)) {
                logger.warn("Source {} did not accept volume {}", plugin.getName(), clamped);
                return false;
            }
            tracker.updatePlaybackInfo(new PlaybackUpdate().volume(clamped));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called by the watchdog when the engine stops producing sound by itself. Unless the playback it observed has
     * since been stopped, paused or replaced, this advances to the next track and plays it.
     *
     * @param observedGeneration the playback generation the watchdog saw finish
     *
     * @return {@code true} if the player advanced to a new track
     */
    @API(status = API.Status.INTERNAL)
    public boolean trackFinished(long observedGeneration) {
        lock.lock();
        try {
            if (observedGeneration != generation.get() || state != PlayerState.PLAYING ||
                    !orchestrator.isLocalActive() || engine.isBusy()) {
                logger.debug("Ignoring stale end of track notification for generation {}", observedGeneration);
                return false;
            }
            logger.info("Track {} finished, advancing", currentTrack);
            final TrackReference next = navigator.navigate(Direction.NEXT);
            if (next == null) {
                return stopEngine();
            }
            return startTrack(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Publish the current local position, if local playback is running.
     */
    @API(status = API.Status.INTERNAL)
    public void reportPosition() {
        lock.lock();
        try {
            if (state == PlayerState.PLAYING && orchestrator.isLocalActive()) {
                report(new PlaybackUpdate().position(elapsedSeconds()));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the local transport state.
     *
     * @return whether the local engine is stopped, playing or paused
     */
    @API(status = API.Status.STABLE)
    public PlayerState getState() {
        return state;
    }

    /**
     * Get the current playback generation, which changes whenever a track is started or explicitly stopped.
     *
     * @return the generation counter
     */
    @API(status = API.Status.INTERNAL)
    public long getPlaybackGeneration() {
        return generation.get();
    }

    /**
     * Get the track that is loaded or staged for local playback.
     *
     * @return the current track, or {@code null} if none
     */
    @API(status = API.Status.STABLE)
    public TrackReference getCurrentTrack() {
        lock.lock();
        try {
            return currentTrack;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the length of the current local track.
     *
     * @return the length in seconds, zero when unknown
     */
    @API(status = API.Status.STABLE)
    public double getTrackLength() {
        lock.lock();
        try {
            return trackLength;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Work out how far into the current local track playback has reached. Time spent paused is not counted.
     *
     * @return the elapsed seconds, or zero when stopped
     */
    @API(status = API.Status.STABLE)
    public double getElapsedSeconds() {
        lock.lock();
        try {
            return elapsedSeconds();
        } finally {
            lock.unlock();
        }
    }

    private double elapsedSeconds() {
        switch (state) {
            case PLAYING:
                return (System.nanoTime() - startNanos) / 1_000_000_000.0;
            case PAUSED:
                return pausedPosition;
            default:
                return 0.0;
        }
    }

    /**
     * Replace the local playlist. Local playback is stopped first, and nothing is current until the first track is
     * played or navigated to.
     *
     * @param playlist the tracks to play
     */
    @API(status = API.Status.STABLE)
    public void loadPlaylist(Playlist playlist) {
        lock.lock();
        try {
            if (state != PlayerState.STOPPED) {
                stopEngine();
            }
            navigator.setPlaylist(playlist);
            stage(null);
            logger.info("Loaded {}", playlist);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a track from the local playlist. If it is the track being played, local playback is stopped first.
     *
     * @param index the position of the track to remove
     *
     * @return the track that was removed, or {@code null} if the index was out of range
     */
    @API(status = API.Status.STABLE)
    public TrackReference removeTrack(int index) {
        lock.lock();
        try {
            final boolean removingCurrent = navigator.getPlaylist().get(index) != null &&
                    navigator.getCurrentIndex() == index;
            if (removingCurrent && state != PlayerState.STOPPED) {
                logger.info("Removing the track being played, stopping playback");
                stopEngine();
            }
            final TrackReference removed = navigator.removeTrack(index);
            if (removingCurrent) {
                stage(navigator.getCurrentTrack());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Turn shuffle mode on or off for local playback.
     *
     * @param shuffle {@code true} to move to random tracks
     */
    @API(status = API.Status.STABLE)
    public void setShuffle(boolean shuffle) {
        navigator.setShuffle(shuffle);
        logger.info("Shuffle {}", shuffle ? "enabled" : "disabled");
    }

    // The operations below are used by the TransportState implementations, and by the local source. Callers
    // must hold the lock.

    /**
     * Start the track at the navigator's current position.
     *
     * @return {@code true} if it started
     */
    boolean startCurrent() {
        final TrackReference track = navigator.getCurrentTrack();
        if (track == null) {
            logger.warn("Cannot play: playlist is empty");
            return false;
        }
        return startTrack(track);
    }

    /**
     * Load a track into the engine and start it.
     *
     * @param track the track to play
     *
     * @return {@code true} if it started, {@code false} if the engine could not play it
     */
    boolean startTrack(TrackReference track) {
        try {
            engine.play(track);
        } catch (EngineException e) {
            logger.warn("Unable to play {}", track.location, e);
            generation.incrementAndGet();
            currentTrack = track;
            trackLength = 0.0;
            state = PlayerState.STOPPED;
            report(new PlaybackUpdate().state(PlayerState.STOPPED).trackName(track.name)
                    .trackLocation(track.location).position(0.0).duration(0.0));
            return false;
        }
        generation.incrementAndGet();
        currentTrack = track;
        trackLength = engine.getDuration();
        startNanos = System.nanoTime();
        pausedPosition = 0.0;
        state = PlayerState.PLAYING;
        report(new PlaybackUpdate().state(PlayerState.PLAYING).trackName(track.name).trackLocation(track.location)
                .artist(null).album(null).genre(null).position(0.0).duration(trackLength));
        return true;
    }

    /**
     * Pause the engine, remembering where it was.
     *
     * @return {@code true}
     */
    boolean pauseEngine() {
        pausedPosition = elapsedSeconds();
        pausedAtNanos = System.nanoTime();
        engine.pause();
        state = PlayerState.PAUSED;
        report(new PlaybackUpdate().state(PlayerState.PAUSED).position(pausedPosition));
        return true;
    }

    /**
     * Resume a paused engine, moving the start baseline forward so the pause is not counted as elapsed time.
     *
     * @return {@code true}
     */
    boolean resumeEngine() {
        engine.resume();
        startNanos += System.nanoTime() - pausedAtNanos;
        state = PlayerState.PLAYING;
        report(new PlaybackUpdate().state(PlayerState.PLAYING).position(elapsedSeconds()));
        return true;
    }

    /**
     * Stop the engine and forget the playback position.
     *
     * @return {@code true}
     */
    boolean stopEngine() {
        engine.stop();
        generation.incrementAndGet();
        pausedPosition = 0.0;
        state = PlayerState.STOPPED;
        report(new PlaybackUpdate().state(PlayerState.STOPPED).position(0.0));
        return true;
    }

    /**
     * Move through the playlist, either restarting playback on the new track or just staging it.
     *
     * @param direction which way to move
     * @param restart {@code true} to play the new track, {@code false} to only make it current
     *
     * @return {@code true} if the move succeeded
     */
    boolean advance(Direction direction, boolean restart) {
        if (restart) {
            engine.stop();
            generation.incrementAndGet();
        }
        final TrackReference track = navigator.navigate(direction);
        if (track == null) {
            if (restart) {
                state = PlayerState.STOPPED;
                report(new PlaybackUpdate().state(PlayerState.STOPPED).position(0.0));
            }
            return false;
        }
        if (restart) {
            return startTrack(track);
        }
        stage(track);
        return true;
    }

    /**
     * Make a track current without playing it.
     *
     * @param track the track to stage, or {@code null} if there is none
     */
    private void stage(TrackReference track) {
        currentTrack = track;
        trackLength = 0.0;
        report(new PlaybackUpdate().trackName(track == null ? null : track.name)
                .trackLocation(track == null ? null : track.location)
                .artist(null).album(null).genre(null).position(0.0).duration(0.0));
    }

    // Entry points for the local source, which is only commanded once it is already active.

    boolean localPlay() {
        lock.lock();
        try {
            return behavior().play(this);
        } finally {
            lock.unlock();
        }
    }

    boolean localPause() {
        lock.lock();
        try {
            return behavior().pause(this);
        } finally {
            lock.unlock();
        }
    }

    boolean localStop() {
        lock.lock();
        try {
            return behavior().stop(this);
        } finally {
            lock.unlock();
        }
    }

    boolean localNext() {
        lock.lock();
        try {
            return behavior().next(this);
        } finally {
            lock.unlock();
        }
    }

    boolean localPrevious() {
        lock.lock();
        try {
            return behavior().previous(this);
        } finally {
            lock.unlock();
        }
    }
}
