package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.data.PlaybackInfo;
import org.deepsymmetry.playlink.data.PlaybackUpdate;
import org.deepsymmetry.playlink.source.Capability;
import org.deepsymmetry.playlink.source.SourceCommand;
import org.deepsymmetry.playlink.source.SourceHandle;
import org.deepsymmetry.playlink.source.SourcePlayback;
import org.deepsymmetry.playlink.source.SourceRegistry;
import org.deepsymmetry.playlink.source.SourceRegistryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <p>Decides which source is active, and makes sure that only the active source is ever producing sound.</p>
 *
 * <p>Switching sources silences the outgoing one first: if it reports that it is playing, it is told to stop (or
 * pause, if it cannot stop), and then polled until it confirms it has gone quiet. A source that never confirms is
 * logged, but does not prevent the switch.</p>
 *
 * <p>All of this happens while holding a single lock, which the {@link PlayerStateMachine} also uses to protect the
 * state of the local engine, so a source switch can never interleave with a local transport command.</p>
 */
@API(status = API.Status.STABLE)
public class PlaybackOrchestrator implements SourceRegistryListener {

    private static final Logger logger = LoggerFactory.getLogger(PlaybackOrchestrator.class);

    private final SourceRegistry registry;

    private final PlaybackTracker tracker;

    /**
     * Serializes source switches and local transport changes.
     */
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * The name of the source that is allowed to play. Written only while holding {@link #lock}.
     */
    private volatile String activeSource = SourceRegistry.LOCAL_SOURCE;

    /**
     * How many times to check whether an outgoing source has stopped.
     */
    private final AtomicInteger stopConfirmAttempts = new AtomicInteger(5);

    /**
     * How long to wait between checks, in milliseconds.
     */
    private final AtomicLong stopConfirmDelay = new AtomicLong(100);

    /**
     * How old a plugin's self-reported playback may be before it is asked again, in milliseconds.
     */
    private final AtomicLong sourceRefreshInterval = new AtomicLong(1000);

    /**
     * Create an orchestrator. It registers itself with the registry so it can move playback off sources that are
     * being unloaded.
     *
     * @param registry where sources are found
     * @param tracker where changes of source are recorded
     */
    @API(status = API.Status.STABLE)
    public PlaybackOrchestrator(SourceRegistry registry, PlaybackTracker tracker) {
        this.registry = registry;
        this.tracker = tracker;
        registry.addRegistryListener(this);
    }

    /**
     * Get the lock that serializes source switches with local playback changes.
     *
     * @return the orchestrator lock
     */
    ReentrantLock getLock() {
        return lock;
    }

    /**
     * Get the name of the active source.
     *
     * @return the source that is currently allowed to play
     */
    @API(status = API.Status.STABLE)
    public String getActiveSource() {
        return activeSource;
    }

    /**
     * Check whether the local engine is the active source.
     *
     * @return {@code true} if local playback is in control
     */
    @API(status = API.Status.STABLE)
    public boolean isLocalActive() {
        return SourceRegistry.LOCAL_SOURCE.equals(activeSource);
    }

    /**
     * Make a source the active one, silencing the previously active source if it is playing.
     *
     * @param sourceName the source that should become active
     *
     * @return {@code true} if it is now active, {@code false} if no source by that name is loaded or it is being
     *         unloaded
     */
    @API(status = API.Status.STABLE)
    public boolean ensureExclusive(String sourceName) {
        lock.lock();
        try {
            final SourceHandle incoming = registry.get(sourceName);
            if (incoming == null) {
                logger.warn("Cannot make {} the active source: it is not loaded", sourceName);
                return false;
            }
            if (incoming.isUnloading()) {
                logger.warn("Cannot make {} the active source: it is being unloaded", sourceName);
                return false;
            }
            final String previous = activeSource;
            if (previous.equals(sourceName)) {
                return true;
            }
            final SourceHandle outgoing = registry.get(previous);
            if (outgoing != null) {
                silence(outgoing);
            } else {
                logger.debug("Previously active source {} is no longer loaded", previous);
            }
            activeSource = sourceName;
            tracker.updatePlaybackInfo(describe(incoming));
            logger.info("Active source changed from {} to {}", previous, sourceName);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Make a source active and, still holding the lock, run a command against it, so that nothing can slip in
     * between the switch and the command.
     *
     * @param sourceName the source that should become active
     * @param command what to do once it is
     *
     * @return {@code false} if the source could not be made active, otherwise the result of the command
     */
    @API(status = API.Status.STABLE)
    public boolean runExclusive(String sourceName, SourceCommand command) {
        lock.lock();
        try {
            if (!ensureExclusive(sourceName)) {
                return false;
            }
            return command.execute(registry.get(sourceName));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return control to the local source, silencing whatever plugin was active.
     *
     * @return {@code true} once the local source is active
     */
    @API(status = API.Status.STABLE)
    public boolean forceLocal() {
        return ensureExclusive(SourceRegistry.LOCAL_SOURCE);
    }

    /**
     * Build the update describing a newly active source: its name, plus whatever it reports about what it is
     * playing, or a stopped state if it reports nothing.
     *
     * @param incoming the source that is becoming active
     *
     * @return the changes to record
     */
    private PlaybackUpdate describe(SourceHandle incoming) {
        final PlaybackUpdate update = new PlaybackUpdate().source(incoming.getName()).clearTrack();
        final SourcePlayback report = incoming.queryPlayback();
        if (report == null) {
            update.state(PlayerState.STOPPED);
        } else {
            update.trackName(report.trackName).artist(report.artist).album(report.album)
                    .position(report.position).duration(report.duration)
                    .state(report.playing ? PlayerState.PLAYING : PlayerState.PAUSED);
        }
        return update;
    }

    /**
     * Work out whether a source is producing sound. The local source is always asked directly; plugins may be
     * answered from a recent report, and sources that cannot report are judged by the shared playback state.
     *
     * @param handle the source of interest
     * @param fresh whether a cached report is unacceptable
     *
     * @return {@code true} if the source appears to be playing
     */
    private boolean isPlaying(SourceHandle handle, boolean fresh) {
        if (handle.supports(Capability.QUERY_PLAYBACK)) {
            final boolean live = fresh || SourceRegistry.LOCAL_SOURCE.equals(handle.getName());
            final SourcePlayback report = live ? handle.queryPlayback() :
                    handle.getReportedPlayback(sourceRefreshInterval.get());
            return report != null && report.playing;
        }
        final PlaybackInfo info = tracker.getPlaybackInfo();
        return handle.getName().equals(info.source) && info.state == PlayerState.PLAYING;
    }

    /**
     * Stop a source that is about to lose control, if it is playing, and wait a bounded time for it to confirm.
     *
     * @param outgoing the source that is currently active
     */
    private void silence(SourceHandle outgoing) {
        if (!isPlaying(outgoing, false)) {
            return;
        }
        final boolean sent;
        if (outgoing.supports(Capability.STOP)) {
            sent = outgoing.stop(Collections.emptyList());
        } else if (outgoing.supports(Capability.PAUSE)) {
            sent = outgoing.pause(Collections.emptyList());
        } else {
            logger.warn("Source {} is playing but can be neither stopped nor paused", outgoing.getName());
            return;
        }
        if (!sent) {
            logger.warn("Source {} refused to stop", outgoing.getName());
        }
        if (!outgoing.supports(Capability.QUERY_PLAYBACK)) {
            if (sent) {
                tracker.updatePlaybackInfo(new PlaybackUpdate().state(
                        outgoing.supports(Capability.STOP) ? PlayerState.STOPPED : PlayerState.PAUSED));
            }
            return;
        }
        final int attempts = stopConfirmAttempts.get();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (!isPlaying(outgoing, true)) {
                logger.debug("Source {} confirmed stopped after {} checks", outgoing.getName(), attempt);
                return;
            }
            if (attempt < attempts) {
                try {
                    TimeUnit.MILLISECONDS.sleep(stopConfirmDelay.get());
                } catch (InterruptedException e) {
                    logger.warn("Interrupted while waiting for source {} to stop", outgoing.getName());
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.warn("Source {} did not confirm that it stopped playing, switching anyway", outgoing.getName());
    }

    @Override
    public void sourceLoaded(SourceHandle handle) {
        logger.debug("Source {} is now available for playback", handle.getName());
    }

    @Override
    public void sourceUnloading(String sourceName) {
        lock.lock();
        try {
            if (sourceName.equals(activeSource)) {
                logger.info("Active source {} is being unloaded, returning control to the local source", sourceName);
                forceLocal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Set how many times an outgoing source is checked before giving up on confirmation that it stopped.
     *
     * @param attempts the number of checks, at least one
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setStopConfirmAttempts(int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
        stopConfirmAttempts.set(attempts);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public int getStopConfirmAttempts() {
        return stopConfirmAttempts.get();
    }

    /**
     * Set how long to wait between checks that an outgoing source has stopped.
     *
     * @param delay the wait in milliseconds
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setStopConfirmDelay(long delay) {
        if (delay < 0) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        stopConfirmDelay.set(delay);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public long getStopConfirmDelay() {
        return stopConfirmDelay.get();
    }

    /**
     * Set how old a plugin's playback report may be before it is asked again.
     *
     * @param interval the maximum age in milliseconds
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setSourceRefreshInterval(long interval) {
        if (interval < 0) {
            throw new IllegalArgumentException("interval must not be negative");
        }
        sourceRefreshInterval.set(interval);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public long getSourceRefreshInterval() {
        return sourceRefreshInterval.get();
    }
}
