package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.data.Direction;
import org.deepsymmetry.playlink.data.PlaybackInfo;
import org.deepsymmetry.playlink.data.PlaybackUpdate;
import org.deepsymmetry.playlink.data.TrackNavigator;
import org.deepsymmetry.playlink.data.TrackReference;
import org.deepsymmetry.playlink.engine.AudioEngine;
import org.deepsymmetry.playlink.engine.ClipAudioEngine;
import org.deepsymmetry.playlink.source.SourceHandle;
import org.deepsymmetry.playlink.source.SourcePlayback;
import org.deepsymmetry.playlink.source.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * <p>Builds and connects all the parts of the playback system, and starts and shuts them down in the right order.
 * This is the object an application creates; everything else is reached through it.</p>
 *
 * <p>The context is also the {@link PlaybackCallback} handed to every source, so sources can report what they are
 * doing and claim playback without seeing anything else.</p>
 */
@API(status = API.Status.STABLE)
public class PlaybackContext extends LifecycleParticipant implements PlaybackCallback {

    private static final Logger logger = LoggerFactory.getLogger(PlaybackContext.class);

    private final PlaybackSettings settings;
    private final EventBus eventBus;
    private final PlaybackTracker tracker;
    private final SourceRegistry registry;
    private final PlaybackOrchestrator orchestrator;
    private final TrackNavigator navigator;
    private final AudioEngine engine;
    private final PlayerStateMachine player;
    private final Watchdog watchdog;

    /**
     * Keeps track of whether we are running.
     */
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Set once shutdown has begun, so it only happens once.
     */
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    /**
     * Create a context using settings from the class path and system properties, playing through Java Sound.
     */
    @API(status = API.Status.STABLE)
    public PlaybackContext() {
        this(PlaybackSettings.load(), new ClipAudioEngine());
    }

    /**
     * Create a context with specific settings and engine, discovering sources with the context class loader.
     *
     * @param settings the configuration to use
     * @param engine the engine for local playback
     */
    @API(status = API.Status.STABLE)
    public PlaybackContext(PlaybackSettings settings, AudioEngine engine) {
        this(settings, engine, new Random(), Thread.currentThread().getContextClassLoader());
    }

    /**
     * Create a context with full control over its collaborators.
     *
     * @param settings the configuration to use
     * @param engine the engine for local playback
     * @param random the source of randomness for shuffle mode
     * @param classLoader where source providers are discovered
     */
    @API(status = API.Status.STABLE)
    public PlaybackContext(PlaybackSettings settings, AudioEngine engine, Random random, ClassLoader classLoader) {
        this.settings = settings;
        this.engine = engine;
        eventBus = new EventBus(Math.max(1, settings.subscriberQueueCapacity));
        tracker = new PlaybackTracker(eventBus, SourceRegistry.LOCAL_SOURCE, settings.defaultVolume);
        registry = new SourceRegistry(eventBus, classLoader);
        registry.setPlaybackCallback(this);
        orchestrator = new PlaybackOrchestrator(registry, tracker);
        orchestrator.setStopConfirmAttempts(Math.max(1, settings.stopConfirmAttempts));
        orchestrator.setStopConfirmDelay(settings.stopConfirmDelayMillis);
        orchestrator.setSourceRefreshInterval(settings.sourceRefreshIntervalMillis);
        navigator = new TrackNavigator(random);
        navigator.setShuffle(settings.isShuffle());
        player = new PlayerStateMachine(orchestrator, registry, navigator, engine, tracker);
        registry.register(new LocalSource(player, engine));
        watchdog = new Watchdog(player, orchestrator, engine);
        watchdog.setInterval(Math.max(1, settings.watchdogIntervalMillis));
        watchdog.setIdleGracePeriod(settings.idleGraceMillis);
        watchdog.setPositionReportInterval(Math.max(1, settings.positionReportIntervalMillis));
        watchdog.setJoinTimeout(settings.shutdownJoinTimeoutMillis);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Discover the available sources, load the configured ones, apply the default volume, and start watching local
     * playback.
     *
     * @throws IllegalStateException if the context has already been shut down
     */
    @API(status = API.Status.STABLE)
    public synchronized void start() {
        if (shutDown.get()) {
            throw new IllegalStateException("PlaybackContext has been shut down and cannot be restarted");
        }
        if (!isRunning()) {
            registry.scan();
            if (settings.autoLoadSources) {
                final int loaded = registry.enableAll(settings.enabledSources);
                logger.info("Auto-loaded {} of {} configured sources", loaded, settings.enabledSources.size());
            }
            engine.setVolume(settings.defaultVolume);
            watchdog.start();
            running.set(true);
            logger.info("Playback context started with {}", settings);
            deliverLifecycleAnnouncement(logger, true);
        }
    }

    /**
     * Shut everything down: stop the watchdog, stop playback, hand control back to the local source, call the
     * shutdown hooks of every loaded source (the one that had been active goes last), then release the engine and
     * the event bus. Problems along the way are logged and do not stop the rest of the shutdown.
     */
    @API(status = API.Status.STABLE)
    public void shutdown() {
        if (shutDown.getAndSet(true)) {
            return;
        }
        logger.info("Shutting down playback context");
        watchdog.requestStop();
        try {
            player.stop();
        } catch (Throwable t) {
            logger.warn("Problem stopping playback during shutdown", t);
        }
        final String previouslyActive = orchestrator.getActiveSource();
        try {
            orchestrator.forceLocal();
        } catch (Throwable t) {
            logger.warn("Problem returning control to the local source during shutdown", t);
        }
        final List<SourceHandle> ordered = new ArrayList<>();
        SourceHandle last = null;
        for (SourceHandle handle : registry.getLoadedHandles()) {
            if (handle.getName().equals(previouslyActive)) {
                last = handle;
            } else {
                ordered.add(handle);
            }
        }
        if (last != null) {
            ordered.add(last);
        }
        for (SourceHandle handle : ordered) {
            handle.shutdown();
        }
        final long timeout = settings.shutdownJoinTimeoutMillis;
        watchdog.awaitTermination(timeout);
        try {
            engine.close();
        } catch (Throwable t) {
            logger.warn("Problem closing the audio engine", t);
        }
        eventBus.shutdown(timeout, TimeUnit.MILLISECONDS);
        final boolean wasRunning = running.getAndSet(false);
        logger.info("Playback context shut down");
        if (wasRunning) {
            deliverLifecycleAnnouncement(logger, false);
        }
    }

    @Override
    public void updatePlaybackInfo(PlaybackUpdate update) {
        final ReentrantLock lock = orchestrator.getLock();
        lock.lock();
        try {
            if (update.has(PlaybackUpdate.Field.SOURCE) && !update.getSource().equals(orchestrator.getActiveSource())) {
                logger.debug("Ignoring playback report from inactive source {}", update.getSource());
                return;
            }
            tracker.updatePlaybackInfo(update);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PlaybackInfo getCurrentPlayback() {
        final ReentrantLock lock = orchestrator.getLock();
        lock.lock();
        try {
            if (orchestrator.isLocalActive()) {
                return tracker.getPlaybackInfo().withPosition(player.getElapsedSeconds());
            }
            final SourceHandle handle = registry.get(orchestrator.getActiveSource());
            if (handle != null) {
                final SourcePlayback report = handle.getReportedPlayback(orchestrator.getSourceRefreshInterval());
                if (report != null) {
                    return tracker.updatePlaybackInfo(new PlaybackUpdate()
                            .trackName(report.trackName).artist(report.artist).album(report.album)
                            .position(report.position).duration(report.duration)
                            .state(report.playing ? PlayerState.PLAYING : PlayerState.PAUSED));
                }
            }
            return tracker.getPlaybackInfo();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean ensureExclusivePlayback(String sourceName) {
        return orchestrator.ensureExclusive(sourceName);
    }

    @Override
    public boolean playExclusively(String sourceName, BooleanSupplier start) {
        return orchestrator.runExclusive(sourceName, handle -> {
            final boolean started;
            try {
                started = start.getAsBoolean();
            } catch (Throwable t) {
                logger.warn("Problem starting playback on source {}", sourceName, t);
                return false;
            } finally {
                handle.invalidateCache();
            }
            if (started) {
                tracker.updatePlaybackInfo(new PlaybackUpdate().state(PlayerState.PLAYING));
            }
            return started;
        });
    }

    @Override
    public TrackReference navigateTrack(Direction direction) {
        return navigator.navigate(direction);
    }

    @API(status = API.Status.STABLE)
    public PlaybackSettings getSettings() {
        return settings;
    }

    @API(status = API.Status.STABLE)
    public EventBus getEventBus() {
        return eventBus;
    }

    @API(status = API.Status.STABLE)
    public PlaybackTracker getTracker() {
        return tracker;
    }

    @API(status = API.Status.STABLE)
    public SourceRegistry getRegistry() {
        return registry;
    }

    @API(status = API.Status.STABLE)
    public PlaybackOrchestrator getOrchestrator() {
        return orchestrator;
    }

    @API(status = API.Status.STABLE)
    public TrackNavigator getNavigator() {
        return navigator;
    }

    @API(status = API.Status.STABLE)
    public PlayerStateMachine getPlayer() {
        return player;
    }

    @API(status = API.Status.STABLE)
    public Watchdog getWatchdog() {
        return watchdog;
    }

    @API(status = API.Status.STABLE)
    public AudioEngine getEngine() {
        return engine;
    }
}
