package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.engine.AudioEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <p>Watches local playback on a background thread, so that when a track reaches its end the player moves on to
 * the next one by itself. While a local track is playing, it also reports the elapsed position at a regular
 * interval.</p>
 *
 * <p>The watchdog only acts while the local source is active and playing. A track is considered to have ended
 * naturally when the engine stops being busy during the same playback generation in which it was seen busy, or
 * when it is found idle in a generation it was never seen busy in, once the idle grace period has elapsed since
 * that track started. An explicit stop or a new track changes the generation, so those are never mistaken for the
 * end of a track.</p>
 */
@API(status = API.Status.STABLE)
public class Watchdog extends LifecycleParticipant {

    private static final Logger logger = LoggerFactory.getLogger(Watchdog.class);

    private final PlayerStateMachine player;

    private final PlaybackOrchestrator orchestrator;

    private final AudioEngine engine;

    /**
     * Keeps track of whether we are running.
     */
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * The thread doing the watching, while we are running.
     */
    private volatile Thread thread;

    /**
     * How often to check the engine, in milliseconds.
     */
    private final AtomicLong interval = new AtomicLong(100);

    /**
     * How often to report the playback position, in milliseconds.
     */
    private final AtomicLong positionReportInterval = new AtomicLong(1000);

    /**
     * How long a track must have been playing before an engine that was never seen busy counts as finished, in
     * milliseconds.
     */
    private final AtomicLong idleGracePeriod = new AtomicLong(500);

    /**
     * How long {@link #stop()} waits for the thread to exit, in milliseconds.
     */
    private final AtomicLong joinTimeout = new AtomicLong(2000);

    // State used only by the watching thread, or by tests calling tick() directly.
    private long watchedGeneration = -1;
    private boolean sawBusy;
    private long lastPositionReport;

    /**
     * Create a watchdog for the local player.
     *
     * @param player the player to advance when tracks end
     * @param orchestrator tells us whether the local source is in control
     * @param engine the engine whose busy flag is watched
     */
    @API(status = API.Status.STABLE)
    public Watchdog(PlayerStateMachine player, PlaybackOrchestrator orchestrator, AudioEngine engine) {
        this.player = player;
        this.orchestrator = orchestrator;
        this.engine = engine;
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Start watching local playback. Has no effect if already running.
     */
    @API(status = API.Status.STABLE)
    public synchronized void start() {
        if (!isRunning()) {
            running.set(true);
            thread = new Thread(() -> {
                while (running.get() && thread == Thread.currentThread()) {
                    try {
                        tick();
                    } catch (Throwable t) {
                        logger.warn("Problem checking local playback, will try again", t);
                    }
                    try {
                        Thread.sleep(interval.get());
                    } catch (InterruptedException e) {
                        logger.debug("Interrupted, presumably due to Watchdog shutdown.");
                    }
                }
                logger.debug("Watchdog loop exited");
            }, "play-link Watchdog");
            thread.setDaemon(true);
            thread.start();
            logger.info("Watchdog started");
            deliverLifecycleAnnouncement(logger, true);
        }
    }

    /**
     * Ask the watching thread to exit, without waiting for it.
     */
    @API(status = API.Status.STABLE)
    public synchronized void requestStop() {
        if (running.getAndSet(false) && thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Wait a bounded time for the watching thread to exit after {@link #requestStop()}.
     *
     * @param timeoutMillis how long to wait
     *
     * @return {@code true} if the thread has exited
     */
    @API(status = API.Status.STABLE)
    public boolean awaitTermination(long timeoutMillis) {
        final Thread watching;
        synchronized (this) {
            watching = thread;
        }
        if (watching == null || watching == Thread.currentThread()) {
            return true;
        }
        try {
            watching.join(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (watching.isAlive()) {
            logger.warn("Watchdog thread did not exit within {} ms, continuing without it", timeoutMillis);
            return false;
        }
        synchronized (this) {
            if (thread == watching) {
                thread = null;
            }
        }
        return true;
    }

    /**
     * Stop watching, waiting up to the join timeout for the thread to exit. Proceeds regardless if it does not.
     */
    @API(status = API.Status.STABLE)
    public void stop() {
        final boolean wasRunning = isRunning();
        requestStop();
        awaitTermination(joinTimeout.get());
        if (wasRunning) {
            logger.info("Watchdog stopped");
            deliverLifecycleAnnouncement(logger, false);
        }
    }

    /**
     * Perform one check of local playback. Called repeatedly by the watching thread.
     */
    void tick() {
        if (!orchestrator.isLocalActive() || player.getState() != PlayerState.PLAYING) {
            watchedGeneration = -1;
            sawBusy = false;
            return;
        }
        final long generation = player.getPlaybackGeneration();
        if (generation != watchedGeneration) {
            watchedGeneration = generation;
            sawBusy = false;
            lastPositionReport = System.nanoTime();
        }
        if (engine.isBusy()) {
            sawBusy = true;
            final long now = System.nanoTime();
            if (now - lastPositionReport >= positionReportInterval.get() * 1_000_000L) {
                lastPositionReport = now;
                player.reportPosition();
            }
        } else if (sawBusy) {
            sawBusy = false;
            logger.debug("Engine went idle during playback generation {}", generation);
            player.trackFinished(generation);
        } else if (player.getElapsedSeconds() * 1000.0 >= idleGracePeriod.get()) {
            // Shorter than a tick, or finished before the first one.
            logger.debug("Engine never seen busy during playback generation {}, treating it as finished", generation);
            player.trackFinished(generation);
        }
    }

    @API(status = API.Status.EXPERIMENTAL)
    public long getInterval() {
        return interval.get();
    }

    /**
     * Set how often the engine is checked.
     *
     * @param interval the time between checks, in milliseconds
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setInterval(long interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.interval.set(interval);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public long getPositionReportInterval() {
        return positionReportInterval.get();
    }

    /**
     * Set how often the playback position is reported while a local track plays.
     *
     * @param interval the time between reports, in milliseconds
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setPositionReportInterval(long interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be positive");
        }
        positionReportInterval.set(interval);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public long getIdleGracePeriod() {
        return idleGracePeriod.get();
    }

    /**
     * Set how long a track must have been playing before an engine that was never seen busy is taken to have
     * finished it.
     *
     * @param period the grace period, in milliseconds
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setIdleGracePeriod(long period) {
        if (period < 0) {
            throw new IllegalArgumentException("period must not be negative");
        }
        idleGracePeriod.set(period);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public long getJoinTimeout() {
        return joinTimeout.get();
    }

    /**
     * Set how long {@link #stop()} waits for the watching thread to exit.
     *
     * @param timeout the wait, in milliseconds
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setJoinTimeout(long timeout) {
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        joinTimeout.set(timeout);
    }
}
