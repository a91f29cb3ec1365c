package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.PlaybackEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * <p>Wraps a loaded {@link Source} so that the rest of the system can command it safely. The capabilities are read
 * once when the handle is created; commands the source did not declare are refused without calling it, and
 * anything a source throws is logged and reported as failure.</p>
 *
 * <p>The handle also caches the most recent report from {@link Source#getCurrentPlayback()}, so that sources which
 * are expensive to query are not asked more often than necessary.</p>
 */
@API(status = API.Status.STABLE)
public class SourceHandle {

    private static final Logger logger = LoggerFactory.getLogger(SourceHandle.class);

    private final Source source;

    private final String name;

    private final Set<Capability> capabilities;

    /**
     * The listener that forwards events to the source, if it wanted them.
     */
    private final PlaybackEventListener eventRouter;

    /**
     * The most recent playback report and when it was obtained, guarded by synchronizing on this handle.
     */
    private SourcePlayback cachedPlayback;
    private long cachedAtNanos;
    private boolean cacheValid;

    /**
     * Set once the registry has begun unloading the source, after which it can never become active again.
     */
    private volatile boolean unloading;

    SourceHandle(Source source, PlaybackEventListener eventRouter) {
        this.source = source;
        this.eventRouter = eventRouter;
        name = source.getName();
        final Set<Capability> declared = source.getCapabilities();
        final EnumSet<Capability> copy = EnumSet.noneOf(Capability.class);
        if (declared != null) {
            copy.addAll(declared);
        }
        capabilities = Collections.unmodifiableSet(copy);
    }

    /**
     * Get the name of the source.
     *
     * @return the source name
     */
    @API(status = API.Status.STABLE)
    public String getName() {
        return name;
    }

    /**
     * Get the source itself.
     *
     * @return the wrapped source
     */
    @API(status = API.Status.STABLE)
    public Source getSource() {
        return source;
    }

    /**
     * Get the capabilities the source declared when it was registered.
     *
     * @return the cached capability set
     */
    @API(status = API.Status.STABLE)
    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    /**
     * Check whether the source supports an operation.
     *
     * @param capability the operation of interest
     *
     * @return {@code true} if the source declared it
     */
    @API(status = API.Status.STABLE)
    public boolean supports(Capability capability) {
        return capabilities.contains(capability);
    }

    PlaybackEventListener getEventRouter() {
        return eventRouter;
    }

    /**
     * The signature shared by the transport commands, so they can all be guarded the same way.
     */
    private interface Command {
        boolean run();
    }

    /**
     * Send a command to the source if it supports it, turning any exception into a logged failure.
     *
     * @param capability the capability the command needs
     * @param command the call to make
     *
     * @return {@code true} if the source carried out the command
     */
    private boolean invoke(Capability capability, Command command) {
        if (!supports(capability)) {
            logger.debug("Source {} does not support {}", name, capability);
            return false;
        }
        try {
            final boolean result = command.run();
            invalidateCache();
            return result;
        } catch (Throwable t) {
            logger.warn("Problem sending {} to source {}", capability, name, t);
            return false;
        }
    }

    @API(status = API.Status.STABLE)
    public boolean play(List<String> args) {
        return invoke(Capability.PLAY, () -> source.play(args));
    }

    @API(status = API.Status.STABLE)
    public boolean pause(List<String> args) {
        return invoke(Capability.PAUSE, () -> source.pause(args));
    }

    @API(status = API.Status.STABLE)
    public boolean stop(List<String> args) {
        return invoke(Capability.STOP, () -> source.stop(args));
    }

    @API(status = API.Status.STABLE)
    public boolean next(List<String> args) {
        return invoke(Capability.NEXT, () -> source.next(args));
    }

    @API(status = API.Status.STABLE)
    public boolean prev(List<String> args) {
        return invoke(Capability.PREV, () -> source.prev(args));
    }

    @API(status = API.Status.STABLE)
    public boolean setVolume(int level) {
        return invoke(Capability.SET_VOLUME, () -> source.setVolume(level));
    }

    /**
     * Ask the source what it is playing right now, bypassing the cache.
     *
     * @return the report, or {@code null} if the source cannot report or has nothing loaded
     */
    @API(status = API.Status.STABLE)
    public SourcePlayback queryPlayback() {
        if (!supports(Capability.QUERY_PLAYBACK)) {
            return null;
        }
        SourcePlayback result;
        try {
            result = source.getCurrentPlayback();
        } catch (Throwable t) {
            logger.warn("Problem asking source {} for its playback", name, t);
            result = null;
        }
        synchronized (this) {
            cachedPlayback = result;
            cachedAtNanos = System.nanoTime();
            cacheValid = true;
        }
        return result;
    }

    /**
     * Get what the source last reported about its playback, asking again only if that report is older than
     * the specified age.
     *
     * @param maxAgeMillis how old a cached report may be
     *
     * @return the report, or {@code null} if the source cannot report or has nothing loaded
     */
    @API(status = API.Status.STABLE)
    public SourcePlayback getReportedPlayback(long maxAgeMillis) {
        synchronized (this) {
            if (cacheValid && System.nanoTime() - cachedAtNanos <= maxAgeMillis * 1_000_000L) {
                return cachedPlayback;
            }
        }
        return queryPlayback();
    }

    /**
     * Check whether the registry has begun unloading this source.
     *
     * @return {@code true} if the source is on its way out and must not be made active
     */
    @API(status = API.Status.STABLE)
    public boolean isUnloading() {
        return unloading;
    }

    void markUnloading() {
        unloading = true;
    }

    /**
     * Discard the cached playback report, so the next request asks the source.
     */
    @API(status = API.Status.STABLE)
    public synchronized void invalidateCache() {
        cacheValid = false;
    }

    /**
     * Call the shutdown hook of the source, if it declared one. Failures are logged, never thrown.
     */
    @API(status = API.Status.STABLE)
    public void shutdown() {
        if (!supports(Capability.SHUTDOWN)) {
            return;
        }
        try {
            source.shutdown();
            logger.info("Shut down source {}", name);
        } catch (Throwable t) {
            logger.warn("Problem shutting down source {}", name, t);
        }
    }

    @Override
    public String toString() {
        return "SourceHandle[name:" + name + ", capabilities:" + capabilities + "]";
    }
}
