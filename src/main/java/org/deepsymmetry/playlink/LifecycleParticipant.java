package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provides the abstract skeleton for all the classes that can be started and stopped in Play Link, and for which
 * other classes may have a need to know when they start or stop.
 */
@API(status = API.Status.STABLE)
public abstract class LifecycleParticipant {

    /**
     * Keeps track of the registered lifecycle listeners.
     */
    private final Set<LifecycleListener> lifecycleListeners = Collections.newSetFromMap(new ConcurrentHashMap<>());

    /**
     * <p>Adds the specified life cycle listener to receive announcements when the component starts and stops.
     * If {@code listener} is {@code null} or already present in the set
     * of registered listeners, no exception is thrown and no action is performed.</p>
     *
     * <p>Lifecycle announcements are delivered to listeners on a separate thread to avoid worries about deadlock in
     * synchronized start and stop methods. The called function should still be fast, or delegate long operations to
     * its own separate thread.</p>
     *
     * @param listener the lifecycle listener to add
     */
    @API(status = API.Status.STABLE)
    public void addLifecycleListener(LifecycleListener listener) {
        if (listener != null) {
            lifecycleListeners.add(listener);
        }
    }

    /**
     * Removes the specified life cycle listener so that it no longer receives announcements when
     * the component starts or stops. If {@code listener} is {@code null} or not present
     * in the set of registered listeners, no exception is thrown and no action is performed.
     *
     * @param listener the life cycle listener to remove
     */
    @API(status = API.Status.STABLE)
    public void removeLifecycleListener(LifecycleListener listener) {
        if (listener != null) {
            lifecycleListeners.remove(listener);
        }
    }

    /**
     * Get the set of lifecycle listeners that are currently registered.
     *
     * @return the currently registered lifecycle listeners
     */
    @API(status = API.Status.STABLE)
    public Set<LifecycleListener> getLifecycleListeners() {
        // Make a copy so the caller gets an immutable snapshot of the current moment in time.
        return Set.copyOf(lifecycleListeners);
    }

    /**
     * Send a lifecycle announcement to all registered listeners.
     *
     * @param logger the logger to use, so the log entry shows as belonging to the proper subclass.
     * @param starting will be {@code true} if the component is starting, {@code false} if it is stopping.
     */
    protected void deliverLifecycleAnnouncement(final Logger logger, final boolean starting) {
        final Set<LifecycleListener> listeners = getLifecycleListeners();
        if (listeners.isEmpty()) {
            return;
        }
        Thread delivery = new Thread(() -> {
            for (final LifecycleListener listener : listeners) {
                try {
                    if (starting) {
                        listener.started(LifecycleParticipant.this);
                    } else {
                        listener.stopped(LifecycleParticipant.this);
                    }
                } catch (Throwable t) {
                    logger.warn("Problem delivering lifecycle announcement to listener", t);
                }
            }
        }, "play-link lifecycle announcement delivery");
        delivery.setDaemon(true);
        delivery.start();
    }

    /**
     * Check whether this component has been started.
     *
     * @return the component has started successfully and is ready to perform any service it offers.
     */
    @API(status = API.Status.STABLE)
    abstract public boolean isRunning();
}
