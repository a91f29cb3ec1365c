package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * The interface that must be implemented by anything that wants to subscribe to one or more {@link EventType}s
 * through the {@link EventBus}.
 *
 * <p>Events are delivered on a thread that belongs to the subscription, never on the thread that published them,
 * and each subscriber sees the events it receives in the order they were published. Any exception thrown by
 * {@link #eventPublished(PlaybackEvent)} is logged and otherwise ignored.</p>
 */
@API(status = API.Status.STABLE)
@FunctionalInterface
public interface PlaybackEventListener {

    /**
     * Called when an event of a type this listener subscribed to has been published.
     *
     * @param event the event that was published
     */
    @API(status = API.Status.STABLE)
    void eventPublished(PlaybackEvent event);
}
