package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * The common superclass of all the events that are published through the {@link EventBus}. Events are immutable
 * value objects, so they can safely be handed to any number of listeners on any number of threads.
 */
@API(status = API.Status.STABLE)
public abstract class PlaybackEvent {

    /**
     * The system millisecond timestamp at which the event was created.
     */
    @API(status = API.Status.STABLE)
    public final long timestamp;

    /**
     * Constructor for subclasses, records the creation time.
     */
    protected PlaybackEvent() {
        timestamp = System.currentTimeMillis();
    }

    /**
     * Identify the kind of event this is, which determines which subscribers will receive it.
     *
     * @return the type under which this event is published
     */
    @API(status = API.Status.STABLE)
    public abstract EventType getType();

    /**
     * Invoke the method of a typed listener which corresponds to this kind of event.
     *
     * @param listener the listener to be informed of this event
     */
    @API(status = API.Status.INTERNAL)
    public abstract void deliverTo(PlaybackListener listener);
}
