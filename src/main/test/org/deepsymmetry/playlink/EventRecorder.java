package org.deepsymmetry.playlink;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the events it is sent, and lets tests wait for them to arrive.
 */
public class EventRecorder implements PlaybackEventListener {

    private final List<PlaybackEvent> events = new ArrayList<>();

    /**
     * Subscribe a new recorder to every event type on a bus.
     */
    public static EventRecorder subscribeAll(EventBus eventBus) {
        final EventRecorder recorder = new EventRecorder();
        for (EventType type : EventType.values()) {
            eventBus.subscribe(type, recorder);
        }
        return recorder;
    }

    @Override
    public synchronized void eventPublished(PlaybackEvent event) {
        events.add(event);
        notifyAll();
    }

    public synchronized List<PlaybackEvent> getEvents() {
        return new ArrayList<>(events);
    }

    @SuppressWarnings("unchecked")
    public synchronized <T extends PlaybackEvent> List<T> getEvents(Class<T> eventClass) {
        final List<T> result = new ArrayList<>();
        for (PlaybackEvent event : events) {
            if (eventClass.isInstance(event)) {
                result.add((T) event);
            }
        }
        return result;
    }

    public synchronized void clear() {
        events.clear();
    }

    /**
     * Wait until at least the specified number of events of a type have arrived.
     *
     * @return {@code true} if they arrived before the timeout
     */
    public synchronized boolean await(Class<? extends PlaybackEvent> eventClass, int count, long timeoutMillis)
            throws InterruptedException {
        final long deadline = System.currentTimeMillis() + timeoutMillis;
        while (getEvents(eventClass).size() < count) {
            final long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }

    /**
     * Give any events still in flight a chance to arrive, for tests checking that something was not published.
     */
    public static void settle() throws InterruptedException {
        Thread.sleep(200);
    }
}
