package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>Distributes {@link PlaybackEvent}s to the listeners that have subscribed to their {@link EventType}s.</p>
 *
 * <p>Every subscription owns a bounded queue and a daemon thread that drains it, so publishing never waits on a
 * listener, each listener sees events in the order they were published, and a slow or broken listener only hurts
 * itself. If a subscriber falls so far behind that its queue fills up, further events for that subscriber are
 * dropped with a warning until it catches up.</p>
 *
 * <p>Listeners may safely subscribe, unsubscribe, or publish from within their own event handlers.</p>
 */
@API(status = API.Status.STABLE)
public class EventBus {

    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    /**
     * The number of events that can wait for a single subscriber before new ones start being dropped, unless
     * another capacity is chosen at construction.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_QUEUE_CAPACITY = 256;

    /**
     * How long an idle delivery thread waits for an event before checking whether it has been asked to exit.
     */
    private static final long IDLE_POLL_MILLISECONDS = 250;

    /**
     * The subscriptions for each event type, in the order they were made. Guarded by synchronizing on the map.
     */
    private final Map<EventType, List<Subscription>> subscriptions = new EnumMap<>(EventType.class);

    /**
     * The queue capacity given to new subscriptions.
     */
    private final AtomicInteger queueCapacity = new AtomicInteger(DEFAULT_QUEUE_CAPACITY);

    /**
     * Set once {@link #shutdown(long, TimeUnit)} has been called, after which nothing more is delivered.
     */
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    /**
     * Create an event bus whose subscriptions can each hold {@link #DEFAULT_QUEUE_CAPACITY} undelivered events.
     */
    @API(status = API.Status.STABLE)
    public EventBus() {
        this(DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * Create an event bus with a specific per-subscriber queue capacity.
     *
     * @param queueCapacity the number of undelivered events each subscriber can have waiting
     *
     * @throws IllegalArgumentException if {@code queueCapacity} is less than one
     */
    @API(status = API.Status.STABLE)
    public EventBus(int queueCapacity) {
        setQueueCapacity(queueCapacity);
    }

    /**
     * Set the capacity of the delivery queue created for each new subscription. Existing subscriptions keep the
     * capacity they were created with.
     *
     * @param capacity the number of undelivered events each new subscriber can have waiting
     *
     * @throws IllegalArgumentException if {@code capacity} is less than one
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setQueueCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Subscriber queue capacity must be positive, got " + capacity);
        }
        queueCapacity.set(capacity);
    }

    /**
     * Check the capacity that will be given to the delivery queue of new subscriptions.
     *
     * @return the number of undelivered events each new subscriber can have waiting
     */
    @API(status = API.Status.EXPERIMENTAL)
    public int getQueueCapacity() {
        return queueCapacity.get();
    }

    /**
     * Arrange for a listener to be told about every event of the specified type that is published from now on.
     * Subscribing a listener that is already subscribed to that type has no effect.
     *
     * @param type the type of events of interest
     * @param listener the listener to receive them
     *
     * @return {@code true} if a new subscription was created
     */
    @API(status = API.Status.STABLE)
    public boolean subscribe(EventType type, PlaybackEventListener listener) {
        if (type == null || listener == null) {
            throw new IllegalArgumentException("type and listener must not be null");
        }
        synchronized (subscriptions) {
            if (shutDown.get()) {
                logger.warn("Ignoring subscription to {} events because the event bus has been shut down", type);
                return false;
            }
            final List<Subscription> list = subscriptions.computeIfAbsent(type, t -> new ArrayList<>());
            for (Subscription existing : list) {
                if (existing.listener.equals(listener)) {
                    return false;
                }
            }
            final Subscription subscription = new Subscription(type, listener, queueCapacity.get());
            list.add(subscription);
            subscription.start();
            logger.debug("Subscribed {} to {} events", listener, type);
            return true;
        }
    }

    /**
     * Stop delivering events of the specified type to a listener. Events that were already waiting in its queue
     * are discarded.
     *
     * @param type the type of events the listener is no longer interested in
     * @param listener the listener to be removed, compared using {@code equals}
     *
     * @return {@code true} if the listener had been subscribed to that type
     */
    @API(status = API.Status.STABLE)
    public boolean unsubscribe(EventType type, PlaybackEventListener listener) {
        if (type == null || listener == null) {
            return false;
        }
        Subscription removed = null;
        synchronized (subscriptions) {
            final List<Subscription> list = subscriptions.get(type);
            if (list != null) {
                final Iterator<Subscription> iterator = list.iterator();
                while (iterator.hasNext()) {
                    final Subscription subscription = iterator.next();
                    if (subscription.listener.equals(listener)) {
                        iterator.remove();
                        removed = subscription;
                        break;
                    }
                }
            }
        }
        if (removed != null) {
            removed.cancel();
            logger.debug("Unsubscribed {} from {} events", listener, type);
            return true;
        }
        return false;
    }

    /**
     * Remove every subscription a listener has, whatever the event type.
     *
     * @param listener the listener to be removed, compared using {@code equals}
     *
     * @return the number of subscriptions that were removed
     */
    @API(status = API.Status.STABLE)
    public int unsubscribeAll(PlaybackEventListener listener) {
        int count = 0;
        for (EventType type : EventType.values()) {
            if (unsubscribe(type, listener)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Get the listeners that are currently subscribed to an event type.
     *
     * @param type the event type of interest
     *
     * @return a snapshot of the subscribed listeners, in subscription order
     */
    @API(status = API.Status.STABLE)
    public List<PlaybackEventListener> getSubscribers(EventType type) {
        synchronized (subscriptions) {
            final List<Subscription> list = subscriptions.get(type);
            if (list == null || list.isEmpty()) {
                return Collections.emptyList();
            }
            final List<PlaybackEventListener> result = new ArrayList<>(list.size());
            for (Subscription subscription : list) {
                result.add(subscription.listener);
            }
            return Collections.unmodifiableList(result);
        }
    }

    /**
     * Hand an event to every listener subscribed to its type. This returns as soon as the event has been queued
     * for each of them; delivery happens on the subscribers' own threads.
     *
     * @param event the event to be published
     */
    @API(status = API.Status.STABLE)
    public void publish(PlaybackEvent event) {
        if (event == null) {
            return;
        }
        final List<Subscription> targets;
        synchronized (subscriptions) {
            if (shutDown.get()) {
                logger.debug("Event bus is shut down, not publishing {}", event);
                return;
            }
            final List<Subscription> list = subscriptions.get(event.getType());
            if (list == null || list.isEmpty()) {
                return;
            }
            targets = new ArrayList<>(list);
        }
        for (Subscription subscription : targets) {
            subscription.enqueue(event);
        }
    }

    /**
     * Check whether the event bus has been shut down.
     *
     * @return {@code true} once {@link #shutdown(long, TimeUnit)} has been called
     */
    @API(status = API.Status.STABLE)
    public boolean isShutdown() {
        return shutDown.get();
    }

    /**
     * Stop accepting events and wind down all the delivery threads. Events already queued are given until the
     * timeout to be delivered; any subscriber still busy after that is abandoned with a warning.
     *
     * @param timeout how long to wait for the subscribers to finish, in total
     * @param unit the unit in which {@code timeout} is expressed
     */
    @API(status = API.Status.STABLE)
    public void shutdown(long timeout, TimeUnit unit) {
        final List<Subscription> all = new LinkedList<>();
        synchronized (subscriptions) {
            if (shutDown.getAndSet(true)) {
                return;
            }
            for (List<Subscription> list : subscriptions.values()) {
                all.addAll(list);
            }
            subscriptions.clear();
        }
        for (Subscription subscription : all) {
            subscription.drain();
        }
        final long deadline = System.nanoTime() + unit.toNanos(timeout);
        for (Subscription subscription : all) {
            final long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (!subscription.awaitTermination(Math.max(remaining, 1))) {
                logger.warn("Delivery thread for {} did not finish within the shutdown timeout, abandoning it", subscription.listener);
                subscription.cancel();
            }
        }
        logger.info("Event bus shut down");
    }

    /**
     * Ties a listener to one event type, with the queue and thread used to deliver those events to it.
     */
    private static final class Subscription {

        /**
         * Queued to wake an idle delivery thread so it notices it should exit. Never delivered.
         */
        private static final PlaybackEvent WAKE = new PlaybackEvent() {
            @Override
            public EventType getType() {
                return null;
            }

            @Override
            public void deliverTo(PlaybackListener listener) {
            }
        };

        private final EventType type;
        private final PlaybackEventListener listener;
        private final BlockingQueue<PlaybackEvent> queue;
        private final Thread deliveryThread;

        /**
         * Cleared when the subscription is cancelled; nothing more gets delivered after that.
         */
        private volatile boolean active = true;

        /**
         * Set when the thread should exit as soon as its queue is empty.
         */
        private volatile boolean draining = false;

        private Subscription(EventType type, PlaybackEventListener listener, int capacity) {
            this.type = type;
            this.listener = listener;
            queue = new LinkedBlockingQueue<>(capacity);
            deliveryThread = new Thread(this::deliverEvents, "play-link event delivery (" + type + ")");
            deliveryThread.setDaemon(true);
        }

        private void start() {
            deliveryThread.start();
        }

        private void enqueue(PlaybackEvent event) {
            if (!active) {
                return;
            }
            if (!queue.offer(event)) {
                logger.warn("Delivery queue full for listener {}, dropping {}", listener, event);
            }
        }

        private void deliverEvents() {
            while (active) {
                if (draining && queue.isEmpty()) {
                    return;
                }
                final PlaybackEvent event;
                try {
                    event = queue.poll(IDLE_POLL_MILLISECONDS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    logger.debug("Interrupted while waiting for events, continuing.");
                    continue;
                }
                if (event != null && event != WAKE && active) {
                    try {
                        listener.eventPublished(event);
                    } catch (Throwable t) {
                        logger.warn("Problem delivering {} event to listener", type, t);
                    }
                }
            }
        }

        // Neither of these interrupts the delivery thread, which may be inside a listener. A full queue needs no
        // wake event, since the thread is not idle.
        private void drain() {
            draining = true;
            queue.offer(WAKE);
        }

        private void cancel() {
            active = false;
            queue.clear();
            queue.offer(WAKE);
        }

        private boolean awaitTermination(long millis) {
            if (Thread.currentThread() == deliveryThread) {
                return true;
            }
            try {
                deliveryThread.join(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return !deliveryThread.isAlive();
        }
    }
}
