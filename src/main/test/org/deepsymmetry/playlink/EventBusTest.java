package org.deepsymmetry.playlink;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EventBusTest {

    private EventBus eventBus;

    @Before
    public void setUp() {
        eventBus = new EventBus();
    }

    @After
    public void tearDown() {
        eventBus.shutdown(1, TimeUnit.SECONDS);
    }

    @Test
    public void deliversOnlySubscribedTypes() throws Exception {
        final EventRecorder recorder = new EventRecorder();
        eventBus.subscribe(EventType.VOLUME_CHANGED, recorder);

        eventBus.publish(new StateChangeEvent(PlayerState.STOPPED, PlayerState.PLAYING, "local"));
        eventBus.publish(new VolumeChangeEvent(70, 50));

        assertTrue(recorder.await(VolumeChangeEvent.class, 1, 2000));
        EventRecorder.settle();
        assertEquals(1, recorder.getEvents().size());
        assertEquals(50, recorder.getEvents(VolumeChangeEvent.class).get(0).newVolume);
    }

    @Test
    public void duplicateSubscriptionIsIgnored() throws Exception {
        final EventRecorder recorder = new EventRecorder();
        assertTrue(eventBus.subscribe(EventType.TRACK_CHANGED, recorder));
        assertFalse(eventBus.subscribe(EventType.TRACK_CHANGED, recorder));
        assertEquals(1, eventBus.getSubscribers(EventType.TRACK_CHANGED).size());

        eventBus.publish(new TrackChangeEvent(null, "one.wav"));
        assertTrue(recorder.await(TrackChangeEvent.class, 1, 2000));
        EventRecorder.settle();
        assertEquals(1, recorder.getEvents().size());
    }

    @Test
    public void unsubscribedListenerHearsNothingMore() throws Exception {
        final EventRecorder recorder = new EventRecorder();
        eventBus.subscribe(EventType.TRACK_CHANGED, recorder);
        eventBus.publish(new TrackChangeEvent(null, "one.wav"));
        assertTrue(recorder.await(TrackChangeEvent.class, 1, 2000));

        assertTrue(eventBus.unsubscribe(EventType.TRACK_CHANGED, recorder));
        assertFalse(eventBus.unsubscribe(EventType.TRACK_CHANGED, recorder));
        eventBus.publish(new TrackChangeEvent("one.wav", "two.wav"));
        EventRecorder.settle();
        assertEquals(1, recorder.getEvents().size());
    }

    @Test
    public void unsubscribeAllRemovesEveryType() {
        final EventRecorder recorder = EventRecorder.subscribeAll(eventBus);
        assertEquals(EventType.values().length, eventBus.unsubscribeAll(recorder));
        for (EventType type : EventType.values()) {
            assertTrue(eventBus.getSubscribers(type).isEmpty());
        }
    }

    @Test
    public void failingSubscriberDoesNotAffectOthers() throws Exception {
        final PlaybackEventListener broken = event -> {
            throw new RuntimeException("Listener failure for testing");
        };
        final EventRecorder recorder = new EventRecorder();
        eventBus.subscribe(EventType.POSITION_CHANGED, broken);
        eventBus.subscribe(EventType.POSITION_CHANGED, recorder);

        for (int i = 0; i < 10; i++) {
            eventBus.publish(new PositionChangeEvent(i, 100.0));
        }
        assertTrue(recorder.await(PositionChangeEvent.class, 10, 2000));
    }

    @Test
    public void eachSubscriberSeesPublicationOrder() throws Exception {
        final EventRecorder first = new EventRecorder();
        final EventRecorder second = new EventRecorder();
        eventBus.subscribe(EventType.POSITION_CHANGED, first);
        eventBus.subscribe(EventType.POSITION_CHANGED, second);

        for (int i = 0; i < 100; i++) {
            eventBus.publish(new PositionChangeEvent(i, 100.0));
        }
        assertTrue(first.await(PositionChangeEvent.class, 100, 5000));
        assertTrue(second.await(PositionChangeEvent.class, 100, 5000));
        for (EventRecorder recorder : new EventRecorder[] { first, second }) {
            final List<PositionChangeEvent> events = recorder.getEvents(PositionChangeEvent.class);
            for (int i = 0; i < 100; i++) {
                assertEquals(i, events.get(i).position, 0.0);
            }
        }
    }

    @Test
    public void slowSubscriberDoesNotBlockPublisher() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        eventBus.subscribe(EventType.STATE_CHANGED, event -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        final EventRecorder recorder = new EventRecorder();
        eventBus.subscribe(EventType.STATE_CHANGED, recorder);

        final long started = System.nanoTime();
        for (int i = 0; i < 20; i++) {
            eventBus.publish(new StateChangeEvent(PlayerState.STOPPED, PlayerState.PLAYING, "local"));
        }
        final long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertTrue("publishing took " + elapsedMillis + " ms", elapsedMillis < 1000);
        assertTrue(recorder.await(StateChangeEvent.class, 20, 2000));
        release.countDown();
    }

    @Test(timeout = 10000)
    public void shutdownLetsBusyListenersFinishUninterrupted() {
        final AtomicInteger delivered = new AtomicInteger();
        final AtomicInteger interrupted = new AtomicInteger();
        eventBus.subscribe(EventType.POSITION_CHANGED, event -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                Thread.currentThread().interrupt();
            }
            delivered.incrementAndGet();
        });
        for (int i = 0; i < 5; i++) {
            eventBus.publish(new PositionChangeEvent(i, 100.0));
        }

        eventBus.shutdown(5, TimeUnit.SECONDS);
        assertEquals(5, delivered.get());
        assertEquals(0, interrupted.get());
    }

    @Test
    public void fullQueueDropsEventsForThatSubscriberOnly() throws Exception {
        eventBus = new EventBus(1);
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final List<PlaybackEvent> slowReceived = Collections.synchronizedList(new ArrayList<>());
        eventBus.subscribe(EventType.VOLUME_CHANGED, event -> {
            slowReceived.add(event);
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        eventBus.publish(new VolumeChangeEvent(0, 1));
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        for (int i = 2; i <= 5; i++) {
            eventBus.publish(new VolumeChangeEvent(i - 1, i));
        }
        release.countDown();
        EventRecorder.settle();
        assertEquals(2, slowReceived.size());
        assertEquals(2, ((VolumeChangeEvent) slowReceived.get(1)).newVolume);
    }

    @Test
    public void listenersMaySubscribeAndPublishFromHandlers() throws Exception {
        final EventRecorder downstream = new EventRecorder();
        eventBus.subscribe(EventType.SOURCE_CHANGED, event -> {
            eventBus.subscribe(EventType.TRACK_CHANGED, downstream);
            eventBus.publish(new TrackChangeEvent(null, "from handler"));
        });

        eventBus.publish(new SourceChangeEvent("local", "alpha"));
        assertTrue(downstream.await(TrackChangeEvent.class, 1, 2000));
        assertEquals("from handler", downstream.getEvents(TrackChangeEvent.class).get(0).newTrack);
    }

    @Test
    public void nothingIsDeliveredAfterShutdown() throws Exception {
        final EventRecorder recorder = new EventRecorder();
        eventBus.subscribe(EventType.VOLUME_CHANGED, recorder);
        eventBus.shutdown(1, TimeUnit.SECONDS);

        assertTrue(eventBus.isShutdown());
        eventBus.publish(new VolumeChangeEvent(1, 2));
        assertFalse(eventBus.subscribe(EventType.VOLUME_CHANGED, new EventRecorder()));
        EventRecorder.settle();
        assertTrue(recorder.getEvents().isEmpty());
    }

    @Test
    public void adapterReceivesTypedCallbacks() throws Exception {
        final CountDownLatch heard = new CountDownLatch(1);
        final List<Integer> volumes = Collections.synchronizedList(new ArrayList<>());
        final PlaybackAdapter adapter = new PlaybackAdapter() {
            @Override
            public void volumeChanged(VolumeChangeEvent event) {
                volumes.add(event.newVolume);
                heard.countDown();
            }
        };
        final PlaybackEventListener router = event -> event.deliverTo(adapter);
        eventBus.subscribe(EventType.STATE_CHANGED, router);
        eventBus.subscribe(EventType.VOLUME_CHANGED, router);

        eventBus.publish(new StateChangeEvent(PlayerState.STOPPED, PlayerState.PLAYING, "local"));
        eventBus.publish(new VolumeChangeEvent(70, 20));
        assertTrue(heard.await(2, TimeUnit.SECONDS));
        assertEquals(Collections.singletonList(20), volumes);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveCapacity() {
        new EventBus(0);
    }
}
