package org.deepsymmetry.playlink;

import org.deepsymmetry.playlink.source.Capability;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class PlaybackOrchestratorTest {

    private ExclusivityMonitor monitor;
    private FakeAudioEngine engine;
    private PlaybackContext context;
    private PlayerStateMachine player;
    private PlaybackOrchestrator orchestrator;
    private FakeSource alpha;

    @Before
    public void setUp() {
        monitor = new ExclusivityMonitor();
        engine = new FakeAudioEngine(monitor);
        final PlaybackSettings settings = new PlaybackSettings();
        settings.stopConfirmDelayMillis = 5;
        settings.shutdownJoinTimeoutMillis = 500;
        context = new PlaybackContext(settings, engine, new Random(3), getClass().getClassLoader());
        player = context.getPlayer();
        orchestrator = context.getOrchestrator();
        player.loadPlaylist(SamplePlaylists.of(3));
        alpha = new FakeSource("alpha", context, monitor);
        context.getRegistry().register(alpha);
    }

    @After
    public void tearDown() {
        context.shutdown();
    }

    @Test
    public void localStopsBeforePluginStarts() throws Exception {
        assertTrue(player.play());
        final EventRecorder recorder = EventRecorder.subscribeAll(context.getEventBus());

        assertTrue(player.play("alpha", Collections.singletonList("some query")));
        assertEquals("alpha", orchestrator.getActiveSource());
        assertEquals(PlayerState.STOPPED, player.getState());
        assertEquals(Arrays.asList("start:local", "stop:local", "start:alpha"), monitor.getHistory());
        assertEquals(Collections.singletonList("play:some query"), alpha.getCommands());
        assertTrue(monitor.getViolations().isEmpty());

        assertTrue(recorder.await(SourceChangeEvent.class, 1, 2000));
        EventRecorder.settle();
        final List<SourceChangeEvent> changes = recorder.getEvents(SourceChangeEvent.class);
        assertEquals(1, changes.size());
        assertEquals("local", changes.get(0).previousSource);
        assertEquals("alpha", changes.get(0).newSource);
        assertEquals(PlayerState.PLAYING, context.getTracker().getPlaybackInfo().state);
    }

    @Test
    public void pluginStopsBeforeLocalStarts() {
        assertTrue(player.play("alpha", null));
        assertTrue(player.play());
        assertTrue(orchestrator.isLocalActive());
        assertFalse(alpha.isPlaying());
        assertEquals(Arrays.asList("start:alpha", "stop:alpha", "start:local"), monitor.getHistory());
        assertTrue(monitor.getViolations().isEmpty());
        assertEquals(Collections.singletonList("track0.wav"), engine.getPlayed());
    }

    @Test
    public void unknownSourceCannotBecomeActive() {
        assertFalse(orchestrator.ensureExclusive("nobody"));
        assertFalse(player.play("nobody", null));
        assertTrue(orchestrator.isLocalActive());
    }

    @Test
    public void switchingToActiveSourcePublishesNothing() throws Exception {
        final EventRecorder recorder = EventRecorder.subscribeAll(context.getEventBus());
        assertTrue(orchestrator.ensureExclusive("local"));
        assertTrue(orchestrator.forceLocal());
        EventRecorder.settle();
        assertTrue(recorder.getEvents().isEmpty());
    }

    @Test
    public void incomingSourceStateComesFromItsReport() {
        assertTrue(orchestrator.ensureExclusive("alpha"));
        assertEquals(PlayerState.STOPPED, context.getTracker().getPlaybackInfo().state);
        assertNull(context.getTracker().getPlaybackInfo().trackName);

        assertTrue(player.play("alpha", null));
        orchestrator.forceLocal();
        assertTrue(orchestrator.ensureExclusive("alpha"));
        assertEquals(PlayerState.PAUSED, context.getTracker().getPlaybackInfo().state);
        assertEquals("alpha track", context.getTracker().getPlaybackInfo().trackName);
    }

    @Test(timeout = 5000)
    public void stubbornSourceDoesNotBlockSwitch() {
        orchestrator.setStopConfirmAttempts(3);
        orchestrator.setStopConfirmDelay(50);
        alpha.setStubborn(true);
        assertTrue(player.play("alpha", null));

        final long started = System.nanoTime();
        assertTrue(player.play());
        final long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(orchestrator.isLocalActive());
        assertTrue(alpha.getCommands().contains("stop"));
        assertTrue("switch took " + elapsedMillis + " ms", elapsedMillis < 2000);
        assertEquals(PlayerState.PLAYING, player.getState());
    }

    @Test
    public void sourceWithoutStopIsPaused() {
        final FakeSource beta = new FakeSource("beta", context, monitor,
                Capability.PLAY, Capability.PAUSE, Capability.QUERY_PLAYBACK);
        context.getRegistry().register(beta);
        assertTrue(player.play("beta", null));
        assertTrue(player.play());
        assertEquals(Arrays.asList("play", "pause"), beta.getCommands());
        assertFalse(beta.isPlaying());
    }

    @Test
    public void sourceWithoutQueriesIsJudgedBySharedState() {
        final FakeSource gamma = new FakeSource("gamma", context, monitor, Capability.PLAY, Capability.STOP);
        context.getRegistry().register(gamma);

        assertTrue(orchestrator.ensureExclusive("gamma"));
        assertTrue(orchestrator.forceLocal());
        assertFalse("a silent source that never played needs no stop", gamma.getCommands().contains("stop"));

        assertTrue(player.play("gamma", null));
        assertTrue(orchestrator.forceLocal());
        assertEquals(Arrays.asList("play", "stop"), gamma.getCommands());
        assertFalse(monitor.isPlaying("gamma"));
    }

    @Test
    public void activeSourceUnloadedReturnsToLocal() {
        assertTrue(player.play("alpha", null));
        assertTrue(context.getRegistry().disable("alpha"));
        assertTrue(orchestrator.isLocalActive());
        assertFalse(alpha.isPlaying());
    }

    @Test(timeout = 30000)
    public void concurrentCommandsNeverOverlapPlayback() throws Exception {
        final FakeSource beta = new FakeSource("beta", context, monitor);
        context.getRegistry().register(beta);
        final int threads = 6;
        final CountDownLatch start = new CountDownLatch(1);
        final CountDownLatch done = new CountDownLatch(threads);
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        final List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final Random random = new Random(t);
            final Thread worker = new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        switch (random.nextInt(9)) {
                            case 0: player.play(); break;
                            case 1: player.pause(); break;
                            case 2: player.stop(); break;
                            case 3: player.play("alpha", null); break;
                            case 4: player.play("beta", null); break;
                            case 5: player.next(); break;
                            case 6: alpha.startOnOwn(); break;
                            case 7: beta.startOnOwn(); break;
                            default: player.previous(); break;
                        }
                    }
                } catch (Throwable e) {
                    failure.compareAndSet(null, e);
                } finally {
                    done.countDown();
                }
            }, "stress " + t);
            workers.add(worker);
            worker.start();
        }
        start.countDown();
        assertTrue(done.await(25, TimeUnit.SECONDS));
        if (failure.get() != null) {
            throw new AssertionError("Worker failed", failure.get());
        }
        assertEquals(Collections.emptyList(), monitor.getViolations());
    }

    @Test(timeout = 30000)
    public void unloadingSourceCannotBeReactivated() throws Exception {
        final AtomicBoolean running = new AtomicBoolean(true);
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        final Thread contender = new Thread(() -> {
            try {
                while (running.get()) {
                    player.play("alpha", null);
                }
            } catch (Throwable e) {
                failure.compareAndSet(null, e);
            }
        }, "play alpha");
        contender.start();

        final List<String> stale = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                assertTrue(context.getRegistry().disable("alpha"));
                if ("alpha".equals(orchestrator.getActiveSource()) && !context.getRegistry().isLoaded("alpha")) {
                    stale.add("iteration " + i);
                }
                context.getRegistry().register(alpha);
            }
        } finally {
            running.set(false);
            contender.join();
        }
        if (failure.get() != null) {
            throw new AssertionError("Player thread failed", failure.get());
        }
        assertEquals(Collections.emptyList(), stale);
        assertEquals(Collections.emptyList(), monitor.getViolations());
    }
}
