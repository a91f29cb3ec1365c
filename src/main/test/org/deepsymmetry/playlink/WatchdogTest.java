package org.deepsymmetry.playlink;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class WatchdogTest {

    private FakeAudioEngine engine;
    private PlaybackContext context;
    private PlayerStateMachine player;
    private Watchdog watchdog;

    @Before
    public void setUp() {
        engine = new FakeAudioEngine();
        final PlaybackSettings settings = new PlaybackSettings();
        settings.stopConfirmDelayMillis = 5;
        settings.shutdownJoinTimeoutMillis = 500;
        context = new PlaybackContext(settings, engine, new Random(11), getClass().getClassLoader());
        player = context.getPlayer();
        player.loadPlaylist(SamplePlaylists.of(3));
        watchdog = context.getWatchdog();
    }

    @After
    public void tearDown() {
        context.shutdown();
    }

    @Test
    public void naturalEndAdvancesToNextTrack() {
        player.play();
        watchdog.tick();
        engine.finishTrack();
        watchdog.tick();
        assertEquals(Arrays.asList("track0.wav", "track1.wav"), engine.getPlayed());
        assertEquals(PlayerState.PLAYING, player.getState());

        watchdog.tick();
        assertEquals("a single end advances once", 2, engine.getPlayed().size());
    }

    @Test
    public void idleEngineBeforePlaybackBeginsIsNotAnEnd() {
        player.play();
        engine.finishTrack();
        watchdog.tick();
        assertEquals(Collections.singletonList("track0.wav"), engine.getPlayed());
    }

    @Test
    public void trackEndingBeforeFirstCheckStillAdvances() throws Exception {
        watchdog.setIdleGracePeriod(50);
        player.play();
        engine.finishTrack();
        watchdog.tick();
        assertEquals("too early to tell", Collections.singletonList("track0.wav"), engine.getPlayed());

        Thread.sleep(80);
        watchdog.tick();
        assertEquals(Arrays.asList("track0.wav", "track1.wav"), engine.getPlayed());
        assertEquals("track1.wav", player.getCurrentTrack().name);
        assertEquals(PlayerState.PLAYING, player.getState());
    }

    @Test
    public void explicitStopIsNotAnEnd() {
        player.play();
        watchdog.tick();
        player.stop();
        watchdog.tick();
        assertEquals(PlayerState.STOPPED, player.getState());
        assertEquals(1, engine.getPlayed().size());
    }

    @Test
    public void pauseIsNotAnEnd() {
        player.play();
        watchdog.tick();
        player.pause();
        watchdog.tick();
        assertTrue(player.play());
        watchdog.tick();
        assertEquals(PlayerState.PLAYING, player.getState());
        assertEquals(1, engine.getPlayed().size());
    }

    @Test
    public void pluginPlaybackIsLeftAlone() {
        context.getRegistry().register(new FakeSource("alpha", context, new ExclusivityMonitor()));
        player.play();
        watchdog.tick();
        assertTrue(player.play("alpha", null));
        watchdog.tick();
        assertEquals(1, engine.getPlayed().size());
        assertEquals("alpha", context.getOrchestrator().getActiveSource());
    }

    @Test(timeout = 10000)
    public void runningWatchdogAdvancesPlayback() throws Exception {
        watchdog.setInterval(10);
        watchdog.start();
        assertTrue(watchdog.isRunning());
        player.play();
        Thread.sleep(100);
        engine.finishTrack();
        while (engine.getPlayed().size() < 2) {
            Thread.sleep(10);
        }
        assertEquals("track1.wav", player.getCurrentTrack().name);
    }

    @Test(timeout = 10000)
    public void survivesFailingEngineQueries() throws Exception {
        watchdog.setInterval(10);
        watchdog.start();
        player.play();
        engine.setFailQueries(true);
        Thread.sleep(100);
        engine.setFailQueries(false);
        Thread.sleep(100);
        engine.finishTrack();
        while (engine.getPlayed().size() < 2) {
            Thread.sleep(10);
        }
        assertTrue(watchdog.isRunning());
    }

    @Test(timeout = 10000)
    public void stopJoinsThread() {
        watchdog.setInterval(10);
        watchdog.start();
        watchdog.stop();
        assertFalse(watchdog.isRunning());
        assertTrue(watchdog.awaitTermination(100));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeIdleGracePeriod() {
        watchdog.setIdleGracePeriod(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveInterval() {
        watchdog.setInterval(0);
    }
}
