package org.deepsymmetry.playlink.source;

import org.deepsymmetry.playlink.EventType;
import org.deepsymmetry.playlink.ExclusivityMonitor;
import org.deepsymmetry.playlink.FakeAudioEngine;
import org.deepsymmetry.playlink.FakeSource;
import org.deepsymmetry.playlink.PlaybackCallback;
import org.deepsymmetry.playlink.PlaybackContext;
import org.deepsymmetry.playlink.PlaybackEvent;
import org.deepsymmetry.playlink.PlaybackSettings;
import org.deepsymmetry.playlink.PlayerState;
import org.deepsymmetry.playlink.StateChangeEvent;
import org.deepsymmetry.playlink.SamplePlaylists;
import org.deepsymmetry.playlink.VolumeChangeEvent;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SourceRegistryTest {

    private ExclusivityMonitor monitor;
    private PlaybackContext context;
    private SourceRegistry registry;

    @Before
    public void setUp() {
        monitor = new ExclusivityMonitor();
        final PlaybackSettings settings = new PlaybackSettings();
        settings.stopConfirmDelayMillis = 5;
        settings.shutdownJoinTimeoutMillis = 500;
        context = new PlaybackContext(settings, new FakeAudioEngine(monitor), new Random(5),
                getClass().getClassLoader());
        registry = context.getRegistry();
    }

    @After
    public void tearDown() {
        context.shutdown();
    }

    private static class FakeProvider implements SourceProvider {
        private final String name;
        private final String createdName;
        private final ExclusivityMonitor monitor;

        FakeProvider(String name, String createdName, ExclusivityMonitor monitor) {
            this.name = name;
            this.createdName = createdName;
            this.monitor = monitor;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Source createSource(PlaybackCallback callback) {
            return new FakeSource(createdName, callback, monitor);
        }
    }

    @Test
    public void localSourceIsAlwaysLoaded() {
        assertTrue(registry.isLoaded(SourceRegistry.LOCAL_SOURCE));
        assertTrue(registry.getAvailableSources().contains(SourceRegistry.LOCAL_SOURCE));
        assertFalse(registry.unregister(SourceRegistry.LOCAL_SOURCE));
        assertTrue(registry.isLoaded(SourceRegistry.LOCAL_SOURCE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateNamesAreRejected() {
        registry.register(new FakeSource("alpha", context, monitor));
        registry.register(new FakeSource("alpha", context, monitor));
    }

    @Test
    public void unknownSourceIsUnavailable() {
        try {
            registry.enable("missing");
            fail("Expected an unknown source to be unavailable");
        } catch (SourceUnavailableException e) {
            assertEquals("missing", e.sourceName);
        }
        try {
            registry.require("missing");
            fail("Expected an unloaded source to be unavailable");
        } catch (SourceUnavailableException e) {
            assertEquals("missing", e.sourceName);
        }
    }

    @Test
    public void addedProviderCanBeEnabled() throws Exception {
        registry.addProvider(new FakeProvider("alpha", "alpha", monitor));
        assertTrue(registry.getAvailableSources().contains("alpha"));
        assertFalse(registry.isLoaded("alpha"));

        final SourceHandle handle = registry.enable("alpha");
        assertEquals("alpha", handle.getName());
        assertTrue(handle.supports(Capability.QUERY_PLAYBACK));
        assertSame(handle, registry.enable("alpha"));
        assertSame(handle, registry.require("alpha"));
    }

    @Test
    public void providerMustCreateSourceWithItsName() {
        registry.addProvider(new FakeProvider("alpha", "impostor", monitor));
        try {
            registry.enable("alpha");
            fail("Expected a misnamed source to be rejected");
        } catch (SourceUnavailableException e) {
            assertFalse(registry.isLoaded("alpha"));
            assertFalse(registry.isLoaded("impostor"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void providerCannotClaimLocalName() {
        registry.addProvider(new FakeProvider(SourceRegistry.LOCAL_SOURCE, "alpha", monitor));
    }

    @Test
    public void enableAllSkipsFailures() {
        registry.addProvider(new FakeProvider("alpha", "alpha", monitor));
        assertEquals(1, registry.enableAll(Arrays.asList("alpha", "missing")));
        assertEquals(new ArrayList<>(Arrays.asList(SourceRegistry.LOCAL_SOURCE, "alpha")),
                new ArrayList<>(registry.getLoadedSources()));
    }

    @Test
    public void disablingPlayingSourceHandsBackToLocal() throws Exception {
        final List<String> seenWhileUnloading = Collections.synchronizedList(new ArrayList<>());
        registry.addRegistryListener(new SourceRegistryListener() {
            @Override
            public void sourceLoaded(SourceHandle handle) {
            }

            @Override
            public void sourceUnloading(String sourceName) {
                seenWhileUnloading.add(sourceName + " loaded:" + registry.isLoaded(sourceName)
                        + " active:" + context.getOrchestrator().getActiveSource());
            }
        });
        registry.addProvider(new FakeProvider("alpha", "alpha", monitor));
        final SourceHandle handle = registry.enable("alpha");
        final FakeSource alpha = (FakeSource) handle.getSource();
        assertTrue(context.getPlayer().play("alpha", null));
        assertTrue(alpha.isPlaying());

        assertTrue(registry.disable("alpha"));

        assertEquals(Collections.singletonList("alpha loaded:true active:local"), seenWhileUnloading);
        assertTrue(context.getOrchestrator().isLocalActive());
        assertFalse(alpha.isPlaying());
        assertTrue(alpha.getCommands().contains("shutdown"));
        assertFalse(registry.isLoaded("alpha"));
        for (EventType type : EventType.values()) {
            assertTrue(context.getEventBus().getSubscribers(type).isEmpty());
        }
        assertTrue("provider is still there", registry.getAvailableSources().contains("alpha"));

        assertTrue(registry.removeProvider("alpha"));
        assertFalse(registry.getAvailableSources().contains("alpha"));
        assertFalse(registry.disable("alpha"));
    }

    @Test
    public void scanFindsRegisteredProviders() throws Exception {
        assertTrue(registry.scan().contains(DiscoverableSourceProvider.NAME));
        assertTrue(registry.getAvailableSources().contains(DiscoverableSourceProvider.NAME));
        final SourceHandle handle = registry.enable(DiscoverableSourceProvider.NAME);
        assertNotNull(handle);
        assertTrue(handle.getSource() instanceof FakeSource);
    }

    @Test
    public void listenerSourcesReceiveEvents() throws Exception {
        final FakeSource alpha = new FakeSource("alpha", context, monitor);
        registry.register(alpha);
        context.getPlayer().loadPlaylist(SamplePlaylists.of(2));
        context.getPlayer().play();
        context.getPlayer().setVolume(40);

        final long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline && !hasVolumeChange(alpha.getEvents())) {
            Thread.sleep(20);
        }
        assertTrue(hasVolumeChange(alpha.getEvents()));
        boolean sawPlaying = false;
        for (PlaybackEvent event : alpha.getEvents()) {
            if (event instanceof StateChangeEvent && ((StateChangeEvent) event).newState == PlayerState.PLAYING) {
                sawPlaying = true;
            }
        }
        assertTrue(sawPlaying);
    }

    private static boolean hasVolumeChange(List<PlaybackEvent> events) {
        for (PlaybackEvent event : events) {
            if (event instanceof VolumeChangeEvent && ((VolumeChangeEvent) event).newVolume == 40) {
                return true;
            }
        }
        return false;
    }

    @Test
    public void failingCommandsAreContained() {
        final SourceHandle handle = registry.register(new FakeSource("broken", context, monitor, Capability.PLAY) {
            @Override
            public boolean play(List<String> args) {
                throw new IllegalStateException("Simulated source failure");
            }
        });
        assertFalse(handle.play(Collections.emptyList()));
        assertFalse("unsupported commands are refused", handle.stop(Collections.emptyList()));
        assertNull(handle.queryPlayback());
    }
}
