package org.deepsymmetry.playlink;

import org.junit.Test;

import java.util.Arrays;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PlaybackSettingsTest {

    @Test
    public void defaultsComeFromBundledResource() {
        final PlaybackSettings settings = PlaybackSettings.load(getClass().getClassLoader(), new Properties());
        assertEquals(70, settings.defaultVolume);
        assertEquals("name", settings.defaultSort);
        assertFalse(settings.isShuffle());
        assertEquals(100, settings.watchdogIntervalMillis);
        assertEquals(500, settings.idleGraceMillis);
        assertEquals(5, settings.stopConfirmAttempts);
        assertEquals(256, settings.subscriberQueueCapacity);
        assertFalse(settings.autoLoadSources);
        assertTrue(settings.enabledSources.isEmpty());
    }

    @Test
    public void prefixedOverridesWin() {
        final Properties overrides = new Properties();
        overrides.setProperty("playlink.default.volume", "35");
        overrides.setProperty("playlink.default.sort", "random");
        overrides.setProperty("default.volume", "5");
        overrides.setProperty("unrelated.setting", "x");
        final PlaybackSettings settings = PlaybackSettings.load(getClass().getClassLoader(), overrides);
        assertEquals(35, settings.defaultVolume);
        assertTrue(settings.isShuffle());
    }

    @Test
    public void badValuesFallBackToDefaults() {
        final Properties properties = new Properties();
        properties.setProperty("watchdog.interval.ms", "soon");
        properties.setProperty("stop.confirm.attempts", "-4");
        properties.setProperty("default.volume", "250");
        final PlaybackSettings settings = PlaybackSettings.fromProperties(properties);
        assertEquals(100, settings.watchdogIntervalMillis);
        assertEquals(5, settings.stopConfirmAttempts);
        assertEquals(100, settings.defaultVolume);
    }

    @Test
    public void enabledSourcesAreParsed() {
        final Properties properties = new Properties();
        properties.setProperty("sources.auto.load", "true");
        properties.setProperty("sources.enabled", " alpha, ,beta ");
        final PlaybackSettings settings = PlaybackSettings.fromProperties(properties);
        assertTrue(settings.autoLoadSources);
        assertEquals(Arrays.asList("alpha", "beta"), settings.enabledSources);
    }
}
