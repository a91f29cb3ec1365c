package org.deepsymmetry.playlink;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * <p>The configuration parameters of the playback system. A simple mutable class (and therefore not thread-safe);
 * the values are read when a {@link PlaybackContext} is created.</p>
 *
 * <p>{@link #load()} reads {@value #RESOURCE_NAME} from the class path, then applies any system properties whose
 * names are the same keys prefixed with {@value #SYSTEM_PROPERTY_PREFIX}. Values that cannot be parsed are logged
 * and leave the default in place.</p>
 */
@API(status = API.Status.STABLE)
public class PlaybackSettings {

    private static final Logger logger = LoggerFactory.getLogger(PlaybackSettings.class);

    /**
     * The class path resource from which settings are loaded.
     */
    @API(status = API.Status.STABLE)
    public static final String RESOURCE_NAME = "playlink.properties";

    /**
     * The prefix of system properties which override the resource.
     */
    @API(status = API.Status.STABLE)
    public static final String SYSTEM_PROPERTY_PREFIX = "playlink.";

    /**
     * The sort order value that turns shuffle mode on.
     */
    @API(status = API.Status.STABLE)
    public static final String RANDOM_SORT = "random";

    /**
     * Create an instance with default settings values.
     */
    @API(status = API.Status.STABLE)
    public PlaybackSettings() {
        // Nothing to do.
    }

    /**
     * The volume level at startup, from 0 to 100.
     */
    @API(status = API.Status.STABLE)
    public int defaultVolume = 70;

    /**
     * How the local playlist is ordered. {@value #RANDOM_SORT} turns on shuffle mode.
     */
    @API(status = API.Status.STABLE)
    public String defaultSort = "name";

    /**
     * How often the watchdog checks the local engine, in milliseconds.
     */
    @API(status = API.Status.STABLE)
    public long watchdogIntervalMillis = 100;

    /**
     * How long a local track must have been playing before an engine that was never seen busy counts as having
     * finished it, in milliseconds.
     */
    @API(status = API.Status.STABLE)
    public long idleGraceMillis = 500;

    /**
     * How often the local playback position is reported, in milliseconds.
     */
    @API(status = API.Status.STABLE)
    public long positionReportIntervalMillis = 1000;

    /**
     * How many times an outgoing source is checked for having stopped when switching sources.
     */
    @API(status = API.Status.STABLE)
    public int stopConfirmAttempts = 5;

    /**
     * The wait between those checks, in milliseconds.
     */
    @API(status = API.Status.STABLE)
    public long stopConfirmDelayMillis = 100;

    /**
     * How long shutdown waits for background threads, in milliseconds.
     */
    @API(status = API.Status.STABLE)
    public long shutdownJoinTimeoutMillis = 2000;

    /**
     * How many undelivered events each event subscriber may have waiting.
     */
    @API(status = API.Status.STABLE)
    public int subscriberQueueCapacity = 256;

    /**
     * How old a plugin source's playback report may be before it is asked again, in milliseconds.
     */
    @API(status = API.Status.STABLE)
    public long sourceRefreshIntervalMillis = 1000;

    /**
     * Whether the sources listed in {@link #enabledSources} are loaded at startup.
     */
    @API(status = API.Status.STABLE)
    public boolean autoLoadSources = false;

    /**
     * The sources to load at startup when {@link #autoLoadSources} is on.
     */
    @API(status = API.Status.STABLE)
    public List<String> enabledSources = new ArrayList<>();

    /**
     * Check whether the configured sort order asks for shuffle mode.
     *
     * @return {@code true} if tracks should be played in random order
     */
    @API(status = API.Status.STABLE)
    public boolean isShuffle() {
        return RANDOM_SORT.equalsIgnoreCase(defaultSort);
    }

    /**
     * Load settings from the class path resource and system properties.
     *
     * @return the loaded settings
     */
    @API(status = API.Status.STABLE)
    public static PlaybackSettings load() {
        return load(PlaybackSettings.class.getClassLoader(), System.getProperties());
    }

    /**
     * Load settings from the resource as found by a specific class loader, then apply overrides.
     *
     * @param classLoader where to look for {@value #RESOURCE_NAME}
     * @param overrides properties whose {@value #SYSTEM_PROPERTY_PREFIX}-prefixed entries take precedence
     *
     * @return the loaded settings
     */
    @API(status = API.Status.STABLE)
    public static PlaybackSettings load(ClassLoader classLoader, Properties overrides) {
        final Properties properties = new Properties();
        try (InputStream stream = classLoader.getResourceAsStream(RESOURCE_NAME)) {
            if (stream == null) {
                logger.info("No {} found, using default settings", RESOURCE_NAME);
            } else {
                properties.load(stream);
            }
        } catch (IOException e) {
            logger.warn("Problem reading {}, using default settings", RESOURCE_NAME, e);
        }
        if (overrides != null) {
            for (String name : overrides.stringPropertyNames()) {
                if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                    properties.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), overrides.getProperty(name));
                }
            }
        }
        return fromProperties(properties);
    }

    /**
     * Build settings from a set of properties using the unprefixed key names.
     *
     * @param properties the configuration values
     *
     * @return the settings, with defaults for anything missing or unparseable
     */
    @API(status = API.Status.STABLE)
    public static PlaybackSettings fromProperties(Properties properties) {
        final PlaybackSettings settings = new PlaybackSettings();
        settings.defaultVolume = Math.max(0, Math.min(100, (int) readLong(properties, "default.volume", settings.defaultVolume)));
        settings.defaultSort = properties.getProperty("default.sort", settings.defaultSort).trim();
        settings.watchdogIntervalMillis = readLong(properties, "watchdog.interval.ms", settings.watchdogIntervalMillis);
        settings.idleGraceMillis = readLong(properties, "watchdog.idle.grace.ms", settings.idleGraceMillis);
        settings.positionReportIntervalMillis = readLong(properties, "position.report.interval.ms", settings.positionReportIntervalMillis);
        settings.stopConfirmAttempts = (int) readLong(properties, "stop.confirm.attempts", settings.stopConfirmAttempts);
        settings.stopConfirmDelayMillis = readLong(properties, "stop.confirm.delay.ms", settings.stopConfirmDelayMillis);
        settings.shutdownJoinTimeoutMillis = readLong(properties, "shutdown.join.timeout.ms", settings.shutdownJoinTimeoutMillis);
        settings.subscriberQueueCapacity = (int) readLong(properties, "subscriber.queue.capacity", settings.subscriberQueueCapacity);
        settings.sourceRefreshIntervalMillis = readLong(properties, "source.refresh.interval.ms", settings.sourceRefreshIntervalMillis);
        settings.autoLoadSources = Boolean.parseBoolean(properties.getProperty("sources.auto.load", Boolean.toString(settings.autoLoadSources)).trim());
        final String enabled = properties.getProperty("sources.enabled", "");
        final List<String> names = new ArrayList<>();
        for (String name : enabled.split(",")) {
            if (!name.trim().isEmpty()) {
                names.add(name.trim());
            }
        }
        settings.enabledSources = names;
        return settings;
    }

    /**
     * Read a positive whole number, falling back to a default if it is missing or bad.
     */
    private static long readLong(Properties properties, String key, long defaultValue) {
        final String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            final long result = Long.parseLong(value.trim());
            if (result < 0) {
                logger.warn("Ignoring negative value {} for setting {}, using {}", value, key, defaultValue);
                return defaultValue;
            }
            return result;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparseable value {} for setting {}, using {}", value, key, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "PlaybackSettings[defaultVolume:" + defaultVolume + ", defaultSort:" + defaultSort +
                ", watchdogIntervalMillis:" + watchdogIntervalMillis + ", idleGraceMillis:" + idleGraceMillis +
                ", positionReportIntervalMillis:" + positionReportIntervalMillis +
                ", stopConfirmAttempts:" + stopConfirmAttempts + ", stopConfirmDelayMillis:" + stopConfirmDelayMillis +
                ", shutdownJoinTimeoutMillis:" + shutdownJoinTimeoutMillis +
                ", subscriberQueueCapacity:" + subscriberQueueCapacity +
                ", sourceRefreshIntervalMillis:" + sourceRefreshIntervalMillis +
                ", autoLoadSources:" + autoLoadSources + ", enabledSources:" + Collections.unmodifiableList(enabledSources) + "]";
    }
}
