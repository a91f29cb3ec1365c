package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.EventBus;
import org.deepsymmetry.playlink.EventType;
import org.deepsymmetry.playlink.PlaybackCallback;
import org.deepsymmetry.playlink.PlaybackEventListener;
import org.deepsymmetry.playlink.PlaybackListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <p>Keeps track of the sources that could be used and the ones that are actually loaded.</p>
 *
 * <p>A source is <em>available</em> when a {@link SourceProvider} for it has been discovered through
 * {@link ServiceLoader} or added with {@link #addProvider(SourceProvider)}, or when it is loaded. It is
 * <em>loaded</em> once it has been created and registered, at which point it can be commanded through its
 * {@link SourceHandle}. The local source is always loaded and can never be unloaded.</p>
 *
 * <p>Unloading a source tells the registry listeners first, while the source can still be commanded, so that
 * playback can be moved away from it before its event subscriptions are removed and it is dropped.</p>
 */
@API(status = API.Status.STABLE)
public class SourceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SourceRegistry.class);

    /**
     * The name of the source which plays tracks through the local engine.
     */
    @API(status = API.Status.STABLE)
    public static final String LOCAL_SOURCE = "local";

    /**
     * Where loaded sources that want playback events are subscribed.
     */
    private final EventBus eventBus;

    /**
     * The class loader used to discover providers.
     */
    private final ClassLoader classLoader;

    /**
     * Providers found by the last scan, keyed by source name.
     */
    private final Map<String, SourceProvider> discoveredProviders = new LinkedHashMap<>();

    /**
     * Providers added by code rather than discovered, keyed by source name.
     */
    private final Map<String, SourceProvider> addedProviders = new LinkedHashMap<>();

    /**
     * The loaded sources, in the order they were loaded.
     */
    private final Map<String, SourceHandle> loaded = new LinkedHashMap<>();

    /**
     * Keeps track of the registered registry listeners.
     */
    private final List<SourceRegistryListener> registryListeners = new CopyOnWriteArrayList<>();

    /**
     * The callback handed to sources created from providers.
     */
    private volatile PlaybackCallback playbackCallback;

    /**
     * Create a registry which discovers providers with the context class loader.
     *
     * @param eventBus where sources that implement {@link PlaybackListener} will be subscribed
     */
    @API(status = API.Status.STABLE)
    public SourceRegistry(EventBus eventBus) {
        this(eventBus, Thread.currentThread().getContextClassLoader());
    }

    /**
     * Create a registry which discovers providers with a specific class loader.
     *
     * @param eventBus where sources that implement {@link PlaybackListener} will be subscribed
     * @param classLoader used to find provider configuration files and classes
     */
    @API(status = API.Status.STABLE)
    public SourceRegistry(EventBus eventBus, ClassLoader classLoader) {
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus must not be null");
        }
        this.eventBus = eventBus;
        this.classLoader = classLoader;
    }

    /**
     * Set the callback that will be handed to sources created by {@link #enable(String)}.
     *
     * @param callback the narrow interface sources can use to report back
     */
    @API(status = API.Status.INTERNAL)
    public void setPlaybackCallback(PlaybackCallback callback) {
        playbackCallback = callback;
    }

    /**
     * Adds the specified registry listener to be told when sources are loaded and unloaded.
     *
     * @param listener the listener to add
     */
    @API(status = API.Status.STABLE)
    public void addRegistryListener(SourceRegistryListener listener) {
        if (listener != null && !registryListeners.contains(listener)) {
            registryListeners.add(listener);
        }
    }

    /**
     * Removes the specified registry listener.
     *
     * @param listener the listener to remove
     */
    @API(status = API.Status.STABLE)
    public void removeRegistryListener(SourceRegistryListener listener) {
        if (listener != null) {
            registryListeners.remove(listener);
        }
    }

    /**
     * Look for source providers on the class path, replacing the results of any earlier scan. A provider that
     * cannot be instantiated is logged and skipped.
     *
     * @return the names of the sources whose providers were found
     */
    @API(status = API.Status.STABLE)
    public synchronized Set<String> scan() {
        discoveredProviders.clear();
        final ServiceLoader<SourceProvider> loader = ServiceLoader.load(SourceProvider.class, classLoader);
        final Iterator<SourceProvider> iterator = loader.iterator();
        while (true) {
            try {
                if (!iterator.hasNext()) {
                    break;
                }
                final SourceProvider provider = iterator.next();
                final String name = provider.getName();
                if (name == null || name.isEmpty() || LOCAL_SOURCE.equals(name)) {
                    logger.warn("Ignoring source provider {} with unusable name {}", provider.getClass().getName(), name);
                } else if (discoveredProviders.putIfAbsent(name, provider) != null) {
                    logger.warn("Ignoring duplicate provider {} for source {}", provider.getClass().getName(), name);
                }
            } catch (ServiceConfigurationError e) {
                logger.warn("Problem loading source provider, skipping it", e);
            }
        }
        logger.info("Scan found source providers {}", discoveredProviders.keySet());
        return Collections.unmodifiableSet(new LinkedHashSet<>(discoveredProviders.keySet()));
    }

    /**
     * Make a provider available without it having to be discovered.
     *
     * @param provider the provider to add
     *
     * @throws IllegalArgumentException if the provider has no usable name
     */
    @API(status = API.Status.STABLE)
    public synchronized void addProvider(SourceProvider provider) {
        final String name = provider.getName();
        if (name == null || name.isEmpty() || LOCAL_SOURCE.equals(name)) {
            throw new IllegalArgumentException("Provider name must be non-empty and not \"" + LOCAL_SOURCE + "\"");
        }
        addedProviders.put(name, provider);
    }

    /**
     * Withdraw a provider that was added with {@link #addProvider(SourceProvider)}. A source that is already loaded
     * stays loaded.
     *
     * @param name the name of the source whose provider should be withdrawn
     *
     * @return {@code true} if a provider was withdrawn
     */
    @API(status = API.Status.STABLE)
    public synchronized boolean removeProvider(String name) {
        return addedProviders.remove(name) != null;
    }

    private SourceProvider findProvider(String name) {
        final SourceProvider added = addedProviders.get(name);
        return (added != null) ? added : discoveredProviders.get(name);
    }

    /**
     * Load a source that was created directly rather than through a provider. If the source implements
     * {@link PlaybackListener} it is subscribed to every event type.
     *
     * @param source the source to load
     *
     * @return the handle through which the source can now be commanded
     *
     * @throws IllegalArgumentException if a source with the same name is already loaded
     */
    @API(status = API.Status.STABLE)
    public SourceHandle register(Source source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        final String name = source.getName();
        PlaybackEventListener router = null;
        if (source instanceof PlaybackListener) {
            final PlaybackListener listener = (PlaybackListener) source;
            router = event -> event.deliverTo(listener);
        }
        final SourceHandle handle = new SourceHandle(source, router);
        synchronized (this) {
            if (loaded.containsKey(name)) {
                throw new IllegalArgumentException("A source named " + name + " is already loaded");
            }
            loaded.put(name, handle);
        }
        if (router != null) {
            for (EventType type : EventType.values()) {
                eventBus.subscribe(type, router);
            }
        }
        logger.info("Loaded source {} with capabilities {}", name, handle.getCapabilities());
        for (SourceRegistryListener listener : registryListeners) {
            try {
                listener.sourceLoaded(handle);
            } catch (Throwable t) {
                logger.warn("Problem delivering source loaded announcement to listener", t);
            }
        }
        return handle;
    }

    /**
     * Create and load the source with the specified name from its provider. Enabling a source that is already
     * loaded just returns its handle.
     *
     * @param name the name of the source to enable
     *
     * @return the handle of the loaded source
     *
     * @throws SourceUnavailableException if there is no provider for that name, or it fails to create the source
     */
    @API(status = API.Status.STABLE)
    public SourceHandle enable(String name) throws SourceUnavailableException {
        final SourceProvider provider;
        synchronized (this) {
            final SourceHandle existing = loaded.get(name);
            if (existing != null) {
                return existing;
            }
            provider = findProvider(name);
        }
        if (provider == null) {
            throw new SourceUnavailableException(name, "No provider is available for source " + name);
        }
        final Source source;
        try {
            source = provider.createSource(playbackCallback);
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(name, "Provider failed to create source " + name, e);
        }
        if (source == null || !name.equals(source.getName())) {
            throw new SourceUnavailableException(name, "Provider for " + name + " created a source with the wrong name");
        }
        try {
            return register(source);
        } catch (IllegalArgumentException e) {
            throw new SourceUnavailableException(name, "Source " + name + " was loaded concurrently", e);
        }
    }

    /**
     * Enable every source in a list, logging rather than failing on the ones that cannot be enabled.
     *
     * @param names the sources to enable
     *
     * @return the number of sources which are loaded afterwards from that list
     */
    @API(status = API.Status.STABLE)
    public int enableAll(Collection<String> names) {
        int count = 0;
        for (String name : names) {
            try {
                enable(name);
                count++;
            } catch (SourceUnavailableException e) {
                logger.warn("Unable to enable source {}", name, e);
            }
        }
        return count;
    }

    /**
     * Unload a source. It is first marked as unloading, so it can no longer be made active. Registry listeners are
     * told next, while the source can still be commanded, then its event subscriptions are removed, its shutdown
     * hook is called, and it is dropped from the loaded set. It remains available only if a provider for it can
     * still be found.
     *
     * @param name the name of the source to unload
     *
     * @return {@code true} if the source had been loaded
     */
    @API(status = API.Status.STABLE)
    public boolean unregister(String name) {
        if (LOCAL_SOURCE.equals(name)) {
            logger.warn("The local source cannot be unloaded");
            return false;
        }
        final SourceHandle handle = get(name);
        if (handle == null) {
            logger.debug("Source {} is not loaded, nothing to unload", name);
            return false;
        }
        // From here on the orchestrator refuses to make this source active.
        handle.markUnloading();
        for (SourceRegistryListener listener : registryListeners) {
            try {
                listener.sourceUnloading(name);
            } catch (Throwable t) {
                logger.warn("Problem delivering source unloading announcement to listener", t);
            }
        }
        if (handle.getEventRouter() != null) {
            eventBus.unsubscribeAll(handle.getEventRouter());
        }
        handle.shutdown();
        synchronized (this) {
            loaded.remove(name);
        }
        logger.info("Unloaded source {}", name);
        return true;
    }

    /**
     * Another name for {@link #unregister(String)}, matching {@link #enable(String)}.
     *
     * @param name the name of the source to disable
     *
     * @return {@code true} if the source had been loaded
     */
    @API(status = API.Status.STABLE)
    public boolean disable(String name) {
        return unregister(name);
    }

    /**
     * Find a loaded source.
     *
     * @param name the source name
     *
     * @return its handle, or {@code null} if no source by that name is loaded
     */
    @API(status = API.Status.STABLE)
    public synchronized SourceHandle get(String name) {
        return loaded.get(name);
    }

    /**
     * Find a loaded source that must be present.
     *
     * @param name the source name
     *
     * @return its handle
     *
     * @throws SourceUnavailableException if no source by that name is loaded
     */
    @API(status = API.Status.STABLE)
    public SourceHandle require(String name) throws SourceUnavailableException {
        final SourceHandle handle = get(name);
        if (handle == null) {
            throw new SourceUnavailableException(name, "Source " + name + " is not loaded");
        }
        return handle;
    }

    /**
     * Check whether a source is loaded.
     *
     * @param name the source name
     *
     * @return {@code true} if it is loaded
     */
    @API(status = API.Status.STABLE)
    public synchronized boolean isLoaded(String name) {
        return loaded.containsKey(name);
    }

    /**
     * Get the names of every source that could be loaded, or already is.
     *
     * @return the available source names
     */
    @API(status = API.Status.STABLE)
    public synchronized Set<String> getAvailableSources() {
        final Set<String> result = new LinkedHashSet<>(loaded.keySet());
        result.addAll(discoveredProviders.keySet());
        result.addAll(addedProviders.keySet());
        return Collections.unmodifiableSet(result);
    }

    /**
     * Get the names of the loaded sources.
     *
     * @return the loaded source names, in the order they were loaded
     */
    @API(status = API.Status.STABLE)
    public synchronized Set<String> getLoadedSources() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(loaded.keySet()));
    }

    /**
     * Get the handles of the loaded sources.
     *
     * @return the handles, in the order the sources were loaded
     */
    @API(status = API.Status.STABLE)
    public synchronized List<SourceHandle> getLoadedHandles() {
        return Collections.unmodifiableList(new ArrayList<>(loaded.values()));
    }
}
