package org.deepsymmetry.playlink.source;

import org.apiguardian.api.API;
import org.deepsymmetry.playlink.PlaybackCallback;
import org.deepsymmetry.playlink.data.PlaybackUpdate;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * <p>A convenient starting point for writing a {@link Source}. Every command fails by default, so subclasses only
 * override the ones they declare in their capabilities. {@link #shutdown()} stops playback.</p>
 *
 * <p>Subclasses get helpers for the two things sources most often need from the rest of the system: claiming the
 * right to play, and reporting what they are doing.</p>
 */
@API(status = API.Status.STABLE)
public abstract class AbstractSource implements Source {

    private final String name;

    private final Set<Capability> capabilities;

    /**
     * How the source talks back to the playback system. May be {@code null} for sources created outside a
     * registry.
     */
    protected final PlaybackCallback callback;

    /**
     * Constructor for subclasses.
     *
     * @param name the name of the source
     * @param callback how the source reports back to the playback system, may be {@code null}
     * @param capabilities the operations the source supports
     */
    @API(status = API.Status.STABLE)
    protected AbstractSource(String name, PlaybackCallback callback, Capability... capabilities) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Source name must not be empty");
        }
        this.name = name;
        this.callback = callback;
        final EnumSet<Capability> set = EnumSet.noneOf(Capability.class);
        Collections.addAll(set, capabilities);
        this.capabilities = Collections.unmodifiableSet(set);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    @Override
    public boolean play(List<String> args) {
        return false;
    }

    @Override
    public boolean pause(List<String> args) {
        return false;
    }

    @Override
    public boolean stop(List<String> args) {
        return false;
    }

    @Override
    public boolean next(List<String> args) {
        return false;
    }

    @Override
    public boolean prev(List<String> args) {
        return false;
    }

    @Override
    public boolean setVolume(int level) {
        return false;
    }

    @Override
    public SourcePlayback getCurrentPlayback() {
        return null;
    }

    @Override
    public void shutdown() {
        stop(Collections.emptyList());
    }

    /**
     * Become the active source and start producing sound, silencing whatever else is playing first. Use this
     * whenever the source starts playing without having been told to.
     *
     * @param start starts the sound, returning {@code true} if it did
     *
     * @return {@code true} if this source is now active and playing
     */
    @API(status = API.Status.STABLE)
    protected boolean playExclusively(BooleanSupplier start) {
        return callback != null && callback.playExclusively(name, start);
    }

    /**
     * Report a change in what this source is doing. Reports are ignored unless this is the active source.
     *
     * @param update the fields that changed
     */
    @API(status = API.Status.STABLE)
    protected void reportPlayback(PlaybackUpdate update) {
        if (callback != null) {
            callback.updatePlaybackInfo(update.source(name));
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name:" + name + ", capabilities:" + capabilities + "]";
    }
}
