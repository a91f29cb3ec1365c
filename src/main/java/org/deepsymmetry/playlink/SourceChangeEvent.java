package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * Reports that a different source has become the active one, so it is now the only source allowed to produce
 * sound.
 */
@API(status = API.Status.STABLE)
public class SourceChangeEvent extends PlaybackEvent {

    /**
     * The name of the source which was active before the switch.
     */
    @API(status = API.Status.STABLE)
    public final String previousSource;

    /**
     * The name of the source which is now active.
     */
    @API(status = API.Status.STABLE)
    public final String newSource;

    /**
     * Create an event describing a source switch.
     *
     * @param previousSource the source that was active
     * @param newSource the source that is now active
     */
    @API(status = API.Status.STABLE)
    public SourceChangeEvent(String previousSource, String newSource) {
        this.previousSource = previousSource;
        this.newSource = newSource;
    }

    @Override
    public EventType getType() {
        return EventType.SOURCE_CHANGED;
    }

    @Override
    public void deliverTo(PlaybackListener listener) {
        listener.sourceChanged(this);
    }

    @Override
    public String toString() {
        return "SourceChangeEvent[previousSource:" + previousSource + ", newSource:" + newSource + "]";
    }
}
