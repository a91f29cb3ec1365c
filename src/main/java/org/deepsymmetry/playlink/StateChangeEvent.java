package org.deepsymmetry.playlink;

import org.apiguardian.api.API;

/**
 * Reports that the player moved from one transport state to another.
 */
@API(status = API.Status.STABLE)
public class StateChangeEvent extends PlaybackEvent {

    /**
     * The state that was in effect before the change.
     */
    @API(status = API.Status.STABLE)
    public final PlayerState previousState;

    /**
     * The state that is now in effect.
     */
    @API(status = API.Status.STABLE)
    public final PlayerState newState;

    /**
     * The name of the source whose state changed, which is always the active source.
     */
    @API(status = API.Status.STABLE)
    public final String source;

    /**
     * Create an event describing a state transition.
     *
     * @param previousState the state before the change
     * @param newState the state after the change
     * @param source the name of the active source
     */
    @API(status = API.Status.STABLE)
    public StateChangeEvent(PlayerState previousState, PlayerState newState, String source) {
        this.previousState = previousState;
        this.newState = newState;
        this.source = source;
    }

    @Override
    public EventType getType() {
        return EventType.STATE_CHANGED;
    }

    @Override
    public void deliverTo(PlaybackListener listener) {
        listener.stateChanged(this);
    }

    @Override
    public String toString() {
        return "StateChangeEvent[previousState:" + previousState + ", newState:" + newState + ", source:" + source + "]";
    }
}
