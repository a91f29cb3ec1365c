package org.deepsymmetry.playlink;

import org.deepsymmetry.playlink.data.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nothing is loaded in the engine. Playing starts the current track; moving through the playlist only changes
 * which track will be played.
 */
final class StoppedState implements TransportState {

    private static final Logger logger = LoggerFactory.getLogger(StoppedState.class);

    static final StoppedState INSTANCE = new StoppedState();

    private StoppedState() {
    }

    @Override
    public PlayerState getState() {
        return PlayerState.STOPPED;
    }

    @Override
    public boolean play(PlayerStateMachine player) {
        return player.startCurrent();
    }

    @Override
    public boolean pause(PlayerStateMachine player) {
        logger.warn("Cannot pause: player is stopped");
        return false;
    }

    @Override
    public boolean stop(PlayerStateMachine player) {
        return true;  // Already stopped.
    }

    @Override
    public boolean next(PlayerStateMachine player) {
        return player.advance(Direction.NEXT, false);
    }

    @Override
    public boolean previous(PlayerStateMachine player) {
        return player.advance(Direction.PREVIOUS, false);
    }
}
