package org.deepsymmetry.playlink;

import org.deepsymmetry.playlink.data.Direction;

/**
 * A track is loaded in the engine but suspended. Playing resumes it where it left off; moving through the playlist
 * starts the new track playing.
 */
final class PausedState implements TransportState {

    static final PausedState INSTANCE = new PausedState();

    private PausedState() {
    }

    @Override
    public PlayerState getState() {
        return PlayerState.PAUSED;
    }

    @Override
    public boolean play(PlayerStateMachine player) {
        return player.resumeEngine();
    }

    @Override
    public boolean pause(PlayerStateMachine player) {
        return true;
    }

    @Override
    public boolean stop(PlayerStateMachine player) {
        return player.stopEngine();
    }

    @Override
    public boolean next(PlayerStateMachine player) {
        return player.advance(Direction.NEXT, true);
    }

    @Override
    public boolean previous(PlayerStateMachine player) {
        return player.advance(Direction.PREVIOUS, true);
    }
}
