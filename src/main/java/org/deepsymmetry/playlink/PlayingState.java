package org.deepsymmetry.playlink;

import org.deepsymmetry.playlink.data.Direction;

/**
 * The engine is producing sound.
 */
final class PlayingState implements TransportState {

    static final PlayingState INSTANCE = new PlayingState();

    private PlayingState() {
    }

    @Override
    public PlayerState getState() {
        return PlayerState.PLAYING;
    }

    @Override
    public boolean play(PlayerStateMachine player) {
        return true;
    }

    @Override
    public boolean pause(PlayerStateMachine player) {
        return player.pauseEngine();
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
