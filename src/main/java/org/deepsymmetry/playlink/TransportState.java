package org.deepsymmetry.playlink;

/**
 * The behavior of the local player in one of its states. Implementations hold no data of their own; everything
 * they change lives in the {@link PlayerStateMachine} they are given, and they are only called while its lock is
 * held.
 */
interface TransportState {

    /**
     * Identify the state whose behavior this is.
     *
     * @return the corresponding player state
     */
    PlayerState getState();

    boolean play(PlayerStateMachine player);

    boolean pause(PlayerStateMachine player);

    boolean stop(PlayerStateMachine player);

    boolean next(PlayerStateMachine player);

    boolean previous(PlayerStateMachine player);
}
