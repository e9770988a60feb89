package com.lsnp.peer.game;

/**
 * Game notifications. Called on the receive thread or on the caller's thread for local moves.
 */
public interface GameListener {

    default void onGameInvite(GameInvite invite) {}

    default void onGameMove(GameSession session, GameMove move) {}

    default void onGameFinished(GameSession session, GameOutcome outcome) {}
}
