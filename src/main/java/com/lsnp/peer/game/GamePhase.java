package com.lsnp.peer.game;

/**
 * Game lifecycle: invited, playing, over.
 */
public enum GamePhase {
    PENDING,
    ACTIVE,
    FINISHED
}
