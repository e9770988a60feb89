package com.lsnp.peer.game;

/**
 * Result of applying a move, local or remote.
 */
public enum MoveOutcome {
    APPLIED,
    UNACKNOWLEDGED,   // applied locally, but the peer never ACKed the MOVE
    UNKNOWN_GAME,
    AWAITING_ACCEPT,  // local move on an invitation not yet accepted
    NOT_A_PLAYER,
    NOT_YOUR_TURN,
    DUPLICATE_TURN,
    OUT_OF_RANGE,
    OCCUPIED,
    FINISHED;

    /** True if the board changed. */
    public boolean isApplied() {
        return this == APPLIED || this == UNACKNOWLEDGED;
    }
}
