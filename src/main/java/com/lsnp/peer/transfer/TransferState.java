package com.lsnp.peer.transfer;

/**
 * Sender-side transfer states.
 */
public enum TransferState {
    OFFERED,     // FILE_OFFER sent, waiting for accept or reject
    ACCEPTED,
    SENDING,     // streaming FILE_CHUNKs
    SENT,        // all chunks sent, waiting for FILE_RECEIVED
    COMPLETED,
    TIMED_OUT,   // no decision (or no ACK for the offer) in time
    REJECTED,
    EXPIRED,     // no FILE_RECEIVED within the receipt window
    FAILED;      // local file could not be read

    public boolean isTerminal() {
        return switch (this) {
            case COMPLETED, TIMED_OUT, REJECTED, EXPIRED, FAILED -> true;
            default -> false;
        };
    }
}
