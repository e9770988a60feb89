package com.lsnp.peer.game;

/**
 * RESULT header values.
 */
public enum ResultType {
    WIN,
    LOSS,
    DRAW,
    FORFEIT;

    /** @return the result type for a wire value, or null if unknown */
    public static ResultType fromWire(String value) {
        for (ResultType t : values()) {
            if (t.name().equals(value)) {
                return t;
            }
        }
        return null;
    }
}
