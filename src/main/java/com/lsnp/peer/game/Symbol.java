package com.lsnp.peer.game;

public enum Symbol {
    X,
    O;

    public Symbol opposite() {
        return this == X ? O : X;
    }

    /** @return the symbol for a wire value, or null if it is neither X nor O */
    public static Symbol fromWire(String value) {
        if ("X".equals(value)) return X;
        if ("O".equals(value)) return O;
        return null;
    }
}
