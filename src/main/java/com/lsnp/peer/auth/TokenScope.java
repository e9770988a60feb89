package com.lsnp.peer.auth;

/**
 * Capability scopes a token can grant. The wire name is the lower-case form
 * carried in the third token field.
 */
public enum TokenScope {
    CHAT("chat"),
    BROADCAST("broadcast"),
    FOLLOW("follow"),
    FILE("file"),
    GAME("game"),
    GROUP("group");

    private final String wireName;

    TokenScope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** @return the scope with this wire name, or null if unknown */
    public static TokenScope fromWire(String name) {
        for (TokenScope s : values()) {
            if (s.wireName.equals(name)) {
                return s;
            }
        }
        return null;
    }
}
