package com.lsnp.peer.auth;

/**
 * Outcome of validating a token. Checks run in declaration order after OK;
 * the first failing check wins.
 */
public enum TokenStatus {
    OK,
    MALFORMED,
    EXPIRED,
    SCOPE_MISMATCH,
    REVOKED;

    public boolean isOk() {
        return this == OK;
    }
}
