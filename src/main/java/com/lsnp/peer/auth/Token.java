package com.lsnp.peer.auth;

/**
 * Capability token. Wire form: {@code identity|expiry|scope}, expiry in unix seconds.
 * The scope is kept as its raw wire string so unknown scopes still parse and simply fail the scope check.
 */
public record Token(String identity, long expiry, String scope) {

    private static final char SEP = '|';

    public Token {
        if (identity == null || identity.indexOf(SEP) >= 0) {
            throw new IllegalArgumentException("invalid token identity: " + identity);
        }
        if (scope == null || scope.indexOf(SEP) >= 0) {
            throw new IllegalArgumentException("invalid token scope: " + scope);
        }
    }

    /**
     * Parse a token from its wire form.
     * @return the token, or null if it does not have three fields with a numeric expiry
     */
    public static Token parse(String raw) {
        if (raw == null) {
            return null;
        }
        String[] parts = raw.split("\\|", -1);
        if (parts.length != 3 || parts[0].isEmpty()) {
            return null;
        }
        try {
            return new Token(parts[0], Long.parseLong(parts[1].trim()), parts[2]);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isExpired(long nowSeconds) {
        return nowSeconds > expiry;
    }

    public String toWire() {
        return identity + SEP + expiry + SEP + scope;
    }
}
