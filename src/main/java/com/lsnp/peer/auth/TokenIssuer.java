package com.lsnp.peer.auth;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the local identity's current token per scope, minting a fresh one when
 * the cached token is no longer valid.
 */
public class TokenIssuer {

    private final TokenAuthority authority;
    private final String identity;
    private final long ttlSeconds;
    private final Map<TokenScope, String> current = new EnumMap<>(TokenScope.class);

    public TokenIssuer(TokenAuthority authority, String identity, long ttlSeconds) {
        this.authority = authority;
        this.identity = identity;
        this.ttlSeconds = ttlSeconds;
    }

    public synchronized String tokenFor(TokenScope scope) {
        String token = current.get(scope);
        if (token == null || authority.validate(token, scope) != TokenStatus.OK) {
            token = authority.mint(identity, scope, ttlSeconds);
            current.put(scope, token);
        }
        return token;
    }

    /**
     * Revoke every token minted here and still valid.
     * @return the revoked tokens, for announcing to peers
     */
    public synchronized List<String> revokeAll() {
        List<String> tokens = new ArrayList<>();
        for (String token : authority.issuedTokens()) {
            Token parsed = Token.parse(token);
            if (parsed != null && parsed.identity().equals(identity)) {
                authority.revoke(token);
                tokens.add(token);
            }
        }
        current.clear();
        return tokens;
    }

    public String identity() {
        return identity;
    }
}
