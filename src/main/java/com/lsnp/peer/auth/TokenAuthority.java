package com.lsnp.peer.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mints, validates and revokes capability tokens.
 *
 * Validation order: malformed, expired, scope mismatch, revoked. Revocations are
 * kept until the revoked token's own expiry and dropped lazily after that, since an
 * expired token already fails validation on its own.
 */
public class TokenAuthority {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthority.class);

    public static final long DEFAULT_TTL_SECONDS = 3600;

    private final Clock clock;
    private final Map<String, Long> revoked = new ConcurrentHashMap<>();
    private final Map<String, Long> issued = new ConcurrentHashMap<>();

    public TokenAuthority() {
        this(Clock.systemUTC());
    }

    public TokenAuthority(Clock clock) {
        this.clock = clock;
    }

    /**
     * Mint a token for {@code identity} valid for {@code ttlSeconds} from now.
     * The token is remembered so it can be revoked on shutdown.
     */
    public String mint(String identity, TokenScope scope, long ttlSeconds) {
        long expiry = nowSeconds() + ttlSeconds;
        String raw = new Token(identity, expiry, scope.wireName()).toWire();
        // a revoked token minted earlier in the same second must not be handed out again
        while (revoked.containsKey(raw)) {
            expiry++;
            raw = new Token(identity, expiry, scope.wireName()).toWire();
        }
        issued.put(raw, expiry);
        return raw;
    }

    /**
     * Validate a raw token.
     *
     * @param expectedScope scope required by the message type, or null to skip the scope check
     */
    public TokenStatus validate(String raw, TokenScope expectedScope) {
        Token token = Token.parse(raw);
        if (token == null) {
            return TokenStatus.MALFORMED;
        }
        if (token.isExpired(nowSeconds())) {
            return TokenStatus.EXPIRED;
        }
        if (expectedScope != null && !expectedScope.wireName().equals(token.scope())) {
            return TokenStatus.SCOPE_MISMATCH;
        }
        if (isRevoked(raw)) {
            return TokenStatus.REVOKED;
        }
        return TokenStatus.OK;
    }

    /**
     * Revoke a token. Revoking twice is a no-op; malformed tokens are ignored.
     */
    public void revoke(String raw) {
        Token token = Token.parse(raw);
        if (token == null) {
            log.debug("Ignoring revocation of malformed token");
            return;
        }
        issued.remove(raw);
        if (revoked.putIfAbsent(raw, token.expiry()) == null) {
            log.info("Revoked token for {} (scope {})", token.identity(), token.scope());
        }
    }

    public boolean isRevoked(String raw) {
        Long expiry = revoked.get(raw);
        if (expiry == null) {
            return false;
        }
        if (nowSeconds() > expiry) {
            revoked.remove(raw);
            return false;
        }
        return true;
    }

    /** Tokens minted here that are neither expired nor revoked. */
    public List<String> issuedTokens() {
        long now = nowSeconds();
        issued.entrySet().removeIf(e -> now > e.getValue());
        return new ArrayList<>(issued.keySet());
    }

    /** Drop revocation records whose tokens have expired. */
    public void purgeExpired() {
        long now = nowSeconds();
        int before = revoked.size();
        revoked.entrySet().removeIf(e -> now > e.getValue());
        int removed = before - revoked.size();
        if (removed > 0) {
            log.debug("Purged {} expired revocation(s)", removed);
        }
    }

    public int revocationCount() {
        return revoked.size();
    }

    long nowSeconds() {
        return clock.millis() / 1000;
    }
}
