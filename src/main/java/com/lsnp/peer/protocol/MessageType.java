package com.lsnp.peer.protocol;

import com.lsnp.peer.auth.TokenScope;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.lsnp.peer.protocol.Fields.*;

/**
 * All message types in the LSNP protocol.
 *
 * Each type carries the token scope it must present (null for token-free types),
 * whether the receiver must ACK it, the header naming the sender, and the
 * headers a frame must carry to be decoded at all.
 */
public enum MessageType {

    // Presence
    PING             (null, false, USER_ID, USER_ID),
    PROFILE          (null, false, USER_ID, USER_ID, DISPLAY_NAME),

    // Social
    POST             (TokenScope.BROADCAST, false, USER_ID, USER_ID, CONTENT, TOKEN),
    LIKE             (TokenScope.BROADCAST, false, FROM, FROM, TO, ACTION, TOKEN),
    FOLLOW           (TokenScope.FOLLOW, false, FROM, FROM, TO, TOKEN),
    UNFOLLOW         (TokenScope.FOLLOW, false, FROM, FROM, TO, TOKEN),
    DM               (TokenScope.CHAT, true, FROM, FROM, TO, CONTENT, MESSAGE_ID, TOKEN),

    // Groups
    GROUP_CREATE     (TokenScope.GROUP, false, FROM, FROM, GROUP_ID, TOKEN),
    GROUP_UPDATE     (TokenScope.GROUP, false, FROM, FROM, GROUP_ID, TOKEN),
    GROUP_MESSAGE    (TokenScope.GROUP, false, FROM, FROM, GROUP_ID, TOKEN),

    // Tic-tac-toe
    TICTACTOE_INVITE (TokenScope.GAME, true, FROM, FROM, TO, GAME_ID, SYMBOL, MESSAGE_ID, TOKEN),
    TICTACTOE_MOVE   (TokenScope.GAME, true, FROM, FROM, TO, GAME_ID, SYMBOL, POSITION, TURN, MESSAGE_ID, TOKEN),
    TICTACTOE_RESULT (TokenScope.GAME, true, FROM, FROM, TO, GAME_ID, RESULT, MESSAGE_ID, TOKEN),

    // File transfer
    FILE_OFFER       (TokenScope.FILE, true, FROM, FROM, TO, FILE_ID, FILENAME, FILESIZE, TOTAL_CHUNKS, MESSAGE_ID, TOKEN),
    FILE_ACCEPT      (TokenScope.FILE, false, FROM, FROM, TO, FILE_ID, TOKEN),
    FILE_REJECT      (TokenScope.FILE, false, FROM, FROM, TO, FILE_ID, TOKEN),
    FILE_CHUNK       (TokenScope.FILE, true, FROM, FROM, TO, FILE_ID, CHUNK_INDEX, TOTAL_CHUNKS, DATA, MESSAGE_ID, TOKEN),
    FILE_RECEIVED    (null, false, FROM, FROM, TO, FILE_ID),

    // Control
    ACK              (null, false, null, MESSAGE_ID),
    REVOKE           (null, false, null, TOKEN);

    private final TokenScope scope;
    private final boolean reliable;
    private final String identityField;
    private final List<String> requiredFields;

    MessageType(TokenScope scope, boolean reliable, String identityField, String... requiredFields) {
        this.scope = scope;
        this.reliable = reliable;
        this.identityField = identityField;
        this.requiredFields = List.of(requiredFields);
    }

    /** The scope a token on this type must carry, or null if the type is token-free. */
    public TokenScope scope() {
        return scope;
    }

    public boolean requiresToken() {
        return scope != null;
    }

    /** True if the receiver ACKs this type and the sender retries until it does. */
    public boolean reliable() {
        return reliable;
    }

    /** Header holding the sender identity, or null for ACK and REVOKE. */
    public String identityField() {
        return identityField;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }

    public String wireName() {
        return name();
    }

    private static final Map<String, MessageType> LOOKUP = new HashMap<>();

    static {
        for (MessageType t : values()) {
            LOOKUP.put(t.wireName(), t);
        }
    }

    /**
     * Look up a MessageType by its TYPE header value.
     * @return the MessageType, or null if unknown
     */
    public static MessageType fromWire(String name) {
        return name == null ? null : LOOKUP.get(name);
    }
}
