package com.lsnp.peer.protocol;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable representation of an LSNP message: a type plus ordered header fields.
 *
 * Wire form (see {@link MessageCodec}):
 * <pre>
 * TYPE: TICTACTOE_MOVE
 * FROM: alice@192.168.1.10
 * GAMEID: g42
 * ...
 * (blank line)
 * </pre>
 */
public final class Message {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final MessageType type;
    private final Map<String, String> fields;

    public Message(MessageType type, Map<String, String> fields) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        this.type = type;
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(fields);
        copy.remove(Fields.TYPE);
        this.fields = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(MessageType type) {
        return new Builder(type);
    }

    /** Random 64-bit message id as 16 hex digits. */
    public static String newMessageId() {
        return String.format("%016x", RANDOM.nextLong());
    }

    public MessageType type()            { return type; }
    public Map<String, String> fields()  { return fields; }
    public boolean has(String key)       { return fields.containsKey(key); }
    public String messageId()            { return fields.get(Fields.MESSAGE_ID); }
    public String token()                { return fields.get(Fields.TOKEN); }

    /** Field value, or null if absent. */
    public String get(String key) {
        return fields.get(key);
    }

    /** Sender identity taken from the type's identity header, or null. */
    public String identity() {
        String field = type.identityField();
        return field == null ? null : fields.get(field);
    }

    public String require(String key) throws MessageException {
        String value = fields.get(key);
        if (value == null || value.isEmpty()) {
            throw new MessageException(type + " missing field " + key);
        }
        return value;
    }

    public int requireInt(String key) throws MessageException {
        String value = require(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MessageException(type + " field " + key + " is not an integer: " + value, e);
        }
    }

    public long requireLong(String key) throws MessageException {
        String value = require(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new MessageException(type + " field " + key + " is not a number: " + value, e);
        }
    }

    @Override
    public String toString() {
        return String.format("Message[type=%s, id=%s, fields=%d]", type, messageId(), fields.size());
    }

    public static final class Builder {

        private final MessageType type;
        private final LinkedHashMap<String, String> fields = new LinkedHashMap<>();

        private Builder(MessageType type) {
            this.type = type;
        }

        public Builder field(String key, String value) {
            if (key == null || key.isEmpty() || key.contains(":") || containsLineBreak(key)) {
                throw new IllegalArgumentException("invalid field name: " + key);
            }
            if (value == null) {
                throw new IllegalArgumentException("field " + key + " must not be null");
            }
            if (containsLineBreak(value)) {
                throw new IllegalArgumentException("field " + key + " must not contain line breaks");
            }
            fields.put(key, value);
            return this;
        }

        public Builder field(String key, long value) {
            return field(key, Long.toString(value));
        }

        public Message build() {
            return new Message(type, fields);
        }

        private static boolean containsLineBreak(String s) {
            return s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0;
        }
    }
}
