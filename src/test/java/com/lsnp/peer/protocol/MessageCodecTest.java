package com.lsnp.peer.protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private static Message decode(String raw) throws MessageException {
        byte[] data = raw.getBytes(StandardCharsets.UTF_8);
        return MessageCodec.decode(data, data.length);
    }

    @Test
    void encodesTypeFirstAndTerminatesWithBlankLine() {
        Message msg = Message.builder(MessageType.PING)
                .field(Fields.USER_ID, "alice@10.0.0.1")
                .build();
        String wire = new String(MessageCodec.encode(msg), StandardCharsets.UTF_8);
        assertEquals("TYPE: PING\nUSER_ID: alice@10.0.0.1\n\n", wire);
    }

    @Test
    void decodesFieldsInOrder() throws MessageException {
        Message msg = decode("TYPE: TICTACTOE_MOVE\nFROM: alice@10.0.0.1\nTO: bob@10.0.0.2\n"
                + "GAMEID: g1\nMESSAGE_ID: abc\nPOSITION: 4\nSYMBOL: X\nTURN: 1\nTOKEN: alice@10.0.0.1|99|game\n\n");
        assertEquals(MessageType.TICTACTOE_MOVE, msg.type());
        assertEquals("alice@10.0.0.1", msg.identity());
        assertEquals(4, msg.requireInt(Fields.POSITION));
        assertEquals("abc", msg.messageId());
        assertEquals("FROM", msg.fields().keySet().iterator().next());
        assertFalse(msg.has(Fields.TYPE));
    }

    @Test
    void acceptsCrLfLineEndings() throws MessageException {
        Message msg = decode("TYPE: PING\r\nUSER_ID: bob@10.0.0.2\r\n\r\n");
        assertEquals("bob@10.0.0.2", msg.get(Fields.USER_ID));
    }

    @Test
    void valueMayContainSeparator() throws MessageException {
        Message msg = decode("TYPE: PROFILE\nUSER_ID: bob@10.0.0.2\nDISPLAY_NAME: Bob: the builder\n\n");
        assertEquals("Bob: the builder", msg.get(Fields.DISPLAY_NAME));
    }

    @Test
    void ignoresEverythingAfterFirstBlankLine() throws MessageException {
        Message msg = decode("TYPE: PING\nUSER_ID: bob@10.0.0.2\n\nUSER_ID: mallory@10.0.0.9\n\n");
        assertEquals("bob@10.0.0.2", msg.get(Fields.USER_ID));
    }

    @Test
    void rejectsUnterminatedFrame() {
        assertThrows(MessageException.class, () -> decode("TYPE: PING\nUSER_ID: bob@10.0.0.2\n"));
    }

    @Test
    void rejectsUnknownType() {
        MessageException e = assertThrows(MessageException.class, () -> decode("TYPE: TELEPORT\nX: y\n\n"));
        assertTrue(e.getMessage().contains("unknown type"));
    }

    @Test
    void rejectsMissingType() {
        assertThrows(MessageException.class, () -> decode("USER_ID: bob@10.0.0.2\n\n"));
    }

    @Test
    void rejectsMissingRequiredField() {
        MessageException e = assertThrows(MessageException.class,
                () -> decode("TYPE: DM\nFROM: a@10.0.0.1\nTO: b@10.0.0.2\nCONTENT: hi\nTOKEN: a@10.0.0.1|9|chat\n\n"));
        assertTrue(e.getMessage().contains(Fields.MESSAGE_ID));
    }

    @Test
    void requireIntRejectsNonNumeric() throws MessageException {
        Message msg = decode("TYPE: PING\nUSER_ID: bob@10.0.0.2\nTURN: two\n\n");
        assertThrows(MessageException.class, () -> msg.requireInt(Fields.TURN));
    }

    @Test
    void builderRejectsLineBreaksInValues() {
        Message.Builder b = Message.builder(MessageType.DM);
        assertThrows(IllegalArgumentException.class, () -> b.field(Fields.CONTENT, "line1\nTYPE: REVOKE"));
    }

    @Test
    void newMessageIdsAreSixteenHexDigits() {
        String id = Message.newMessageId();
        assertTrue(id.matches("[0-9a-f]{16}"), id);
        assertNotEquals(id, Message.newMessageId());
    }
}
