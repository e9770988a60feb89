package com.lsnp.peer.protocol;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes and decodes {@link Message} instances to/from UDP datagram bytes.
 *
 * Wire format (UTF-8 text):
 * <pre>
 * TYPE: &lt;type&gt;\n
 * KEY: value\n
 * ...
 * \n
 * </pre>
 * CRLF line endings are accepted on input. Only the header before the first
 * blank line is parsed; lines without a {@code ": "} separator are skipped.
 */
public final class MessageCodec {

    public static final int MAX_DATAGRAM = 65_535;

    private static final String SEPARATOR = ": ";
    private static final String TERMINATOR = "\n\n";

    private MessageCodec() {}

    /**
     * Encode a Message into bytes ready for sending as a UDP datagram.
     */
    public static byte[] encode(Message message) {
        StringBuilder sb = new StringBuilder(128);
        sb.append(Fields.TYPE).append(SEPARATOR).append(message.type().wireName()).append('\n');
        for (Map.Entry<String, String> e : message.fields().entrySet()) {
            sb.append(e.getKey()).append(SEPARATOR).append(e.getValue()).append('\n');
        }
        sb.append('\n');
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decode a received datagram into a Message.
     *
     * @param data the raw datagram bytes
     * @param length number of bytes in the datagram
     * @return the decoded Message
     * @throws MessageException if the frame is unterminated, of unknown type, or lacks a required field
     */
    public static Message decode(byte[] data, int length) throws MessageException {
        String raw = new String(data, 0, length, StandardCharsets.UTF_8)
                .replace("\r\n", "\n")
                .replace('\r', '\n');

        int end = raw.indexOf(TERMINATOR);
        if (end < 0) {
            throw new MessageException("missing blank-line terminator (" + length + " bytes)");
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (String line : raw.substring(0, end).split("\n")) {
            int sep = line.indexOf(SEPARATOR);
            if (sep < 0) {
                continue;
            }
            fields.put(line.substring(0, sep).trim(), line.substring(sep + SEPARATOR.length()).trim());
        }

        String typeName = fields.get(Fields.TYPE);
        if (typeName == null) {
            throw new MessageException("missing TYPE header");
        }
        MessageType type = MessageType.fromWire(typeName);
        if (type == null) {
            throw new MessageException("unknown type: " + typeName);
        }
        for (String required : type.requiredFields()) {
            if (!fields.containsKey(required)) {
                throw new MessageException(type + " missing required field " + required);
            }
        }
        return new Message(type, fields);
    }
}
