package com.lsnp.peer.transfer;

import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageException;
import com.lsnp.peer.protocol.MessageType;

import java.util.Base64;

/**
 * FILE_CHUNK. {@code data} is carried base64-encoded on the wire.
 */
public record FileChunk(String from, String to, String fileId, int chunkIndex, int totalChunks,
                        byte[] data, String messageId, String token) {

    public static FileChunk from(Message msg) throws MessageException {
        byte[] data;
        try {
            data = Base64.getDecoder().decode(msg.get(Fields.DATA) == null ? "" : msg.get(Fields.DATA));
        } catch (IllegalArgumentException e) {
            throw new MessageException("invalid base64 in DATA", e);
        }
        return new FileChunk(msg.require(Fields.FROM), msg.require(Fields.TO), msg.require(Fields.FILE_ID),
                msg.requireInt(Fields.CHUNK_INDEX), msg.requireInt(Fields.TOTAL_CHUNKS), data,
                msg.require(Fields.MESSAGE_ID), msg.require(Fields.TOKEN));
    }

    public Message toMessage(long timestamp) {
        return Message.builder(MessageType.FILE_CHUNK)
                .field(Fields.FROM, from)
                .field(Fields.TO, to)
                .field(Fields.FILE_ID, fileId)
                .field(Fields.CHUNK_INDEX, chunkIndex)
                .field(Fields.TOTAL_CHUNKS, totalChunks)
                .field(Fields.CHUNK_SIZE, data.length)
                .field(Fields.TOKEN, token)
                .field(Fields.MESSAGE_ID, messageId)
                .field(Fields.TIMESTAMP, timestamp)
                .field(Fields.DATA, Base64.getEncoder().encodeToString(data))
                .build();
    }
}
