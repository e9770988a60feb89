package com.lsnp.peer.transfer;

import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageException;
import com.lsnp.peer.protocol.MessageType;

/**
 * FILE_OFFER, as sent and as held by the receiver until accepted or rejected.
 */
public record FileOffer(String from, String to, String fileId, String filename, long fileSize,
                        String fileType, int totalChunks, int chunkSize, String description,
                        String messageId, String token) {

    public static FileOffer from(Message msg) throws MessageException {
        long size = msg.requireLong(Fields.FILESIZE);
        int total = msg.requireInt(Fields.TOTAL_CHUNKS);
        if (size < 0 || total < 1) {
            throw new MessageException("invalid FILESIZE/TOTAL_CHUNKS: " + size + "/" + total);
        }
        int chunkSize = msg.has(Fields.CHUNK_SIZE)
                ? msg.requireInt(Fields.CHUNK_SIZE)
                : FileTransferManager.DEFAULT_CHUNK_SIZE;
        if (chunkSize < 1) {
            throw new MessageException("invalid CHUNK_SIZE: " + chunkSize);
        }
        if (size > (long) total * chunkSize) {
            throw new MessageException("FILESIZE " + size + " exceeds " + total + " chunks of " + chunkSize);
        }
        return new FileOffer(msg.require(Fields.FROM), msg.require(Fields.TO), msg.require(Fields.FILE_ID),
                msg.require(Fields.FILENAME), size,
                orDefault(msg.get(Fields.FILETYPE), "application/octet-stream"),
                total, chunkSize, orDefault(msg.get(Fields.DESCRIPTION), ""),
                msg.require(Fields.MESSAGE_ID), msg.require(Fields.TOKEN));
    }

    public Message toMessage(long timestamp) {
        return Message.builder(MessageType.FILE_OFFER)
                .field(Fields.FROM, from)
                .field(Fields.TO, to)
                .field(Fields.FILENAME, filename)
                .field(Fields.FILESIZE, fileSize)
                .field(Fields.FILETYPE, fileType)
                .field(Fields.FILE_ID, fileId)
                .field(Fields.DESCRIPTION, description)
                .field(Fields.TIMESTAMP, timestamp)
                .field(Fields.TOKEN, token)
                .field(Fields.TOTAL_CHUNKS, totalChunks)
                .field(Fields.CHUNK_SIZE, chunkSize)
                .field(Fields.MESSAGE_ID, messageId)
                .build();
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
