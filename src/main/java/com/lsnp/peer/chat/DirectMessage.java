package com.lsnp.peer.chat;

import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageException;
import com.lsnp.peer.protocol.MessageType;

/**
 * DM.
 */
public record DirectMessage(String from, String to, String content, long timestamp,
                            String messageId, String token) {

    public static DirectMessage from(Message msg) throws MessageException {
        long timestamp = msg.has(Fields.TIMESTAMP) ? msg.requireLong(Fields.TIMESTAMP) : 0L;
        return new DirectMessage(msg.require(Fields.FROM), msg.require(Fields.TO), msg.get(Fields.CONTENT),
                timestamp, msg.require(Fields.MESSAGE_ID), msg.require(Fields.TOKEN));
    }

    public Message toMessage() {
        return Message.builder(MessageType.DM)
                .field(Fields.FROM, from)
                .field(Fields.TO, to)
                .field(Fields.CONTENT, content)
                .field(Fields.TIMESTAMP, timestamp)
                .field(Fields.MESSAGE_ID, messageId)
                .field(Fields.TOKEN, token)
                .build();
    }
}
