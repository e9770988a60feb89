package com.lsnp.peer.game;

import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageException;
import com.lsnp.peer.protocol.MessageType;

/**
 * TICTACTOE_INVITE. {@code symbol} is the inviter's symbol.
 */
public record GameInvite(String from, String to, String gameId, Symbol symbol,
                         String messageId, String token) {

    public static GameInvite from(Message msg) throws MessageException {
        Symbol symbol = Symbol.fromWire(msg.require(Fields.SYMBOL));
        if (symbol == null) {
            throw new MessageException("invalid SYMBOL: " + msg.get(Fields.SYMBOL));
        }
        return new GameInvite(msg.require(Fields.FROM), msg.require(Fields.TO), msg.require(Fields.GAME_ID),
                symbol, msg.require(Fields.MESSAGE_ID), msg.require(Fields.TOKEN));
    }

    public Message toMessage(long timestamp) {
        return Message.builder(MessageType.TICTACTOE_INVITE)
                .field(Fields.FROM, from)
                .field(Fields.TO, to)
                .field(Fields.GAME_ID, gameId)
                .field(Fields.MESSAGE_ID, messageId)
                .field(Fields.SYMBOL, symbol.name())
                .field(Fields.TIMESTAMP, timestamp)
                .field(Fields.TOKEN, token)
                .build();
    }
}
