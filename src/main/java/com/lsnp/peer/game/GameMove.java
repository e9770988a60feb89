package com.lsnp.peer.game;

import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageException;
import com.lsnp.peer.protocol.MessageType;

/**
 * TICTACTOE_MOVE.
 */
public record GameMove(String from, String to, String gameId, Symbol symbol, int position, int turn,
                       String messageId, String token) {

    public static GameMove from(Message msg) throws MessageException {
        Symbol symbol = Symbol.fromWire(msg.require(Fields.SYMBOL));
        if (symbol == null) {
            throw new MessageException("invalid SYMBOL: " + msg.get(Fields.SYMBOL));
        }
        return new GameMove(msg.require(Fields.FROM), msg.require(Fields.TO), msg.require(Fields.GAME_ID),
                symbol, msg.requireInt(Fields.POSITION), msg.requireInt(Fields.TURN),
                msg.require(Fields.MESSAGE_ID), msg.require(Fields.TOKEN));
    }

    public Message toMessage() {
        return Message.builder(MessageType.TICTACTOE_MOVE)
                .field(Fields.FROM, from)
                .field(Fields.TO, to)
                .field(Fields.GAME_ID, gameId)
                .field(Fields.MESSAGE_ID, messageId)
                .field(Fields.POSITION, position)
                .field(Fields.SYMBOL, symbol.name())
                .field(Fields.TURN, turn)
                .field(Fields.TOKEN, token)
                .build();
    }
}
