package com.lsnp.peer.game;

import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageException;
import com.lsnp.peer.protocol.MessageType;

import java.util.ArrayList;
import java.util.List;

/**
 * TICTACTOE_RESULT. {@code symbol} and {@code winningLine} are only present for WIN.
 */
public record GameResult(String from, String to, String gameId, ResultType result, Symbol symbol,
                         List<Integer> winningLine, String messageId, String token) {

    public static GameResult from(Message msg) throws MessageException {
        ResultType result = ResultType.fromWire(msg.require(Fields.RESULT));
        if (result == null) {
            throw new MessageException("invalid RESULT: " + msg.get(Fields.RESULT));
        }
        Symbol symbol = Symbol.fromWire(msg.get(Fields.SYMBOL));
        List<Integer> line = null;
        String rawLine = msg.get(Fields.WINNING_LINE);
        if (rawLine != null && !rawLine.isEmpty()) {
            line = new ArrayList<>();
            for (String cell : rawLine.split(",")) {
                try {
                    line.add(Integer.parseInt(cell.trim()));
                } catch (NumberFormatException e) {
                    throw new MessageException("invalid WINNING_LINE: " + rawLine, e);
                }
            }
        }
        return new GameResult(msg.require(Fields.FROM), msg.require(Fields.TO), msg.require(Fields.GAME_ID),
                result, symbol, line, msg.require(Fields.MESSAGE_ID), msg.require(Fields.TOKEN));
    }

    public Message toMessage(long timestamp) {
        Message.Builder b = Message.builder(MessageType.TICTACTOE_RESULT)
                .field(Fields.FROM, from)
                .field(Fields.TO, to)
                .field(Fields.GAME_ID, gameId)
                .field(Fields.MESSAGE_ID, messageId)
                .field(Fields.RESULT, result.name());
        if (symbol != null) {
            b.field(Fields.SYMBOL, symbol.name());
        }
        if (winningLine != null) {
            StringBuilder sb = new StringBuilder();
            for (Integer cell : winningLine) {
                if (sb.length() > 0) sb.append(',');
                sb.append(cell);
            }
            b.field(Fields.WINNING_LINE, sb.toString());
        }
        return b.field(Fields.TIMESTAMP, timestamp)
                .field(Fields.TOKEN, token)
                .build();
    }
}
