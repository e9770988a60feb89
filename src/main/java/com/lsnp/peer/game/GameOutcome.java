package com.lsnp.peer.game;

import java.util.List;

/**
 * How a game ended. {@code winner} and {@code line} are null for a draw;
 * for a forfeit {@code winner} is the player who did not forfeit.
 */
public record GameOutcome(ResultType type, Symbol winner, List<Integer> line) {

    public static GameOutcome win(Symbol winner, List<Integer> line) {
        return new GameOutcome(ResultType.WIN, winner, List.copyOf(line));
    }

    public static GameOutcome draw() {
        return new GameOutcome(ResultType.DRAW, null, null);
    }

    public static GameOutcome forfeit(Symbol winner) {
        return new GameOutcome(ResultType.FORFEIT, winner, null);
    }

    public boolean isDraw() {
        return type == ResultType.DRAW;
    }
}
