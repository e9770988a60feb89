package com.lsnp.peer.game;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tic-tac-toe board shared by two peers with no arbiter.
 *
 * Each peer applies its own moves and the opponent's moves to its copy. A move is
 * legal only when the mover holds the turn, the turn number is the next expected one
 * and has not been seen, and the cell is empty. X always moves first, on turn 1.
 */
public class GameSession {

    public static final int CELLS = 9;

    static final int[][] LINES = {
            {0, 1, 2}, {3, 4, 5}, {6, 7, 8},   // rows
            {0, 3, 6}, {1, 4, 7}, {2, 5, 8},   // columns
            {0, 4, 8}, {2, 4, 6}               // diagonals
    };

    private final String gameId;
    private final Symbol localSymbol;
    private final Map<Symbol, String> players = new EnumMap<>(Symbol.class);
    private final Symbol[] board = new Symbol[CELLS];
    private final Set<Integer> seenTurns = new HashSet<>();

    private Symbol nextToMove = Symbol.X;
    private int turnCounter = 1;
    private GamePhase phase = GamePhase.PENDING;
    private GameOutcome outcome;

    public GameSession(String gameId, String playerX, String playerO, Symbol localSymbol) {
        this.gameId = gameId;
        this.localSymbol = localSymbol;
        players.put(Symbol.X, playerX);
        players.put(Symbol.O, playerO);
    }

    /**
     * Apply a move by {@code mover} playing {@code symbol}.
     * On success marks the cell, passes the turn and checks for a finished game.
     */
    public synchronized MoveOutcome applyMove(String mover, Symbol symbol, int position, int turn) {
        if (phase == GamePhase.FINISHED) {
            return MoveOutcome.FINISHED;
        }
        if (seenTurns.contains(turn)) {
            return MoveOutcome.DUPLICATE_TURN;
        }
        if (symbol == null || !players.get(symbol).equals(mover)) {
            return MoveOutcome.NOT_A_PLAYER;
        }
        if (symbol != nextToMove || turn != turnCounter) {
            return MoveOutcome.NOT_YOUR_TURN;
        }
        if (position < 0 || position >= CELLS) {
            return MoveOutcome.OUT_OF_RANGE;
        }
        if (board[position] != null) {
            return MoveOutcome.OCCUPIED;
        }

        board[position] = symbol;
        seenTurns.add(turn);
        turnCounter++;
        nextToMove = symbol.opposite();
        phase = GamePhase.ACTIVE;

        outcome = evaluate();
        if (outcome != null) {
            phase = GamePhase.FINISHED;
        }
        return MoveOutcome.APPLIED;
    }

    /** Mark the game over without a board result. */
    public synchronized void finish(GameOutcome result) {
        phase = GamePhase.FINISHED;
        if (outcome == null) {
            outcome = result;
        }
    }

    private GameOutcome evaluate() {
        for (int[] line : LINES) {
            Symbol s = board[line[0]];
            if (s != null && s == board[line[1]] && s == board[line[2]]) {
                return GameOutcome.win(s, List.of(line[0], line[1], line[2]));
            }
        }
        for (Symbol cell : board) {
            if (cell == null) {
                return null;
            }
        }
        return GameOutcome.draw();
    }

    public String gameId()                      { return gameId; }
    public Symbol localSymbol()                 { return localSymbol; }
    public String player(Symbol symbol)         { return players.get(symbol); }
    public String opponent()                    { return players.get(localSymbol.opposite()); }
    public synchronized Symbol nextToMove()     { return nextToMove; }
    public synchronized int turnCounter()       { return turnCounter; }
    public synchronized GamePhase phase()       { return phase; }
    public synchronized GameOutcome outcome()   { return outcome; }
    public synchronized Symbol cell(int index)  { return board[index]; }

    public synchronized boolean isLocalTurn() {
        return phase != GamePhase.FINISHED && nextToMove == localSymbol;
    }

    /** Three-row text rendering, empty cells shown by index. */
    public synchronized String render() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                int i = row * 3 + col;
                sb.append(' ').append(board[i] == null ? String.valueOf(i) : board[i].name()).append(' ');
                if (col < 2) sb.append('|');
            }
            sb.append('\n');
            if (row < 2) sb.append("---+---+---\n");
        }
        return sb.toString();
    }
}
