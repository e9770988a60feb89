package com.lsnp.peer.game;

import com.lsnp.peer.auth.TokenIssuer;
import com.lsnp.peer.auth.TokenScope;
import com.lsnp.peer.net.MessageRouter;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageException;
import com.lsnp.peer.protocol.MessageType;
import com.lsnp.peer.transport.ReliableSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs tic-tac-toe sessions against remote peers.
 *
 * Flow: invite (reliable) → each side applies its own moves locally and sends them
 * reliably → the peer that makes the finishing move sends one RESULT and tears down.
 * The receiver of the finishing move reaches the same outcome on its own board and
 * tears down without announcing. Rejecting an invitation sends RESULT FORFEIT.
 *
 * Session locks are never held while sending.
 */
public class GameSessionManager {

    private static final Logger log = LoggerFactory.getLogger(GameSessionManager.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final TokenIssuer tokens;
    private final ReliableSender sender;
    private final GameListener listener;
    private final String localIdentity;
    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, GameInvite> invitations = new ConcurrentHashMap<>();

    public GameSessionManager(TokenIssuer tokens, ReliableSender sender, GameListener listener) {
        this.tokens = tokens;
        this.sender = sender;
        this.listener = listener;
        this.localIdentity = tokens.identity();
    }

    public void register(MessageRouter router) {
        router.addHandler(MessageType.TICTACTOE_INVITE, this::handleInvite);
        router.addHandler(MessageType.TICTACTOE_MOVE, this::handleMove);
        router.addHandler(MessageType.TICTACTOE_RESULT, this::handleResult);
    }

    /**
     * Invite {@code opponent} to a game where the local player uses {@code symbol}.
     * Blocks until the invite is acknowledged. When playing X, follow with {@link #move}.
     *
     * @return the new session, or null if the invite was never acknowledged
     */
    public GameSession invite(String opponent, Symbol symbol) {
        String gameId = newGameId();
        String playerX = symbol == Symbol.X ? localIdentity : opponent;
        String playerO = symbol == Symbol.O ? localIdentity : opponent;
        GameSession session = new GameSession(gameId, playerX, playerO, symbol);
        sessions.put(gameId, session);

        GameInvite invite = new GameInvite(localIdentity, opponent, gameId, symbol,
                Message.newMessageId(), tokens.tokenFor(TokenScope.GAME));
        log.info("Inviting {} to game {} as {}", opponent, gameId, symbol);
        if (!sender.sendReliable(invite.toMessage(nowSeconds()), opponent)) {
            sessions.remove(gameId);
            log.warn("Invite for game {} to {} was not acknowledged", gameId, opponent);
            return null;
        }
        return session;
    }

    /**
     * Accept a pending invitation by making the first local move.
     * The invitation stays pending if the move is not legal yet.
     */
    public MoveOutcome accept(String gameId, int position) {
        if (!invitations.containsKey(gameId)) {
            return MoveOutcome.UNKNOWN_GAME;
        }
        return playLocal(gameId, position, true);
    }

    /** Decline an invitation: tear down locally and send RESULT FORFEIT. */
    public boolean reject(String gameId) {
        GameInvite invite = invitations.remove(gameId);
        if (invite == null) {
            return false;
        }
        GameSession session = sessions.remove(gameId);
        if (session != null) {
            session.finish(GameOutcome.forfeit(session.localSymbol().opposite()));
        }
        log.info("Rejecting game {} from {}", gameId, invite.from());
        GameResult forfeit = new GameResult(localIdentity, invite.from(), gameId, ResultType.FORFEIT,
                null, null, Message.newMessageId(), tokens.tokenFor(TokenScope.GAME));
        return sender.sendReliable(forfeit.toMessage(nowSeconds()), invite.from());
    }

    /** Make a local move in an accepted or self-initiated game. */
    public MoveOutcome move(String gameId, int position) {
        if (invitations.containsKey(gameId)) {
            return MoveOutcome.AWAITING_ACCEPT;
        }
        return playLocal(gameId, position, false);
    }

    private MoveOutcome playLocal(String gameId, int position, boolean accepting) {
        GameSession session = sessions.get(gameId);
        if (session == null) {
            return MoveOutcome.UNKNOWN_GAME;
        }

        Symbol mine = session.localSymbol();
        int turn;
        MoveOutcome applied;
        GameOutcome outcome;
        synchronized (session) {
            turn = session.turnCounter();
            applied = session.applyMove(localIdentity, mine, position, turn);
            outcome = session.outcome();
        }
        if (applied != MoveOutcome.APPLIED) {
            return applied;
        }
        if (accepting) {
            invitations.remove(gameId);
        }

        String opponent = session.opponent();
        GameMove move = new GameMove(localIdentity, opponent, gameId, mine, position, turn,
                Message.newMessageId(), tokens.tokenFor(TokenScope.GAME));
        boolean acked = sender.sendReliable(move.toMessage(), opponent);
        if (!acked) {
            log.warn("Move {} in game {} was not acknowledged by {}", turn, gameId, opponent);
        }

        if (outcome != null) {
            announce(session, outcome);
        }
        return acked ? MoveOutcome.APPLIED : MoveOutcome.UNACKNOWLEDGED;
    }

    private void announce(GameSession session, GameOutcome outcome) {
        String opponent = session.opponent();
        GameResult result = new GameResult(localIdentity, opponent, session.gameId(), outcome.type(),
                outcome.winner(), outcome.line(), Message.newMessageId(), tokens.tokenFor(TokenScope.GAME));
        if (!sender.sendReliable(result.toMessage(nowSeconds()), opponent)) {
            log.warn("Result of game {} was not acknowledged by {}", session.gameId(), opponent);
        }
        sessions.remove(session.gameId());
        log.info("Game {} finished: {}", session.gameId(), describe(outcome));
        listener.onGameFinished(session, outcome);
    }

    void handleInvite(Message msg) {
        GameInvite invite;
        try {
            invite = GameInvite.from(msg);
        } catch (MessageException e) {
            log.debug("Ignoring bad invite: {}", e.getMessage());
            return;
        }
        if (!localIdentity.equals(invite.to())) {
            log.debug("Ignoring invite for {}", invite.to());
            return;
        }
        if (sessions.containsKey(invite.gameId())) {
            log.debug("Ignoring invite for existing game {}", invite.gameId());
            return;
        }

        Symbol theirs = invite.symbol();
        String playerX = theirs == Symbol.X ? invite.from() : localIdentity;
        String playerO = theirs == Symbol.O ? invite.from() : localIdentity;
        sessions.put(invite.gameId(), new GameSession(invite.gameId(), playerX, playerO, theirs.opposite()));
        invitations.put(invite.gameId(), invite);
        log.info("{} invited us to game {} (they play {})", invite.from(), invite.gameId(), theirs);
        listener.onGameInvite(invite);
    }

    void handleMove(Message msg) {
        GameMove move;
        try {
            move = GameMove.from(msg);
        } catch (MessageException e) {
            log.debug("Ignoring bad move: {}", e.getMessage());
            return;
        }
        applyRemoteMove(move);
    }

    /** Apply an inbound move; illegal moves are dropped (they were already ACKed). */
    MoveOutcome applyRemoteMove(GameMove move) {
        if (!localIdentity.equals(move.to())) {
            return MoveOutcome.NOT_A_PLAYER;
        }
        GameSession session = sessions.get(move.gameId());
        if (session == null) {
            log.debug("Move for unknown game {}", move.gameId());
            return MoveOutcome.UNKNOWN_GAME;
        }

        MoveOutcome applied;
        GameOutcome outcome;
        synchronized (session) {
            applied = session.applyMove(move.from(), move.symbol(), move.position(), move.turn());
            outcome = session.outcome();
        }
        if (applied != MoveOutcome.APPLIED) {
            log.debug("Dropping move {} in game {} from {}: {}", move.turn(), move.gameId(), move.from(), applied);
            return applied;
        }

        listener.onGameMove(session, move);
        if (outcome != null) {
            sessions.remove(move.gameId());
            invitations.remove(move.gameId());
            log.info("Game {} finished: {}", move.gameId(), describe(outcome));
            listener.onGameFinished(session, outcome);
        }
        return applied;
    }

    void handleResult(Message msg) {
        GameResult result;
        try {
            result = GameResult.from(msg);
        } catch (MessageException e) {
            log.debug("Ignoring bad result: {}", e.getMessage());
            return;
        }
        if (!localIdentity.equals(result.to())) {
            return;
        }

        GameSession session = sessions.get(result.gameId());
        if (session == null) {
            invitations.remove(result.gameId());
            log.debug("Result {} for settled game {}", result.result(), result.gameId());
            return;
        }
        if (!result.from().equals(session.opponent())) {
            log.warn("Ignoring {} for game {} from {}, not a player", result.result(), result.gameId(), result.from());
            return;
        }
        if (!sessions.remove(result.gameId(), session)) {
            return;
        }
        invitations.remove(result.gameId());

        GameOutcome outcome = switch (result.result()) {
            case WIN -> GameOutcome.win(result.symbol(), result.winningLine() == null ? List.of() : result.winningLine());
            case DRAW -> GameOutcome.draw();
            case LOSS -> GameOutcome.forfeit(session.localSymbol());
            case FORFEIT -> GameOutcome.forfeit(session.localSymbol());
        };
        session.finish(outcome);
        log.info("Game {} ended by {}: {}", result.gameId(), result.from(), result.result());
        listener.onGameFinished(session, outcome);
    }

    public GameSession session(String gameId) {
        return sessions.get(gameId);
    }

    public List<GameSession> sessions() {
        return new ArrayList<>(sessions.values());
    }

    public List<GameInvite> invitations() {
        return new ArrayList<>(invitations.values());
    }

    private String newGameId() {
        String id;
        do {
            id = "g" + RANDOM.nextInt(1_000_000);
        } while (sessions.containsKey(id));
        return id;
    }

    private static String describe(GameOutcome outcome) {
        return outcome.isDraw() ? "draw" : outcome.type() + " for " + outcome.winner() + " on " + outcome.line();
    }

    private static long nowSeconds() {
        return System.currentTimeMillis() / 1000;
    }
}
