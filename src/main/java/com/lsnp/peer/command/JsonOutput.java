package com.lsnp.peer.command;

import com.lsnp.peer.game.GameInvite;
import com.lsnp.peer.game.GameMove;
import com.lsnp.peer.game.GameOutcome;
import com.lsnp.peer.game.GameSession;
import com.lsnp.peer.transfer.FileOffer;
import com.lsnp.peer.transfer.OutgoingTransfer;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Emits newline-delimited JSON events for machine-readable output.
 * Used by RunCommand when the --json flag is set.
 */
final class JsonOutput {

    private final PrintStream out;

    JsonOutput(PrintStream out) {
        this.out = out;
    }

    void started(String identity, int port) {
        emit("{\"event\":\"started\",\"identity\":\"%s\",\"port\":%d}", escapeJson(identity), port);
    }

    void gameInvite(GameInvite invite) {
        emit("{\"event\":\"game_invite\",\"game\":\"%s\",\"from\":\"%s\",\"their_symbol\":\"%s\"}",
                escapeJson(invite.gameId()), escapeJson(invite.from()), invite.symbol());
    }

    void gameMove(GameMove move) {
        emit("{\"event\":\"game_move\",\"game\":\"%s\",\"from\":\"%s\",\"symbol\":\"%s\",\"position\":%d,\"turn\":%d}",
                escapeJson(move.gameId()), escapeJson(move.from()), move.symbol(), move.position(), move.turn());
    }

    void gameFinished(GameSession session, GameOutcome outcome) {
        emit("{\"event\":\"game_finished\",\"game\":\"%s\",\"result\":\"%s\",\"winner\":\"%s\"}",
                escapeJson(session.gameId()), outcome.type(),
                outcome.winner() == null ? "" : outcome.winner().name());
    }

    void fileOffer(FileOffer offer) {
        emit("{\"event\":\"file_offer\",\"file\":\"%s\",\"from\":\"%s\",\"name\":\"%s\",\"size\":%d,\"description\":\"%s\"}",
                escapeJson(offer.fileId()), escapeJson(offer.from()), escapeJson(offer.filename()),
                offer.fileSize(), escapeJson(offer.description()));
    }

    void fileReceived(FileOffer offer, Path savedTo) {
        emit("{\"event\":\"file_received\",\"file\":\"%s\",\"from\":\"%s\",\"path\":\"%s\"}",
                escapeJson(offer.fileId()), escapeJson(offer.from()), escapeJson(savedTo.toString()));
    }

    void transferFinished(OutgoingTransfer transfer) {
        emit("{\"event\":\"transfer_finished\",\"file\":\"%s\",\"to\":\"%s\",\"state\":\"%s\",\"chunks_sent\":%d,\"total_chunks\":%d}",
                escapeJson(transfer.fileId()), escapeJson(transfer.recipient()),
                transfer.state().name().toLowerCase(), transfer.chunksSent(), transfer.totalChunks());
    }

    void directMessage(String from, String content) {
        emit("{\"event\":\"dm\",\"from\":\"%s\",\"content\":\"%s\"}", escapeJson(from), escapeJson(content));
    }

    void peerRevoked(String identity) {
        emit("{\"event\":\"peer_revoked\",\"identity\":\"%s\"}", escapeJson(identity));
    }

    void error(String message) {
        emit("{\"event\":\"error\",\"message\":\"%s\"}", escapeJson(message));
    }

    private void emit(String format, Object... args) {
        out.println(String.format(format, args));
        out.flush();
    }

    static String escapeJson(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
