package com.lsnp.peer.command;

import com.lsnp.peer.chat.DirectMessage;
import com.lsnp.peer.game.GameInvite;
import com.lsnp.peer.game.GameMove;
import com.lsnp.peer.game.GameOutcome;
import com.lsnp.peer.game.GameSession;
import com.lsnp.peer.node.PeerEventListener;
import com.lsnp.peer.transfer.FileOffer;
import com.lsnp.peer.transfer.OutgoingTransfer;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Prints node events as text, or as JSON lines when {@code json} is set.
 */
class ConsoleEvents implements PeerEventListener {

    private final PrintStream out;
    private final JsonOutput json;

    ConsoleEvents(PrintStream out, boolean json) {
        this.out = out;
        this.json = json ? new JsonOutput(out) : null;
    }

    JsonOutput json() {
        return json;
    }

    @Override
    public void onGameInvite(GameInvite invite) {
        if (json != null) { json.gameInvite(invite); return; }
        out.printf("%s invites you to tic-tac-toe game %s (they play %s). Use: accept %s <cell> | reject %s%n",
                invite.from(), invite.gameId(), invite.symbol(), invite.gameId(), invite.gameId());
    }

    @Override
    public void onGameMove(GameSession session, GameMove move) {
        if (json != null) { json.gameMove(move); return; }
        out.printf("%s played %s at %d (turn %d) in %s%n%s", move.from(), move.symbol(), move.position(),
                move.turn(), move.gameId(), session.render());
    }

    @Override
    public void onGameFinished(GameSession session, GameOutcome outcome) {
        if (json != null) { json.gameFinished(session, outcome); return; }
        String summary = switch (outcome.type()) {
            case DRAW -> "draw";
            case FORFEIT -> "forfeited";
            default -> outcome.winner() == session.localSymbol() ? "you won" : "you lost";
        };
        out.printf("Game %s over: %s%n", session.gameId(), summary);
    }

    @Override
    public void onFileOffer(FileOffer offer) {
        if (json != null) { json.fileOffer(offer); return; }
        out.printf("%s offers %s (%s) as %s: %s. Use: accept-file %s | reject-file %s%n",
                offer.from(), offer.filename(), formatSize(offer.fileSize()), offer.fileId(),
                offer.description(), offer.fileId(), offer.fileId());
    }

    @Override
    public void onFileReceived(FileOffer offer, Path savedTo) {
        if (json != null) { json.fileReceived(offer, savedTo); return; }
        out.printf("Received %s from %s, saved to %s%n", offer.filename(), offer.from(), savedTo);
    }

    @Override
    public void onTransferFinished(OutgoingTransfer transfer) {
        if (json != null) { json.transferFinished(transfer); return; }
        out.printf("Transfer %s of %s to %s: %s (%d/%d chunks)%n", transfer.fileId(),
                transfer.path().getFileName(), transfer.recipient(), transfer.state(),
                transfer.chunksSent(), transfer.totalChunks());
    }

    @Override
    public void onDirectMessage(DirectMessage message) {
        if (json != null) { json.directMessage(message.from(), message.content()); return; }
        out.printf("[DM] %s: %s%n", message.from(), message.content());
    }

    @Override
    public void onPeerRevoked(String identity) {
        if (json != null) { json.peerRevoked(identity); return; }
        out.printf("%s left the network%n", identity);
    }

    static String formatSize(long bytes) {
        if (bytes >= 1_000_000_000) return String.format("%.1f GB", bytes / 1_000_000_000.0);
        if (bytes >= 1_000_000) return String.format("%.1f MB", bytes / 1_000_000.0);
        if (bytes >= 1_000) return String.format("%.1f KB", bytes / 1_000.0);
        return bytes + " B";
    }
}
