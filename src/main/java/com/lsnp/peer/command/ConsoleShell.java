package com.lsnp.peer.command;

import com.lsnp.peer.game.GameInvite;
import com.lsnp.peer.game.GameSession;
import com.lsnp.peer.game.MoveOutcome;
import com.lsnp.peer.game.Symbol;
import com.lsnp.peer.net.Peer;
import com.lsnp.peer.node.LsnpNode;
import com.lsnp.peer.transfer.FileOffer;
import com.lsnp.peer.transfer.OutgoingTransfer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.file.Path;

/**
 * Line-oriented console over a running node. Commands that send reliably block
 * until delivered or given up on.
 */
class ConsoleShell {

    private static final String HELP = String.join("\n",
            "peers                          list active peers",
            "dm <id> <text>                 send a direct message",
            "invite <id> <X|O>              invite a peer to tic-tac-toe",
            "accept <game> <cell>           accept an invitation with your first move",
            "reject <game>                  decline an invitation",
            "move <game> <cell>             play a cell (0-8)",
            "board <game>                   show a board",
            "games                          list games and invitations",
            "send <id> <path> [description] offer a file",
            "offers                         list pending file offers",
            "accept-file <fileId>           accept a file offer",
            "reject-file <fileId>           decline a file offer",
            "revoke                         revoke all issued tokens",
            "quit                           leave");

    private final LsnpNode node;
    private final BufferedReader in;
    private final PrintStream out;

    ConsoleShell(LsnpNode node, Reader in, PrintStream out) {
        this.node = node;
        this.in = new BufferedReader(in);
        this.out = out;
    }

    void run() throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.equals("quit") || line.equals("exit")) {
                return;
            }
            try {
                execute(line);
            } catch (NumberFormatException e) {
                out.println("Expected a number: " + e.getMessage());
            } catch (IllegalArgumentException | IOException e) {
                out.println("Error: " + e.getMessage());
            }
        }
    }

    void execute(String line) throws IOException {
        String[] args = line.split("\\s+", 3);
        switch (args[0]) {
            case "help" -> out.println(HELP);
            case "peers" -> {
                for (Peer p : node.peers()) {
                    out.printf("  %-28s %-16s %s%n", p.identity(), p.displayName(), p.status() == null ? "" : p.status());
                }
            }
            case "dm" -> {
                require(args, 3, "dm <id> <text>");
                out.println(node.chat().send(args[1], args[2]) ? "Delivered." : "Not delivered.");
            }
            case "invite" -> {
                require(args, 3, "invite <id> <X|O>");
                Symbol symbol = Symbol.fromWire(args[2].toUpperCase());
                if (symbol == null) {
                    throw new IllegalArgumentException("symbol must be X or O");
                }
                GameSession session = node.games().invite(args[1], symbol);
                if (session == null) {
                    out.println("Invite not acknowledged.");
                } else {
                    out.println("Game " + session.gameId() + " created. You play " + symbol
                            + (symbol == Symbol.X ? "; make the first move." : "; wait for X."));
                }
            }
            case "accept" -> {
                String[] a = split(line, 3, "accept <game> <cell>");
                report(a[1], node.games().accept(a[1], Integer.parseInt(a[2])));
            }
            case "move" -> {
                String[] a = split(line, 3, "move <game> <cell>");
                report(a[1], node.games().move(a[1], Integer.parseInt(a[2])));
            }
            case "reject" -> {
                require(args, 2, "reject <game>");
                out.println(node.games().reject(args[1]) ? "Rejected." : "No such invitation, or not acknowledged.");
            }
            case "board" -> {
                require(args, 2, "board <game>");
                GameSession session = node.games().session(args[1]);
                out.print(session == null ? "No such game.\n" : session.render());
            }
            case "games" -> {
                for (GameSession s : node.games().sessions()) {
                    out.printf("  %s vs %s, you are %s, %s%n", s.gameId(), s.opponent(), s.localSymbol(),
                            s.isLocalTurn() ? "your turn" : "waiting");
                }
                for (GameInvite i : node.games().invitations()) {
                    out.printf("  %s invitation from %s%n", i.gameId(), i.from());
                }
            }
            case "send" -> {
                require(args, 3, "send <id> <path> [description]");
                String[] rest = args[2].split("\\s+", 2);
                OutgoingTransfer t = node.transfers().offer(args[1], Path.of(rest[0]), rest.length > 1 ? rest[1] : "");
                out.println("Offered " + t.fileId() + ": " + t.state());
            }
            case "offers" -> {
                for (FileOffer o : node.transfers().pendingOffers()) {
                    out.printf("  %s %s (%s) from %s%n", o.fileId(), o.filename(),
                            ConsoleEvents.formatSize(o.fileSize()), o.from());
                }
            }
            case "accept-file" -> {
                require(args, 2, "accept-file <fileId>");
                out.println(node.transfers().acceptOffer(args[1]) ? "Accepted." : "No such offer.");
            }
            case "reject-file" -> {
                require(args, 2, "reject-file <fileId>");
                out.println(node.transfers().rejectOffer(args[1]) ? "Rejected." : "No such offer.");
            }
            case "revoke" -> out.println("Revoked " + node.revokeTokens() + " token(s).");
            default -> out.println("Unknown command: " + args[0] + " (try 'help')");
        }
    }

    private void report(String gameId, MoveOutcome outcome) {
        out.println(outcome.isApplied() ? "Played (" + outcome + ")." : "Move refused: " + outcome);
        GameSession session = node.games().session(gameId);
        if (session != null) {
            out.print(session.render());
        }
    }

    private static void require(String[] args, int count, String usage) {
        if (args.length < count) {
            throw new IllegalArgumentException("usage: " + usage);
        }
    }

    private static String[] split(String line, int count, String usage) {
        String[] args = line.split("\\s+");
        require(args, count, usage);
        return args;
    }
}
