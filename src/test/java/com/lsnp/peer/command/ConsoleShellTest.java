package com.lsnp.peer.command;

import com.lsnp.peer.game.GameSession;
import com.lsnp.peer.node.LsnpNode;
import com.lsnp.peer.testutil.InMemoryNetwork;
import com.lsnp.peer.testutil.RecordingListener;
import com.lsnp.peer.testutil.TestPeers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleShellTest {

    @TempDir
    Path tempDir;

    private final InMemoryNetwork network = new InMemoryNetwork();
    private final RecordingListener bobEvents = new RecordingListener();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private LsnpNode alice;
    private LsnpNode bob;

    @BeforeEach
    void setUp() {
        alice = TestPeers.node(network, "alice", "10.0.0.1", tempDir, new RecordingListener());
        bob = TestPeers.node(network, "bob", "10.0.0.2", tempDir, bobEvents);
    }

    private String run(String script) throws Exception {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        new ConsoleShell(alice, new StringReader(script), out).run();
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void directMessageCommand() throws Exception {
        String output = run("dm bob@10.0.0.2 see you at noon\n");

        assertTrue(output.contains("Delivered."), output);
        assertEquals("see you at noon", bobEvents.directMessages.get(0).content());
    }

    @Test
    void inviteAndMoveCommands() throws Exception {
        run("invite bob@10.0.0.2 x\n");
        assertEquals(1, alice.games().sessions().size());
        GameSession session = alice.games().sessions().iterator().next();

        String output = run("move " + session.gameId() + " 4\nboard " + session.gameId() + "\n");

        assertTrue(output.contains("Game " + session.gameId() + " created. You play X"), output);
        assertTrue(output.contains("Played (APPLIED)."), output);
        assertEquals(1, bobEvents.moves.size());
    }

    @Test
    void badInputIsReportedAndShellContinues() throws Exception {
        String output = run("frobnicate\nmove g1 four\ndm\ninvite bob@10.0.0.2 Z\nquit\ndm bob@10.0.0.2 unreachable\n");

        assertTrue(output.contains("Unknown command: frobnicate"), output);
        assertTrue(output.contains("Expected a number"), output);
        assertTrue(output.contains("usage: dm <id> <text>"), output);
        assertTrue(output.contains("symbol must be X or O"), output);
        assertTrue(bobEvents.directMessages.isEmpty(), "commands after quit are not run");
    }
}
