package com.lsnp.peer.command;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsonOutputTest {

    @Test
    void escapesQuotesAndControlCharacters() {
        assertEquals("say \\\"hi\\\"\\n\\tbye\\\\", JsonOutput.escapeJson("say \"hi\"\n\tbye\\"));
        assertEquals("", JsonOutput.escapeJson(null));
    }

    @Test
    void eachEventIsOneLine() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        JsonOutput json = new JsonOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        json.directMessage("alice@10.0.0.1", "two\nlines");
        json.peerRevoked("alice@10.0.0.1");

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(2, lines.length);
        assertEquals("{\"event\":\"dm\",\"from\":\"alice@10.0.0.1\",\"content\":\"two\\nlines\"}", lines[0]);
        assertEquals("{\"event\":\"peer_revoked\",\"identity\":\"alice@10.0.0.1\"}", lines[1]);
    }
}
