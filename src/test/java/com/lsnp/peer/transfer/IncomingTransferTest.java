package com.lsnp.peer.transfer;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class IncomingTransferTest {

    private static FileOffer offer(int totalChunks, long size) {
        return new FileOffer("alice@10.0.0.1", "bob@10.0.0.2", "f1", "notes.txt", size,
                "text/plain", totalChunks, 4, "", "m1", "alice@10.0.0.1|9999999999|file");
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void neverCompletesWithOneChunkMissing() {
        IncomingTransfer t = new IncomingTransfer(offer(3, 10));
        assertFalse(t.store(0, bytes("abcd")));
        assertFalse(t.store(2, bytes("ij")));
        assertFalse(t.store(2, bytes("ij")));
        assertFalse(t.isComplete());
        assertEquals(2, t.receivedCount());
        assertThrows(IllegalStateException.class, t::assemble);
    }

    @Test
    void assemblesInIndexOrderRegardlessOfArrival() {
        IncomingTransfer t = new IncomingTransfer(offer(3, 10));
        t.store(2, bytes("ij"));
        t.store(0, bytes("abcd"));
        assertTrue(t.store(1, bytes("efgh")));
        assertEquals("abcdefghij", new String(t.assemble(), StandardCharsets.US_ASCII));
    }

    @Test
    void duplicatesOverwriteAndOutOfRangeIsDropped() {
        IncomingTransfer t = new IncomingTransfer(offer(2, 8));
        t.store(0, bytes("xxxx"));
        t.store(0, bytes("abcd"));
        assertFalse(t.store(2, bytes("zzzz")));
        assertFalse(t.store(-1, bytes("zzzz")));
        assertEquals(1, t.receivedCount());
        assertTrue(t.store(1, bytes("efgh")));
        assertEquals("abcdefgh", new String(t.assemble(), StandardCharsets.US_ASCII));
    }

    @Test
    void assemblySizeFollowsReceivedBytesNotDeclaredSize() {
        IncomingTransfer t = new IncomingTransfer(offer(1, 9_000_000_000L));
        assertTrue(t.store(0, bytes("abc")));
        assertEquals(3, t.assemble().length);
    }
}
