package com.lsnp.peer.transfer;

import com.lsnp.peer.auth.TokenScope;
import com.lsnp.peer.net.RouteResult;
import com.lsnp.peer.node.LsnpNode;
import com.lsnp.peer.node.NodeConfig;
import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageType;
import com.lsnp.peer.testutil.InMemoryNetwork;
import com.lsnp.peer.testutil.RecordingListener;
import com.lsnp.peer.testutil.TestPeers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sender and receiver transfer managers talking over an in-memory network.
 */
class FileTransferManagerTest {

    @TempDir
    Path tempDir;

    private final InMemoryNetwork network = new InMemoryNetwork();
    private final RecordingListener aliceEvents = new RecordingListener();
    private final RecordingListener bobEvents = new RecordingListener();
    private LsnpNode alice;
    private LsnpNode bob;

    private void start(UnaryOperator<NodeConfig> tweak) {
        alice = TestPeers.node(network, "alice", "10.0.0.1", tempDir.resolve("alice-dl"), aliceEvents, tweak);
        bob = TestPeers.node(network, "bob", "10.0.0.2", tempDir.resolve("bob-dl"), bobEvents, tweak);
    }

    private Path createFile(String name, int size) throws Exception {
        byte[] data = new byte[size];
        new Random(42).nextBytes(data);
        Path file = tempDir.resolve(name);
        Files.write(file, data);
        return file;
    }

    private OutgoingTransfer awaitFinished() throws InterruptedException {
        assertTrue(aliceEvents.transferDone.await(10, TimeUnit.SECONDS), "transfer should finish");
        return aliceEvents.transfers.get(0);
    }

    @Test
    void chunkCountRoundsUpAndEmptyFileHasOneChunk() {
        assertEquals(1, FileTransferManager.totalChunks(0, 1024));
        assertEquals(1, FileTransferManager.totalChunks(1024, 1024));
        assertEquals(2, FileTransferManager.totalChunks(1025, 1024));
        assertEquals(3, FileTransferManager.totalChunks(2500, 1024));
    }

    @Test
    void filenamesAreReducedToTheirLastSegment() {
        assertEquals("passwd", FileTransferManager.sanitize("../../etc/passwd"));
        assertEquals("a.txt", FileTransferManager.sanitize("C:\\temp\\a.txt"));
        assertEquals("download.bin", FileTransferManager.sanitize(".."));
    }

    @Test
    void acceptedOfferIsStreamedReassembledAndConfirmed() throws Exception {
        start(UnaryOperator.identity());
        Path file = createFile("photo.jpg", 2500);

        OutgoingTransfer transfer = alice.transfers().offer(bob.identity(), file, "holiday");
        assertEquals(1, bobEvents.offers.size());
        FileOffer offer = bobEvents.offers.get(0);
        assertEquals("photo.jpg", offer.filename());
        assertEquals(2500, offer.fileSize());
        assertEquals(3, offer.totalChunks());
        assertEquals("holiday", offer.description());
        assertEquals(transfer.fileId(), offer.fileId());

        assertTrue(bob.transfers().acceptOffer(offer.fileId()));

        OutgoingTransfer finished = awaitFinished();
        assertEquals(TransferState.COMPLETED, finished.state());
        assertEquals(3, finished.chunksSent());
        assertNull(alice.transfers().outgoing(transfer.fileId()));

        assertEquals(1, bobEvents.received.size());
        Path saved = bobEvents.received.get(0);
        assertEquals(tempDir.resolve("bob-dl").resolve("photo.jpg"), saved);
        assertArrayEquals(Files.readAllBytes(file), Files.readAllBytes(saved));
        assertEquals(1, network.delivered(MessageType.FILE_RECEIVED).size());
        assertEquals("COMPLETE", network.delivered(MessageType.FILE_RECEIVED).get(0).message().get(Fields.STATUS));
        assertNull(bob.transfers().incoming(offer.fileId()));
    }

    @Test
    void emptyFileTravelsAsSingleChunk() throws Exception {
        start(UnaryOperator.identity());
        Path file = createFile("empty.txt", 0);

        alice.transfers().offer(bob.identity(), file, "");
        bob.transfers().acceptOffer(bobEvents.offers.get(0).fileId());

        assertEquals(TransferState.COMPLETED, awaitFinished().state());
        assertEquals(1, network.delivered(MessageType.FILE_CHUNK).size());
        assertEquals(0, Files.size(bobEvents.received.get(0)));
    }

    @Test
    void rejectedOfferSendsNoChunks() throws Exception {
        start(UnaryOperator.identity());
        alice.transfers().offer(bob.identity(), createFile("a.bin", 100), "");

        assertTrue(bob.transfers().rejectOffer(bobEvents.offers.get(0).fileId()));

        assertEquals(TransferState.REJECTED, awaitFinished().state());
        assertTrue(network.delivered(MessageType.FILE_CHUNK).isEmpty());
        assertTrue(bob.transfers().pendingOffers().isEmpty());
    }

    @Test
    void unansweredOfferTimesOut() throws Exception {
        start(c -> c.withTransferTimeouts(200, 1_000));
        alice.transfers().offer(bob.identity(), createFile("a.bin", 100), "");

        OutgoingTransfer finished = awaitFinished();
        assertEquals(TransferState.TIMED_OUT, finished.state());
        assertEquals(0, finished.chunksSent());
        assertEquals(1, bob.transfers().pendingOffers().size());
    }

    @Test
    void lostChunkMeansNoReassemblyAndNoReceipt() throws Exception {
        start(c -> c.withAckPolicy(3, 30).withTransferTimeouts(1_000, 300));
        network.dropWhen(m -> m.type() == MessageType.FILE_CHUNK && "1".equals(m.get(Fields.CHUNK_INDEX)));
        Path file = createFile("doc.pdf", 3000);

        alice.transfers().offer(bob.identity(), file, "");
        String fileId = bobEvents.offers.get(0).fileId();
        bob.transfers().acceptOffer(fileId);

        OutgoingTransfer finished = awaitFinished();
        assertEquals(TransferState.EXPIRED, finished.state());
        assertEquals(2, finished.chunksSent());

        long chunkOneAttempts = network.sent().stream()
                .filter(s -> s.message().type() == MessageType.FILE_CHUNK)
                .filter(s -> "1".equals(s.message().get(Fields.CHUNK_INDEX)))
                .count();
        assertEquals(6, chunkOneAttempts, "three attempts, then one retry of three more");

        assertTrue(network.delivered(MessageType.FILE_RECEIVED).isEmpty());
        assertTrue(bobEvents.received.isEmpty());
        assertEquals(2, bob.transfers().incoming(fileId).receivedCount());
        assertFalse(Files.exists(tempDir.resolve("bob-dl").resolve("doc.pdf")));
    }

    @Test
    void offerToUnreachablePeerTimesOut() throws Exception {
        start(c -> c.withAckPolicy(2, 30));
        network.dropWhen(m -> m.type() == MessageType.FILE_OFFER);

        OutgoingTransfer transfer = alice.transfers().offer(bob.identity(), createFile("a.bin", 10), "");

        assertEquals(TransferState.TIMED_OUT, transfer.state());
        assertTrue(bobEvents.offers.isEmpty());
        assertNull(alice.transfers().outgoing(transfer.fileId()));
    }

    @Test
    void offerIsHeldUntilAnswered() throws Exception {
        start(UnaryOperator.identity());
        alice.transfers().offer(bob.identity(), createFile("a.bin", 10), "");
        String fileId = bobEvents.offers.get(0).fileId();

        assertNull(bob.transfers().incoming(fileId));
        assertFalse(bob.transfers().acceptOffer("unknown"));
        assertEquals(1, bob.transfers().pendingOffers().size());
    }

    private Message offerFromAlice(String fileId, long declaredSize, int totalChunks) {
        return new FileOffer(alice.identity(), bob.identity(), fileId, "big.iso", declaredSize,
                "application/octet-stream", totalChunks, FileTransferManager.DEFAULT_CHUNK_SIZE, "",
                Message.newMessageId(), alice.authority().mint(alice.identity(), TokenScope.FILE, 3600))
                .toMessage(0);
    }

    private Message chunkFromAlice(String fileId, int totalChunks, byte[] data) {
        return new FileChunk(alice.identity(), bob.identity(), fileId, 0, totalChunks, data,
                Message.newMessageId(), alice.authority().mint(alice.identity(), TokenScope.FILE, 3600))
                .toMessage(0);
    }

    @Test
    void offerLargerThanItsChunksIsRefused() {
        start(UnaryOperator.identity());

        bob.router().route(offerFromAlice("huge", 9_000_000_000L, 1), TestPeers.address("10.0.0.1"));

        assertTrue(bobEvents.offers.isEmpty());
        assertTrue(bob.transfers().pendingOffers().isEmpty());
    }

    @Test
    void shortFileIsDiscardedAndReceiverKeepsListening() {
        start(UnaryOperator.identity());
        bob.router().route(offerFromAlice("short", 10, 1), TestPeers.address("10.0.0.1"));
        assertTrue(bob.transfers().acceptOffer("short"));

        assertEquals(RouteResult.DISPATCHED,
                bob.router().route(chunkFromAlice("short", 1, new byte[3]), TestPeers.address("10.0.0.1")));

        assertTrue(bobEvents.received.isEmpty());
        assertTrue(network.delivered(MessageType.FILE_RECEIVED).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("bob-dl").resolve("big.iso")));
        assertTrue(alice.chat().send(bob.identity(), "still there?"));
    }

    @Test
    void chunkWithDifferentTotalIsIgnored() {
        start(UnaryOperator.identity());
        bob.router().route(offerFromAlice("mixed", 3, 1), TestPeers.address("10.0.0.1"));
        bob.transfers().acceptOffer("mixed");

        bob.router().route(chunkFromAlice("mixed", 2, new byte[3]), TestPeers.address("10.0.0.1"));

        assertEquals(0, bob.transfers().incoming("mixed").receivedCount());
        assertTrue(bobEvents.received.isEmpty());
    }
}
