package com.lsnp.peer.transfer;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Sender-side record of one file transfer.
 *
 * The accept/reject decision and the receiver's FILE_RECEIVED each arrive on the
 * receive thread and release a latch; only the transfer's own worker thread moves
 * the state forward.
 */
public class OutgoingTransfer {

    private final String fileId;
    private final String recipient;
    private final Path path;
    private final long fileSize;
    private final int totalChunks;

    private volatile TransferState state = TransferState.OFFERED;
    private volatile boolean accepted;
    private volatile int chunksSent;
    private final CountDownLatch decisionLatch = new CountDownLatch(1);
    private final CountDownLatch receivedLatch = new CountDownLatch(1);

    public OutgoingTransfer(String fileId, String recipient, Path path, long fileSize, int totalChunks) {
        this.fileId = fileId;
        this.recipient = recipient;
        this.path = path;
        this.fileSize = fileSize;
        this.totalChunks = totalChunks;
    }

    /** Record the receiver's decision. Only the first decision counts. */
    void decide(boolean accept) {
        synchronized (decisionLatch) {
            if (decisionLatch.getCount() == 0) {
                return;
            }
            accepted = accept;
            decisionLatch.countDown();
        }
    }

    boolean awaitDecision(long timeoutMs) throws InterruptedException {
        return decisionLatch.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    void markReceived() {
        receivedLatch.countDown();
    }

    boolean awaitReceived(long timeoutMs) throws InterruptedException {
        return receivedLatch.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    void setState(TransferState state) {
        this.state = state;
    }

    void chunkSent() {
        chunksSent++;
    }

    public String fileId()        { return fileId; }
    public String recipient()     { return recipient; }
    public Path path()            { return path; }
    public long fileSize()        { return fileSize; }
    public int totalChunks()      { return totalChunks; }
    public TransferState state()  { return state; }
    public boolean accepted()     { return accepted; }
    public int chunksSent()       { return chunksSent; }

    @Override
    public String toString() {
        return String.format("OutgoingTransfer[id=%s, to=%s, file=%s, state=%s, chunks=%d/%d]",
                fileId, recipient, path.getFileName(), state, chunksSent, totalChunks);
    }
}
