package com.lsnp.peer.transfer;

import java.io.ByteArrayOutputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Receiver-side chunk collection for an accepted offer.
 * Complete only once every index in {@code [0, totalChunks)} has been stored.
 */
public class IncomingTransfer {

    private final FileOffer offer;
    private final Map<Integer, byte[]> chunks = new HashMap<>();

    public IncomingTransfer(FileOffer offer) {
        this.offer = offer;
    }

    /**
     * Store a chunk by index. Duplicates overwrite; out-of-range indices are dropped.
     * @return true if the transfer is complete after this chunk
     */
    public synchronized boolean store(int index, byte[] data) {
        if (index < 0 || index >= offer.totalChunks()) {
            return false;
        }
        chunks.put(index, data);
        return chunks.size() == offer.totalChunks();
    }

    public synchronized boolean isComplete() {
        return chunks.size() == offer.totalChunks();
    }

    public synchronized int receivedCount() {
        return chunks.size();
    }

    /** Concatenate chunks in index order. */
    public synchronized byte[] assemble() {
        if (!isComplete()) {
            throw new IllegalStateException("transfer " + offer.fileId() + " has "
                    + chunks.size() + "/" + offer.totalChunks() + " chunks");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < offer.totalChunks(); i++) {
            out.writeBytes(chunks.get(i));
        }
        return out.toByteArray();
    }

    public FileOffer offer() {
        return offer;
    }
}
