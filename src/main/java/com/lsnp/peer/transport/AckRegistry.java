package com.lsnp.peer.transport;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;

/**
 * Pending-ACK waiters keyed by message id.
 */
public class AckRegistry {

    private final Map<String, CountDownLatch> waiters = new ConcurrentHashMap<>();

    /** Register (or return the existing) waiter for a message id. */
    public CountDownLatch register(String messageId) {
        return waiters.computeIfAbsent(messageId, id -> new CountDownLatch(1));
    }

    /**
     * Resolve the waiter for an incoming ACK. Idempotent.
     * @return true if a waiter was registered for this id
     */
    public boolean onAckReceived(String messageId) {
        CountDownLatch latch = messageId == null ? null : waiters.get(messageId);
        if (latch == null) {
            return false;
        }
        latch.countDown();
        return true;
    }

    public void remove(String messageId) {
        waiters.remove(messageId);
    }

    public boolean isPending(String messageId) {
        CountDownLatch latch = waiters.get(messageId);
        return latch != null && latch.getCount() > 0;
    }

    public int pendingCount() {
        return waiters.size();
    }
}
