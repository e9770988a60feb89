package com.lsnp.peer.transport;

import com.lsnp.peer.net.PeerDirectory;
import com.lsnp.peer.net.Transport;
import com.lsnp.peer.protocol.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Stop-and-wait delivery over an unreliable transport.
 *
 * Registers an ACK waiter keyed by MESSAGE_ID, then transmits and waits up to
 * the ACK timeout, for at most {@code maxAttempts} attempts. Blocks the caller.
 */
public class ReliableSender {

    private static final Logger log = LoggerFactory.getLogger(ReliableSender.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_ACK_TIMEOUT_MS = 2_000;

    private final Transport transport;
    private final AckRegistry acks;
    private final PeerDirectory directory;
    private final int maxAttempts;
    private final long ackTimeoutMs;

    public ReliableSender(Transport transport, AckRegistry acks, PeerDirectory directory) {
        this(transport, acks, directory, DEFAULT_MAX_ATTEMPTS, DEFAULT_ACK_TIMEOUT_MS);
    }

    public ReliableSender(Transport transport, AckRegistry acks, PeerDirectory directory,
                          int maxAttempts, long ackTimeoutMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.transport = transport;
        this.acks = acks;
        this.directory = directory;
        this.maxAttempts = maxAttempts;
        this.ackTimeoutMs = ackTimeoutMs;
    }

    /**
     * Send to a peer identity, resolving its address through the peer directory.
     * @return true once an ACK arrives; false if unresolvable or the retry budget is exhausted
     */
    public boolean sendReliable(Message message, String recipient) {
        InetAddress address = directory.resolve(recipient);
        if (address == null) {
            log.warn("Cannot resolve address for {}, dropping {}", recipient, message.type());
            return false;
        }
        return sendReliable(message, address);
    }

    public boolean sendReliable(Message message, InetAddress address) {
        String messageId = message.messageId();
        if (messageId == null) {
            throw new IllegalArgumentException(message.type() + " has no MESSAGE_ID");
        }

        CountDownLatch latch = acks.register(messageId);
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    transport.send(message, address);
                } catch (IOException e) {
                    log.debug("Send of {} {} failed (attempt {}/{}): {}",
                            message.type(), messageId, attempt, maxAttempts, e.getMessage());
                }
                if (latch.await(ackTimeoutMs, TimeUnit.MILLISECONDS)) {
                    if (attempt > 1) {
                        log.debug("{} {} acknowledged after {} attempts", message.type(), messageId, attempt);
                    }
                    return true;
                }
                log.debug("No ACK for {} {} from {} (attempt {}/{})",
                        message.type(), messageId, address.getHostAddress(), attempt, maxAttempts);
            }
            log.warn("{} {} to {} unacknowledged after {} attempts",
                    message.type(), messageId, address.getHostAddress(), maxAttempts);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            acks.remove(messageId);
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long ackTimeoutMs() {
        return ackTimeoutMs;
    }
}
