package com.lsnp.peer.node;

import com.lsnp.peer.auth.TokenAuthority;
import com.lsnp.peer.net.Identity;
import com.lsnp.peer.net.PeerDirectory;
import com.lsnp.peer.net.UdpTransport;
import com.lsnp.peer.presence.PresenceService;
import com.lsnp.peer.transfer.FileTransferManager;
import com.lsnp.peer.transport.DedupCache;
import com.lsnp.peer.transport.ReliableSender;

import java.net.InetAddress;
import java.nio.file.Path;

/**
 * Immutable node settings. {@link #defaults} carries the protocol constants.
 */
public record NodeConfig(
        String username,
        String displayName,
        String status,
        InetAddress address,
        int bindPort,
        int peerPort,
        Path downloadDir,
        int ackAttempts,
        long ackTimeoutMs,
        long offerTimeoutMs,
        long receiptTimeoutMs,
        int chunkSize,
        int dedupCapacity,
        long activeWindowMs,
        long tokenTtlSeconds,
        long presenceIntervalSeconds) {

    public static NodeConfig defaults(String username, InetAddress address, Path downloadDir) {
        return new NodeConfig(username, username, "Online", address,
                UdpTransport.DEFAULT_PORT, UdpTransport.DEFAULT_PORT, downloadDir,
                ReliableSender.DEFAULT_MAX_ATTEMPTS, ReliableSender.DEFAULT_ACK_TIMEOUT_MS,
                FileTransferManager.DEFAULT_OFFER_TIMEOUT_MS, FileTransferManager.DEFAULT_RECEIPT_TIMEOUT_MS,
                FileTransferManager.DEFAULT_CHUNK_SIZE, DedupCache.DEFAULT_CAPACITY,
                PeerDirectory.DEFAULT_ACTIVE_WINDOW_MS, TokenAuthority.DEFAULT_TTL_SECONDS,
                PresenceService.DEFAULT_INTERVAL_SECONDS);
    }

    /** {@code username@ip}. */
    public String identity() {
        return Identity.of(username, address.getHostAddress());
    }

    public NodeConfig withProfile(String newDisplayName, String newStatus) {
        return new NodeConfig(username, newDisplayName, newStatus, address, bindPort, peerPort, downloadDir,
                ackAttempts, ackTimeoutMs, offerTimeoutMs, receiptTimeoutMs, chunkSize, dedupCapacity,
                activeWindowMs, tokenTtlSeconds, presenceIntervalSeconds);
    }

    public NodeConfig withPorts(int newBindPort, int newPeerPort) {
        return new NodeConfig(username, displayName, status, address, newBindPort, newPeerPort, downloadDir,
                ackAttempts, ackTimeoutMs, offerTimeoutMs, receiptTimeoutMs, chunkSize, dedupCapacity,
                activeWindowMs, tokenTtlSeconds, presenceIntervalSeconds);
    }

    public NodeConfig withAckPolicy(int attempts, long timeoutMs) {
        return new NodeConfig(username, displayName, status, address, bindPort, peerPort, downloadDir,
                attempts, timeoutMs, offerTimeoutMs, receiptTimeoutMs, chunkSize, dedupCapacity,
                activeWindowMs, tokenTtlSeconds, presenceIntervalSeconds);
    }

    public NodeConfig withTransferTimeouts(long newOfferTimeoutMs, long newReceiptTimeoutMs) {
        return new NodeConfig(username, displayName, status, address, bindPort, peerPort, downloadDir,
                ackAttempts, ackTimeoutMs, newOfferTimeoutMs, newReceiptTimeoutMs, chunkSize, dedupCapacity,
                activeWindowMs, tokenTtlSeconds, presenceIntervalSeconds);
    }

    public NodeConfig withTokenTtl(long seconds) {
        return new NodeConfig(username, displayName, status, address, bindPort, peerPort, downloadDir,
                ackAttempts, ackTimeoutMs, offerTimeoutMs, receiptTimeoutMs, chunkSize, dedupCapacity,
                activeWindowMs, seconds, presenceIntervalSeconds);
    }

    public NodeConfig withPresenceInterval(long seconds) {
        return new NodeConfig(username, displayName, status, address, bindPort, peerPort, downloadDir,
                ackAttempts, ackTimeoutMs, offerTimeoutMs, receiptTimeoutMs, chunkSize, dedupCapacity,
                activeWindowMs, tokenTtlSeconds, seconds);
    }
}
