package com.lsnp.peer.net;

import java.net.InetAddress;

/**
 * A known peer as last seen on the network.
 */
public record Peer(String identity, String displayName, String status, InetAddress address, long lastSeenMs) {

    public boolean isActive(long nowMs, long windowMs) {
        return nowMs - lastSeenMs < windowMs;
    }

    Peer seenAt(InetAddress newAddress, long nowMs) {
        return new Peer(identity, displayName, status, newAddress, nowMs);
    }
}
