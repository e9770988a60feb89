package com.lsnp.peer.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity to address map with liveness. Shared by the router (writer) and the
 * managers (readers); all access goes through one lock.
 */
public class PeerDirectory {

    private static final Logger log = LoggerFactory.getLogger(PeerDirectory.class);

    public static final long DEFAULT_ACTIVE_WINDOW_MS = 60_000;

    private final Object lock = new Object();
    private final Map<String, Peer> peers = new HashMap<>();
    private final Clock clock;
    private final long activeWindowMs;

    public PeerDirectory() {
        this(Clock.systemUTC(), DEFAULT_ACTIVE_WINDOW_MS);
    }

    public PeerDirectory(Clock clock, long activeWindowMs) {
        this.clock = clock;
        this.activeWindowMs = activeWindowMs;
    }

    /** Record that {@code identity} was heard from {@code address}. */
    public void touch(String identity, InetAddress address) {
        long now = clock.millis();
        synchronized (lock) {
            Peer existing = peers.get(identity);
            if (existing == null) {
                peers.put(identity, new Peer(identity, Identity.username(identity), null, address, now));
                log.debug("New peer {} at {}", identity, address.getHostAddress());
            } else {
                peers.put(identity, existing.seenAt(address, now));
            }
        }
    }

    public void updateProfile(String identity, String displayName, String status, InetAddress address) {
        long now = clock.millis();
        synchronized (lock) {
            peers.put(identity, new Peer(identity, displayName, status, address, now));
        }
    }

    public Peer get(String identity) {
        synchronized (lock) {
            return peers.get(identity);
        }
    }

    /** Address last seen for {@code identity}, or null. */
    public InetAddress lookup(String identity) {
        synchronized (lock) {
            Peer p = peers.get(identity);
            return p == null ? null : p.address();
        }
    }

    /** Directory address first, then the IPv4 literal embedded in the identity. */
    public InetAddress resolve(String identity) {
        InetAddress known = lookup(identity);
        return known != null ? known : Identity.embeddedAddress(identity);
    }

    public boolean isActive(String identity) {
        synchronized (lock) {
            Peer p = peers.get(identity);
            return p != null && p.isActive(clock.millis(), activeWindowMs);
        }
    }

    public List<Peer> activePeers() {
        long now = clock.millis();
        List<Peer> result = new ArrayList<>();
        synchronized (lock) {
            for (Peer p : peers.values()) {
                if (p.isActive(now, activeWindowMs)) {
                    result.add(p);
                }
            }
        }
        result.sort(Comparator.comparing(Peer::identity));
        return result;
    }

    public boolean remove(String identity) {
        synchronized (lock) {
            return peers.remove(identity) != null;
        }
    }

    public int size() {
        synchronized (lock) {
            return peers.size();
        }
    }
}
