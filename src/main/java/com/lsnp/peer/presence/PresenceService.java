package com.lsnp.peer.presence;

import com.lsnp.peer.net.Identity;
import com.lsnp.peer.net.MessageRouter;
import com.lsnp.peer.net.PeerDirectory;
import com.lsnp.peer.net.Transport;
import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic PING/PROFILE broadcasts and the handlers that feed the peer directory from them.
 */
public class PresenceService {

    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    public static final long DEFAULT_INTERVAL_SECONDS = 300;

    private final String localIdentity;
    private final String displayName;
    private final String status;
    private final Transport transport;
    private final PeerDirectory directory;
    private ScheduledExecutorService scheduler;

    public PresenceService(String localIdentity, String displayName, String status,
                           Transport transport, PeerDirectory directory) {
        this.localIdentity = localIdentity;
        this.displayName = displayName;
        this.status = status;
        this.transport = transport;
        this.directory = directory;
    }

    public void register(MessageRouter router) {
        router.addHandler(MessageType.PING, msg -> log.trace("PING from {}", msg.identity()));
        router.addHandler(MessageType.PROFILE, this::handleProfile);
    }

    /** Broadcast immediately, then every {@code intervalSeconds}. */
    public void start(long intervalSeconds) {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "presence");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::announce, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /** Broadcast PING and PROFILE once. */
    public void announce() {
        try {
            transport.broadcast(Message.builder(MessageType.PING)
                    .field(Fields.USER_ID, localIdentity)
                    .build());
            transport.broadcast(profileMessage());
        } catch (IOException e) {
            log.warn("Presence broadcast failed: {}", e.getMessage());
        }
    }

    Message profileMessage() {
        return Message.builder(MessageType.PROFILE)
                .field(Fields.USER_ID, localIdentity)
                .field(Fields.DISPLAY_NAME, displayName)
                .field(Fields.STATUS, status)
                .build();
    }

    private void handleProfile(Message msg) {
        String identity = msg.identity();
        if (localIdentity.equals(identity)) {
            return;
        }
        InetAddress address = directory.lookup(identity);
        if (address == null) {
            address = Identity.embeddedAddress(identity);
        }
        if (address == null) {
            return;
        }
        directory.updateProfile(identity, msg.get(Fields.DISPLAY_NAME), msg.get(Fields.STATUS), address);
        log.debug("Profile from {}: {}", identity, msg.get(Fields.DISPLAY_NAME));
    }
}
