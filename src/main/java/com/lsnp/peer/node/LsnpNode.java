package com.lsnp.peer.node;

import com.lsnp.peer.auth.Token;
import com.lsnp.peer.auth.TokenAuthority;
import com.lsnp.peer.auth.TokenIssuer;
import com.lsnp.peer.chat.ChatService;
import com.lsnp.peer.game.GameSessionManager;
import com.lsnp.peer.net.*;
import com.lsnp.peer.presence.PresenceService;
import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageType;
import com.lsnp.peer.transfer.FileTransferManager;
import com.lsnp.peer.transport.AckRegistry;
import com.lsnp.peer.transport.DedupCache;
import com.lsnp.peer.transport.ReliableSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * One LSNP peer: wires transport, router, token authority and the managers together
 * and owns their lifecycle.
 */
public class LsnpNode implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LsnpNode.class);

    private final NodeConfig config;
    private final String identity;
    private final Transport transport;
    private final TokenAuthority authority;
    private final TokenIssuer tokens;
    private final PeerDirectory directory;
    private final MessageRouter router;
    private final GameSessionManager games;
    private final FileTransferManager transfers;
    private final ChatService chat;
    private final PresenceService presence;

    private UdpTransport udp;
    private volatile boolean closed;

    public LsnpNode(NodeConfig config, Transport transport, PeerEventListener listener) {
        this.config = config;
        this.identity = config.identity();
        this.transport = transport;
        this.authority = new TokenAuthority();
        this.tokens = new TokenIssuer(authority, identity, config.tokenTtlSeconds());
        this.directory = new PeerDirectory(Clock.systemUTC(), config.activeWindowMs());

        AckRegistry acks = new AckRegistry();
        this.router = new MessageRouter(transport, authority, new DedupCache(config.dedupCapacity()), acks, directory);
        ReliableSender sender = new ReliableSender(transport, acks, directory,
                config.ackAttempts(), config.ackTimeoutMs());

        this.games = new GameSessionManager(tokens, sender, listener);
        this.transfers = new FileTransferManager(tokens, sender, transport, directory, listener,
                new FileTransferManager.Settings(config.downloadDir(), config.chunkSize(),
                        config.offerTimeoutMs(), config.receiptTimeoutMs()));
        this.chat = new ChatService(tokens, sender, listener);
        this.presence = new PresenceService(identity, config.displayName(), config.status(), transport, directory);

        games.register(router);
        transfers.register(router);
        chat.register(router);
        presence.register(router);
        router.addHandler(MessageType.REVOKE, msg -> {
            Token token = Token.parse(msg.token());
            if (token != null) {
                listener.onPeerRevoked(token.identity());
            }
        });
    }

    /**
     * Create a node listening on UDP as configured. Call {@link #start()} to begin receiving.
     */
    public static LsnpNode bind(NodeConfig config, PeerEventListener listener) throws IOException {
        UdpTransport udp = new UdpTransport(null, config.bindPort(), config.peerPort(),
                NetworkUtil.broadcastAddresses(config.address()));
        LsnpNode node = new LsnpNode(config, udp, listener);
        node.udp = udp;
        return node;
    }

    /** Start receiving and, if configured, periodic presence broadcasts. */
    public void start() {
        if (udp != null) {
            udp.start(router);
        }
        if (config.presenceIntervalSeconds() > 0) {
            presence.start(config.presenceIntervalSeconds());
        }
        log.info("Node {} started", identity);
    }

    /**
     * Revoke every token this node issued and tell the network.
     * @return number of tokens revoked
     */
    public int revokeTokens() {
        List<String> revoked = tokens.revokeAll();
        for (String token : revoked) {
            Message msg = Message.builder(MessageType.REVOKE)
                    .field(Fields.TOKEN, token)
                    .field(Fields.MESSAGE_ID, Message.newMessageId())
                    .build();
            try {
                transport.broadcast(msg);
            } catch (IOException e) {
                log.warn("Failed to broadcast revocation: {}", e.getMessage());
            }
        }
        if (!revoked.isEmpty()) {
            log.info("Revoked {} token(s)", revoked.size());
        }
        return revoked.size();
    }

    /** Active peers other than this node. */
    public List<Peer> peers() {
        List<Peer> result = new ArrayList<>();
        for (Peer p : directory.activePeers()) {
            if (!p.identity().equals(identity)) {
                result.add(p);
            }
        }
        return result;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        revokeTokens();
        presence.stop();
        if (udp != null) {
            udp.close();
        }
        log.info("Node {} stopped", identity);
    }

    public String identity()                  { return identity; }
    public NodeConfig config()                { return config; }
    public MessageRouter router()             { return router; }
    public TokenAuthority authority()         { return authority; }
    public PeerDirectory directory()          { return directory; }
    public GameSessionManager games()         { return games; }
    public FileTransferManager transfers()    { return transfers; }
    public ChatService chat()                 { return chat; }
    public PresenceService presence()         { return presence; }
}
