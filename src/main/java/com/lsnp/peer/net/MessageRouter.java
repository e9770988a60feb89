package com.lsnp.peer.net;

import com.lsnp.peer.auth.Token;
import com.lsnp.peer.auth.TokenAuthority;
import com.lsnp.peer.auth.TokenStatus;
import com.lsnp.peer.protocol.*;
import com.lsnp.peer.transport.AckRegistry;
import com.lsnp.peer.transport.DedupCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Inbound pipeline, run synchronously on the receive thread for every datagram:
 * <ol>
 *   <li>decode (malformed frames are dropped silently)</li>
 *   <li>ACK fast path: resolve the pending waiter</li>
 *   <li>identity/IP consistency: enforced for token-bearing types, logged otherwise</li>
 *   <li>token validation for token-bearing types</li>
 *   <li>dedup by MESSAGE_ID; a duplicate reliable message is re-ACKed, never re-dispatched</li>
 *   <li>auto-ACK for reliable types</li>
 *   <li>peer directory upsert, then dispatch to the registered handler</li>
 * </ol>
 * Handlers must not block on reliable sends.
 */
public class MessageRouter implements DatagramReceiver {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final Transport transport;
    private final TokenAuthority authority;
    private final DedupCache dedup;
    private final AckRegistry acks;
    private final PeerDirectory directory;
    private final Map<MessageType, Consumer<Message>> handlers = new ConcurrentHashMap<>();

    public MessageRouter(Transport transport, TokenAuthority authority, DedupCache dedup,
                         AckRegistry acks, PeerDirectory directory) {
        this.transport = transport;
        this.authority = authority;
        this.dedup = dedup;
        this.acks = acks;
        this.directory = directory;
    }

    /** Register a handler for a specific message type. */
    public void addHandler(MessageType type, Consumer<Message> handler) {
        handlers.put(type, handler);
    }

    /** Remove a handler. */
    public void removeHandler(MessageType type) {
        handlers.remove(type);
    }

    @Override
    public void onDatagram(byte[] data, int length, InetAddress source) {
        route(data, length, source);
    }

    public RouteResult route(byte[] data, int length, InetAddress source) {
        Message msg;
        try {
            msg = MessageCodec.decode(data, length);
        } catch (MessageException e) {
            log.debug("Ignoring malformed message from {}: {}", source.getHostAddress(), e.getMessage());
            return RouteResult.MALFORMED;
        }
        return route(msg, source);
    }

    public RouteResult route(Message msg, InetAddress source) {
        MessageType type = msg.type();

        if (type == MessageType.ACK) {
            if (!acks.onAckReceived(msg.messageId())) {
                log.trace("ACK for unknown or settled message {}", msg.messageId());
            }
            return RouteResult.ACKNOWLEDGEMENT;
        }
        if (type == MessageType.REVOKE) {
            return handleRevoke(msg, source);
        }

        String identity = msg.identity();
        if (!matchesSource(identity, source)) {
            if (type.requiresToken()) {
                log.warn("Dropping spoofed {} from {} claiming {}", type, source.getHostAddress(), identity);
                return RouteResult.SPOOFED;
            }
            log.debug("{} from {} claims identity {}", type, source.getHostAddress(), identity);
        }

        if (type.requiresToken()) {
            String raw = msg.token();
            TokenStatus status = authority.validate(raw, type.scope());
            if (!status.isOk()) {
                log.info("Rejecting {} from {}: token {}", type, identity, status);
                return RouteResult.UNAUTHORIZED;
            }
            Token token = Token.parse(raw);
            if (!token.identity().equals(identity)) {
                log.info("Rejecting {} from {}: token issued to {}", type, identity, token.identity());
                return RouteResult.UNAUTHORIZED;
            }
        }

        String messageId = msg.messageId();
        if (messageId != null && dedup.isDuplicate(messageId)) {
            log.debug("Duplicate {} {} from {}", type, messageId, identity);
            if (type.reliable()) {
                sendAck(messageId, source);
            }
            return RouteResult.DUPLICATE;
        }
        if (type.reliable()) {
            sendAck(messageId, source);
        }

        if (identity != null) {
            directory.touch(identity, source);
        }
        return dispatch(msg);
    }

    private RouteResult handleRevoke(Message msg, InetAddress source) {
        String raw = msg.token();
        Token token = Token.parse(raw);
        if (token == null) {
            log.debug("Ignoring REVOKE with malformed token from {}", source.getHostAddress());
            return RouteResult.UNAUTHORIZED;
        }
        if (!matchesSource(token.identity(), source)) {
            log.warn("Dropping spoofed REVOKE from {} for {}", source.getHostAddress(), token.identity());
            return RouteResult.SPOOFED;
        }
        String dedupKey = msg.messageId() != null ? msg.messageId() : "REVOKE:" + raw;
        if (dedup.isDuplicate(dedupKey)) {
            return RouteResult.DUPLICATE;
        }

        authority.revoke(raw);
        if (directory.remove(token.identity())) {
            log.info("Peer {} revoked its token and left", token.identity());
        }
        Consumer<Message> handler = handlers.get(MessageType.REVOKE);
        if (handler != null) {
            invoke(handler, msg);
        }
        return RouteResult.REVOCATION;
    }

    private RouteResult dispatch(Message msg) {
        Consumer<Message> handler = handlers.get(msg.type());
        if (handler == null) {
            log.debug("No handler for message type: {}", msg.type());
            return RouteResult.UNHANDLED;
        }
        invoke(handler, msg);
        return RouteResult.DISPATCHED;
    }

    private void invoke(Consumer<Message> handler, Message msg) {
        try {
            handler.accept(msg);
        } catch (RuntimeException e) {
            log.warn("Handler for {} failed: {}", msg.type(), e.getMessage(), e);
        }
    }

    private static boolean matchesSource(String identity, InetAddress source) {
        String embedded = Identity.embeddedIp(identity);
        return embedded == null || embedded.equals(source.getHostAddress());
    }

    private void sendAck(String messageId, InetAddress source) {
        Message ack = Message.builder(MessageType.ACK)
                .field(Fields.MESSAGE_ID, messageId)
                .field(Fields.STATUS, "RECEIVED")
                .build();
        try {
            transport.send(ack, source);
        } catch (IOException e) {
            log.debug("Failed to send ACK for {}: {}", messageId, e.getMessage());
        }
    }
}
