package com.lsnp.peer.chat;

import com.lsnp.peer.auth.TokenIssuer;
import com.lsnp.peer.auth.TokenScope;
import com.lsnp.peer.net.MessageRouter;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageException;
import com.lsnp.peer.protocol.MessageType;
import com.lsnp.peer.transport.ReliableSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Direct messages over the reliable substrate. History is not kept.
 */
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final TokenIssuer tokens;
    private final ReliableSender sender;
    private final ChatListener listener;

    public ChatService(TokenIssuer tokens, ReliableSender sender, ChatListener listener) {
        this.tokens = tokens;
        this.sender = sender;
        this.listener = listener;
    }

    public void register(MessageRouter router) {
        router.addHandler(MessageType.DM, this::handleDirectMessage);
    }

    /** Send a DM. Blocks until acknowledged or the retry budget is spent. */
    public boolean send(String recipient, String content) {
        DirectMessage dm = new DirectMessage(tokens.identity(), recipient, content,
                System.currentTimeMillis() / 1000, Message.newMessageId(), tokens.tokenFor(TokenScope.CHAT));
        boolean delivered = sender.sendReliable(dm.toMessage(), recipient);
        if (!delivered) {
            log.warn("DM to {} was not delivered", recipient);
        }
        return delivered;
    }

    private void handleDirectMessage(Message msg) {
        DirectMessage dm;
        try {
            dm = DirectMessage.from(msg);
        } catch (MessageException e) {
            log.debug("Ignoring bad DM: {}", e.getMessage());
            return;
        }
        if (!tokens.identity().equals(dm.to())) {
            return;
        }
        log.debug("DM from {}", dm.from());
        listener.onDirectMessage(dm);
    }
}
