package com.lsnp.peer.node;

import com.lsnp.peer.chat.ChatListener;
import com.lsnp.peer.game.GameListener;
import com.lsnp.peer.transfer.TransferListener;

/**
 * Everything a node reports to its user interface. All methods default to no-ops.
 */
public interface PeerEventListener extends GameListener, TransferListener, ChatListener {

    default void onPeerRevoked(String identity) {}
}
