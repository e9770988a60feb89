package com.lsnp.peer.net;

import com.lsnp.peer.protocol.Message;

import java.io.IOException;
import java.net.InetAddress;

/**
 * Unreliable datagram transport. Every peer listens on the same protocol port,
 * so a destination is just an address.
 */
public interface Transport {

    void send(Message message, InetAddress address) throws IOException;

    void broadcast(Message message) throws IOException;
}
