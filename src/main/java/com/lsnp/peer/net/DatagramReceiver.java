package com.lsnp.peer.net;

import java.net.InetAddress;

/**
 * Callback for raw inbound datagrams.
 */
@FunctionalInterface
public interface DatagramReceiver {

    void onDatagram(byte[] data, int length, InetAddress source);
}
