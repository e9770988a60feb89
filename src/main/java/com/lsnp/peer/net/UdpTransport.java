package com.lsnp.peer.net;

import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.util.Arrays;
import java.util.List;

/**
 * UDP transport on the protocol port.
 *
 * One daemon thread receives datagrams and hands them to a {@link DatagramReceiver}
 * synchronously. Sends always target the peer protocol port, never the source port
 * of the datagram being answered.
 */
public class UdpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(UdpTransport.class);

    public static final int DEFAULT_PORT = 50999;
    private static final int RECEIVE_TIMEOUT_MS = 500;

    private final DatagramSocket socket;
    private final int peerPort;
    private final List<InetAddress> broadcastTargets;

    private volatile boolean running;
    private Thread receiveThread;

    /**
     * @param bindAddress local address to bind, or null for the wildcard address
     * @param bindPort local port to listen on
     * @param peerPort port other peers listen on (normally equal to bindPort)
     * @param broadcastTargets addresses a broadcast is sent to
     */
    public UdpTransport(InetAddress bindAddress, int bindPort, int peerPort,
                        List<InetAddress> broadcastTargets) throws IOException {
        this.peerPort = peerPort;
        this.broadcastTargets = List.copyOf(broadcastTargets);
        this.socket = new DatagramSocket(null);
        socket.setReuseAddress(true);
        socket.setBroadcast(true);
        socket.bind(new InetSocketAddress(bindAddress, bindPort));
        socket.setSoTimeout(RECEIVE_TIMEOUT_MS);
        log.info("Listening on UDP {}:{}", bindAddress == null ? "*" : bindAddress.getHostAddress(),
                socket.getLocalPort());
    }

    @Override
    public void send(Message message, InetAddress address) throws IOException {
        byte[] data = MessageCodec.encode(message);
        socket.send(new DatagramPacket(data, data.length, address, peerPort));
        log.trace("Sent {} to {}:{}", message.type(), address.getHostAddress(), peerPort);
    }

    @Override
    public void broadcast(Message message) throws IOException {
        byte[] data = MessageCodec.encode(message);
        IOException lastError = null;
        int sent = 0;
        for (InetAddress target : broadcastTargets) {
            try {
                socket.send(new DatagramPacket(data, data.length, target, peerPort));
                sent++;
            } catch (IOException e) {
                log.debug("Broadcast of {} to {} failed: {}", message.type(), target.getHostAddress(), e.getMessage());
                lastError = e;
            }
        }
        if (sent == 0 && lastError != null) {
            throw lastError;
        }
    }

    /** Start the receive loop. */
    public void start(DatagramReceiver receiver) {
        running = true;
        receiveThread = new Thread(() -> receiveLoop(receiver), "lsnp-receiver");
        receiveThread.setDaemon(true);
        receiveThread.start();
    }

    /** Stop the receive loop and close the socket. */
    public void close() {
        running = false;
        socket.close();
        if (receiveThread != null) {
            try {
                receiveThread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public int localPort() {
        return socket.getLocalPort();
    }

    public boolean isRunning() {
        return running;
    }

    private void receiveLoop(DatagramReceiver receiver) {
        byte[] recvBuf = new byte[MessageCodec.MAX_DATAGRAM];

        while (running) {
            DatagramPacket dgram = new DatagramPacket(recvBuf, recvBuf.length);
            try {
                socket.receive(dgram);
            } catch (SocketTimeoutException e) {
                continue;
            } catch (IOException e) {
                if (running) {
                    log.warn("Receive error: {}", e.getMessage());
                    continue;
                }
                break;
            }

            byte[] data = Arrays.copyOf(recvBuf, dgram.getLength());
            try {
                receiver.onDatagram(data, data.length, dgram.getAddress());
            } catch (RuntimeException e) {
                log.warn("Unexpected error handling datagram from {}: {}",
                        dgram.getAddress().getHostAddress(), e.getMessage(), e);
            } catch (Error e) {
                running = false;
                log.error("Receive loop stopped by error handling datagram from {}",
                        dgram.getAddress().getHostAddress(), e);
                throw e;
            }
        }

        log.debug("Receive loop exited");
    }
}
