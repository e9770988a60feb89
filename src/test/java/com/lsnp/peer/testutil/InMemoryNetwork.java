package com.lsnp.peer.testutil;

import com.lsnp.peer.net.DatagramReceiver;
import com.lsnp.peer.net.Transport;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageCodec;
import com.lsnp.peer.protocol.MessageType;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Lossless (unless told otherwise) datagram network that delivers synchronously on the sender's thread.
 * Every send is recorded, including dropped ones.
 */
public class InMemoryNetwork {

    public record Sent(InetAddress from, InetAddress to, Message message, boolean dropped) {}

    private final Map<InetAddress, DatagramReceiver> receivers = new ConcurrentHashMap<>();
    private final List<Sent> history = new CopyOnWriteArrayList<>();
    private volatile Predicate<Message> dropFilter = m -> false;

    public Transport transport(InetAddress self) {
        return new Endpoint(self);
    }

    public void attach(InetAddress address, DatagramReceiver receiver) {
        receivers.put(address, receiver);
    }

    public void dropWhen(Predicate<Message> filter) {
        this.dropFilter = filter;
    }

    public List<Sent> sent() {
        return new ArrayList<>(history);
    }

    /** Delivered (not dropped) messages of a type. */
    public List<Sent> delivered(MessageType type) {
        List<Sent> result = new ArrayList<>();
        for (Sent s : history) {
            if (!s.dropped() && s.message().type() == type) {
                result.add(s);
            }
        }
        return result;
    }

    private void deliver(InetAddress from, InetAddress to, Message message) {
        boolean drop = dropFilter.test(message);
        history.add(new Sent(from, to, message, drop));
        DatagramReceiver receiver = receivers.get(to);
        if (drop || receiver == null) {
            return;
        }
        byte[] data = MessageCodec.encode(message);
        receiver.onDatagram(data, data.length, from);
    }

    private class Endpoint implements Transport {

        private final InetAddress self;

        Endpoint(InetAddress self) {
            this.self = self;
        }

        @Override
        public void send(Message message, InetAddress address) {
            deliver(self, address, message);
        }

        @Override
        public void broadcast(Message message) {
            for (InetAddress address : receivers.keySet()) {
                if (!address.equals(self)) {
                    deliver(self, address, message);
                }
            }
        }
    }
}
