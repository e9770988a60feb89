package com.lsnp.peer.transport;

import com.lsnp.peer.net.PeerDirectory;
import com.lsnp.peer.net.Transport;
import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ReliableSenderTest {

    private static final String BOB = "bob@10.0.0.2";

    /** Transport that ACKs a message id once it has seen it {@code ackOnAttempt} times. */
    private static class AckingTransport implements Transport {
        final List<Message> sent = new CopyOnWriteArrayList<>();
        final AckRegistry acks;
        final int ackOnAttempt;

        AckingTransport(AckRegistry acks, int ackOnAttempt) {
            this.acks = acks;
            this.ackOnAttempt = ackOnAttempt;
        }

        @Override
        public void send(Message message, InetAddress address) {
            sent.add(message);
            if (sent.size() == ackOnAttempt) {
                acks.onAckReceived(message.messageId());
            }
        }

        @Override
        public void broadcast(Message message) throws IOException {
            throw new IOException("not used");
        }
    }

    private static Message dm() {
        return Message.builder(MessageType.DM)
                .field(Fields.FROM, "alice@10.0.0.1")
                .field(Fields.TO, BOB)
                .field(Fields.CONTENT, "hi")
                .field(Fields.MESSAGE_ID, Message.newMessageId())
                .field(Fields.TOKEN, "alice@10.0.0.1|9999999999|chat")
                .build();
    }

    @Test
    void succeedsOnFirstAck() {
        AckRegistry acks = new AckRegistry();
        AckingTransport transport = new AckingTransport(acks, 1);
        ReliableSender sender = new ReliableSender(transport, acks, new PeerDirectory(), 3, 50);

        assertTrue(sender.sendReliable(dm(), BOB));
        assertEquals(1, transport.sent.size());
        assertEquals(0, acks.pendingCount());
    }

    @Test
    void retransmitsUntilAcked() {
        AckRegistry acks = new AckRegistry();
        AckingTransport transport = new AckingTransport(acks, 3);
        ReliableSender sender = new ReliableSender(transport, acks, new PeerDirectory(), 3, 50);

        assertTrue(sender.sendReliable(dm(), BOB));
        assertEquals(3, transport.sent.size());
    }

    @Test
    void givesUpAfterRetryBudgetAndRemovesWaiter() {
        AckRegistry acks = new AckRegistry();
        AckingTransport transport = new AckingTransport(acks, Integer.MAX_VALUE);
        ReliableSender sender = new ReliableSender(transport, acks, new PeerDirectory(), 3, 30);

        long start = System.nanoTime();
        Message msg = dm();
        assertFalse(sender.sendReliable(msg, BOB));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(3, transport.sent.size());
        assertTrue(elapsedMs >= 90, "waited " + elapsedMs + "ms");
        assertFalse(acks.isPending(msg.messageId()));
        assertFalse(acks.onAckReceived(msg.messageId()), "late ACK has no waiter");
    }

    @Test
    void unresolvableRecipientFailsWithoutSending() {
        AckRegistry acks = new AckRegistry();
        AckingTransport transport = new AckingTransport(acks, 1);
        ReliableSender sender = new ReliableSender(transport, acks, new PeerDirectory(), 3, 30);

        assertFalse(sender.sendReliable(dm(), "bob-without-address"));
        assertTrue(transport.sent.isEmpty());
    }

    @Test
    void interruptedSenderStopsAndKeepsFlag() {
        AckRegistry acks = new AckRegistry();
        AckingTransport transport = new AckingTransport(acks, Integer.MAX_VALUE);
        ReliableSender sender = new ReliableSender(transport, acks, new PeerDirectory(), 3, 5_000);

        Thread.currentThread().interrupt();
        try {
            assertFalse(sender.sendReliable(dm(), BOB));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertEquals(1, transport.sent.size());
    }

    @Test
    void ackResolutionIsIdempotent() {
        AckRegistry acks = new AckRegistry();
        acks.register("m1");
        assertTrue(acks.onAckReceived("m1"));
        assertTrue(acks.onAckReceived("m1"));
        assertFalse(acks.isPending("m1"));
    }
}
