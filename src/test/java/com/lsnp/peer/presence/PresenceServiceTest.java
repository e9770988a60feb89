package com.lsnp.peer.presence;

import com.lsnp.peer.net.Peer;
import com.lsnp.peer.node.LsnpNode;
import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageType;
import com.lsnp.peer.testutil.InMemoryNetwork;
import com.lsnp.peer.testutil.RecordingListener;
import com.lsnp.peer.testutil.TestPeers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PresenceServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void announcedProfileReachesOtherPeers() {
        InMemoryNetwork network = new InMemoryNetwork();
        LsnpNode alice = TestPeers.node(network, "alice", "10.0.0.1", tempDir, new RecordingListener(),
                c -> c.withProfile("Alice A.", "Exploring"));
        LsnpNode bob = TestPeers.node(network, "bob", "10.0.0.2", tempDir, new RecordingListener());

        alice.presence().announce();

        Peer peer = bob.directory().get(alice.identity());
        assertNotNull(peer);
        assertEquals("Alice A.", peer.displayName());
        assertEquals("Exploring", peer.status());
        assertEquals(TestPeers.address("10.0.0.1"), peer.address());
        assertEquals(1, network.delivered(MessageType.PING).size());
        assertEquals(1, network.delivered(MessageType.PROFILE).size());
        assertNull(alice.directory().get(bob.identity()));
    }

    @Test
    void profileCarriesIdentityAndStatus() {
        PresenceService presence = new PresenceService("carol@10.0.0.3", "Carol", "Away", null, null);
        Message profile = presence.profileMessage();
        assertEquals(MessageType.PROFILE, profile.type());
        assertEquals("carol@10.0.0.3", profile.get(Fields.USER_ID));
        assertEquals("Carol", profile.get(Fields.DISPLAY_NAME));
        assertEquals("Away", profile.get(Fields.STATUS));
    }
}
