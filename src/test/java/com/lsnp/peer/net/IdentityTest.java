package com.lsnp.peer.net;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentityTest {

    @Test
    void extractsEmbeddedIpv4() {
        assertEquals("192.168.1.20", Identity.embeddedIp("alice@192.168.1.20"));
        assertEquals("10.0.0.1", Identity.embeddedIp("first.last@10.0.0.1"));
    }

    @Test
    void rejectsNonAddresses() {
        assertNull(Identity.embeddedIp("alice"));
        assertNull(Identity.embeddedIp("alice@host.local"));
        assertNull(Identity.embeddedIp("alice@300.1.1.1"));
        assertNull(Identity.embeddedIp("alice@1.2.3"));
        assertNull(Identity.embeddedIp(null));
    }

    @Test
    void usernameAndComposition() {
        assertEquals("bob@10.0.0.2", Identity.of("bob", "10.0.0.2"));
        assertEquals("bob", Identity.username("bob@10.0.0.2"));
        assertEquals("bob", Identity.username("bob"));
    }

    @Test
    void embeddedAddressIsLiteral() {
        assertEquals("10.0.0.2", Identity.embeddedAddress("bob@10.0.0.2").getHostAddress());
        assertNull(Identity.embeddedAddress("bob@nowhere"));
    }
}
