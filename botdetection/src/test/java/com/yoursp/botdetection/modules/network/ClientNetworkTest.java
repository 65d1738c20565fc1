package com.yoursp.botdetection.modules.network;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ClientNetwork: masking and the compressed string form.
 */
class ClientNetworkTest {

    private static InetAddress ip(String literal) {
        return IpLiteral.parse(literal).orElseThrow();
    }

    @Test
    void masksIpv4HostBits() {
        ClientNetwork network = ClientNetwork.of(ip("203.0.113.77"), 24);

        assertEquals("203.0.113.0/24", network.compressed());
        assertFalse(network.isIpv6());
    }

    @Test
    void masksWithinAByte() {
        assertEquals("10.0.0.128/25", ClientNetwork.of(ip("10.0.0.200"), 25).compressed());
        assertEquals("0.0.0.0/0", ClientNetwork.of(ip("192.0.2.1"), 0).compressed());
        assertEquals("192.0.2.1/32", ClientNetwork.of(ip("192.0.2.1"), 32).compressed());
    }

    @Test
    void compressesIpv6WithLongestZeroRun() {
        assertEquals("2001:db8::/48", ClientNetwork.of(ip("2001:db8:0:1234:5678::1"), 48).compressed());
        assertEquals("::1/128", ClientNetwork.of(ip("::1"), 128).compressed());
        assertEquals("::/0", ClientNetwork.of(ip("2001:db8::1"), 0).compressed());
        assertEquals("2001:db8::1:0:0:1/128", ClientNetwork.of(ip("2001:db8:0:0:1:0:0:1"), 128).compressed());
    }

    @Test
    void singleZeroHextetIsNotCompressed() {
        assertEquals("2001:db8:0:1:1:1:1:1/128",
                ClientNetwork.of(ip("2001:0DB8:0000:0001:0001:0001:0001:0001"), 128).compressed());
    }

    @Test
    void addressesOfTheSameNetworkAreEqual() {
        ClientNetwork a = ClientNetwork.of(ip("203.0.113.5"), 24);
        ClientNetwork b = ClientNetwork.of(ip("203.0.113.250"), 24);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(a.contains(ip("203.0.113.9")));
        assertFalse(a.contains(ip("203.0.114.9")));
        assertFalse(a.contains(ip("2001:db8::1")));
    }

    @Test
    void parseRoundTripsCompressedForm() {
        assertEquals("203.0.113.0/24", ClientNetwork.parse("203.0.113.0/24").compressed());
        assertEquals("2001:db8::/48", ClientNetwork.parse("2001:db8::/48").compressed());
    }

    @Test
    void rejectsPrefixOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> ClientNetwork.of(ip("192.0.2.1"), 33));
        assertThrows(IllegalArgumentException.class, () -> ClientNetwork.of(ip("2001:db8::1"), 129));
        assertThrows(IllegalArgumentException.class, () -> ClientNetwork.parse("192.0.2.1"));
        assertThrows(IllegalArgumentException.class, () -> ClientNetwork.parse("example.org/24"));
    }
}
