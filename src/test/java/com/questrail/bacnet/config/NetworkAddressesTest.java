package com.questrail.bacnet.config;

import com.questrail.bacnet.error.ConfigurationException;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;

import static org.junit.jupiter.api.Assertions.*;

class NetworkAddressesTest {

    @Test
    void resolvesIpv4Literal() {
        InetAddress address = NetworkAddresses.resolve("192.168.1.255");

        assertArrayEquals(new byte[]{(byte) 192, (byte) 168, 1, (byte) 255}, address.getAddress());
    }

    @Test
    void resolvesLocalhostByName() {
        assertTrue(NetworkAddresses.resolve("localhost").isLoopbackAddress());
    }

    @Test
    void malformedLiteralIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> NetworkAddresses.resolve("300.1.1.1"));
        assertThrows(ConfigurationException.class, () -> NetworkAddresses.resolve("1.2.3"));
        assertThrows(ConfigurationException.class, () -> NetworkAddresses.resolve(" "));
    }

    @Test
    void unknownHostIsAConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> NetworkAddresses.resolve("no-such-host.invalid"));
    }

    @Test
    void primaryBroadcastAddressIsAlwaysUsable() {
        String broadcast = NetworkAddresses.primaryBroadcastAddress();

        assertNotNull(broadcast);
        assertEquals(4, NetworkAddresses.resolve(broadcast).getAddress().length);
    }
}
