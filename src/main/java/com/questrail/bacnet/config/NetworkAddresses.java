package com.questrail.bacnet.config;

import com.questrail.bacnet.error.ConfigurationException;

import io.netty.util.NetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Collections;

/**
 * Address helpers for building a local device.
 */
public final class NetworkAddresses
{
    private static final Logger log = LoggerFactory.getLogger(NetworkAddresses.class);

    /** Limited broadcast, used when no interface reports a subnet broadcast. */
    public static final String LIMITED_BROADCAST = "255.255.255.255";

    private NetworkAddresses() {
    }

    /**
     * Resolve a configured address.
     *
     * <p>A string made of digits and dots is taken as an IPv4 literal and must be
     * a valid one; anything else is looked up as a host name.</p>
     *
     * @throws ConfigurationException if the address cannot be resolved
     */
    public static InetAddress resolve(String address) {
        if (address == null || address.isBlank()) {
            throw new ConfigurationException("address is blank");
        }
        String trimmed = address.trim();
        if (trimmed.chars().allMatch(c -> c == '.' || Character.isDigit(c))) {
            byte[] octets = NetUtil.createByteArrayFromIpAddressString(trimmed);
            if (octets == null || octets.length != 4) {
                throw new ConfigurationException("not a valid IPv4 address: " + address);
            }
            try {
                return InetAddress.getByAddress(octets);
            }
            catch (UnknownHostException e) {
                throw new ConfigurationException("not a valid IPv4 address: " + address, e);
            }
        }
        try {
            return InetAddress.getByName(trimmed);
        }
        catch (UnknownHostException e) {
            throw new ConfigurationException("cannot resolve address: " + address, e);
        }
    }

    /**
     * Broadcast address of the first up, non-loopback interface with an IPv4
     * subnet, or {@link #LIMITED_BROADCAST}.
     */
    public static String primaryBroadcastAddress() {
        try {
            for (NetworkInterface nif : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nif.isUp() || nif.isLoopback()) {
                    continue;
                }
                for (InterfaceAddress ia : nif.getInterfaceAddresses()) {
                    if (ia.getAddress() instanceof Inet4Address && ia.getBroadcast() != null) {
                        return ia.getBroadcast().getHostAddress();
                    }
                }
            }
        }
        catch (SocketException e) {
            log.warn("Cannot enumerate network interfaces, using {}", LIMITED_BROADCAST, e);
        }
        return LIMITED_BROADCAST;
    }
}
