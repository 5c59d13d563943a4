package com.questrail.bacnet.config;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.error.ConfigurationException;

import java.time.Duration;

/**
 * LocalDeviceConfig
 * =============================================================================
 * Immutable settings a local device is built from. Stored verbatim in backups.
 *
 * <ul>
 *   <li><b>deviceId</b>: instance number of the local device object (0-4194303)</li>
 *   <li><b>broadcastAddress</b>: IPv4 broadcast address of the local subnet</li>
 *   <li><b>port</b>: UDP port the device binds</li>
 *   <li><b>destinationPort</b>: UDP port broadcasts are sent to</li>
 *   <li><b>localAddress</b>: interface to bind, {@code null} for the wildcard address</li>
 *   <li><b>timeout</b>: APDU timeout per attempt, in milliseconds</li>
 *   <li><b>apduTimeout</b>: overall ceiling on a blocking request in milliseconds;
 *       {@code null} derives it from {@code timeout} and {@code retries}</li>
 *   <li><b>retries</b>: APDU retransmissions after the first attempt</li>
 *   <li><b>segTimeout</b>, <b>segWindow</b>: segmentation tunables, passed through
 *       to the transport</li>
 * </ul>
 */
public record LocalDeviceConfig(
        int deviceId,
        String broadcastAddress,
        int port,
        int destinationPort,
        String localAddress,
        int timeout,
        Integer apduTimeout,
        int retries,
        int segTimeout,
        int segWindow
) {
    public static final int DEFAULT_DEVICE_ID = 1338;
    public static final int DEFAULT_PORT = 47808;
    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;
    public static final int DEFAULT_RETRIES = 2;
    public static final int DEFAULT_SEG_TIMEOUT_MILLIS = 1_000;
    public static final int DEFAULT_SEG_WINDOW = 5;

    public LocalDeviceConfig {
        if (deviceId < 0 || deviceId > ObjectIdentifier.MAX_INSTANCE) {
            throw new ConfigurationException("deviceId must be 0-" + ObjectIdentifier.MAX_INSTANCE + ": " + deviceId);
        }
        if (broadcastAddress == null || broadcastAddress.isBlank()) {
            throw new ConfigurationException("broadcastAddress is required");
        }
        requirePort("port", port);
        requirePort("destinationPort", destinationPort);
        if (localAddress != null && localAddress.isBlank()) {
            localAddress = null;
        }
        requireNonNegative("timeout", timeout);
        if (apduTimeout != null) {
            requireNonNegative("apduTimeout", apduTimeout);
        }
        requireNonNegative("retries", retries);
        requireNonNegative("segTimeout", segTimeout);
        if (segWindow < 1) {
            throw new ConfigurationException("segWindow must be >= 1: " + segWindow);
        }
    }

    /** Defaults, with the broadcast address of the primary IPv4 interface. */
    public static LocalDeviceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-loaded with every field of {@code base}. */
    public static Builder builder(LocalDeviceConfig base) {
        return new Builder(base);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Longest a caller may wait for one confirmed request: {@code apduTimeout}
     * when set, otherwise one {@code timeout} per attempt.
     */
    public Duration requestTimeout() {
        if (apduTimeout != null) {
            return Duration.ofMillis(apduTimeout);
        }
        return Duration.ofMillis((long) timeout * (retries + 1));
    }

    private static void requirePort(String name, int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new ConfigurationException(name + " must be 0-65535: " + value);
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new ConfigurationException(name + " must be non-negative: " + value);
        }
    }

    public static final class Builder {
        private int deviceId = DEFAULT_DEVICE_ID;
        private String broadcastAddress;
        private int port = DEFAULT_PORT;
        private int destinationPort = DEFAULT_PORT;
        private String localAddress;
        private int timeout = DEFAULT_TIMEOUT_MILLIS;
        private Integer apduTimeout;
        private int retries = DEFAULT_RETRIES;
        private int segTimeout = DEFAULT_SEG_TIMEOUT_MILLIS;
        private int segWindow = DEFAULT_SEG_WINDOW;

        private Builder() {
        }

        private Builder(LocalDeviceConfig base) {
            this.deviceId = base.deviceId;
            this.broadcastAddress = base.broadcastAddress;
            this.port = base.port;
            this.destinationPort = base.destinationPort;
            this.localAddress = base.localAddress;
            this.timeout = base.timeout;
            this.apduTimeout = base.apduTimeout;
            this.retries = base.retries;
            this.segTimeout = base.segTimeout;
            this.segWindow = base.segWindow;
        }

        public Builder withDeviceId(int deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder withBroadcastAddress(String broadcastAddress) {
            this.broadcastAddress = broadcastAddress;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withDestinationPort(int destinationPort) {
            this.destinationPort = destinationPort;
            return this;
        }

        public Builder withLocalAddress(String localAddress) {
            this.localAddress = localAddress;
            return this;
        }

        public Builder withTimeout(int timeoutMillis) {
            this.timeout = timeoutMillis;
            return this;
        }

        public Builder withApduTimeout(Integer apduTimeoutMillis) {
            this.apduTimeout = apduTimeoutMillis;
            return this;
        }

        public Builder withRetries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder withSegTimeout(int segTimeoutMillis) {
            this.segTimeout = segTimeoutMillis;
            return this;
        }

        public Builder withSegWindow(int segWindow) {
            this.segWindow = segWindow;
            return this;
        }

        public LocalDeviceConfig build() {
            String broadcast = broadcastAddress != null
                    ? broadcastAddress
                    : NetworkAddresses.primaryBroadcastAddress();
            return new LocalDeviceConfig(deviceId, broadcast, port, destinationPort, localAddress,
                    timeout, apduTimeout, retries, segTimeout, segWindow);
        }
    }
}
