package com.questrail.bacnet.device;

import com.questrail.bacnet.config.LocalDeviceConfig;
import com.questrail.bacnet.transport.BacnetTransport;

/**
 * Settings that can change on a live device without rebinding it.
 *
 * @param retries    APDU retransmissions after the first attempt
 * @param timeout    APDU timeout per attempt, milliseconds
 * @param segTimeout segment timeout, milliseconds
 * @param segWindow  segmentation window size
 */
public record DeviceTunables(int retries, int timeout, int segTimeout, int segWindow)
{
    public DeviceTunables {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative");
        }
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        if (segTimeout < 0) {
            throw new IllegalArgumentException("segTimeout must be non-negative");
        }
        if (segWindow < 1) {
            throw new IllegalArgumentException("segWindow must be >= 1");
        }
    }

    public static DeviceTunables from(LocalDeviceConfig config) {
        return new DeviceTunables(config.retries(), config.timeout(), config.segTimeout(), config.segWindow());
    }

    public static DeviceTunables from(BacnetTransport transport) {
        return new DeviceTunables(transport.getRetries(), transport.getTimeout(),
                transport.getSegTimeout(), transport.getSegWindow());
    }

    void applyTo(BacnetTransport transport) {
        transport.setRetries(retries);
        transport.setTimeout(timeout);
        transport.setSegTimeout(segTimeout);
        transport.setSegWindow(segWindow);
    }
}
