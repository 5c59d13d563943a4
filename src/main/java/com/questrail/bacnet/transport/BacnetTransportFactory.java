package com.questrail.bacnet.transport;

import com.questrail.bacnet.config.LocalDeviceConfig;

/**
 * Builds a fresh, uninitialized {@link BacnetTransport} for a configuration.
 */
@FunctionalInterface
public interface BacnetTransportFactory
{
    BacnetTransport create(LocalDeviceConfig config);
}
