package com.questrail.bacnet.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BacnetObservabilitySink that writes every event to SLF4J.
 */
public final class Slf4jBacnetObservabilitySink implements BacnetObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBacnetObservabilitySink.class);

    @Override
    public void onDeviceLifecycle(DeviceLifecycleEvent event) {
        log.info("Local device {} (port {}): {} -> {}",
            event.deviceId(),
            event.port(),
            event.oldState() != null ? event.oldState() : "NEW",
            event.newState());
    }

    @Override
    public void onRequestCompleted(RequestCompletedEvent event) {
        if (event.outcome().isSuccess()) {
            log.debug("{} to device {}: {} in {} ms",
                event.service(), event.remoteDeviceId(), event.outcomeKind(), event.elapsed().toMillis());
        }
        else {
            log.info("{} to device {}: {} in {} ms",
                event.service(), event.remoteDeviceId(), event.outcome(), event.elapsed().toMillis());
        }
    }

    @Override
    public void onDiscovery(DiscoveryEvent event) {
        log.info("Discovery attempt {}: {} device(s) {}",
            event.attempt(), event.deviceIds().size(), event.deviceIds());
    }

    @Override
    public void onError(BacnetErrorEvent event) {
        log.error("BACnet node error: {}", event.message(), event.cause());
    }
}
