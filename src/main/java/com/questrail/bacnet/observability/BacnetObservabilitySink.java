package com.questrail.bacnet.observability;

/**
 * Receives node observability events. Implementations can log, count or trace;
 * they must not throw and must not block.
 */
public interface BacnetObservabilitySink {
    /**
     * A local device changed lifecycle state.
     * @param event old and new state of the device
     */
    void onDeviceLifecycle(DeviceLifecycleEvent event);

    /**
     * A blocking request finished with an outcome.
     * @param event request, target and outcome
     */
    void onRequestCompleted(RequestCompletedEvent event);

    /**
     * One discovery pass completed.
     * @param event attempt number and devices found
     */
    void onDiscovery(DiscoveryEvent event);

    /**
     * Something failed that the caller did not see as an exception.
     * @param event the error event
     */
    void onError(BacnetErrorEvent event);
}
