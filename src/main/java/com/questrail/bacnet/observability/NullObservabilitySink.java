package com.questrail.bacnet.observability;

/**
 * No-op implementation of BacnetObservabilitySink.
 */
public final class NullObservabilitySink implements BacnetObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDeviceLifecycle(DeviceLifecycleEvent event) {}

    @Override
    public void onRequestCompleted(RequestCompletedEvent event) {}

    @Override
    public void onDiscovery(DiscoveryEvent event) {}

    @Override
    public void onError(BacnetErrorEvent event) {}
}
