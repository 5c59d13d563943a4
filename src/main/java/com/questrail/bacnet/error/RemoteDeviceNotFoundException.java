package com.questrail.bacnet.error;

/**
 * The device id is not in the transport's remote-device table. Run discovery first.
 */
public final class RemoteDeviceNotFoundException extends NotFoundException
{
    private final int deviceId;

    public RemoteDeviceNotFoundException(int deviceId) {
        super("Remote device " + deviceId + " has not been discovered");
        this.deviceId = deviceId;
    }

    public int deviceId() {
        return deviceId;
    }
}
