package com.questrail.bacnet.transport;

import com.questrail.bacnet.service.CovNotification;
import com.questrail.bacnet.service.IHaveRequest;

/**
 * Receiver for unsolicited traffic seen by a {@link BacnetTransport}.
 *
 * <p>Callbacks run on the transport's receive thread and must return quickly.</p>
 */
public interface BacnetTransportListener
{
    /** A device announced itself; it is already in the remote-device table. */
    default void iAmReceived(RemoteDevice device) {
    }

    default void iHaveReceived(IHaveRequest iHave) {
    }

    default void covNotificationReceived(CovNotification notification, boolean confirmed) {
    }
}
