package com.questrail.bacnet.service;

import java.util.Objects;

public record ConfirmedCovNotificationRequest(CovNotification notification) implements ConfirmedRequest
{
    public ConfirmedCovNotificationRequest {
        Objects.requireNonNull(notification, "notification");
    }
}
