package com.questrail.bacnet.service;

import java.util.Objects;

public record UnconfirmedCovNotificationRequest(CovNotification notification) implements UnconfirmedRequest
{
    public UnconfirmedCovNotificationRequest {
        Objects.requireNonNull(notification, "notification");
    }
}
