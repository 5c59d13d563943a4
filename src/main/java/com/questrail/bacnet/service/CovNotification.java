package com.questrail.bacnet.service;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.PropertyIdentifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Content of a COV notification, shared by the confirmed and unconfirmed forms.
 */
public record CovNotification(
        long subscriberProcessId,
        int initiatingDeviceId,
        ObjectIdentifier monitoredObject,
        int timeRemainingSeconds,
        Map<PropertyIdentifier, Object> values
) {
    public CovNotification {
        Objects.requireNonNull(monitoredObject, "monitoredObject");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
    }
}
