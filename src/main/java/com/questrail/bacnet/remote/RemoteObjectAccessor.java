package com.questrail.bacnet.remote;

import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.ObjectRecord;
import com.questrail.bacnet.api.PropertyIdentifier;
import com.questrail.bacnet.api.RequestOutcome;
import com.questrail.bacnet.bridge.RequestBridge;
import com.questrail.bacnet.error.TransportException;
import com.questrail.bacnet.service.CreateObjectAck;
import com.questrail.bacnet.service.CreateObjectRequest;
import com.questrail.bacnet.service.DeleteObjectRequest;
import com.questrail.bacnet.service.PropertyAccessError;
import com.questrail.bacnet.service.ReadPropertyMultipleAck;
import com.questrail.bacnet.service.ReadPropertyMultipleRequest;
import com.questrail.bacnet.service.SubscribeCovRequest;
import com.questrail.bacnet.service.WritePropertyRequest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * RemoteObjectAccessor
 * =============================================================================
 * Object-level operations on remote devices, each built from one or more
 * {@link RequestBridge} round-trips.
 *
 * <p>Nothing here retries. Each operation reports the outcome of its
 * round-trip(s) as a {@link RequestOutcome}; only a missing local or remote
 * device raises an exception.</p>
 */
public final class RemoteObjectAccessor
{
    private final RequestBridge bridge;

    public RemoteObjectAccessor(RequestBridge bridge) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
    }

    /**
     * Read several properties of one object in a single ReadPropertyMultiple.
     * Pass {@link PropertyIdentifier#ALL} for every property. A property the
     * device could not read maps to a {@link PropertyAccessError}. An answer of
     * the wrong kind comes back as a {@link RequestOutcome.Timeout}.
     *
     * @throws IllegalArgumentException if no property is given
     */
    public RequestOutcome<Map<PropertyIdentifier, Object>> readProperties(int deviceId,
                                                                         ObjectIdentifier objectIdentifier,
                                                                         PropertyIdentifier... properties) {
        return readProperties(deviceId, objectIdentifier, Arrays.asList(properties));
    }

    public RequestOutcome<Map<PropertyIdentifier, Object>> readProperties(int deviceId,
                                                                         ObjectIdentifier objectIdentifier,
                                                                         List<PropertyIdentifier> properties) {
        Objects.requireNonNull(objectIdentifier, "objectIdentifier");
        Objects.requireNonNull(properties, "properties");
        if (properties.isEmpty()) {
            throw new IllegalArgumentException("no properties requested for " + objectIdentifier);
        }
        ReadPropertyMultipleRequest request = ReadPropertyMultipleRequest.of(objectIdentifier, properties);
        return bridge.sendAndWait(deviceId, request).flatMap(ack -> {
            if (ack instanceof ReadPropertyMultipleAck rpm) {
                return RequestOutcome.success(rpm.resultsFor(objectIdentifier));
            }
            return RequestOutcome.timeout(unexpected(deviceId, "ReadPropertyMultiple", ack));
        });
    }

    /** The remote device's {@code object-list}, device object included. */
    public RequestOutcome<List<ObjectIdentifier>> listObjects(int deviceId) {
        RequestOutcome<Map<PropertyIdentifier, Object>> read =
                readProperties(deviceId, ObjectIdentifier.device(deviceId), PropertyIdentifier.OBJECT_LIST);
        if (!(read instanceof RequestOutcome.Success<Map<PropertyIdentifier, Object>> success)) {
            return read.failureAs();
        }
        Object value = success.value().get(PropertyIdentifier.OBJECT_LIST);
        if (value instanceof PropertyAccessError error) {
            return RequestOutcome.error(error.errorClass(), error.errorCode());
        }
        List<ObjectIdentifier> ids = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object o : list) {
                if (!(o instanceof ObjectIdentifier id)) {
                    return RequestOutcome.timeout(unexpected(deviceId, "object-list entry", o));
                }
                ids.add(id);
            }
        }
        return RequestOutcome.success(Collections.unmodifiableList(ids));
    }

    /**
     * Every object of the remote device with all its properties, one
     * round-trip per object. Stops at the first failed round-trip and returns
     * its outcome.
     */
    public RequestOutcome<List<ObjectRecord>> readAllObjectsFullProperties(int deviceId) {
        RequestOutcome<List<ObjectIdentifier>> listed = listObjects(deviceId);
        if (!(listed instanceof RequestOutcome.Success<List<ObjectIdentifier>> ids)) {
            return listed.failureAs();
        }
        List<ObjectRecord> records = new ArrayList<>();
        for (ObjectIdentifier id : ids.value()) {
            RequestOutcome<Map<PropertyIdentifier, Object>> read = readProperties(deviceId, id, PropertyIdentifier.ALL);
            if (!(read instanceof RequestOutcome.Success<Map<PropertyIdentifier, Object>> props)) {
                return read.failureAs();
            }
            records.add(ObjectRecord.of(id, props.value()));
        }
        return RequestOutcome.success(Collections.unmodifiableList(records));
    }

    /**
     * One WriteProperty per property of {@code record}. {@code object-list} is
     * never written (the identity properties are not part of a record's map).
     *
     * @return outcome per property, in the record's order
     */
    public Map<PropertyIdentifier, RequestOutcome<Boolean>> writeProperties(int deviceId, ObjectRecord record) {
        Objects.requireNonNull(record, "record");
        Map<PropertyIdentifier, RequestOutcome<Boolean>> outcomes = new LinkedHashMap<>();
        record.properties().forEach((property, value) -> {
            if (property.equals(PropertyIdentifier.OBJECT_LIST)) {
                return;
            }
            WritePropertyRequest write = new WritePropertyRequest(record.objectIdentifier(), property, value);
            outcomes.put(property, bridge.sendAndWait(deviceId, write).map(ack -> Boolean.TRUE));
        });
        return Collections.unmodifiableMap(outcomes);
    }

    /**
     * Create {@code record} on the remote device. {@code object-list} is left
     * out of the initial values.
     *
     * @return the identifier of the created object
     */
    public RequestOutcome<ObjectIdentifier> createRemoteObject(int deviceId, ObjectRecord record) {
        Objects.requireNonNull(record, "record");
        CreateObjectRequest create = new CreateObjectRequest(record.objectIdentifier(),
                record.withoutProperty(PropertyIdentifier.OBJECT_LIST).properties());
        return bridge.sendAndWait(deviceId, create)
                .map(ack -> ack instanceof CreateObjectAck created ? created.objectIdentifier() : record.objectIdentifier());
    }

    public RequestOutcome<Boolean> deleteRemoteObject(int deviceId, ObjectIdentifier objectIdentifier) {
        return bridge.sendAndWait(deviceId, new DeleteObjectRequest(objectIdentifier))
                .map(ack -> Boolean.TRUE);
    }

    /** SubscribeCOV with process id 0, unconfirmed notifications, 60 s lifetime. */
    public RequestOutcome<Boolean> subscribeCov(int deviceId, ObjectIdentifier objectIdentifier) {
        return subscribeCov(deviceId, objectIdentifier, CovSubscriptionOptions.defaults());
    }

    public RequestOutcome<Boolean> subscribeCov(int deviceId, ObjectIdentifier objectIdentifier,
                                                CovSubscriptionOptions options) {
        Objects.requireNonNull(options, "options");
        SubscribeCovRequest subscribe = new SubscribeCovRequest(options.processId(), objectIdentifier,
                options.confirmed(), options.lifetimeSeconds());
        return bridge.sendAndWait(deviceId, subscribe).map(ack -> Boolean.TRUE);
    }

    public RequestOutcome<Boolean> cancelCov(int deviceId, ObjectIdentifier objectIdentifier, long processId) {
        return bridge.sendAndWait(deviceId, SubscribeCovRequest.cancel(processId, objectIdentifier))
                .map(ack -> Boolean.TRUE);
    }

    private static TransportException unexpected(int deviceId, String what, Object answer) {
        return new TransportException("device " + deviceId + " answered " + what + " with unexpected "
                + (answer == null ? "null" : answer.getClass().getSimpleName()));
    }
}
