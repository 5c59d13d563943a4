package com.questrail.bacnet.transport.ip;

import com.questrail.bacnet.api.ErrorClass;
import com.questrail.bacnet.api.ErrorCode;
import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.ObjectRecord;
import com.questrail.bacnet.api.ObjectType;
import com.questrail.bacnet.api.PropertyIdentifier;
import com.questrail.bacnet.api.PropertyValues;
import com.questrail.bacnet.internal.time.MonotonicClock;
import com.questrail.bacnet.service.ConfirmedRequest;
import com.questrail.bacnet.service.CreateObjectAck;
import com.questrail.bacnet.service.CreateObjectRequest;
import com.questrail.bacnet.service.DeleteObjectRequest;
import com.questrail.bacnet.service.PropertyAccessError;
import com.questrail.bacnet.service.ReadPropertyAck;
import com.questrail.bacnet.service.ReadPropertyMultipleAck;
import com.questrail.bacnet.service.ReadPropertyMultipleRequest;
import com.questrail.bacnet.service.ReadPropertyRequest;
import com.questrail.bacnet.service.SubscribeCovRequest;
import com.questrail.bacnet.service.WritePropertyRequest;
import com.questrail.bacnet.transport.ApduFailure;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * LocalObjectServer
 * =============================================================================
 * The local object table of one BACnet/IP device and the logic that answers
 * inbound confirmed requests against it.
 *
 * <h2>Device object</h2>
 * The device object is not stored. It is built on every read from the device id
 * and the current table, so its {@code object-list} is always current. It can be
 * read but not written, created or deleted.
 *
 * <h2>COV</h2>
 * SubscribeCOV requests are recorded here. The transport asks
 * {@link #subscribersFor} after every change to an object and sends the
 * notifications itself. Expired subscriptions are pruned lazily.
 */
final class LocalObjectServer
{
    static final String VENDOR_NAME = "Questrail";
    static final int VENDOR_IDENTIFIER = 0;
    static final String MODEL_NAME = "bacnet-node";
    static final int MAX_APDU_LENGTH_ACCEPTED = 1476;

    static final List<String> SERVICES_SUPPORTED = List.of(
            "read-property", "read-property-multiple", "write-property",
            "create-object", "delete-object", "subscribe-cov",
            "who-is", "who-has", "i-am", "i-have");

    private final int deviceId;
    private final MonotonicClock clock;

    private final ConcurrentSkipListMap<ObjectIdentifier, ObjectRecord> objects = new ConcurrentSkipListMap<>();
    private final Map<CovSubscription.Key, CovSubscription> subscriptions = new ConcurrentHashMap<>();

    LocalObjectServer(int deviceId, MonotonicClock clock) {
        this.deviceId = deviceId;
        this.clock = clock;
    }

    // ---------------------------------------------------------------------
    // Table
    // ---------------------------------------------------------------------

    void add(ObjectRecord record) {
        if (record.objectIdentifier().isDevice()) {
            throw new IllegalStateException("the device object is managed by the transport");
        }
        if (objects.putIfAbsent(record.objectIdentifier(), record) != null) {
            throw new IllegalStateException("object already exists: " + record.objectIdentifier());
        }
    }

    void replace(ObjectRecord record) {
        if (objects.replace(record.objectIdentifier(), record) == null) {
            throw new IllegalStateException("no such object: " + record.objectIdentifier());
        }
    }

    Optional<ObjectRecord> get(ObjectIdentifier id) {
        if (id.equals(deviceObjectId())) {
            return Optional.of(deviceObject());
        }
        return Optional.ofNullable(objects.get(id));
    }

    Optional<ObjectRecord> remove(ObjectIdentifier id) {
        ObjectRecord removed = objects.remove(id);
        if (removed != null) {
            subscriptions.keySet().removeIf(k -> k.monitoredObject().equals(id));
        }
        return Optional.ofNullable(removed);
    }

    Collection<ObjectRecord> snapshot() {
        return List.copyOf(objects.values());
    }

    Optional<ObjectRecord> findByName(String name) {
        if (name.equals(deviceObject().property(PropertyIdentifier.OBJECT_NAME).orElse(null))) {
            return Optional.of(deviceObject());
        }
        return objects.values().stream()
                .filter(o -> name.equals(o.property(PropertyIdentifier.OBJECT_NAME).orElse(null)))
                .findFirst();
    }

    ObjectIdentifier deviceObjectId() {
        return ObjectIdentifier.device(deviceId);
    }

    ObjectRecord deviceObject() {
        List<ObjectIdentifier> objectList = new ArrayList<>();
        objectList.add(deviceObjectId());
        objectList.addAll(objects.keySet());

        Map<PropertyIdentifier, Object> props = new LinkedHashMap<>();
        props.put(PropertyIdentifier.OBJECT_NAME, MODEL_NAME + "-" + deviceId);
        props.put(PropertyIdentifier.VENDOR_NAME, VENDOR_NAME);
        props.put(PropertyIdentifier.VENDOR_IDENTIFIER, VENDOR_IDENTIFIER);
        props.put(PropertyIdentifier.MODEL_NAME, MODEL_NAME);
        props.put(PropertyIdentifier.PROTOCOL_SERVICES_SUPPORTED, SERVICES_SUPPORTED);
        props.put(PropertyIdentifier.of("max-apdu-length-accepted"), MAX_APDU_LENGTH_ACCEPTED);
        props.put(PropertyIdentifier.of("segmentation-supported"), "no-segmentation");
        props.put(PropertyIdentifier.of("system-status"), "operational");
        props.put(PropertyIdentifier.OBJECT_LIST, List.copyOf(objectList));
        return ObjectRecord.of(deviceObjectId(), props);
    }

    // ---------------------------------------------------------------------
    // Serving
    // ---------------------------------------------------------------------

    /**
     * Answer one inbound confirmed request. COV notifications are not handled
     * here; the transport hands them to its listeners.
     */
    ServiceAnswer serve(ConfirmedRequest request, SocketAddress source) {
        if (request instanceof ReadPropertyRequest rp) {
            return readProperty(rp);
        }
        if (request instanceof ReadPropertyMultipleRequest rpm) {
            return new ServiceAnswer.Ack(readPropertyMultiple(rpm));
        }
        if (request instanceof WritePropertyRequest wp) {
            return writeProperty(wp);
        }
        if (request instanceof CreateObjectRequest co) {
            return createObject(co);
        }
        if (request instanceof DeleteObjectRequest del) {
            return deleteObject(del);
        }
        if (request instanceof SubscribeCovRequest sub) {
            return subscribe(sub, source);
        }
        return error(ErrorClass.SERVICES, ErrorCode.SERVICE_REQUEST_DENIED);
    }

    private ServiceAnswer readProperty(ReadPropertyRequest request) {
        Optional<ObjectRecord> object = get(request.objectIdentifier());
        if (object.isEmpty()) {
            return error(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT);
        }
        Map<PropertyIdentifier, Object> props = object.get().asPropertyMap();
        if (!props.containsKey(request.propertyIdentifier())) {
            return error(ErrorClass.PROPERTY, ErrorCode.UNKNOWN_PROPERTY);
        }
        Object value = props.get(request.propertyIdentifier());
        if (request.arrayIndex() != null) {
            if (!(value instanceof List<?> list)) {
                return error(ErrorClass.PROPERTY, ErrorCode.PROPERTY_IS_NOT_AN_ARRAY);
            }
            int index = request.arrayIndex();
            if (index == 0) {
                value = list.size();
            }
            else if (index <= list.size()) {
                value = list.get(index - 1);
            }
            else {
                return error(ErrorClass.PROPERTY, ErrorCode.INVALID_ARRAY_INDEX);
            }
        }
        return new ServiceAnswer.Ack(new ReadPropertyAck(request.objectIdentifier(), request.propertyIdentifier(), value));
    }

    private ReadPropertyMultipleAck readPropertyMultiple(ReadPropertyMultipleRequest request) {
        Map<ObjectIdentifier, Map<PropertyIdentifier, Object>> results = new LinkedHashMap<>();
        request.specifications().forEach((id, requested) -> {
            Map<PropertyIdentifier, Object> values = new LinkedHashMap<>();
            Optional<ObjectRecord> object = get(id);
            if (object.isEmpty()) {
                PropertyAccessError unknown = new PropertyAccessError(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT);
                requested.forEach(p -> values.put(p, unknown));
            }
            else {
                Map<PropertyIdentifier, Object> props = object.get().asPropertyMap();
                for (PropertyIdentifier p : requested) {
                    if (p.equals(PropertyIdentifier.ALL)) {
                        values.putAll(props);
                    }
                    else if (props.containsKey(p)) {
                        values.put(p, props.get(p));
                    }
                    else {
                        values.put(p, new PropertyAccessError(ErrorClass.PROPERTY, ErrorCode.UNKNOWN_PROPERTY));
                    }
                }
            }
            results.put(id, values);
        });
        return new ReadPropertyMultipleAck(results);
    }

    private ServiceAnswer writeProperty(WritePropertyRequest request) {
        ObjectIdentifier id = request.objectIdentifier();
        if (id.equals(deviceObjectId())) {
            return error(ErrorClass.PROPERTY, ErrorCode.WRITE_ACCESS_DENIED);
        }
        PropertyIdentifier property = request.propertyIdentifier();
        if (property.isIdentity() || property.equals(PropertyIdentifier.OBJECT_LIST)) {
            return error(ErrorClass.PROPERTY, ErrorCode.WRITE_ACCESS_DENIED);
        }
        if (!PropertyValues.isSupported(request.value())) {
            return error(ErrorClass.PROPERTY, ErrorCode.INVALID_DATA_TYPE);
        }
        ObjectRecord updated = objects.computeIfPresent(id, (k, existing) -> existing.withProperty(property, request.value()));
        if (updated == null) {
            return error(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT);
        }
        return ServiceAnswer.simpleAck();
    }

    private ServiceAnswer createObject(CreateObjectRequest request) {
        ObjectIdentifier id = request.objectIdentifier();
        if (id.type() == ObjectType.DEVICE) {
            return error(ErrorClass.OBJECT, ErrorCode.DYNAMIC_CREATION_NOT_SUPPORTED);
        }
        if (!request.initialValues().values().stream().allMatch(PropertyValues::isSupported)) {
            return error(ErrorClass.PROPERTY, ErrorCode.INVALID_DATA_TYPE);
        }
        if (objects.putIfAbsent(id, ObjectRecord.of(id, request.initialValues())) != null) {
            return error(ErrorClass.OBJECT, ErrorCode.OBJECT_IDENTIFIER_ALREADY_EXISTS);
        }
        return new ServiceAnswer.Ack(new CreateObjectAck(id));
    }

    private ServiceAnswer deleteObject(DeleteObjectRequest request) {
        ObjectIdentifier id = request.objectIdentifier();
        if (id.isDevice()) {
            return error(ErrorClass.OBJECT, ErrorCode.OBJECT_DELETION_NOT_PERMITTED);
        }
        if (remove(id).isEmpty()) {
            return error(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT);
        }
        return ServiceAnswer.simpleAck();
    }

    private ServiceAnswer subscribe(SubscribeCovRequest request, SocketAddress source) {
        ObjectIdentifier id = request.monitoredObject();
        if (!objects.containsKey(id)) {
            return error(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT);
        }
        CovSubscription.Key key = new CovSubscription.Key(source, request.subscriberProcessId(), id);
        if (request.isCancellation()) {
            subscriptions.remove(key);
            return ServiceAnswer.simpleAck();
        }
        int lifetime = request.lifetimeSeconds();
        long expires = lifetime == 0
                ? Long.MAX_VALUE
                : clock.nowNanos() + lifetime * 1_000_000_000L;
        CovSubscription subscription = new CovSubscription(source, request.subscriberProcessId(), id,
                Boolean.TRUE.equals(request.issueConfirmedNotifications()), expires);
        subscriptions.put(subscription.key(), subscription);
        return ServiceAnswer.simpleAck();
    }

    // ---------------------------------------------------------------------
    // COV
    // ---------------------------------------------------------------------

    /** Live subscriptions on an object. Expired ones are dropped. */
    List<CovSubscription> subscribersFor(ObjectIdentifier id) {
        long now = clock.nowNanos();
        subscriptions.values().removeIf(s -> s.expired(now));
        List<CovSubscription> live = new ArrayList<>();
        for (CovSubscription s : subscriptions.values()) {
            if (s.monitoredObject().equals(id)) {
                live.add(s);
            }
        }
        return live;
    }

    /** present-value and status-flags when the object has them, else every property. */
    Map<PropertyIdentifier, Object> covValues(ObjectRecord object) {
        Map<PropertyIdentifier, Object> values = new LinkedHashMap<>();
        for (PropertyIdentifier p : List.of(PropertyIdentifier.PRESENT_VALUE, PropertyIdentifier.STATUS_FLAGS)) {
            if (object.has(p)) {
                values.put(p, object.properties().get(p));
            }
        }
        return values.isEmpty() ? object.properties() : values;
    }

    private static ServiceAnswer error(ErrorClass errorClass, ErrorCode errorCode) {
        return new ServiceAnswer.Refused(new ApduFailure.Error(errorClass, errorCode));
    }
}
