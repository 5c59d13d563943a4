package com.questrail.bacnet.transport.ip;

import com.questrail.bacnet.api.ErrorClass;
import com.questrail.bacnet.api.ErrorCode;
import com.questrail.bacnet.api.ObjectIdentifier;
import com.questrail.bacnet.api.ObjectRecord;
import com.questrail.bacnet.api.ObjectType;
import com.questrail.bacnet.api.PropertyIdentifier;
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
import com.questrail.bacnet.time.ManualMonotonicClock;
import com.questrail.bacnet.transport.ApduFailure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LocalObjectServerTest {

    private static final int DEVICE_ID = 1234;
    private static final SocketAddress CLIENT = new InetSocketAddress("127.0.0.1", 47809);
    private static final ObjectIdentifier DEVICE = ObjectIdentifier.device(DEVICE_ID);
    private static final ObjectIdentifier AV1 = ObjectIdentifier.of(ObjectType.ANALOG_VALUE, 1);
    private static final ObjectIdentifier AV2 = ObjectIdentifier.of(ObjectType.ANALOG_VALUE, 2);

    private ManualMonotonicClock clock;
    private LocalObjectServer server;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        server = new LocalObjectServer(DEVICE_ID, clock);
        server.add(ObjectRecord.of(AV1, Map.of(
                PropertyIdentifier.OBJECT_NAME, "Zone temp",
                PropertyIdentifier.PRESENT_VALUE, 20.0f)));
    }

    private static ApduFailure.Error error(ErrorClass errorClass, ErrorCode code) {
        return new ApduFailure.Error(errorClass, code);
    }

    private Object ackValue(ServiceAnswer answer) {
        return assertInstanceOf(ServiceAnswer.Ack.class, answer).value();
    }

    private ApduFailure refusal(ServiceAnswer answer) {
        return assertInstanceOf(ServiceAnswer.Refused.class, answer).failure();
    }

    // ---------------------------------------------------------------------
    // Device object
    // ---------------------------------------------------------------------

    @Test
    void deviceObjectListsItselfFirstThenEveryObject() {
        server.add(ObjectRecord.of(AV2));

        ReadPropertyAck ack = (ReadPropertyAck) ackValue(
                server.serve(new ReadPropertyRequest(DEVICE, PropertyIdentifier.OBJECT_LIST), CLIENT));

        assertEquals(List.of(DEVICE, AV1, AV2), ack.value());
    }

    @Test
    void arrayIndexZeroIsTheLengthAndOneBasedOtherwise() {
        Object length = ((ReadPropertyAck) ackValue(server.serve(
                new ReadPropertyRequest(DEVICE, PropertyIdentifier.OBJECT_LIST, 0), CLIENT))).value();
        Object second = ((ReadPropertyAck) ackValue(server.serve(
                new ReadPropertyRequest(DEVICE, PropertyIdentifier.OBJECT_LIST, 2), CLIENT))).value();

        assertEquals(2, length);
        assertEquals(AV1, second);
        assertEquals(error(ErrorClass.PROPERTY, ErrorCode.INVALID_ARRAY_INDEX), refusal(server.serve(
                new ReadPropertyRequest(DEVICE, PropertyIdentifier.OBJECT_LIST, 3), CLIENT)));
        assertEquals(error(ErrorClass.PROPERTY, ErrorCode.PROPERTY_IS_NOT_AN_ARRAY), refusal(server.serve(
                new ReadPropertyRequest(AV1, PropertyIdentifier.PRESENT_VALUE, 1), CLIENT)));
    }

    @Test
    void deviceObjectCannotBeAddedWrittenOrDeleted() {
        assertThrows(IllegalStateException.class, () -> server.add(ObjectRecord.of(DEVICE)));
        assertEquals(error(ErrorClass.PROPERTY, ErrorCode.WRITE_ACCESS_DENIED), refusal(server.serve(
                new WritePropertyRequest(DEVICE, PropertyIdentifier.OBJECT_NAME, "renamed"), CLIENT)));
        assertEquals(error(ErrorClass.OBJECT, ErrorCode.OBJECT_DELETION_NOT_PERMITTED), refusal(server.serve(
                new DeleteObjectRequest(DEVICE), CLIENT)));
        assertEquals(error(ErrorClass.OBJECT, ErrorCode.DYNAMIC_CREATION_NOT_SUPPORTED), refusal(server.serve(
                new CreateObjectRequest(ObjectIdentifier.device(99), Map.of()), CLIENT)));
    }

    @Test
    void findByNameCoversTheDeviceObject() {
        assertEquals(DEVICE, server.findByName("bacnet-node-1234").orElseThrow().objectIdentifier());
        assertEquals(AV1, server.findByName("Zone temp").orElseThrow().objectIdentifier());
        assertTrue(server.findByName("nothing").isEmpty());
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    @Test
    void readOfMissingObjectOrPropertyIsAnError() {
        assertEquals(error(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT), refusal(server.serve(
                new ReadPropertyRequest(AV2, PropertyIdentifier.PRESENT_VALUE), CLIENT)));
        assertEquals(error(ErrorClass.PROPERTY, ErrorCode.UNKNOWN_PROPERTY), refusal(server.serve(
                new ReadPropertyRequest(AV1, PropertyIdentifier.UNITS), CLIENT)));
    }

    @Test
    void identityPropertiesAreReadable() {
        Object type = ((ReadPropertyAck) ackValue(server.serve(
                new ReadPropertyRequest(AV1, PropertyIdentifier.OBJECT_TYPE), CLIENT))).value();

        assertEquals(ObjectType.ANALOG_VALUE, type);
    }

    @Test
    void readMultipleReportsPerPropertyErrors() {
        Map<ObjectIdentifier, List<PropertyIdentifier>> specs = new LinkedHashMap<>();
        specs.put(AV1, List.of(PropertyIdentifier.ALL));
        specs.put(AV2, List.of(PropertyIdentifier.PRESENT_VALUE));
        specs.put(DEVICE, List.of(PropertyIdentifier.VENDOR_NAME, PropertyIdentifier.UNITS));

        ReadPropertyMultipleAck ack = (ReadPropertyMultipleAck) ackValue(
                server.serve(new ReadPropertyMultipleRequest(specs), CLIENT));

        assertEquals(ObjectRecord.of(AV1, Map.of(
                        PropertyIdentifier.OBJECT_NAME, "Zone temp",
                        PropertyIdentifier.PRESENT_VALUE, 20.0f)).asPropertyMap(),
                ack.resultsFor(AV1));
        assertEquals(new PropertyAccessError(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT),
                ack.resultsFor(AV2).get(PropertyIdentifier.PRESENT_VALUE));
        assertEquals(LocalObjectServer.VENDOR_NAME, ack.resultsFor(DEVICE).get(PropertyIdentifier.VENDOR_NAME));
        assertEquals(new PropertyAccessError(ErrorClass.PROPERTY, ErrorCode.UNKNOWN_PROPERTY),
                ack.resultsFor(DEVICE).get(PropertyIdentifier.UNITS));
    }

    // ---------------------------------------------------------------------
    // Writes, create, delete
    // ---------------------------------------------------------------------

    @Test
    void writeAddsOrReplacesAPropertyButNeverTheIdentity() {
        assertNull(ackValue(server.serve(
                new WritePropertyRequest(AV1, PropertyIdentifier.UNITS, "degrees-celsius"), CLIENT)));
        assertEquals("degrees-celsius", server.get(AV1).orElseThrow().property(PropertyIdentifier.UNITS).orElseThrow());

        assertEquals(error(ErrorClass.PROPERTY, ErrorCode.WRITE_ACCESS_DENIED), refusal(server.serve(
                new WritePropertyRequest(AV1, PropertyIdentifier.OBJECT_IDENTIFIER, AV2), CLIENT)));
        assertEquals(error(ErrorClass.PROPERTY, ErrorCode.WRITE_ACCESS_DENIED), refusal(server.serve(
                new WritePropertyRequest(AV1, PropertyIdentifier.OBJECT_LIST, List.of()), CLIENT)));
        assertEquals(error(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT), refusal(server.serve(
                new WritePropertyRequest(AV2, PropertyIdentifier.PRESENT_VALUE, 1.0f), CLIENT)));
    }

    @Test
    void valuesThatCannotBeBackedUpAreRefused() {
        byte[] octets = {0x01, 0x02};

        assertEquals(error(ErrorClass.PROPERTY, ErrorCode.INVALID_DATA_TYPE), refusal(server.serve(
                new WritePropertyRequest(AV1, PropertyIdentifier.DESCRIPTION, octets), CLIENT)));
        assertEquals(error(ErrorClass.PROPERTY, ErrorCode.INVALID_DATA_TYPE), refusal(server.serve(
                new CreateObjectRequest(AV2, Map.of(PropertyIdentifier.DESCRIPTION, List.of(octets))), CLIENT)));

        assertFalse(server.get(AV1).orElseThrow().has(PropertyIdentifier.DESCRIPTION));
        assertTrue(server.get(AV2).isEmpty());
    }

    @Test
    void createThenDelete() {
        CreateObjectAck created = (CreateObjectAck) ackValue(server.serve(
                new CreateObjectRequest(AV2, Map.of(PropertyIdentifier.OBJECT_NAME, "Setpoint")), CLIENT));

        assertEquals(AV2, created.objectIdentifier());
        assertEquals(error(ErrorClass.OBJECT, ErrorCode.OBJECT_IDENTIFIER_ALREADY_EXISTS), refusal(server.serve(
                new CreateObjectRequest(AV2, Map.of()), CLIENT)));

        assertNull(ackValue(server.serve(new DeleteObjectRequest(AV2), CLIENT)));
        assertEquals(error(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT), refusal(server.serve(
                new DeleteObjectRequest(AV2), CLIENT)));
    }

    // ---------------------------------------------------------------------
    // COV
    // ---------------------------------------------------------------------

    @Test
    void subscriptionExpiresAfterItsLifetime() {
        server.serve(new SubscribeCovRequest(5, AV1, false, 60), CLIENT);

        clock.advanceMillis(59_000);
        List<CovSubscription> live = server.subscribersFor(AV1);
        assertEquals(1, live.size());
        assertEquals(1, live.get(0).secondsRemaining(clock.nowNanos()));

        clock.advanceMillis(1_000);
        assertTrue(server.subscribersFor(AV1).isEmpty());
    }

    @Test
    void zeroLifetimeNeverExpires() {
        server.serve(new SubscribeCovRequest(5, AV1, true, 0), CLIENT);

        clock.advanceMillis(365L * 24 * 3600 * 1000);

        CovSubscription subscription = server.subscribersFor(AV1).get(0);
        assertTrue(subscription.confirmed());
        assertEquals(0, subscription.secondsRemaining(clock.nowNanos()));
    }

    @Test
    void resubscribingReplacesAndCancellingRemoves() {
        server.serve(new SubscribeCovRequest(5, AV1, false, 60), CLIENT);
        server.serve(new SubscribeCovRequest(5, AV1, false, 120), CLIENT);
        server.serve(new SubscribeCovRequest(6, AV1, false, 60), CLIENT);
        assertEquals(2, server.subscribersFor(AV1).size());

        server.serve(SubscribeCovRequest.cancel(5, AV1), CLIENT);

        assertEquals(6, server.subscribersFor(AV1).get(0).processId());
        assertEquals(1, server.subscribersFor(AV1).size());
    }

    @Test
    void deletingAnObjectDropsItsSubscriptions() {
        server.serve(new SubscribeCovRequest(5, AV1, false, 0), CLIENT);

        server.remove(AV1);
        server.add(ObjectRecord.of(AV1));

        assertTrue(server.subscribersFor(AV1).isEmpty());
    }

    @Test
    void subscribeToMissingObjectIsAnError() {
        assertEquals(error(ErrorClass.OBJECT, ErrorCode.UNKNOWN_OBJECT), refusal(server.serve(
                new SubscribeCovRequest(5, AV2, false, 60), CLIENT)));
    }

    @Test
    void covValuesPreferPresentValueAndStatusFlags() {
        ObjectRecord withStatus = server.get(AV1).orElseThrow()
                .withProperty(PropertyIdentifier.STATUS_FLAGS, List.of(false, false, false, false));
        ObjectRecord bare = ObjectRecord.of(AV2, Map.of(PropertyIdentifier.DESCRIPTION, "spare"));

        assertEquals(Map.of(
                        PropertyIdentifier.PRESENT_VALUE, 20.0f,
                        PropertyIdentifier.STATUS_FLAGS, List.of(false, false, false, false)),
                server.covValues(withStatus));
        assertEquals(bare.properties(), server.covValues(bare));
    }
}
