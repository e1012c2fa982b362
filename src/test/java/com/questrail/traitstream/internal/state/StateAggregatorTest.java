package com.questrail.traitstream.internal.state;

import com.questrail.traitstream.api.DeviceSummary;
import com.questrail.traitstream.api.StateSnapshot;
import com.questrail.traitstream.api.TraitRecord;
import com.questrail.traitstream.api.TraitType;
import com.questrail.traitstream.internal.decode.EnvelopeDecoder;
import com.questrail.traitstream.internal.decode.FrameDecodeException;
import com.questrail.traitstream.internal.dispatch.TraitDispatcher;
import com.questrail.traitstream.model.Envelope;
import com.questrail.traitstream.model.GetOperation;
import com.questrail.traitstream.model.SubMessage;
import com.questrail.traitstream.model.TraitPayload;
import com.questrail.traitstream.observability.ProtocolObservabilityEvent;
import com.questrail.traitstream.observability.RecordingObservabilitySink;
import com.questrail.traitstream.schema.ProtobufSchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.traitstream.schema.WireFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateAggregatorTest
 * -----------------------------------------------------------------------------
 * Unit tests for folding decoded envelopes into aggregated state.
 *
 * These tests deliberately:
 * <ul>
 *   <li>do not involve transports</li>
 *   <li>do not involve framing</li>
 *   <li>do not involve threading</li>
 * </ul>
 */
public class StateAggregatorTest
{
    private RecordingObservabilitySink sink;
    private EnvelopeDecoder decoder;
    private StateAggregator aggregator;

    @BeforeEach
    void setUp() {
        ProtobufSchemaRegistry registry = new ProtobufSchemaRegistry();
        sink = new RecordingObservabilitySink();
        decoder = new EnvelopeDecoder(registry, sink);
        aggregator = new StateAggregator(TraitDispatcher.standard(registry), sink);
    }

    private StateAggregator.ApplyResult apply(Msg... gets) throws FrameDecodeException {
        return aggregator.apply(decoder.decode(streamBody(gets)));
    }

    // ---------------------------------------------------------------------
    // Records and summaries
    // ---------------------------------------------------------------------

    @Test
    void lockRecordProducesDeviceSummary() throws FrameDecodeException {
        StateAggregator.ApplyResult result = apply(get("DEVICE_1", TraitType.BOLT_LOCK,
                boltLock(DeviceSummary.LOCKED_STATE_LOCKED, DeviceSummary.ACTUATOR_STATE_OK)));

        assertTrue(result.changed());
        DeviceSummary summary = result.snapshot().deviceSummaries().get("DEVICE_1");
        assertNotNull(summary);
        assertTrue(summary.locked());
        assertFalse(summary.moving());
        assertEquals(DeviceSummary.ACTUATOR_STATE_OK, summary.actuatorState());
    }

    @Test
    void laterRecordForSameKeyReplacesEarlierOne() throws FrameDecodeException {
        apply(get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(2, 1)));
        StateSnapshot after = apply(get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(1, 3))).snapshot();

        assertEquals(1, after.allTraits().size());
        DeviceSummary summary = after.deviceSummaries().get("DEVICE_1");
        assertFalse(summary.locked());
        assertTrue(summary.moving());
        assertEquals(3, summary.actuatorState());
    }

    @Test
    void operationsInOneEnvelopeApplyInWireOrder() throws FrameDecodeException {
        StateSnapshot snapshot = apply(
                get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(2, 1)),
                get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(1, 1))).snapshot();

        assertFalse(snapshot.deviceSummaries().get("DEVICE_1").locked());
    }

    @Test
    void statePersistsAcrossEnvelopes() throws FrameDecodeException {
        apply(get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(2, 1)));
        StateSnapshot snapshot = apply(get("DEVICE_2", TraitType.BOLT_LOCK, boltLock(1, 1))).snapshot();

        assertEquals(List.of("DEVICE_1", "DEVICE_2"), List.copyOf(snapshot.deviceSummaries().keySet()));
    }

    @Test
    void earlierSnapshotIsNotAffectedByLaterUpdates() throws FrameDecodeException {
        StateSnapshot first = apply(get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(2, 1))).snapshot();
        apply(get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(1, 1)));

        assertTrue(first.deviceSummaries().get("DEVICE_1").locked());
    }

    @Test
    void envelopeWithoutOperationsReportsNoChange() throws FrameDecodeException {
        StateAggregator.ApplyResult result = aggregator.apply(decoder.decode(noopBody(2)));

        assertFalse(result.changed());
        assertTrue(result.snapshot().isEmpty());
    }

    @Test
    void failedDecodeIsStoredButProducesNoSummary() throws FrameDecodeException {
        StateAggregator.ApplyResult result = aggregator.apply(Envelope.of(List.of(new SubMessage(List.of(
                new GetOperation("DEVICE_1", "traits",
                        new TraitPayload(TraitType.BOLT_LOCK.typeUrl(), new byte[] { 0x22, 0x10 }), false))))));

        assertTrue(result.changed());
        TraitRecord record = result.snapshot().trait("DEVICE_1", TraitType.BOLT_LOCK).orElseThrow();
        assertFalse(record.decoded());
        assertNotNull(record.error());
        assertTrue(result.snapshot().deviceSummaries().isEmpty());
    }

    @Test
    void unrecognizedTraitIsKeptAndReported() throws FrameDecodeException {
        StateAggregator.ApplyResult result = apply(get("DEVICE_1", "type.googleapis.com/x.y.NewTrait", empty()));

        assertTrue(result.changed());
        assertEquals(TraitType.UNKNOWN, result.snapshot().allTraits().values().iterator().next().type());
        assertTrue(sink.hasEventOfType(ProtocolObservabilityEvent.UnrecognizedTrait.class));
    }

    @Test
    void operationWithoutObjectIdIsSkippedAndReported() throws FrameDecodeException {
        StateAggregator.ApplyResult result = apply(orphanGet(TraitType.BOLT_LOCK, boltLock(2, 1)));

        assertFalse(result.changed());
        assertEquals(0, aggregator.state().size());
        assertTrue(sink.hasEventOfType(ProtocolObservabilityEvent.OrphanOperation.class));
    }

    // ---------------------------------------------------------------------
    // Discovered user id
    // ---------------------------------------------------------------------

    @Test
    void userInfoLatchesOnlyFirstUserId() throws FrameDecodeException {
        apply(get("USER_1", TraitType.USER_INFO, empty()));
        StateSnapshot snapshot = apply(get("USER_2", TraitType.USER_INFO, empty())).snapshot();

        assertEquals("USER_1", snapshot.userId());
        assertEquals(1, sink.eventsOfType(ProtocolObservabilityEvent.IdentifierLatched.class).size());
    }

    @Test
    void lockActorOriginatorAlwaysOverwritesUserId() throws FrameDecodeException {
        apply(get("USER_1", TraitType.USER_INFO, empty()));
        assertEquals("USER_9", apply(get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(2, 1, "USER_9")))
                .snapshot().userId());

        StateSnapshot snapshot = apply(get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(1, 1, "USER_3"))).snapshot();
        assertEquals("USER_3", snapshot.userId());

        // A user-info trait after the lock events does not take the id back.
        assertEquals("USER_3", apply(get("USER_1", TraitType.USER_INFO, empty())).snapshot().userId());
    }

    @Test
    void lockWithoutActorLeavesUserIdAlone() throws FrameDecodeException {
        apply(get("USER_1", TraitType.USER_INFO, empty()));

        assertEquals("USER_1", apply(get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(2, 1))).snapshot().userId());
    }

    // ---------------------------------------------------------------------
    // Discovered structure id
    // ---------------------------------------------------------------------

    @Test
    void structureIdIsSecondLegacyIdSegment() throws FrameDecodeException {
        StateSnapshot snapshot = apply(get("STRUCTURE_1", TraitType.STRUCTURE_INFO,
                structureInfo("structure.ABC123"))).snapshot();

        assertEquals("ABC123", snapshot.structureId());
    }

    @Test
    void structureIdFollowsLaterStructureInfo() throws FrameDecodeException {
        apply(get("STRUCTURE_1", TraitType.STRUCTURE_INFO, structureInfo("structure.ABC")));
        apply(get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(2, 1)));
        assertEquals("ABC", aggregator.snapshot().structureId());

        apply(get("STRUCTURE_2", TraitType.STRUCTURE_INFO, structureInfo("structure.DEF")));
        assertEquals("DEF", aggregator.snapshot().structureId());
    }

    @Test
    void malformedLegacyIdIsReportedAndIgnored() throws FrameDecodeException {
        apply(get("STRUCTURE_1", TraitType.STRUCTURE_INFO, structureInfo("nodots")));
        apply(get("STRUCTURE_1", TraitType.STRUCTURE_INFO, structureInfo("structure.")));

        assertNull(aggregator.snapshot().structureId());
        assertEquals(2, sink.eventsOfType(ProtocolObservabilityEvent.MalformedLegacyId.class).size());
    }
}
