package com.questrail.traitstream.schema;

import com.questrail.traitstream.api.TraitType;
import com.questrail.traitstream.model.Envelope;
import com.questrail.traitstream.model.GetOperation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.traitstream.schema.WireFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class ProtobufSchemaRegistryTest
{
    private final ProtobufSchemaRegistry registry = new ProtobufSchemaRegistry();

    @Test
    void parsesGetOperationsInWireOrder() throws SchemaException {
        byte[] body = streamBody(
                get("DEVICE_1", TraitType.BOLT_LOCK, boltLock(2, 1)),
                get("STRUCTURE_9", TraitType.STRUCTURE_INFO, structureInfo("s.abc")));

        Envelope envelope = registry.parseStreamBody(body);

        List<GetOperation> ops = envelope.getOperations();
        assertEquals(2, ops.size());
        assertEquals("DEVICE_1", ops.get(0).objectId());
        assertEquals("traits", ops.get(0).objectKey());
        assertEquals(TraitType.BOLT_LOCK.typeUrl(), ops.get(0).payload().typeTag());
        assertArrayEquals(boltLock(2, 1).toByteArray(), ops.get(0).payload().rawBytes());
        assertFalse(ops.get(0).untypedSlotPresent());
        assertEquals("STRUCTURE_9", ops.get(1).objectId());
        assertTrue(envelope.status().isEmpty());
    }

    @Test
    void untypedSlotBecomesPayloadWhenNoPropertyIsPresent() throws SchemaException {
        Envelope envelope = registry.parseStreamBody(streamBody(untypedGet("DEVICE_1", boltLock(2, 1))));

        GetOperation op = envelope.getOperations().get(0);
        assertTrue(op.untypedSlotPresent());
        assertNull(op.payload().typeTag());
        assertArrayEquals(boltLock(2, 1).toByteArray(), op.payload().rawBytes());
    }

    @Test
    void anyWithoutTypeUrlYieldsNullTag() throws SchemaException {
        Envelope envelope = registry.parseStreamBody(streamBody(untaggedGet("DEVICE_1", boltLock(2, 1))));

        GetOperation op = envelope.getOperations().get(0);
        assertFalse(op.untypedSlotPresent());
        assertNull(op.payload().typeTag());
    }

    @Test
    void missingObjectRefLeavesIdNullAndKeyUnknown() throws SchemaException {
        Envelope envelope = registry.parseStreamBody(streamBody(orphanGet(TraitType.BOLT_LOCK, boltLock(2, 1))));

        GetOperation op = envelope.getOperations().get(0);
        assertNull(op.objectId());
        assertEquals(GetOperation.UNKNOWN_KEY, op.objectKey());
    }

    @Test
    void parsesStatusAndCountsNoops() throws SchemaException {
        Envelope status = registry.parseStreamBody(statusBody(7, "permission denied"));
        assertEquals(7, status.status().orElseThrow().code());
        assertEquals("permission denied", status.status().orElseThrow().message());
        assertFalse(status.status().orElseThrow().isOk());
        assertTrue(status.getOperations().isEmpty());

        Envelope noop = registry.parseStreamBody(noopBody(3));
        assertEquals(3, noop.noopCount());
        assertTrue(noop.messages().isEmpty());
    }

    @Test
    void emptyFrameIsAnEmptyEnvelope() throws SchemaException {
        Envelope envelope = registry.parseStreamBody(new byte[0]);

        assertTrue(envelope.messages().isEmpty());
        assertTrue(envelope.status().isEmpty());
        assertEquals(0, envelope.noopCount());
    }

    @Test
    void garbageFrameIsRejected() {
        byte[] garbage = { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF };

        assertThrows(SchemaException.class, () -> registry.parseStreamBody(garbage));
    }

    @Test
    void unpackOfUnknownTraitIsRejected() {
        assertThrows(SchemaException.class, () -> registry.unpack(TraitType.UNKNOWN, new byte[0]));
    }

    @Test
    void unpackReportsTraitNameOnMalformedBytes() {
        SchemaException e = assertThrows(SchemaException.class,
                () -> registry.unpack(TraitType.BOLT_LOCK, new byte[] { 0x0A, 0x05, 0x01 }));

        assertTrue(e.getMessage().contains("BoltLockTrait"), e.getMessage());
    }
}
