package com.questrail.traitstream.schema;

import com.google.protobuf.BoolValue;
import com.google.protobuf.Duration;
import com.google.protobuf.FloatValue;
import com.google.protobuf.StringValue;
import com.google.protobuf.Timestamp;
import org.junit.jupiter.api.Test;

import static com.questrail.traitstream.schema.WireFixtures.msg;
import static org.junit.jupiter.api.Assertions.*;

public class WireMessageTest
{
    @Test
    void lastOccurrenceOfSingularFieldWins() throws SchemaException {
        WireMessage m = WireMessage.parse(msg()
                .varint(1, 4)
                .varint(1, 9)
                .string(2, "first")
                .string(2, "second")
                .toByteArray());

        assertEquals(9, m.int32(1).getAsInt());
        assertEquals("second", m.string(2).orElseThrow());
        assertEquals(2, m.allBytes(2).size());
    }

    @Test
    void absentFieldsAreEmpty() throws SchemaException {
        WireMessage m = WireMessage.parse(new byte[0]);

        assertFalse(m.has(1));
        assertTrue(m.varint(1).isEmpty());
        assertTrue(m.float32(1).isEmpty());
        assertTrue(m.message(1).isEmpty());
        assertTrue(m.stringValue(1).isEmpty());
        assertTrue(m.timestampSeconds(1).isEmpty());
    }

    @Test
    void readsWellKnownWrappers() throws SchemaException {
        WireMessage m = WireMessage.parse(msg()
                .message(1, StringValue.of("Acme"))
                .message(2, FloatValue.of(3.5f))
                .message(3, BoolValue.of(false))
                .message(4, Timestamp.newBuilder().setSeconds(100).setNanos(500_000_000).build())
                .message(5, Duration.newBuilder().setSeconds(30).build())
                .toByteArray());

        assertEquals("Acme", m.stringValue(1).orElseThrow());
        assertEquals(3.5f, m.floatValue(2).orElseThrow().floatValue());
        assertEquals(Boolean.FALSE, m.boolValue(3).orElseThrow());
        assertEquals(100.5, m.timestampSeconds(4).orElseThrow().doubleValue(), 1e-9);
        assertEquals(30.0, m.durationSeconds(5).orElseThrow().doubleValue(), 1e-9);
    }

    @Test
    void presentButDefaultWrapperIsDistinctFromAbsent() throws SchemaException {
        WireMessage m = WireMessage.parse(msg().message(1, FloatValue.of(0f)).toByteArray());

        assertEquals(0f, m.floatValue(1).orElseThrow().floatValue());
        assertTrue(m.floatValue(2).isEmpty());
    }

    @Test
    void malformedNestedMessageRaisesSchemaException() throws SchemaException {
        WireMessage m = WireMessage.parse(msg()
                .bytes(1, com.google.protobuf.ByteString.copyFrom(new byte[] { (byte) 0xFF, (byte) 0xFF }))
                .toByteArray());

        assertThrows(SchemaException.class, () -> m.message(1));
    }
}
