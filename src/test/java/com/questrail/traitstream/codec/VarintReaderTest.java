package com.questrail.traitstream.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VarintReaderTest
{
    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Complete encodings
    // ---------------------------------------------------------------------

    /**
     * Values 0 and 127 fit in one byte.
     */
    @Test
    void decodesSingleByteValues() {
        VarintReader.Result zero = VarintReader.decode(bytes(0x00), 0);
        assertTrue(zero.isComplete());
        assertEquals(0L, zero.value().getAsLong());
        assertEquals(1, zero.newPos());

        VarintReader.Result max = VarintReader.decode(bytes(0x7F), 0);
        assertEquals(127L, max.value().getAsLong());
        assertEquals(1, max.newPos());
    }

    /**
     * 128 and 150 need two bytes, low seven-bit group first.
     */
    @Test
    void decodesMultiByteValuesLeastSignificantGroupFirst() {
        VarintReader.Result r128 = VarintReader.decode(bytes(0x80, 0x01), 0);
        assertEquals(128L, r128.value().getAsLong());
        assertEquals(2, r128.newPos());

        VarintReader.Result r150 = VarintReader.decode(bytes(0x96, 0x01), 0);
        assertEquals(150L, r150.value().getAsLong());
        assertEquals(2, r150.newPos());
    }

    /**
     * 2^63-1 decodes from nine bytes without being flagged.
     */
    @Test
    void decodesLargestSignedLong() {
        byte[] encoded = bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x7F);

        VarintReader.Result r = VarintReader.decode(encoded, 0);

        assertEquals(Long.MAX_VALUE, r.value().getAsLong());
        assertEquals(9, r.newPos());
        assertFalse(r.malformed());
    }

    /**
     * The all-ones 64-bit value uses the tenth byte for bit 63 only and is
     * carried as an unsigned long.
     */
    @Test
    void decodesFullWidthUnsignedValueInTenBytes() {
        byte[] encoded = bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x01);

        VarintReader.Result r = VarintReader.decode(encoded, 0);

        assertTrue(r.isComplete());
        assertEquals(-1L, r.value().getAsLong());
        assertEquals("18446744073709551615", Long.toUnsignedString(r.value().getAsLong()));
        assertEquals(10, r.newPos());
    }

    /**
     * Decoding starts at the given offset and stops at the terminating byte.
     */
    @Test
    void decodesFromNonZeroOffsetAndIgnoresTrailingBytes() {
        byte[] encoded = bytes(0xAA, 0xBB, 0x96, 0x01, 0x33);

        VarintReader.Result r = VarintReader.decode(encoded, 2);

        assertEquals(150L, r.value().getAsLong());
        assertEquals(4, r.newPos());
    }

    // ---------------------------------------------------------------------
    // Incomplete and malformed
    // ---------------------------------------------------------------------

    /**
     * A continuation bit on the last available byte means more input is
     * needed; the position is left unchanged.
     */
    @Test
    void reportsIncompleteWhenContinuationBitRunsOffTheEnd() {
        VarintReader.Result r = VarintReader.decode(bytes(0x96), 0);

        assertFalse(r.isComplete());
        assertFalse(r.malformed());
        assertEquals(0, r.newPos());
    }

    /**
     * An empty slice is incomplete, not malformed.
     */
    @Test
    void reportsIncompleteForEmptyInput() {
        VarintReader.Result r = VarintReader.decode(new byte[0], 0);

        assertFalse(r.isComplete());
        assertFalse(r.malformed());
    }

    /**
     * Ten continuation bytes can never terminate within the 64-bit limit.
     */
    @Test
    void rejectsEncodingLongerThanTenBytes() {
        byte[] encoded = bytes(0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x81, 0x00);

        VarintReader.Result r = VarintReader.decode(encoded, 0);

        assertTrue(r.malformed());
        assertFalse(r.isComplete());
        assertEquals(0, r.newPos());
    }

    /**
     * A tenth byte carrying anything above bit 63 is rejected rather than
     * wrapped.
     */
    @Test
    void rejectsTenthByteCarryingBitsAbove63() {
        byte[] encoded = bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x02);

        assertTrue(VarintReader.decode(encoded, 0).malformed());
    }

    /**
     * Negative start positions are a caller error.
     */
    @Test
    void rejectsNegativePosition() {
        assertThrows(IllegalArgumentException.class, () -> VarintReader.decode(bytes(0x01), -1));
    }

    // ---------------------------------------------------------------------
    // ByteBuf variant
    // ---------------------------------------------------------------------

    /**
     * The ByteBuf variant reads at an absolute index and leaves the reader
     * index alone.
     */
    @Test
    void byteBufVariantDoesNotMoveReaderIndex() {
        ByteBuf buf = Unpooled.wrappedBuffer(bytes(0x05, 0x96, 0x01));
        try {
            VarintReader.Result r = VarintReader.decode(buf, 1);

            assertEquals(150L, r.value().getAsLong());
            assertEquals(3, r.newPos());
            assertEquals(0, buf.readerIndex());
        } finally {
            buf.release();
        }
    }
}
