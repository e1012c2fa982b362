package com.questrail.traitstream.codec;

import com.questrail.traitstream.schema.WireFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FrameBufferTest
 * -----------------------------------------------------------------------------
 * Frame reassembly across arbitrary chunk boundaries.
 */
public class FrameBufferTest
{
    private FrameBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new FrameBuffer(20_000);
    }

    @AfterEach
    void tearDown() {
        buffer.close();
    }

    private static byte[] payload(int length, int seed) {
        byte[] p = new byte[length];
        for (int i = 0; i < length; i++) {
            p[i] = (byte) (seed + i);
        }
        return p;
    }

    // ---------------------------------------------------------------------
    // Happy Path
    // ---------------------------------------------------------------------

    /**
     * A 150-byte frame whose two-byte prefix (0x96 0x01) is split after the
     * first byte yields nothing until the rest arrives, then exactly one frame.
     */
    @Test
    void reassemblesFrameSplitInsideLengthPrefix() {
        byte[] body = payload(150, 1);
        byte[] wire = WireFixtures.frame(body);
        assertEquals((byte) 0x96, wire[0]);
        assertEquals((byte) 0x01, wire[1]);

        buffer.ingest(Arrays.copyOfRange(wire, 0, 1));
        assertTrue(buffer.extractReady().isEmpty());

        buffer.ingest(Arrays.copyOfRange(wire, 1, wire.length));
        List<byte[]> frames = buffer.extractReady();

        assertEquals(1, frames.size());
        assertArrayEquals(body, frames.get(0));
        assertEquals(0, buffer.bufferedBytes());
        assertTrue(buffer.pendingLength().isEmpty());
    }

    /**
     * Several frames delivered in one chunk come out in arrival order.
     */
    @Test
    void extractsSeveralFramesFromOneChunkInOrder() {
        byte[] a = payload(10, 0);
        byte[] b = payload(300, 50);
        byte[] c = payload(7, 99);

        buffer.ingest(WireFixtures.concat(WireFixtures.frame(a), WireFixtures.frame(b), WireFixtures.frame(c)));
        List<byte[]> frames = buffer.extractReady();

        assertEquals(3, frames.size());
        assertArrayEquals(a, frames.get(0));
        assertArrayEquals(b, frames.get(1));
        assertArrayEquals(c, frames.get(2));
    }

    /**
     * Feeding the same bytes in chunks of any size yields the same frames as
     * feeding them at once.
     */
    @Test
    void frameSequenceDoesNotDependOnChunking() {
        byte[] wire = WireFixtures.concat(
                WireFixtures.frame(payload(3, 0)),
                WireFixtures.frame(payload(200, 7)),
                WireFixtures.frame(payload(1, 42)),
                WireFixtures.frame(payload(64, 3)));

        List<byte[]> whole = new ArrayList<>();
        try (FrameBuffer b = new FrameBuffer(20_000)) {
            b.ingest(wire);
            whole.addAll(b.extractReady());
        }

        for (int chunkSize : new int[] { 1, 2, 3, 5, 7, 64 }) {
            List<byte[]> chunked = new ArrayList<>();
            try (FrameBuffer b = new FrameBuffer(20_000)) {
                for (int i = 0; i < wire.length; i += chunkSize) {
                    b.ingest(Arrays.copyOfRange(wire, i, Math.min(wire.length, i + chunkSize)));
                    chunked.addAll(b.extractReady());
                }
            }
            assertEquals(whole.size(), chunked.size(), "chunk size " + chunkSize);
            for (int i = 0; i < whole.size(); i++) {
                assertArrayEquals(whole.get(i), chunked.get(i), "chunk size " + chunkSize + ", frame " + i);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Prefix window
    // ---------------------------------------------------------------------

    /**
     * Fewer than five buffered bytes are enough when they already hold the
     * prefix and its whole frame.
     */
    @Test
    void shortCompleteFrameIsExtractedBelowPrefixWindow() {
        buffer.ingest(new byte[] { 0x02, 0x0A, 0x0B });

        List<byte[]> frames = buffer.extractReady();

        assertEquals(1, frames.size());
        assertArrayEquals(new byte[] { 0x0A, 0x0B }, frames.get(0));
    }

    /**
     * Below the prefix window an incomplete frame leaves its prefix unread
     * until more bytes arrive.
     */
    @Test
    void shortIncompleteFrameLeavesPrefixUnread() {
        buffer.ingest(new byte[] { 0x03, 0x0A });

        assertTrue(buffer.extractReady().isEmpty());
        assertTrue(buffer.pendingLength().isEmpty());
        assertEquals(2, buffer.bufferedBytes());

        buffer.ingest(new byte[] { 0x0B, 0x0C });
        List<byte[]> frames = buffer.extractReady();

        assertEquals(1, frames.size());
        assertArrayEquals(new byte[] { 0x0A, 0x0B, 0x0C }, frames.get(0));
    }

    /**
     * Once a prefix is consumed its length stays pending while the payload
     * is still short.
     */
    @Test
    void pendingLengthIsKeptOncePrefixIsRead() {
        byte[] wire = WireFixtures.frame(payload(150, 0));

        buffer.ingest(Arrays.copyOfRange(wire, 0, 12));

        assertTrue(buffer.extractReady().isEmpty());
        assertEquals(150, buffer.pendingLength().getAsInt());
        assertEquals(10, buffer.bufferedBytes());
    }

    // ---------------------------------------------------------------------
    // Edge cases
    // ---------------------------------------------------------------------

    /**
     * A zero length prefix is consumed and ends the current call; the next
     * call continues with the following frame.
     */
    @Test
    void zeroLengthPrefixEndsCurrentExtraction() {
        buffer.ingest(WireFixtures.concat(new byte[] { 0x00 }, WireFixtures.frame(new byte[] { 1, 2, 3 })));

        assertTrue(buffer.extractReady().isEmpty());

        List<byte[]> next = buffer.extractReady();
        assertEquals(1, next.size());
        assertArrayEquals(new byte[] { 1, 2, 3 }, next.get(0));
    }

    /**
     * A prefix longer than ten bytes can never become valid.
     */
    @Test
    void malformedPrefixRaisesFramingException() {
        byte[] bad = new byte[11];
        Arrays.fill(bad, (byte) 0xFF);
        buffer.ingest(bad);

        assertThrows(FramingException.class, buffer::extractReady);
    }

    /**
     * A length of 2^31 cannot be buffered and is rejected.
     */
    @Test
    void lengthAboveIntRangeRaisesFramingException() {
        // 2^31
        buffer.ingest(new byte[] { (byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, 0x08 });

        assertThrows(FramingException.class, buffer::extractReady);
    }

    /**
     * Reset discards a partial frame so the next connection starts clean.
     */
    @Test
    void resetDropsBufferedBytesAndPendingLength() {
        byte[] wire = WireFixtures.frame(payload(150, 0));
        buffer.ingest(Arrays.copyOfRange(wire, 0, 40));
        buffer.extractReady();

        buffer.reset();

        assertEquals(0, buffer.bufferedBytes());
        assertTrue(buffer.pendingLength().isEmpty());

        buffer.ingest(WireFixtures.frame(new byte[] { 9 }));
        assertArrayEquals(new byte[] { 9 }, buffer.extractReady().get(0));
    }

    /**
     * Complete frames ahead of a malformed prefix are returned whatever the
     * chunking; the failure surfaces after them, either on the call that
     * reaches it or on the next one.
     */
    @Test
    void framesAheadOfMalformedPrefixSurviveAnyChunking() {
        byte[] bad = new byte[11];
        Arrays.fill(bad, (byte) 0xFF);
        byte[] first = payload(6, 1);
        byte[] second = payload(40, 9);
        byte[] wire = WireFixtures.concat(WireFixtures.frame(first), WireFixtures.frame(second), bad);

        for (int chunkSize : new int[] { 1, 4, 8, wire.length }) {
            List<byte[]> frames = new ArrayList<>();
            FramingException failure = null;
            try (FrameBuffer b = new FrameBuffer(20_000)) {
                for (int i = 0; i < wire.length && failure == null; i += chunkSize) {
                    b.ingest(Arrays.copyOfRange(wire, i, Math.min(wire.length, i + chunkSize)));
                    try {
                        frames.addAll(b.extractReady());
                    } catch (FramingException e) {
                        failure = e;
                    }
                }
                if (failure == null) {
                    assertTrue(b.framingError().isPresent(), "chunk size " + chunkSize);
                    failure = assertThrows(FramingException.class, b::extractReady);
                }
            }

            assertNotNull(failure, "chunk size " + chunkSize);
            assertEquals(2, frames.size(), "chunk size " + chunkSize);
            assertArrayEquals(first, frames.get(0));
            assertArrayEquals(second, frames.get(1));
        }
    }

    /**
     * The latched failure keeps firing until reset.
     */
    @Test
    void latchedFramingErrorIsClearedByReset() {
        byte[] bad = new byte[11];
        Arrays.fill(bad, (byte) 0xFF);
        buffer.ingest(WireFixtures.concat(WireFixtures.frame(new byte[] { 1, 2 }), bad));

        assertEquals(1, buffer.extractReady().size());
        assertTrue(buffer.framingError().isPresent());
        assertThrows(FramingException.class, buffer::extractReady);

        buffer.reset();

        assertTrue(buffer.framingError().isEmpty());
        buffer.ingest(WireFixtures.frame(new byte[] { 3 }));
        assertArrayEquals(new byte[] { 3 }, buffer.extractReady().get(0));
    }

    // ---------------------------------------------------------------------
    // High-water
    // ---------------------------------------------------------------------

    /**
     * The high-water signal is raised while a large frame is incomplete and
     * cleared once it is extracted.
     */
    @Test
    void reportsStallOnlyWhileLargeFrameIsIncomplete() {
        try (FrameBuffer small = new FrameBuffer(16)) {
            byte[] body = payload(100, 0);
            byte[] wire = WireFixtures.frame(body);

            small.ingest(Arrays.copyOfRange(wire, 0, 8));
            assertTrue(small.extractReady().isEmpty());
            assertFalse(small.isStalledAboveHighWater());

            small.ingest(Arrays.copyOfRange(wire, 8, 40));
            assertTrue(small.extractReady().isEmpty());
            assertTrue(small.isStalledAboveHighWater());

            small.ingest(Arrays.copyOfRange(wire, 40, wire.length));
            List<byte[]> frames = small.extractReady();
            assertEquals(1, frames.size());
            assertArrayEquals(body, frames.get(0));
            assertFalse(small.isStalledAboveHighWater());
        }
    }

    /**
     * The high-water mark must be positive.
     */
    @Test
    void rejectsNonPositiveHighWaterMark() {
        assertThrows(IllegalArgumentException.class, () -> new FrameBuffer(0));
    }
}
