package com.questrail.traitstream.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * FrameBuffer
 * -----------------------------------------------------------------------------
 * Reassembles length-prefixed frames from arbitrarily chunked transport reads.
 *
 * <p>The observe stream is a sequence of {@code varint length || payload}
 * records. Network reads may split a record anywhere, including inside the
 * length prefix, so this buffer accumulates bytes and slices off complete
 * payloads as they become available.</p>
 *
 * <h2>Prefix window</h2>
 * A new length prefix is only read when at least {@value #MIN_PREFIX_WINDOW}
 * bytes are buffered, or when fewer bytes are buffered but they already hold
 * a complete prefix together with its whole frame. Otherwise the prefix is
 * deferred until more bytes arrive. The rule depends only on the buffered
 * bytes, so the extracted frame sequence does not depend on how the input
 * was chunked.
 *
 * <h2>Edge cases</h2>
 * <ul>
 *   <li>A zero length prefix is consumed and ends extraction for the current
 *       call.</li>
 *   <li>A pending length larger than the buffered bytes waits; nothing is
 *       truncated.</li>
 *   <li>A prefix longer than ten bytes, wider than 64 bits, or above
 *       {@link Integer#MAX_VALUE} can never be satisfied. Frames completed
 *       ahead of it in the same call are still returned; the failure is
 *       latched and exposed by {@link #framingError()}, and the next call to
 *       {@link #extractReady()} raises it as a {@link FramingException}.</li>
 * </ul>
 *
 * <h2>Netty containment</h2>
 * The accumulation buffer is a Netty {@link ByteBuf}; only {@code byte[]}
 * crosses this class boundary.
 *
 * <p>Not thread-safe. A buffer is owned by exactly one stream session.</p>
 */
public final class FrameBuffer implements AutoCloseable
{
    /** Minimum number of buffered bytes before a new length prefix is read. */
    public static final int MIN_PREFIX_WINDOW = 5;

    private static final int NO_PENDING = -1;

    private final int highWaterMark;
    private final ByteBuf cumulation;

    private int pendingLength = NO_PENDING;
    private FramingException framingError;

    /**
     * @param highWaterMark buffered size above which a still-unsatisfied
     *                      pending frame is reported by {@link #isStalledAboveHighWater()}
     */
    public FrameBuffer(int highWaterMark) {
        if (highWaterMark <= 0) {
            throw new IllegalArgumentException("highWaterMark must be positive");
        }
        this.highWaterMark = highWaterMark;
        this.cumulation = Unpooled.buffer(Math.min(highWaterMark, 8192));
    }

    /**
     * Appends one transport chunk.
     */
    public void ingest(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        cumulation.writeBytes(chunk);
    }

    /**
     * Slices off every frame that is complete in the buffer.
     *
     * @return the complete frames, in arrival order; empty if none is ready
     * @throws FramingException if the buffered prefix can never become valid
     *                          and no complete frame precedes it
     */
    public List<byte[]> extractReady() {
        if (framingError != null) {
            throw framingError;
        }

        List<byte[]> frames = new ArrayList<>();

        while (true) {
            if (pendingLength == NO_PENDING) {
                boolean prefixRead;
                try {
                    prefixRead = readPrefix();
                } catch (FramingException e) {
                    framingError = e;
                    if (frames.isEmpty()) {
                        throw e;
                    }
                    break;
                }
                if (!prefixRead) {
                    break;
                }
                if (pendingLength == 0) {
                    pendingLength = NO_PENDING;
                    break;
                }
            }

            if (cumulation.readableBytes() < pendingLength) {
                break;
            }

            byte[] frame = new byte[pendingLength];
            cumulation.readBytes(frame);
            frames.add(frame);
            pendingLength = NO_PENDING;
        }

        cumulation.discardSomeReadBytes();
        return frames;
    }

    private boolean readPrefix() {
        int start = cumulation.readerIndex();
        VarintReader.Result prefix = VarintReader.decode(cumulation, start);

        if (prefix.malformed()) {
            throw new FramingException("Malformed length prefix at buffered offset 0");
        }
        if (!prefix.isComplete()) {
            return false;
        }

        long length = prefix.value().getAsLong();
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new FramingException("Frame length out of range: " + Long.toUnsignedString(length));
        }

        int prefixBytes = prefix.newPos() - start;
        int readable = cumulation.readableBytes();
        if (readable < MIN_PREFIX_WINDOW && readable - prefixBytes < length) {
            return false;
        }

        cumulation.skipBytes(prefixBytes);
        pendingLength = (int) length;
        return true;
    }

    /**
     * The unrecoverable prefix error reached by an earlier
     * {@link #extractReady()} call, if any. Cleared by {@link #reset()}.
     */
    public Optional<FramingException> framingError() {
        return Optional.ofNullable(framingError);
    }

    /**
     * Length of the frame currently being waited for, if a prefix has been read.
     */
    public OptionalInt pendingLength() {
        return pendingLength == NO_PENDING ? OptionalInt.empty() : OptionalInt.of(pendingLength);
    }

    /**
     * Number of buffered bytes not yet handed out as frames or consumed as prefixes.
     */
    public int bufferedBytes() {
        return cumulation.readableBytes();
    }

    /**
     * Bulk-catalog heuristic: {@code true} when the buffer has grown past the
     * high-water mark while the pending frame is still incomplete.
     *
     * <p>This is a monitoring signal only. The frame is still emitted once all
     * of its bytes have arrived.</p>
     */
    public boolean isStalledAboveHighWater() {
        return pendingLength != NO_PENDING
                && cumulation.readableBytes() >= highWaterMark
                && cumulation.readableBytes() < pendingLength;
    }

    public int highWaterMark() {
        return highWaterMark;
    }

    /**
     * Drops all buffered bytes, any pending length and a latched framing error.
     */
    public void reset() {
        cumulation.clear();
        pendingLength = NO_PENDING;
        framingError = null;
    }

    @Override
    public void close() {
        if (cumulation.refCnt() > 0) {
            cumulation.release();
        }
    }
}
