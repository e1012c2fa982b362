package com.questrail.traitstream.codec;

import io.netty.buffer.ByteBuf;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * VarintReader
 * -----------------------------------------------------------------------------
 * Decoder for the base-128 length prefix that precedes every frame on the
 * observe stream.
 *
 * <p>Each byte contributes its low seven bits, least-significant group first;
 * the high bit marks continuation. At most {@value #MAX_VARINT_BYTES} bytes are
 * read. A value that would need more than 64 bits is rejected rather than
 * wrapped.</p>
 *
 * <p>This class is stateless. Both entry points only inspect the input; the
 * {@link ByteBuf} variant does not move the reader index.</p>
 */
public final class VarintReader
{
    /** Longest legal encoding of a 64-bit value. */
    public static final int MAX_VARINT_BYTES = 10;

    private VarintReader() {
    }

    /**
     * Outcome of a decode attempt.
     *
     * @param value     the decoded value (unsigned 64-bit, carried in a {@code long});
     *                  empty if the input ended early or the encoding is malformed
     * @param newPos    position just after the prefix when decoding succeeded;
     *                  the starting position otherwise
     * @param malformed {@code true} when the encoding can never become valid
     *                  (more than ten bytes, or a value wider than 64 bits)
     */
    public record Result(OptionalLong value, int newPos, boolean malformed)
    {
        public Result {
            Objects.requireNonNull(value, "value");
        }

        static Result complete(long value, int newPos) {
            return new Result(OptionalLong.of(value), newPos, false);
        }

        static Result incomplete(int pos) {
            return new Result(OptionalLong.empty(), pos, false);
        }

        static Result rejected(int pos) {
            return new Result(OptionalLong.empty(), pos, true);
        }

        public boolean isComplete() {
            return value.isPresent();
        }
    }

    /**
     * Decodes a varint from {@code buf} starting at {@code pos}.
     */
    public static Result decode(byte[] buf, int pos) {
        Objects.requireNonNull(buf, "buf");
        return decode(new ArrayCursor(buf), pos, buf.length);
    }

    /**
     * Decodes a varint from the absolute index {@code pos} of {@code buf},
     * reading no further than {@code buf.writerIndex()}.
     */
    public static Result decode(ByteBuf buf, int pos) {
        Objects.requireNonNull(buf, "buf");
        return decode(buf::getByte, pos, buf.writerIndex());
    }

    private static Result decode(ByteSource source, int pos, int limit) {
        if (pos < 0) {
            throw new IllegalArgumentException("pos must be non-negative");
        }

        long value = 0;
        int cursor = pos;
        for (int i = 0; i < MAX_VARINT_BYTES; i++) {
            if (cursor >= limit) {
                return Result.incomplete(pos);
            }
            int b = source.byteAt(cursor++) & 0xFF;

            // The tenth byte may only carry bit 63.
            if (i == MAX_VARINT_BYTES - 1 && (b & 0x7E) != 0) {
                return Result.rejected(pos);
            }

            value |= (long) (b & 0x7F) << (7 * i);
            if ((b & 0x80) == 0) {
                return Result.complete(value, cursor);
            }
        }
        return Result.rejected(pos);
    }

    @FunctionalInterface
    private interface ByteSource {
        byte byteAt(int index);
    }

    private record ArrayCursor(byte[] bytes) implements ByteSource {
        @Override
        public byte byteAt(int index) {
            return bytes[index];
        }
    }
}
