package com.questrail.traitstream.transport;

import java.util.Objects;

/**
 * Result of one bounded read from a {@link ChunkStream}.
 */
public sealed interface ChunkRead
{
    /** Bytes arrived. Never empty. */
    record Data(byte[] bytes) implements ChunkRead {
        public Data {
            Objects.requireNonNull(bytes, "bytes");
            if (bytes.length == 0) {
                throw new IllegalArgumentException("bytes must not be empty");
            }
        }
    }

    /** Nothing arrived within the wait window; the stream is still open. */
    enum Idle implements ChunkRead { INSTANCE }

    /** The server ended the stream normally. */
    enum End implements ChunkRead { INSTANCE }

    static ChunkRead data(byte[] bytes) {
        return new Data(bytes);
    }

    static ChunkRead idle() {
        return Idle.INSTANCE;
    }

    static ChunkRead end() {
        return End.INSTANCE;
    }
}
