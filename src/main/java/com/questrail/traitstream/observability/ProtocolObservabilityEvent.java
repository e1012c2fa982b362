package com.questrail.traitstream.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Protocol-level events raised while frames are reassembled and decoded.
 */
public sealed interface ProtocolObservabilityEvent
{
    Instant timestamp();

    /**
     * A complete frame left the frame buffer. The bytes are only retained for
     * trace-level dumps.
     */
    record FrameReceived(Instant timestamp, byte[] frame) implements ProtocolObservabilityEvent {
        public FrameReceived {
            frame = Objects.requireNonNull(frame, "frame").clone();
        }

        @Override
        public byte[] frame() {
            return frame.clone();
        }

        public int length() {
            return frame.length;
        }

        @Override
        public String toString() {
            return "FrameReceived[timestamp=" + timestamp + ", length=" + frame.length + ']';
        }
    }

    /**
     * A get operation without a type tag and without the untyped slot. It was
     * dropped.
     */
    record ClassificationMiss(Instant timestamp, String objectId, String objectKey)
            implements ProtocolObservabilityEvent {}

    /** A type tag no dispatch rule matched. The record is kept undecoded. */
    record UnrecognizedTrait(Instant timestamp, String objectId, String typeTag)
            implements ProtocolObservabilityEvent {}

    /** A get operation naming no object. It was skipped. */
    record OrphanOperation(Instant timestamp, String typeTag) implements ProtocolObservabilityEvent {}

    /**
     * The buffer grew past its high-water mark while still waiting for a frame
     * (typically the initial bulk catalog).
     */
    record BufferHighWater(Instant timestamp, int bufferedBytes, int pendingLength, int highWaterMark)
            implements ProtocolObservabilityEvent {}

    /** The server attached a non-OK status to a frame. */
    record StreamStatusReceived(Instant timestamp, int code, String message)
            implements ProtocolObservabilityEvent {}

    /** A discovered identifier was set or replaced. */
    record IdentifierLatched(Instant timestamp, String identifier, String value, String sourceObjectId)
            implements ProtocolObservabilityEvent {}

    /** A structure legacy id could not be split into its segments. */
    record MalformedLegacyId(Instant timestamp, String objectId, String legacyId)
            implements ProtocolObservabilityEvent {}
}
