package com.questrail.traitstream.internal.decode;

import com.questrail.traitstream.api.TraitType;
import com.questrail.traitstream.internal.time.SystemWallClock;
import com.questrail.traitstream.model.Envelope;
import com.questrail.traitstream.model.GetOperation;
import com.questrail.traitstream.model.SubMessage;
import com.questrail.traitstream.model.TraitPayload;
import com.questrail.traitstream.observability.ProtocolObservabilityEvent;
import com.questrail.traitstream.observability.TraitStreamObservabilitySink;
import com.questrail.traitstream.schema.SchemaException;
import com.questrail.traitstream.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * EnvelopeDecoder
 * =============================================================================
 * Turns one complete frame into an {@link Envelope} whose get operations are
 * ready for dispatch.
 *
 * <h2>Classification</h2>
 * Every payload type tag is passed through {@link TypeUrlNormalizer}. When a
 * payload carries no tag:
 * <ul>
 *   <li>if the operation had the untyped slot (field 7), the tag becomes the
 *       lock-state trait's canonical URL;</li>
 *   <li>otherwise the operation cannot be classified. It is dropped and a
 *       {@link ProtocolObservabilityEvent.ClassificationMiss} is reported.</li>
 * </ul>
 * Operations with no payload at all carry nothing to decode and are dropped
 * without an event.
 *
 * <p>After decoding, every retained operation has a non-null payload with a
 * non-null canonical tag. Sub-message and operation order is preserved.</p>
 */
public final class EnvelopeDecoder
{
    private final SchemaRegistry registry;
    private final TraitStreamObservabilitySink sink;

    public EnvelopeDecoder(SchemaRegistry registry, TraitStreamObservabilitySink sink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @throws FrameDecodeException if the registry rejects the frame
     */
    public Envelope decode(byte[] frame) throws FrameDecodeException {
        Objects.requireNonNull(frame, "frame");

        Envelope parsed;
        try {
            parsed = registry.parseStreamBody(frame);
        } catch (SchemaException e) {
            throw new FrameDecodeException(
                    "Failed to parse " + frame.length + "-byte frame: " + e.getMessage(), frame.length, e);
        }

        List<SubMessage> classified = new ArrayList<>(parsed.messages().size());
        for (SubMessage message : parsed.messages()) {
            List<GetOperation> kept = new ArrayList<>(message.gets().size());
            for (GetOperation get : message.gets()) {
                GetOperation resolved = classify(get);
                if (resolved != null) {
                    kept.add(resolved);
                }
            }
            classified.add(new SubMessage(kept));
        }
        return parsed.withMessages(classified);
    }

    private GetOperation classify(GetOperation get) {
        TraitPayload payload = get.payload();
        if (payload == null) {
            return null;
        }

        if (payload.typeTag() != null) {
            String normalized = TypeUrlNormalizer.normalize(payload.typeTag());
            return normalized.equals(payload.typeTag()) ? get : get.withPayload(payload.withTypeTag(normalized));
        }

        if (get.untypedSlotPresent()) {
            return get.withPayload(payload.withTypeTag(TraitType.BOLT_LOCK.typeUrl()));
        }

        sink.onProtocolEvent(new ProtocolObservabilityEvent.ClassificationMiss(
                SystemWallClock.INSTANCE.now(), get.objectId(), get.objectKey()));
        return null;
    }
}
