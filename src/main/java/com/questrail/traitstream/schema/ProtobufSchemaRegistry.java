package com.questrail.traitstream.schema;

import com.google.protobuf.Any;
import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.questrail.traitstream.api.TraitType;
import com.questrail.traitstream.model.Envelope;
import com.questrail.traitstream.model.GetOperation;
import com.questrail.traitstream.model.StreamStatus;
import com.questrail.traitstream.model.SubMessage;
import com.questrail.traitstream.model.TraitPayload;
import com.questrail.traitstream.schema.TraitLayouts.NestMessage;
import com.questrail.traitstream.schema.TraitLayouts.ObjectRef;
import com.questrail.traitstream.schema.TraitLayouts.Status;
import com.questrail.traitstream.schema.TraitLayouts.StreamBody;
import com.questrail.traitstream.schema.TraitLayouts.TraitData;
import com.questrail.traitstream.schema.TraitLayouts.TraitGet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ProtobufSchemaRegistry
 * =============================================================================
 * {@link SchemaRegistry} backed by protobuf-java.
 *
 * <h2>Envelope</h2>
 * <pre>
 * StreamBody        { repeated NestMessage message = 1; Status status = 2; repeated bytes noop = 15; }
 * NestMessage       { repeated TraitGetProperty get = 3; }
 * TraitGetProperty  { ObjectRef object = 1; TraitData data = 2; (untyped) 7; }
 * ObjectRef         { string id = 1; string key = 2; }
 * TraitData         { google.protobuf.Any property = 1; }
 * </pre>
 *
 * <h2>Untyped slot</h2>
 * Some server versions send the lock state without a type URL. When the
 * {@code Any} carries no type URL, the returned payload has a {@code null}
 * tag and the operation reports whether field 7 was present. When there is
 * no {@code Any} at all but field 7 holds bytes, those bytes become the
 * payload.
 *
 * <p>Trait layouts are listed in {@link TraitLayouts}.</p>
 */
public final class ProtobufSchemaRegistry implements SchemaRegistry
{
    public static final String SCHEMA_VERSION = "nestlabs.gateway.v2";

    @Override
    public String schemaVersion() {
        return SCHEMA_VERSION;
    }

    @Override
    public Envelope parseStreamBody(byte[] frame) throws SchemaException {
        Objects.requireNonNull(frame, "frame");
        WireMessage body = WireMessage.parse(frame);

        List<SubMessage> messages = new ArrayList<>();
        for (WireMessage nest : body.messages(StreamBody.MESSAGE)) {
            List<GetOperation> gets = new ArrayList<>();
            for (WireMessage get : nest.messages(NestMessage.GET)) {
                gets.add(toGetOperation(get));
            }
            messages.add(new SubMessage(gets));
        }

        Optional<StreamStatus> status = Optional.empty();
        Optional<WireMessage> rawStatus = body.message(StreamBody.STATUS);
        if (rawStatus.isPresent()) {
            status = Optional.of(new StreamStatus(
                    rawStatus.get().int32(Status.CODE).orElse(0),
                    rawStatus.get().string(Status.MESSAGE).orElse("")));
        }

        int noops = body.allBytes(StreamBody.NOOP).size();
        return new Envelope(messages, status, noops);
    }

    private static GetOperation toGetOperation(WireMessage get) throws SchemaException {
        String objectId = null;
        String objectKey = GetOperation.UNKNOWN_KEY;

        Optional<WireMessage> object = get.message(TraitGet.OBJECT);
        if (object.isPresent()) {
            objectId = object.get().string(ObjectRef.ID).filter(s -> !s.isEmpty()).orElse(null);
            objectKey = object.get().string(ObjectRef.KEY).filter(s -> !s.isEmpty()).orElse(GetOperation.UNKNOWN_KEY);
        }

        boolean untypedSlot = get.has(TraitGet.UNTYPED_SLOT);
        TraitPayload payload = null;

        Optional<WireMessage> data = get.message(TraitGet.DATA);
        Optional<ByteString> property = data.isPresent()
                ? data.get().bytes(TraitData.PROPERTY)
                : Optional.empty();

        if (property.isPresent()) {
            Any any = parseAny(property.get());
            payload = new TraitPayload(any.getTypeUrl(), any.getValue().toByteArray());
        } else if (untypedSlot) {
            payload = new TraitPayload(null,
                    get.bytes(TraitGet.UNTYPED_SLOT).map(ByteString::toByteArray).orElse(new byte[0]));
        }

        return new GetOperation(objectId, objectKey, payload, untypedSlot);
    }

    private static Any parseAny(ByteString raw) throws SchemaException {
        try {
            return Any.parseFrom(raw);
        } catch (InvalidProtocolBufferException e) {
            throw new SchemaException("Malformed trait property", e);
        }
    }

    @Override
    public WireMessage unpack(TraitType type, byte[] payload) throws SchemaException {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        if (type == TraitType.UNKNOWN) {
            throw new SchemaException("No layout registered for unknown trait");
        }
        try {
            return WireMessage.parse(payload);
        } catch (SchemaException e) {
            throw new SchemaException("Cannot unpack " + type.simpleName() + ": " + e.getMessage(), e);
        }
    }
}
