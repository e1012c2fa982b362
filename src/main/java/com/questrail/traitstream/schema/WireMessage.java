package com.questrail.traitstream.schema;

import com.google.protobuf.BoolValue;
import com.google.protobuf.ByteString;
import com.google.protobuf.Duration;
import com.google.protobuf.FloatValue;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.StringValue;
import com.google.protobuf.Timestamp;
import com.google.protobuf.UnknownFieldSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * WireMessage
 * -----------------------------------------------------------------------------
 * Read-only, field-number addressed view of one protobuf message.
 *
 * <p>The vendor trait messages have no published descriptors, so they are
 * parsed into an {@link UnknownFieldSet} and read by field number. Nested
 * well-known wrappers ({@code Timestamp}, {@code Duration},
 * {@code StringValue}, {@code FloatValue}, {@code BoolValue}) are parsed with
 * their generated protobuf-java classes.</p>
 *
 * <h2>Presence</h2>
 * Every accessor distinguishes "absent" from "present with the default value".
 * For singular fields the last occurrence on the wire wins.
 */
public final class WireMessage
{
    private static final WireMessage EMPTY = new WireMessage(UnknownFieldSet.getDefaultInstance());

    private final UnknownFieldSet fields;

    private WireMessage(UnknownFieldSet fields) {
        this.fields = fields;
    }

    public static WireMessage parse(byte[] bytes) throws SchemaException {
        Objects.requireNonNull(bytes, "bytes");
        try {
            return new WireMessage(UnknownFieldSet.parseFrom(bytes));
        } catch (InvalidProtocolBufferException e) {
            throw new SchemaException("Malformed message: " + e.getMessage(), e);
        }
    }

    public static WireMessage parse(ByteString bytes) throws SchemaException {
        Objects.requireNonNull(bytes, "bytes");
        try {
            return new WireMessage(UnknownFieldSet.parseFrom(bytes));
        } catch (InvalidProtocolBufferException e) {
            throw new SchemaException("Malformed message: " + e.getMessage(), e);
        }
    }

    public static WireMessage empty() {
        return EMPTY;
    }

    /**
     * {@code true} when the field occurs at least once, in any wire type.
     */
    public boolean has(int fieldNumber) {
        return fields.hasField(fieldNumber);
    }

    public OptionalLong varint(int fieldNumber) {
        if (!fields.hasField(fieldNumber)) {
            return OptionalLong.empty();
        }
        List<Long> values = fields.getField(fieldNumber).getVarintList();
        return values.isEmpty() ? OptionalLong.empty() : OptionalLong.of(values.get(values.size() - 1));
    }

    /**
     * A varint field narrowed to {@code int}, the way enum and int32 fields are
     * carried. Enum codes are passed through unmapped.
     */
    public OptionalInt int32(int fieldNumber) {
        OptionalLong v = varint(fieldNumber);
        return v.isPresent() ? OptionalInt.of((int) v.getAsLong()) : OptionalInt.empty();
    }

    public Optional<Boolean> bool(int fieldNumber) {
        OptionalLong v = varint(fieldNumber);
        return v.isPresent() ? Optional.of(v.getAsLong() != 0) : Optional.empty();
    }

    public Optional<Float> float32(int fieldNumber) {
        if (!fields.hasField(fieldNumber)) {
            return Optional.empty();
        }
        List<Integer> values = fields.getField(fieldNumber).getFixed32List();
        return values.isEmpty()
                ? Optional.empty()
                : Optional.of(Float.intBitsToFloat(values.get(values.size() - 1)));
    }

    public Optional<ByteString> bytes(int fieldNumber) {
        List<ByteString> all = allBytes(fieldNumber);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    public List<ByteString> allBytes(int fieldNumber) {
        if (!fields.hasField(fieldNumber)) {
            return List.of();
        }
        return fields.getField(fieldNumber).getLengthDelimitedList();
    }

    public Optional<String> string(int fieldNumber) {
        return bytes(fieldNumber).map(ByteString::toStringUtf8);
    }

    public Optional<WireMessage> message(int fieldNumber) throws SchemaException {
        Optional<ByteString> raw = bytes(fieldNumber);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parseNested(fieldNumber, raw.get()));
    }

    public List<WireMessage> messages(int fieldNumber) throws SchemaException {
        List<ByteString> raw = allBytes(fieldNumber);
        List<WireMessage> out = new ArrayList<>(raw.size());
        for (ByteString b : raw) {
            out.add(parseNested(fieldNumber, b));
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Well-known wrappers
    // ------------------------------------------------------------------

    /**
     * Inner value of a {@code google.protobuf.StringValue} field; empty when
     * the wrapper itself is absent.
     */
    public Optional<String> stringValue(int fieldNumber) throws SchemaException {
        Optional<ByteString> raw = bytes(fieldNumber);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(StringValue.parseFrom(raw.get()).getValue());
        } catch (InvalidProtocolBufferException e) {
            throw wrapperFailure("StringValue", fieldNumber, e);
        }
    }

    public Optional<Float> floatValue(int fieldNumber) throws SchemaException {
        Optional<ByteString> raw = bytes(fieldNumber);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(FloatValue.parseFrom(raw.get()).getValue());
        } catch (InvalidProtocolBufferException e) {
            throw wrapperFailure("FloatValue", fieldNumber, e);
        }
    }

    public Optional<Boolean> boolValue(int fieldNumber) throws SchemaException {
        Optional<ByteString> raw = bytes(fieldNumber);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(BoolValue.parseFrom(raw.get()).getValue());
        } catch (InvalidProtocolBufferException e) {
            throw wrapperFailure("BoolValue", fieldNumber, e);
        }
    }

    /**
     * A {@code google.protobuf.Timestamp} as fractional epoch seconds.
     */
    public Optional<Double> timestampSeconds(int fieldNumber) throws SchemaException {
        Optional<ByteString> raw = bytes(fieldNumber);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            Timestamp ts = Timestamp.parseFrom(raw.get());
            return Optional.of(ts.getSeconds() + ts.getNanos() / 1e9);
        } catch (InvalidProtocolBufferException e) {
            throw wrapperFailure("Timestamp", fieldNumber, e);
        }
    }

    /**
     * A {@code google.protobuf.Duration} as fractional seconds.
     */
    public Optional<Double> durationSeconds(int fieldNumber) throws SchemaException {
        Optional<ByteString> raw = bytes(fieldNumber);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            Duration d = Duration.parseFrom(raw.get());
            return Optional.of(d.getSeconds() + d.getNanos() / 1e9);
        } catch (InvalidProtocolBufferException e) {
            throw wrapperFailure("Duration", fieldNumber, e);
        }
    }

    private static WireMessage parseNested(int fieldNumber, ByteString raw) throws SchemaException {
        try {
            return new WireMessage(UnknownFieldSet.parseFrom(raw));
        } catch (InvalidProtocolBufferException e) {
            throw new SchemaException("Malformed sub-message in field " + fieldNumber, e);
        }
    }

    private static SchemaException wrapperFailure(String wrapper, int fieldNumber, Exception cause) {
        return new SchemaException("Malformed " + wrapper + " in field " + fieldNumber, cause);
    }

    @Override
    public String toString() {
        return "WireMessage" + fields.asMap().keySet();
    }
}
