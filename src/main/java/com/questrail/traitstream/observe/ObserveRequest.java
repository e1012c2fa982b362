package com.questrail.traitstream.observe;

import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;
import com.questrail.traitstream.api.TraitType;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * ObserveRequest
 * -----------------------------------------------------------------------------
 * Body of the subscription POST that opens an observe stream.
 *
 * <pre>
 * ObserveRequest { uint32 version = 1; bool subscribe = 2; repeated Filter filter = 3; }
 * Filter         { string trait_type = 1; }
 * </pre>
 *
 * @param version    protocol version, {@value #DEFAULT_VERSION} for current servers
 * @param subscribe  {@code true} to keep the stream open for updates
 * @param traitTypes fully qualified trait names to observe
 */
public record ObserveRequest(int version, boolean subscribe, List<String> traitTypes)
{
    public static final int DEFAULT_VERSION = 2;

    private static final int FIELD_VERSION = 1;
    private static final int FIELD_SUBSCRIBE = 2;
    private static final int FIELD_FILTER = 3;
    private static final int FIELD_TRAIT_TYPE = 1;

    public ObserveRequest {
        traitTypes = List.copyOf(Objects.requireNonNull(traitTypes, "traitTypes"));
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative");
        }
        for (String t : traitTypes) {
            if (t.isBlank()) {
                throw new IllegalArgumentException("trait type must not be blank");
            }
        }
    }

    public static ObserveRequest forTraits(TraitType... types) {
        return new ObserveRequest(DEFAULT_VERSION, true,
                Arrays.stream(types).map(TraitType::fullName).toList());
    }

    /**
     * Subscribes to every trait the dispatcher can decode.
     */
    public static ObserveRequest allSupportedTraits() {
        return forTraits(Arrays.stream(TraitType.values())
                .filter(t -> t != TraitType.UNKNOWN)
                .toArray(TraitType[]::new));
    }

    public byte[] toByteArray() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            out.writeUInt32(FIELD_VERSION, version);
            out.writeBool(FIELD_SUBSCRIBE, subscribe);
            for (String traitType : traitTypes) {
                out.writeTag(FIELD_FILTER, WireFormat.WIRETYPE_LENGTH_DELIMITED);
                out.writeUInt32NoTag(CodedOutputStream.computeStringSize(FIELD_TRAIT_TYPE, traitType));
                out.writeString(FIELD_TRAIT_TYPE, traitType);
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot encode observe request", e);
        }
        return bytes.toByteArray();
    }
}
