package com.questrail.traitstream.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * A polymorphic trait payload: a type tag naming the schema, plus the
 * serialized trait bytes.
 *
 * <p>The byte array is defensively copied on the way in and out.</p>
 *
 * @param typeTag  the type URL, {@code null} when the server omitted it
 * @param rawBytes serialized trait message (never {@code null}, may be empty)
 */
public record TraitPayload(String typeTag, byte[] rawBytes)
{
    public TraitPayload {
        rawBytes = (rawBytes == null) ? new byte[0] : rawBytes.clone();
        if (typeTag != null && typeTag.isEmpty()) {
            typeTag = null;
        }
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    public Optional<String> typeTagIfPresent() {
        return Optional.ofNullable(typeTag);
    }

    public TraitPayload withTypeTag(String replacement) {
        return new TraitPayload(replacement, rawBytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraitPayload other)) {
            return false;
        }
        return java.util.Objects.equals(typeTag, other.typeTag)
                && Arrays.equals(rawBytes, other.rawBytes);
    }

    @Override
    public int hashCode() {
        return 31 * java.util.Objects.hashCode(typeTag) + Arrays.hashCode(rawBytes);
    }

    @Override
    public String toString() {
        return "TraitPayload[typeTag=" + typeTag + ", length=" + rawBytes.length + ']';
    }
}
