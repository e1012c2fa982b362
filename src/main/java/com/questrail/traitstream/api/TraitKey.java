package com.questrail.traitstream.api;

import java.util.Objects;

/**
 * Identity of one aggregated trait record: the remote object plus the
 * normalized type tag.
 */
public record TraitKey(String objectId, String typeTag) implements Comparable<TraitKey>
{
    public TraitKey {
        Objects.requireNonNull(objectId, "objectId");
        Objects.requireNonNull(typeTag, "typeTag");
    }

    @Override
    public int compareTo(TraitKey other) {
        int c = objectId.compareTo(other.objectId);
        return c != 0 ? c : typeTag.compareTo(other.typeTag);
    }

    @Override
    public String toString() {
        return objectId + ':' + typeTag;
    }
}
