package com.questrail.traitstream.model;

import java.util.Objects;
import java.util.Optional;

/**
 * GetOperation
 * -----------------------------------------------------------------------------
 * A read-style entry referencing one remote object and, optionally, one
 * polymorphic trait payload.
 *
 * @param objectId           remote object id ({@code DEVICE_...}, {@code USER_...},
 *                           {@code STRUCTURE_...}); {@code null} when the wire
 *                           entry carried none
 * @param objectKey          object key, {@code "unknown"} when absent on the wire
 * @param payload            the trait payload, {@code null} when absent
 * @param untypedSlotPresent whether the raw entry carried field 7, the untyped
 *                           slot some server versions use for the lock state
 */
public record GetOperation(String objectId,
                           String objectKey,
                           TraitPayload payload,
                           boolean untypedSlotPresent)
{
    public static final String UNKNOWN_KEY = "unknown";

    public GetOperation {
        Objects.requireNonNull(objectKey, "objectKey");
    }

    public Optional<String> objectIdIfPresent() {
        return Optional.ofNullable(objectId);
    }

    public Optional<TraitPayload> payloadIfPresent() {
        return Optional.ofNullable(payload);
    }

    /**
     * Returns a copy carrying a different payload.
     */
    public GetOperation withPayload(TraitPayload replacement) {
        return new GetOperation(objectId, objectKey, replacement, untypedSlotPresent);
    }
}
