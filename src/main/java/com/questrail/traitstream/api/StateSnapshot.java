package com.questrail.traitstream.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * StateSnapshot
 * =============================================================================
 * Immutable view of the aggregated stream state at one point in time.
 *
 * <h2>Sentinel</h2>
 * {@link #empty()} is emitted once each time the stream drops. Consumers use
 * it as a "disconnected" marker; it carries no records and no identifiers.
 * Aggregated state is not cleared by it: the next snapshot after a reconnect
 * again contains everything accumulated so far.
 *
 * @param deviceSummaries lock summaries by device id
 * @param userId          discovered user id, {@code null} if none yet
 * @param structureId     discovered structure id, {@code null} if none yet
 * @param allTraits       every record, by key
 */
public record StateSnapshot(Map<String, DeviceSummary> deviceSummaries,
                            String userId,
                            String structureId,
                            Map<TraitKey, TraitRecord> allTraits)
{
    private static final StateSnapshot EMPTY = new StateSnapshot(Map.of(), null, null, Map.of());

    public StateSnapshot {
        deviceSummaries = Collections.unmodifiableMap(
                new TreeMap<>(Objects.requireNonNull(deviceSummaries, "deviceSummaries")));
        allTraits = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(allTraits, "allTraits")));
    }

    public static StateSnapshot empty() {
        return EMPTY;
    }

    /**
     * {@code true} for the disconnect sentinel, or any snapshot carrying nothing.
     */
    public boolean isEmpty() {
        return deviceSummaries.isEmpty() && allTraits.isEmpty() && userId == null && structureId == null;
    }

    public Optional<String> userIdIfPresent() {
        return Optional.ofNullable(userId);
    }

    public Optional<String> structureIdIfPresent() {
        return Optional.ofNullable(structureId);
    }

    public Optional<TraitRecord> trait(String objectId, TraitType type) {
        Objects.requireNonNull(type, "type");
        return allTraits.values().stream()
                .filter(r -> r.objectId().equals(objectId) && r.type() == type)
                .findFirst();
    }
}
