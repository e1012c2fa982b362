package com.questrail.traitstream.internal.state;

import com.questrail.traitstream.api.DeviceSummary;
import com.questrail.traitstream.api.StateSnapshot;
import com.questrail.traitstream.api.TraitKey;
import com.questrail.traitstream.api.TraitRecord;
import com.questrail.traitstream.api.TraitType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * AggregatedState
 * -----------------------------------------------------------------------------
 * Mutable, session-owned accumulation of every trait record seen so far.
 *
 * <h2>Ownership</h2>
 * Exactly one stream session owns an instance and only that session's
 * consumer thread touches it, so no locking is done. The state survives
 * reconnects; it is never cleared by a disconnect.
 *
 * <h2>Records</h2>
 * One record per {@link TraitKey}. A newer record for the same key replaces
 * the older one outright; no field-level merge and no history.
 *
 * <h2>Identifiers</h2>
 * The discovered user id and structure id are plain fields here; the rules
 * deciding when they change live in {@link StateAggregator}.
 */
public final class AggregatedState
{
    private final Map<TraitKey, TraitRecord> records = new LinkedHashMap<>();
    private String discoveredUserId;
    private String discoveredStructureId;

    /**
     * Upserts a record.
     *
     * @return the record it replaced, if any
     */
    public Optional<TraitRecord> put(TraitRecord record) {
        Objects.requireNonNull(record, "record");
        return Optional.ofNullable(records.put(record.key(), record));
    }

    public Optional<TraitRecord> get(TraitKey key) {
        return Optional.ofNullable(records.get(key));
    }

    /**
     * All records of one object, in first-seen order.
     */
    public List<TraitRecord> recordsFor(String objectId) {
        return records.values().stream()
                .filter(r -> r.objectId().equals(objectId))
                .toList();
    }

    public int size() {
        return records.size();
    }

    public Optional<String> discoveredUserId() {
        return Optional.ofNullable(discoveredUserId);
    }

    void discoveredUserId(String userId) {
        this.discoveredUserId = Objects.requireNonNull(userId, "userId");
    }

    public Optional<String> discoveredStructureId() {
        return Optional.ofNullable(discoveredStructureId);
    }

    void discoveredStructureId(String structureId) {
        this.discoveredStructureId = Objects.requireNonNull(structureId, "structureId");
    }

    /**
     * Derives an immutable snapshot. Device summaries are recomputed from the
     * decoded lock-state records on every call.
     */
    public StateSnapshot toSnapshot() {
        Map<String, DeviceSummary> summaries = new LinkedHashMap<>();
        for (TraitRecord record : records.values()) {
            if (record.type() != TraitType.BOLT_LOCK || !record.decoded()) {
                continue;
            }
            int lockedState = record.field("locked_state", Integer.class).orElse(0);
            int actuatorState = record.field("actuator_state", Integer.class).orElse(0);
            summaries.put(record.objectId(),
                    DeviceSummary.fromCodes(record.objectId(), lockedState, actuatorState));
        }
        return new StateSnapshot(summaries, discoveredUserId, discoveredStructureId, records);
    }
}
