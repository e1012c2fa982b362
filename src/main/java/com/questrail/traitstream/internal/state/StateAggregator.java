package com.questrail.traitstream.internal.state;

import com.questrail.traitstream.api.StateSnapshot;
import com.questrail.traitstream.api.TraitRecord;
import com.questrail.traitstream.api.TraitType;
import com.questrail.traitstream.internal.dispatch.TraitDispatcher;
import com.questrail.traitstream.internal.time.SystemWallClock;
import com.questrail.traitstream.model.Envelope;
import com.questrail.traitstream.model.GetOperation;
import com.questrail.traitstream.model.TraitPayload;
import com.questrail.traitstream.observability.ProtocolObservabilityEvent;
import com.questrail.traitstream.observability.TraitStreamObservabilitySink;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * StateAggregator
 * =============================================================================
 * Folds decoded envelopes into an {@link AggregatedState}.
 *
 * <h2>Per operation</h2>
 * Each classified get operation is decoded by the {@link TraitDispatcher} and
 * upserted under {@code (objectId, typeTag)}. Operations naming no object are
 * skipped and reported.
 *
 * <h2>Discovered user id</h2>
 * <ul>
 *   <li>A decoded user-info trait sets it only while it is still unset.</li>
 *   <li>A decoded lock-state trait whose actor carries an originator resource
 *       id always overwrites it; later lock events may overwrite it again.</li>
 * </ul>
 *
 * <h2>Discovered structure id</h2>
 * Taken from the second {@code '.'}-separated segment of a structure-info
 * legacy id. It is set when unset and updated when a later structure-info
 * trait names a different structure. Envelopes without structure info leave
 * it untouched. A legacy id without a second segment is reported and ignored.
 */
public final class StateAggregator
{
    /**
     * Outcome of applying one envelope.
     *
     * @param changed  {@code true} if at least one record was produced
     * @param snapshot state after the envelope was applied
     */
    public record ApplyResult(boolean changed, StateSnapshot snapshot) {
        public ApplyResult {
            Objects.requireNonNull(snapshot, "snapshot");
        }
    }

    private final TraitDispatcher dispatcher;
    private final TraitStreamObservabilitySink sink;
    private final AggregatedState state;

    public StateAggregator(TraitDispatcher dispatcher, TraitStreamObservabilitySink sink) {
        this(dispatcher, sink, new AggregatedState());
    }

    public StateAggregator(TraitDispatcher dispatcher, TraitStreamObservabilitySink sink, AggregatedState state) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.state = Objects.requireNonNull(state, "state");
    }

    public AggregatedState state() {
        return state;
    }

    public ApplyResult apply(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        boolean changed = false;
        for (GetOperation get : envelope.getOperations()) {
            TraitPayload payload = get.payload();
            if (payload == null || payload.typeTag() == null) {
                // Envelopes are classified before they get here.
                continue;
            }
            if (get.objectId() == null) {
                sink.onProtocolEvent(new ProtocolObservabilityEvent.OrphanOperation(SystemWallClock.INSTANCE.now(), payload.typeTag()));
                continue;
            }

            TraitRecord record = dispatcher.decode(get.objectId(), payload.typeTag(), payload.rawBytes());
            state.put(record);
            changed = true;

            if (record.type() == TraitType.UNKNOWN) {
                sink.onProtocolEvent(new ProtocolObservabilityEvent.UnrecognizedTrait(
                        SystemWallClock.INSTANCE.now(), record.objectId(), record.typeTag()));
            } else if (record.decoded()) {
                updateIdentifiers(record);
            }
        }
        return new ApplyResult(changed, state.toSnapshot());
    }

    public StateSnapshot snapshot() {
        return state.toSnapshot();
    }

    private void updateIdentifiers(TraitRecord record) {
        switch (record.type()) {
            case USER_INFO -> {
                if (state.discoveredUserId().isEmpty()) {
                    latchUserId(record.objectId(), record.objectId());
                }
            }
            case BOLT_LOCK -> actorOriginator(record)
                    .ifPresent(originator -> latchUserId(originator, record.objectId()));
            case STRUCTURE_INFO -> record.field("legacy_id", String.class)
                    .ifPresent(legacyId -> structureFromLegacyId(record.objectId(), legacyId));
            default -> {
            }
        }
    }

    private static Optional<String> actorOriginator(TraitRecord record) {
        Object actor = record.data().get("bolt_lock_actor");
        if (!(actor instanceof Map<?, ?> fields)) {
            return Optional.empty();
        }
        Object originator = fields.get("originator");
        return originator instanceof String s && !s.isEmpty() ? Optional.of(s) : Optional.empty();
    }

    private void latchUserId(String userId, String sourceObjectId) {
        if (userId.equals(state.discoveredUserId().orElse(null))) {
            return;
        }
        state.discoveredUserId(userId);
        sink.onProtocolEvent(new ProtocolObservabilityEvent.IdentifierLatched(
                SystemWallClock.INSTANCE.now(), "userId", userId, sourceObjectId));
    }

    private void structureFromLegacyId(String objectId, String legacyId) {
        String[] segments = legacyId.split("\\.", -1);
        if (segments.length < 2 || segments[1].isEmpty()) {
            sink.onProtocolEvent(new ProtocolObservabilityEvent.MalformedLegacyId(SystemWallClock.INSTANCE.now(), objectId, legacyId));
            return;
        }
        String structureId = segments[1];
        if (structureId.equals(state.discoveredStructureId().orElse(null))) {
            return;
        }
        state.discoveredStructureId(structureId);
        sink.onProtocolEvent(new ProtocolObservabilityEvent.IdentifierLatched(
                SystemWallClock.INSTANCE.now(), "structureId", structureId, objectId));
    }
}
