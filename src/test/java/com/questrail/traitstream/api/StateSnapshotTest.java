package com.questrail.traitstream.api;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StateSnapshotTest {

    private static TraitRecord lock(String deviceId) {
        return TraitRecord.decoded(deviceId, TraitType.BOLT_LOCK.typeUrl(), TraitType.BOLT_LOCK,
                Map.of("locked_state", 2, "actuator_state", 1));
    }

    @Test
    void emptySentinelCarriesNothing() {
        StateSnapshot empty = StateSnapshot.empty();

        assertTrue(empty.isEmpty());
        assertTrue(empty.deviceSummaries().isEmpty());
        assertTrue(empty.allTraits().isEmpty());
        assertTrue(empty.userIdIfPresent().isEmpty());
        assertTrue(empty.structureIdIfPresent().isEmpty());
        assertSame(empty, StateSnapshot.empty());
    }

    @Test
    void deviceSummariesAreSortedById() {
        Map<String, DeviceSummary> summaries = new LinkedHashMap<>();
        summaries.put("DEVICE_B", DeviceSummary.fromCodes("DEVICE_B", 2, 1));
        summaries.put("DEVICE_A", DeviceSummary.fromCodes("DEVICE_A", 1, 1));

        StateSnapshot snapshot = new StateSnapshot(summaries, null, null, Map.of());

        assertEquals(List.of("DEVICE_A", "DEVICE_B"), List.copyOf(snapshot.deviceSummaries().keySet()));
        assertFalse(snapshot.isEmpty());
    }

    @Test
    void snapshotDoesNotReflectLaterChangesToSourceMaps() {
        Map<TraitKey, TraitRecord> traits = new LinkedHashMap<>();
        TraitRecord record = lock("DEVICE_1");
        traits.put(record.key(), record);

        StateSnapshot snapshot = new StateSnapshot(Map.of(), "USER_1", "S1", traits);
        traits.clear();

        assertEquals(1, snapshot.allTraits().size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.allTraits().clear());
        assertEquals(record, snapshot.trait("DEVICE_1", TraitType.BOLT_LOCK).orElseThrow());
        assertTrue(snapshot.trait("DEVICE_1", TraitType.BATTERY_POWER_SOURCE).isEmpty());
    }

    @Test
    void summaryFlagsFollowWireCodes() {
        DeviceSummary lockedIdle = DeviceSummary.fromCodes("D", DeviceSummary.LOCKED_STATE_LOCKED,
                DeviceSummary.ACTUATOR_STATE_OK);
        assertTrue(lockedIdle.locked());
        assertFalse(lockedIdle.moving());

        DeviceSummary unlockedMoving = DeviceSummary.fromCodes("D", 1, 3);
        assertFalse(unlockedMoving.locked());
        assertTrue(unlockedMoving.moving());
        assertEquals(3, unlockedMoving.actuatorState());
    }
}
