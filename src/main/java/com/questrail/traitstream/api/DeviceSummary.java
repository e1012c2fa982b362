package com.questrail.traitstream.api;

import java.util.Objects;

/**
 * Lock-centric summary of one device, derived from its decoded
 * {@link TraitType#BOLT_LOCK} record.
 *
 * @param deviceId      the device object id
 * @param locked        {@code true} when the locked-state code is LOCKED
 * @param moving        {@code true} when the actuator reports anything but OK
 * @param actuatorState raw actuator state code
 */
public record DeviceSummary(String deviceId, boolean locked, boolean moving, int actuatorState)
{
    /** Wire code of {@code BOLT_LOCKED_STATE_LOCKED}. */
    public static final int LOCKED_STATE_LOCKED = 2;

    /** Wire code of {@code BOLT_ACTUATOR_STATE_OK}. */
    public static final int ACTUATOR_STATE_OK = 1;

    public DeviceSummary {
        Objects.requireNonNull(deviceId, "deviceId");
    }

    public static DeviceSummary fromCodes(String deviceId, int lockedState, int actuatorState) {
        return new DeviceSummary(deviceId,
                lockedState == LOCKED_STATE_LOCKED,
                actuatorState != ACTUATOR_STATE_OK,
                actuatorState);
    }
}
