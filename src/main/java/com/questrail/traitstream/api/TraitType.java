package com.questrail.traitstream.api;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * The trait families this library can decode, by fully qualified message name.
 *
 * <p>A type tag on the wire is {@code type.googleapis.com/<fullName>}.
 * Classification of a tag is the dispatcher's job; this enum only names the
 * targets.</p>
 */
public enum TraitType
{
    DEVICE_IDENTITY("weave.trait.description.DeviceIdentityTrait"),
    BATTERY_POWER_SOURCE("weave.trait.power.BatteryPowerSourceTrait"),
    BOLT_LOCK("weave.trait.security.BoltLockTrait"),
    BOLT_LOCK_SETTINGS("weave.trait.security.BoltLockSettingsTrait"),
    BOLT_LOCK_CAPABILITIES("weave.trait.security.BoltLockCapabilitiesTrait"),
    PINCODE_INPUT("weave.trait.security.PincodeInputTrait"),
    TAMPER("weave.trait.security.TamperTrait"),
    TARGET_TEMPERATURE_SETTINGS("nest.trait.hvac.TargetTemperatureSettingsTrait"),
    HVAC_CONTROL("nest.trait.hvac.HvacControlTrait"),
    ECO_MODE_STATE("nest.trait.hvac.EcoModeStateTrait"),
    ECO_MODE_SETTINGS("nest.trait.hvac.EcoModeSettingsTrait"),
    FAN_CONTROL_SETTINGS("nest.trait.hvac.FanControlSettingsTrait"),
    FAN_CONTROL("nest.trait.hvac.FanControlTrait"),
    DISPLAY_SETTINGS("nest.trait.ui.DisplaySettingsTrait"),
    STRUCTURE_INFO("nest.trait.structure.StructureInfoTrait"),
    USER_INFO("nest.trait.user.UserInfoTrait"),
    OPEN_CLOSE("nest.trait.detector.OpenCloseTrait"),
    AMBIENT_MOTION_SETTINGS("nest.trait.detector.AmbientMotionSettingsTrait"),
    AMBIENT_MOTION_TIMING_SETTINGS("nest.trait.detector.AmbientMotionTimingSettingsTrait"),
    TEMPERATURE("nest.trait.sensor.TemperatureTrait"),
    HUMIDITY("nest.trait.sensor.HumidityTrait"),

    /** A tag no rule matched. Records of this type are kept undecoded. */
    UNKNOWN("");

    /** Canonical type-URL prefix every normalized tag carries. */
    public static final String CANONICAL_PREFIX = "type.googleapis.com/";

    private final String fullName;

    TraitType(String fullName) {
        this.fullName = fullName;
    }

    public String fullName() {
        return fullName;
    }

    /**
     * The canonical type URL for this trait. Not defined for {@link #UNKNOWN}.
     */
    public String typeUrl() {
        if (this == UNKNOWN) {
            throw new IllegalStateException("UNKNOWN has no type URL");
        }
        return CANONICAL_PREFIX + fullName;
    }

    /**
     * Short name as it appears at the end of the tag, e.g. {@code BoltLockTrait}.
     */
    public String simpleName() {
        int dot = fullName.lastIndexOf('.');
        return dot < 0 ? fullName : fullName.substring(dot + 1);
    }

    /**
     * Exact lookup by fully qualified name or canonical type URL.
     */
    public static Optional<TraitType> forExactName(String name) {
        Objects.requireNonNull(name, "name");
        String bare = name.startsWith(CANONICAL_PREFIX) ? name.substring(CANONICAL_PREFIX.length()) : name;
        return Arrays.stream(values())
                .filter(t -> t != UNKNOWN && t.fullName.equals(bare))
                .findFirst();
    }
}
