package com.questrail.traitstream.internal.dispatch;

import com.questrail.traitstream.api.TraitType;
import com.questrail.traitstream.schema.SchemaException;
import com.questrail.traitstream.schema.TraitLayouts;
import com.questrail.traitstream.schema.WireMessage;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * TraitDecoders
 * =============================================================================
 * One decoder per supported trait family.
 *
 * <h2>Field conventions</h2>
 * <ul>
 *   <li>Enum and integer fields are passed through as raw {@link Integer}
 *       wire codes, {@code 0} when absent (proto3 default).</li>
 *   <li>Wrapper fields ({@code StringValue}, {@code FloatValue},
 *       {@code BoolValue}) and sub-messages are presence-checked: an absent
 *       wrapper yields {@code null}.</li>
 *   <li>Timestamps and durations become fractional seconds as {@link Double},
 *       {@code null} when unset.</li>
 *   <li>Plain strings that are empty become {@code null}.</li>
 * </ul>
 */
public final class TraitDecoders
{
    private TraitDecoders() {
    }

    /**
     * Decoders for every {@link TraitType} except {@link TraitType#UNKNOWN}.
     */
    public static Map<TraitType, TraitDecoder> standard() {
        Map<TraitType, TraitDecoder> m = new EnumMap<>(TraitType.class);
        m.put(TraitType.DEVICE_IDENTITY, TraitDecoders::deviceIdentity);
        m.put(TraitType.BATTERY_POWER_SOURCE, TraitDecoders::batteryPowerSource);
        m.put(TraitType.BOLT_LOCK, TraitDecoders::boltLock);
        m.put(TraitType.BOLT_LOCK_SETTINGS, TraitDecoders::boltLockSettings);
        m.put(TraitType.BOLT_LOCK_CAPABILITIES, TraitDecoders::boltLockCapabilities);
        m.put(TraitType.PINCODE_INPUT, TraitDecoders::pincodeInput);
        m.put(TraitType.TAMPER, TraitDecoders::tamper);
        m.put(TraitType.TARGET_TEMPERATURE_SETTINGS, TraitDecoders::targetTemperatureSettings);
        m.put(TraitType.HVAC_CONTROL, TraitDecoders::hvacControl);
        m.put(TraitType.ECO_MODE_STATE, TraitDecoders::ecoModeState);
        m.put(TraitType.ECO_MODE_SETTINGS, TraitDecoders::ecoModeSettings);
        m.put(TraitType.FAN_CONTROL_SETTINGS, TraitDecoders::fanControlSettings);
        m.put(TraitType.FAN_CONTROL, TraitDecoders::fanControl);
        m.put(TraitType.DISPLAY_SETTINGS, TraitDecoders::displaySettings);
        m.put(TraitType.STRUCTURE_INFO, TraitDecoders::structureInfo);
        m.put(TraitType.USER_INFO, TraitDecoders::userInfo);
        m.put(TraitType.OPEN_CLOSE, TraitDecoders::openClose);
        m.put(TraitType.AMBIENT_MOTION_SETTINGS, TraitDecoders::ambientMotionSettings);
        m.put(TraitType.AMBIENT_MOTION_TIMING_SETTINGS, TraitDecoders::ambientMotionTimingSettings);
        m.put(TraitType.TEMPERATURE, TraitDecoders::temperature);
        m.put(TraitType.HUMIDITY, TraitDecoders::humidity);
        return m;
    }

    // ------------------------------------------------------------------
    // weave.trait.*
    // ------------------------------------------------------------------

    static Map<String, Object> deviceIdentity(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("serial_number", nonEmpty(m.string(TraitLayouts.DeviceIdentity.SERIAL_NUMBER)));
        d.put("firmware_version", nonEmpty(m.string(TraitLayouts.DeviceIdentity.FW_VERSION)));
        d.put("manufacturer", m.stringValue(TraitLayouts.DeviceIdentity.MANUFACTURER).orElse(null));
        d.put("model", m.stringValue(TraitLayouts.DeviceIdentity.MODEL_NAME).orElse(null));
        return d;
    }

    static Map<String, Object> batteryPowerSource(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        Float level = null;
        Optional<WireMessage> remaining = m.message(TraitLayouts.BatteryPowerSource.REMAINING);
        if (remaining.isPresent()) {
            level = remaining.get().floatValue(TraitLayouts.BatteryPowerSource.REMAINING_PERCENT).orElse(null);
        }
        d.put("battery_level", level);
        d.put("voltage", m.floatValue(TraitLayouts.BatteryPowerSource.ASSESSED_VOLTAGE).orElse(null));
        d.put("condition", code(m.int32(TraitLayouts.BatteryPowerSource.CONDITION)));
        d.put("status", code(m.int32(TraitLayouts.BatteryPowerSource.STATUS)));
        d.put("replacement_indicator", code(m.int32(TraitLayouts.BatteryPowerSource.REPLACEMENT_INDICATOR)));
        return d;
    }

    static Map<String, Object> boltLock(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("state", code(m.int32(TraitLayouts.BoltLock.STATE)));
        d.put("actuator_state", code(m.int32(TraitLayouts.BoltLock.ACTUATOR_STATE)));
        d.put("locked_state", code(m.int32(TraitLayouts.BoltLock.LOCKED_STATE)));

        Map<String, Object> actor = null;
        Optional<WireMessage> rawActor = m.message(TraitLayouts.BoltLock.ACTOR);
        if (rawActor.isPresent()) {
            WireMessage a = rawActor.get();
            actor = new LinkedHashMap<>();
            actor.put("method", code(a.int32(TraitLayouts.BoltLock.ACTOR_METHOD)));
            actor.put("originator", resourceId(a, TraitLayouts.BoltLock.ACTOR_ORIGINATOR));
            actor.put("agent", resourceId(a, TraitLayouts.BoltLock.ACTOR_AGENT));
        }
        d.put("bolt_lock_actor", actor);
        d.put("locked_state_last_changed_at",
                m.timestampSeconds(TraitLayouts.BoltLock.LOCKED_STATE_LAST_CHANGED_AT).orElse(null));
        return d;
    }

    private static String resourceId(WireMessage actor, int field) throws SchemaException {
        Optional<WireMessage> ref = actor.message(field);
        if (ref.isEmpty()) {
            return null;
        }
        return nonEmpty(ref.get().string(TraitLayouts.BoltLock.RESOURCE_ID));
    }

    static Map<String, Object> boltLockSettings(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("auto_relock_on", m.bool(TraitLayouts.BoltLockSettings.AUTO_RELOCK_ON).orElse(null));
        d.put("auto_relock_duration_seconds",
                m.durationSeconds(TraitLayouts.BoltLockSettings.AUTO_RELOCK_DURATION).orElse(null));
        return d;
    }

    static Map<String, Object> boltLockCapabilities(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("handedness", code(m.int32(TraitLayouts.BoltLockCapabilities.HANDEDNESS)));
        d.put("max_auto_relock_duration_seconds",
                m.durationSeconds(TraitLayouts.BoltLockCapabilities.MAX_AUTO_RELOCK_DURATION).orElse(null));
        return d;
    }

    static Map<String, Object> pincodeInput(String objectId, WireMessage m) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("pincode_input_state", code(m.int32(TraitLayouts.PincodeInput.PINCODE_INPUT_STATE)));
        return d;
    }

    static Map<String, Object> tamper(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("tamper_state", code(m.int32(TraitLayouts.Tamper.TAMPER_STATE)));
        d.put("first_observed_at", m.timestampSeconds(TraitLayouts.Tamper.FIRST_OBSERVED_AT).orElse(null));
        d.put("first_observed_at_ms", m.timestampSeconds(TraitLayouts.Tamper.FIRST_OBSERVED_AT_MS).orElse(null));
        return d;
    }

    // ------------------------------------------------------------------
    // nest.trait.hvac.* and nest.trait.ui.*
    // ------------------------------------------------------------------

    static Map<String, Object> targetTemperatureSettings(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        Optional<WireMessage> target = m.message(TraitLayouts.TargetTemperatureSettings.TARGET_TEMPERATURE);
        if (target.isPresent()) {
            WireMessage t = target.get();
            d.put("setpoint_type", code(t.int32(TraitLayouts.TargetTemperatureSettings.SETPOINT_TYPE)));
            d.put("heating_target", t.floatValue(TraitLayouts.TargetTemperatureSettings.HEATING_TARGET).orElse(null));
            d.put("cooling_target", t.floatValue(TraitLayouts.TargetTemperatureSettings.COOLING_TARGET).orElse(null));
        } else {
            d.put("setpoint_type", null);
            d.put("heating_target", null);
            d.put("cooling_target", null);
        }
        d.put("enabled", m.boolValue(TraitLayouts.TargetTemperatureSettings.ENABLED).orElse(null));
        return d;
    }

    static Map<String, Object> hvacControl(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        Optional<WireMessage> raw = m.message(TraitLayouts.HvacControl.HVAC_STATE);
        WireMessage s = raw.orElse(WireMessage.empty());
        d.put("hvac_state_present", raw.isPresent());
        d.put("cool_stage_1", s.bool(TraitLayouts.HvacControl.COOL_STAGE_1).orElse(false));
        d.put("cool_stage_2", s.bool(TraitLayouts.HvacControl.COOL_STAGE_2).orElse(false));
        d.put("heat_stage_1", s.bool(TraitLayouts.HvacControl.HEAT_STAGE_1).orElse(false));
        d.put("heat_stage_2", s.bool(TraitLayouts.HvacControl.HEAT_STAGE_2).orElse(false));
        d.put("alt_heat", s.bool(TraitLayouts.HvacControl.ALT_HEAT).orElse(false));
        d.put("emergency_heat", s.bool(TraitLayouts.HvacControl.EMERGENCY_HEAT).orElse(false));
        return d;
    }

    static Map<String, Object> ecoModeState(String objectId, WireMessage m) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("eco_mode", code(m.int32(TraitLayouts.EcoModeState.ECO_MODE)));
        d.put("eco_mode_change_reason", code(m.int32(TraitLayouts.EcoModeState.ECO_MODE_CHANGE_REASON)));
        return d;
    }

    static Map<String, Object> ecoModeSettings(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("eco_heat", ecoSetpoint(m, TraitLayouts.EcoModeSettings.ECO_TEMPERATURE_HEAT));
        d.put("eco_cool", ecoSetpoint(m, TraitLayouts.EcoModeSettings.ECO_TEMPERATURE_COOL));
        return d;
    }

    private static Map<String, Object> ecoSetpoint(WireMessage m, int field) throws SchemaException {
        Optional<WireMessage> raw = m.message(field);
        if (raw.isEmpty()) {
            return null;
        }
        Map<String, Object> sp = new LinkedHashMap<>();
        sp.put("enabled", raw.get().bool(TraitLayouts.EcoModeSettings.SETPOINT_ENABLED).orElse(false));
        sp.put("value", raw.get().floatValue(TraitLayouts.EcoModeSettings.SETPOINT_VALUE).orElse(null));
        return sp;
    }

    static Map<String, Object> fanControlSettings(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("mode", code(m.int32(TraitLayouts.FanControlSettings.MODE)));
        d.put("timer_duration_seconds",
                m.durationSeconds(TraitLayouts.FanControlSettings.TIMER_DURATION).orElse(null));
        d.put("hvac_override_speed", code(m.int32(TraitLayouts.FanControlSettings.HVAC_OVERRIDE_SPEED)));
        d.put("schedule_speed", code(m.int32(TraitLayouts.FanControlSettings.SCHEDULE_SPEED)));
        d.put("timer_speed", code(m.int32(TraitLayouts.FanControlSettings.TIMER_SPEED)));
        return d;
    }

    static Map<String, Object> fanControl(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("current_speed", code(m.int32(TraitLayouts.FanControl.CURRENT_SPEED)));
        d.put("timer_end", m.timestampSeconds(TraitLayouts.FanControl.TIMER_END).orElse(null));
        return d;
    }

    static Map<String, Object> displaySettings(String objectId, WireMessage m) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("temperature_scale", code(m.int32(TraitLayouts.DisplaySettings.TEMPERATURE_SCALE)));
        d.put("time_format", code(m.int32(TraitLayouts.DisplaySettings.TIME_FORMAT)));
        return d;
    }

    // ------------------------------------------------------------------
    // structure / user
    // ------------------------------------------------------------------

    /**
     * Keeps the raw legacy id; splitting it into the structure id is the
     * aggregator's concern.
     */
    static Map<String, Object> structureInfo(String objectId, WireMessage m) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("legacy_id", nonEmpty(m.string(TraitLayouts.StructureInfo.LEGACY_ID)));
        return d;
    }

    static Map<String, Object> userInfo(String objectId, WireMessage m) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("user_id", objectId);
        return d;
    }

    // ------------------------------------------------------------------
    // nest.trait.detector.* and nest.trait.sensor.*
    // ------------------------------------------------------------------

    static Map<String, Object> openClose(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("open_close_state", code(m.int32(TraitLayouts.OpenClose.OPEN_CLOSE_STATE)));
        d.put("first_observed_at", m.timestampSeconds(TraitLayouts.OpenClose.FIRST_OBSERVED_AT).orElse(null));
        return d;
    }

    static Map<String, Object> ambientMotionSettings(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("sensitivity", code(m.int32(TraitLayouts.AmbientMotionSettings.SENSITIVITY)));
        d.put("detection_enabled",
                m.boolValue(TraitLayouts.AmbientMotionSettings.DETECTION_ENABLED).orElse(null));
        return d;
    }

    static Map<String, Object> ambientMotionTimingSettings(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("detection_hold_time_seconds",
                m.durationSeconds(TraitLayouts.AmbientMotionTimingSettings.DETECTION_HOLD_TIME).orElse(null));
        d.put("cooldown_time_seconds",
                m.durationSeconds(TraitLayouts.AmbientMotionTimingSettings.COOLDOWN_TIME).orElse(null));
        return d;
    }

    static Map<String, Object> temperature(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        Optional<WireMessage> reading = m.message(TraitLayouts.Temperature.TEMPERATURE_VALUE);
        d.put("temperature", reading.isPresent()
                ? reading.get().floatValue(TraitLayouts.Temperature.TEMPERATURE).orElse(null)
                : null);
        return d;
    }

    static Map<String, Object> humidity(String objectId, WireMessage m) throws SchemaException {
        Map<String, Object> d = new LinkedHashMap<>();
        Optional<WireMessage> reading = m.message(TraitLayouts.Humidity.HUMIDITY_VALUE);
        d.put("humidity", reading.isPresent()
                ? reading.get().floatValue(TraitLayouts.Humidity.HUMIDITY).orElse(null)
                : null);
        return d;
    }

    private static Integer code(OptionalInt value) {
        return value.orElse(0);
    }

    private static String nonEmpty(Optional<String> value) {
        return value.filter(s -> !s.isEmpty()).orElse(null);
    }
}
