package com.questrail.traitstream.schema;

/**
 * TraitLayouts
 * =============================================================================
 * Field numbers of the vendor messages understood by {@link ProtobufSchemaRegistry}.
 *
 * <p>These are the layouts of schema version {@value ProtobufSchemaRegistry#SCHEMA_VERSION}.
 * Wrapper annotations name the well-known type carried in a field.</p>
 */
public final class TraitLayouts
{
    private TraitLayouts() {
    }

    /** {@code nestlabs.gateway.v2.StreamBody}. */
    public static final class StreamBody {
        public static final int MESSAGE = 1;   // repeated NestMessage
        public static final int STATUS = 2;    // google.rpc.Status
        public static final int NOOP = 15;     // repeated bytes
        private StreamBody() {}
    }

    /** {@code google.rpc.Status}. */
    public static final class Status {
        public static final int CODE = 1;
        public static final int MESSAGE = 2;
        private Status() {}
    }

    /** {@code nestlabs.gateway.v2.NestMessage}. */
    public static final class NestMessage {
        public static final int GET = 3;       // repeated TraitGetProperty
        private NestMessage() {}
    }

    /** {@code nestlabs.gateway.v2.TraitGetProperty}. */
    public static final class TraitGet {
        public static final int OBJECT = 1;    // ObjectRef
        public static final int DATA = 2;      // TraitData
        public static final int UNTYPED_SLOT = 7;
        private TraitGet() {}
    }

    public static final class ObjectRef {
        public static final int ID = 1;
        public static final int KEY = 2;
        private ObjectRef() {}
    }

    public static final class TraitData {
        public static final int PROPERTY = 1;  // google.protobuf.Any
        private TraitData() {}
    }

    public static final class DeviceIdentity {
        public static final int SERIAL_NUMBER = 6;
        public static final int FW_VERSION = 7;
        public static final int MANUFACTURER = 8;  // StringValue
        public static final int MODEL_NAME = 9;    // StringValue
        private DeviceIdentity() {}
    }

    public static final class BatteryPowerSource {
        public static final int ASSESSED_VOLTAGE = 2;       // FloatValue
        public static final int CONDITION = 5;
        public static final int STATUS = 6;
        public static final int REPLACEMENT_INDICATOR = 32;
        public static final int REMAINING = 33;             // Remaining
        public static final int REMAINING_PERCENT = 1;      // FloatValue, inside REMAINING
        private BatteryPowerSource() {}
    }

    public static final class BoltLock {
        public static final int STATE = 1;
        public static final int ACTUATOR_STATE = 2;
        public static final int LOCKED_STATE = 3;
        public static final int ACTOR = 4;                  // BoltLockActor
        public static final int LOCKED_STATE_LAST_CHANGED_AT = 5;  // Timestamp
        public static final int ACTOR_METHOD = 1;
        public static final int ACTOR_ORIGINATOR = 2;       // ResourceRef
        public static final int ACTOR_AGENT = 3;            // ResourceRef
        public static final int RESOURCE_ID = 1;            // inside ResourceRef
        private BoltLock() {}
    }

    public static final class BoltLockSettings {
        public static final int AUTO_RELOCK_ON = 1;
        public static final int AUTO_RELOCK_DURATION = 2;   // Duration
        private BoltLockSettings() {}
    }

    public static final class BoltLockCapabilities {
        public static final int HANDEDNESS = 1;
        public static final int MAX_AUTO_RELOCK_DURATION = 2;  // Duration
        private BoltLockCapabilities() {}
    }

    public static final class PincodeInput {
        public static final int PINCODE_INPUT_STATE = 1;
        private PincodeInput() {}
    }

    public static final class Tamper {
        public static final int TAMPER_STATE = 1;
        public static final int FIRST_OBSERVED_AT = 2;      // Timestamp
        public static final int FIRST_OBSERVED_AT_MS = 3;   // Timestamp
        private Tamper() {}
    }

    public static final class TargetTemperatureSettings {
        public static final int TARGET_TEMPERATURE = 1;     // Setpoint
        public static final int ENABLED = 2;                // BoolValue
        public static final int SETPOINT_TYPE = 1;
        public static final int HEATING_TARGET = 2;         // FloatValue
        public static final int COOLING_TARGET = 3;         // FloatValue
        private TargetTemperatureSettings() {}
    }

    public static final class HvacControl {
        public static final int HVAC_STATE = 1;             // HvacState
        public static final int COOL_STAGE_1 = 1;
        public static final int COOL_STAGE_2 = 2;
        public static final int HEAT_STAGE_1 = 4;
        public static final int HEAT_STAGE_2 = 5;
        public static final int ALT_HEAT = 7;
        public static final int EMERGENCY_HEAT = 9;
        private HvacControl() {}
    }

    public static final class EcoModeState {
        public static final int ECO_MODE = 1;
        public static final int ECO_MODE_CHANGE_REASON = 2;
        private EcoModeState() {}
    }

    public static final class EcoModeSettings {
        public static final int ECO_TEMPERATURE_HEAT = 1;   // EcoSetpoint
        public static final int ECO_TEMPERATURE_COOL = 2;   // EcoSetpoint
        public static final int SETPOINT_ENABLED = 1;
        public static final int SETPOINT_VALUE = 2;         // FloatValue
        private EcoModeSettings() {}
    }

    public static final class FanControlSettings {
        public static final int MODE = 1;
        public static final int TIMER_DURATION = 2;         // Duration
        public static final int HVAC_OVERRIDE_SPEED = 3;
        public static final int SCHEDULE_SPEED = 4;
        public static final int TIMER_SPEED = 6;
        private FanControlSettings() {}
    }

    public static final class FanControl {
        public static final int CURRENT_SPEED = 1;
        public static final int TIMER_END = 2;              // Timestamp
        private FanControl() {}
    }

    public static final class DisplaySettings {
        public static final int TEMPERATURE_SCALE = 1;
        public static final int TIME_FORMAT = 2;
        private DisplaySettings() {}
    }

    public static final class StructureInfo {
        public static final int LEGACY_ID = 1;
        private StructureInfo() {}
    }

    public static final class OpenClose {
        public static final int OPEN_CLOSE_STATE = 1;
        public static final int FIRST_OBSERVED_AT = 2;      // Timestamp
        private OpenClose() {}
    }

    public static final class AmbientMotionSettings {
        public static final int SENSITIVITY = 1;
        public static final int DETECTION_ENABLED = 2;      // BoolValue
        private AmbientMotionSettings() {}
    }

    public static final class AmbientMotionTimingSettings {
        public static final int DETECTION_HOLD_TIME = 1;    // Duration
        public static final int COOLDOWN_TIME = 2;          // Duration
        private AmbientMotionTimingSettings() {}
    }

    public static final class Temperature {
        public static final int TEMPERATURE_VALUE = 1;      // Reading
        public static final int TEMPERATURE = 1;            // FloatValue, inside Reading
        private Temperature() {}
    }

    public static final class Humidity {
        public static final int HUMIDITY_VALUE = 1;         // Reading
        public static final int HUMIDITY = 1;               // FloatValue, inside Reading
        private Humidity() {}
    }
}
