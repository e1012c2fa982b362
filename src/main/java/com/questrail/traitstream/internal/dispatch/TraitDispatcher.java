package com.questrail.traitstream.internal.dispatch;

import com.questrail.traitstream.api.TraitRecord;
import com.questrail.traitstream.api.TraitType;
import com.questrail.traitstream.schema.SchemaException;
import com.questrail.traitstream.schema.SchemaRegistry;
import com.questrail.traitstream.schema.WireMessage;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * TraitDispatcher
 * =============================================================================
 * Classifies a canonical type tag and runs the matching decoder.
 *
 * <h2>Ordered rule table</h2>
 * Tags are matched by substring containment, so families sharing a stem
 * (for example {@code BoltLockTrait} and {@code BoltLockSettingsTrait}) are
 * ordered most-specific-first and the base rule excludes its variants. The
 * first matching rule wins. The constructor rejects a table in which a rule
 * could shadow a later, more specific one.
 *
 * <h2>Failure containment</h2>
 * {@link #decode} never throws for bad payload bytes. An unpack failure
 * yields a record with {@code decoded=false} and the reason in
 * {@code error}; a tag no rule matches yields an undecoded record of type
 * {@link TraitType#UNKNOWN} with no error.
 */
public final class TraitDispatcher
{
    /** The dispatch table for the standard trait set. */
    public static final List<TraitRule> STANDARD_RULES = List.of(
            TraitRule.of(TraitType.BOLT_LOCK_SETTINGS),
            TraitRule.of(TraitType.BOLT_LOCK_CAPABILITIES),
            TraitRule.of(TraitType.BOLT_LOCK, "BoltLockSettings", "BoltLockCapabilities"),
            TraitRule.of(TraitType.DEVICE_IDENTITY),
            TraitRule.of(TraitType.BATTERY_POWER_SOURCE),
            TraitRule.of(TraitType.PINCODE_INPUT),
            TraitRule.of(TraitType.TAMPER),
            TraitRule.of(TraitType.TARGET_TEMPERATURE_SETTINGS),
            TraitRule.of(TraitType.HVAC_CONTROL),
            TraitRule.of(TraitType.ECO_MODE_STATE),
            TraitRule.of(TraitType.ECO_MODE_SETTINGS),
            TraitRule.of(TraitType.FAN_CONTROL_SETTINGS),
            TraitRule.of(TraitType.FAN_CONTROL, "FanControlSettings"),
            TraitRule.of(TraitType.DISPLAY_SETTINGS),
            TraitRule.of(TraitType.STRUCTURE_INFO),
            TraitRule.of(TraitType.USER_INFO),
            TraitRule.of(TraitType.OPEN_CLOSE),
            TraitRule.of(TraitType.AMBIENT_MOTION_TIMING_SETTINGS),
            TraitRule.of(TraitType.AMBIENT_MOTION_SETTINGS, "AmbientMotionTimingSettings"),
            TraitRule.of(TraitType.TEMPERATURE, "TargetTemperature"),
            TraitRule.of(TraitType.HUMIDITY)
    );

    private final List<TraitRule> rules;
    private final Map<TraitType, TraitDecoder> decoders;
    private final SchemaRegistry registry;

    public TraitDispatcher(List<TraitRule> rules, Map<TraitType, TraitDecoder> decoders, SchemaRegistry registry) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.decoders = new EnumMap<>(Objects.requireNonNull(decoders, "decoders"));
        this.registry = Objects.requireNonNull(registry, "registry");
        validate(this.rules, this.decoders);
    }

    public static TraitDispatcher standard(SchemaRegistry registry) {
        return new TraitDispatcher(STANDARD_RULES, TraitDecoders.standard(), registry);
    }

    private static void validate(List<TraitRule> rules, Map<TraitType, TraitDecoder> decoders) {
        for (int i = 0; i < rules.size(); i++) {
            TraitRule earlier = rules.get(i);
            if (!decoders.containsKey(earlier.type())) {
                throw new IllegalArgumentException("No decoder for " + earlier.type());
            }
            for (int j = i + 1; j < rules.size(); j++) {
                TraitRule later = rules.get(j);
                // The later rule's own stem must not be claimed by an earlier rule.
                if (earlier.matches(later.stem()) && earlier.type() != later.type()) {
                    throw new IllegalArgumentException(
                            earlier.type() + " shadows " + later.type() + "; order most-specific first");
                }
            }
        }
    }

    /**
     * @param typeTag a normalized type tag
     * @return the first matching rule's type, or {@link TraitType#UNKNOWN}
     */
    public TraitType classify(String typeTag) {
        Objects.requireNonNull(typeTag, "typeTag");
        for (TraitRule rule : rules) {
            if (rule.matches(typeTag)) {
                return rule.type();
            }
        }
        return TraitType.UNKNOWN;
    }

    public TraitRecord decode(String objectId, String typeTag, byte[] rawBytes) {
        Objects.requireNonNull(objectId, "objectId");
        Objects.requireNonNull(rawBytes, "rawBytes");

        TraitType type = classify(typeTag);
        if (type == TraitType.UNKNOWN) {
            return TraitRecord.unrecognized(objectId, typeTag);
        }

        try {
            WireMessage message = registry.unpack(type, rawBytes);
            return TraitRecord.decoded(objectId, typeTag, type, decoders.get(type).decode(objectId, message));
        } catch (SchemaException e) {
            return TraitRecord.failed(objectId, typeTag, type, e.getMessage());
        } catch (RuntimeException e) {
            return TraitRecord.failed(objectId, typeTag, type, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
