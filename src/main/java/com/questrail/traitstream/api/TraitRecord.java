package com.questrail.traitstream.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TraitRecord
 * -----------------------------------------------------------------------------
 * Result of decoding one trait payload for one object.
 *
 * <h2>Data map</h2>
 * Field names map to plain Java values: {@link String}, {@link Integer} (raw
 * enum and integer wire codes, never remapped), {@link Long}, {@link Float},
 * {@link Double} (timestamps and durations as fractional seconds),
 * {@link Boolean}, or a nested {@code Map<String, Object>}. A {@code null}
 * value means the field's wrapper was absent on the wire, which is distinct
 * from an empty string or zero.
 *
 * <h2>Decode outcomes</h2>
 * <ul>
 *   <li>{@code decoded && error == null}: the payload was read.</li>
 *   <li>{@code !decoded && error != null}: unpacking failed; {@code data} is empty.</li>
 *   <li>{@code !decoded && error == null}: no decoder knows this tag.</li>
 * </ul>
 */
public record TraitRecord(String objectId,
                          String typeTag,
                          TraitType type,
                          boolean decoded,
                          Map<String, Object> data,
                          String error)
{
    public TraitRecord {
        Objects.requireNonNull(objectId, "objectId");
        Objects.requireNonNull(typeTag, "typeTag");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
        if (decoded && error != null) {
            throw new IllegalArgumentException("a decoded record cannot carry an error");
        }
        // Map.copyOf rejects null values, which are meaningful here.
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static TraitRecord decoded(String objectId, String typeTag, TraitType type, Map<String, Object> data) {
        return new TraitRecord(objectId, typeTag, type, true, data, null);
    }

    public static TraitRecord failed(String objectId, String typeTag, TraitType type, String error) {
        return new TraitRecord(objectId, typeTag, type, false, Map.of(),
                Objects.requireNonNull(error, "error"));
    }

    public static TraitRecord unrecognized(String objectId, String typeTag) {
        return new TraitRecord(objectId, typeTag, TraitType.UNKNOWN, false, Map.of(), null);
    }

    public TraitKey key() {
        return new TraitKey(objectId, typeTag);
    }

    public Optional<String> errorIfPresent() {
        return Optional.ofNullable(error);
    }

    /**
     * Typed access to one field. Empty when the field is missing or null.
     *
     * @throws ClassCastException if the value is not of {@code type}
     */
    public <T> Optional<T> field(String name, Class<T> type) {
        Object v = data.get(name);
        return v == null ? Optional.empty() : Optional.of(type.cast(v));
    }
}
