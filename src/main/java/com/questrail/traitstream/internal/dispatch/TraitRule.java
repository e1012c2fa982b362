package com.questrail.traitstream.internal.dispatch;

import com.questrail.traitstream.api.TraitType;

import java.util.Objects;
import java.util.Set;

/**
 * One row of the dispatch table: a tag matches when it contains {@code stem}
 * and none of {@code excludes}.
 */
public record TraitRule(TraitType type, String stem, Set<String> excludes)
{
    public TraitRule {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(stem, "stem");
        if (stem.isEmpty()) {
            throw new IllegalArgumentException("stem must not be empty");
        }
        excludes = Set.copyOf(Objects.requireNonNull(excludes, "excludes"));
    }

    /**
     * A rule whose stem is the trait's simple name.
     */
    public static TraitRule of(TraitType type, String... excludes) {
        return new TraitRule(type, type.simpleName(), Set.of(excludes));
    }

    public boolean matches(String typeTag) {
        if (!typeTag.contains(stem)) {
            return false;
        }
        for (String exclude : excludes) {
            if (typeTag.contains(exclude)) {
                return false;
            }
        }
        return true;
    }
}
