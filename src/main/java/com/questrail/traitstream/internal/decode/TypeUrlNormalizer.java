package com.questrail.traitstream.internal.decode;

import com.questrail.traitstream.api.TraitType;

/**
 * Rewrites the legacy vendor type-URL prefix to the canonical one.
 *
 * <p>Only a leading prefix is rewritten, and only once; every other tag is
 * returned unchanged. The operation is idempotent.</p>
 */
public final class TypeUrlNormalizer
{
    public static final String LEGACY_PREFIX = "type.nestlabs.com/";
    public static final String CANONICAL_PREFIX = TraitType.CANONICAL_PREFIX;

    private TypeUrlNormalizer() {
    }

    /**
     * @param typeTag a tag as received, may be {@code null}
     * @return the canonical tag, or {@code null} when given {@code null}
     */
    public static String normalize(String typeTag) {
        if (typeTag == null || !typeTag.startsWith(LEGACY_PREFIX)) {
            return typeTag;
        }
        return CANONICAL_PREFIX + typeTag.substring(LEGACY_PREFIX.length());
    }
}
