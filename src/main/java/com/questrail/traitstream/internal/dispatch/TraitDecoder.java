package com.questrail.traitstream.internal.dispatch;

import com.questrail.traitstream.schema.SchemaException;
import com.questrail.traitstream.schema.WireMessage;

import java.util.Map;

/**
 * Pure extraction of one trait family's fields from its unpacked message.
 */
@FunctionalInterface
public interface TraitDecoder
{
    /**
     * @param objectId the object the trait belongs to
     * @param message  the unpacked trait
     * @return field name to value; values may be {@code null}
     */
    Map<String, Object> decode(String objectId, WireMessage message) throws SchemaException;
}
