package com.questrail.traitstream.schema;

import com.questrail.traitstream.api.TraitType;
import com.questrail.traitstream.model.Envelope;

/**
 * SchemaRegistry
 * -----------------------------------------------------------------------------
 * Collaborator that knows the wire layout of the stream envelope and of every
 * supported trait.
 *
 * <p>The decode pipeline never reads protobuf bytes itself; it asks the
 * registry. Swapping the registry is how a newer server schema is adopted.</p>
 */
public interface SchemaRegistry
{
    /**
     * Identifies the field layouts this registry implements.
     */
    String schemaVersion();

    /**
     * Parses one complete frame as the top-level {@code StreamBody}.
     *
     * <p>Type tags are returned exactly as they appear on the wire; normalizing
     * them is the caller's job.</p>
     *
     * @throws SchemaException if the frame is not a well-formed envelope
     */
    Envelope parseStreamBody(byte[] frame) throws SchemaException;

    /**
     * Unpacks a trait payload against the layout of {@code type}.
     *
     * @throws SchemaException if the bytes do not parse against that layout
     */
    WireMessage unpack(TraitType type, byte[] payload) throws SchemaException;
}
