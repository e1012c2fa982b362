package com.questrail.traitstream.model;

import java.util.List;
import java.util.Objects;

/**
 * One {@code NestMessage} entry of a {@link Envelope}. Only its get operations
 * are retained; set operations are never sent on the observe stream.
 */
public record SubMessage(List<GetOperation> gets)
{
    public SubMessage {
        gets = List.copyOf(Objects.requireNonNull(gets, "gets"));
    }
}
