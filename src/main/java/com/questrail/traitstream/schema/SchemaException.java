package com.questrail.traitstream.schema;

/**
 * Raised when bytes cannot be read against the field layout the registry
 * expects for them.
 *
 * <p>Checked on purpose: every caller either records the failure against the
 * trait it was decoding or reports the frame as dropped.</p>
 */
public class SchemaException extends Exception
{
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
