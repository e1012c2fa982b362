package com.questrail.traitstream.session;

/**
 * Lifecycle states of a {@link StreamSession}.
 *
 * <pre>
 * CONNECTING -> STREAMING -> DISCONNECTED -> CONNECTING ...
 *      any state -> CLOSED
 * </pre>
 *
 * {@link #CLOSED} is reached only by {@link StreamSession#close()} or when the
 * reconnect policy gives up.
 */
public enum SessionState
{
    CONNECTING,
    STREAMING,
    DISCONNECTED,
    CLOSED
}
