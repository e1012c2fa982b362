package com.questrail.traitstream.observability;

/**
 * Main interface for receiving trait stream observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the session's consumer thread and must not block.</p>
 */
public interface TraitStreamObservabilitySink {
    /**
     * Called when a session moves between lifecycle states.
     * @param event the transition event details
     */
    void onStateTransition(SessionStateTransitionEvent event);

    /**
     * Called when a protocol-level event occurs (frame received, classification
     * miss, buffer high-water, server status).
     * @param event the protocol event
     */
    void onProtocolEvent(ProtocolObservabilityEvent event);

    /**
     * Called when a transport-level event occurs (connected, dropped, retry scheduled).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs that the session recovered from.
     * @param event the error event
     */
    void onError(TraitStreamErrorEvent event);
}
