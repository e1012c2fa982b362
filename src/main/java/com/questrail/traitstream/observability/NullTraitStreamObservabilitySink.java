package com.questrail.traitstream.observability;

/**
 * No-op implementation of TraitStreamObservabilitySink.
 */
public final class NullTraitStreamObservabilitySink implements TraitStreamObservabilitySink {
    public static final NullTraitStreamObservabilitySink INSTANCE = new NullTraitStreamObservabilitySink();

    private NullTraitStreamObservabilitySink() {}

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(TraitStreamErrorEvent event) {}
}
