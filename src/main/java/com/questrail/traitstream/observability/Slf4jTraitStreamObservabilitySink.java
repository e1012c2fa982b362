package com.questrail.traitstream.observability;

import io.netty.buffer.ByteBufUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TraitStreamObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTraitStreamObservabilitySink implements TraitStreamObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTraitStreamObservabilitySink.class);

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {
        if (event.oldState() != event.newState()) {
            log.info("Trait stream session: {} -> {} ({})",
                event.oldState(),
                event.newState(),
                event.reason());
        }
    }

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {
        if (event instanceof ProtocolObservabilityEvent.FrameReceived frame) {
            if (log.isTraceEnabled()) {
                log.trace("Frame ({} bytes): {}", frame.length(), ByteBufUtil.hexDump(frame.frame()));
            } else {
                log.debug("Frame received: {} bytes", frame.length());
            }
        } else if (event instanceof ProtocolObservabilityEvent.BufferHighWater hw) {
            log.warn("Frame buffer at {} bytes (high-water {}) waiting for a {}-byte frame",
                hw.bufferedBytes(), hw.highWaterMark(), hw.pendingLength());
        } else if (event instanceof ProtocolObservabilityEvent.StreamStatusReceived status) {
            log.warn("Server status {}: {}", status.code(), status.message());
        } else if (event instanceof ProtocolObservabilityEvent.MalformedLegacyId bad) {
            log.warn("Structure {} carries unparseable legacy id '{}'", bad.objectId(), bad.legacyId());
        } else {
            log.debug("Trait stream protocol event: {}", event);
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event instanceof TransportObservabilityEvent.ReconnectAbandoned abandoned) {
            log.error("Giving up after {} consecutive failures", abandoned.consecutiveFailures());
        } else {
            log.info("Trait stream transport event: {}", event);
        }
    }

    @Override
    public void onError(TraitStreamErrorEvent event) {
        log.warn("Trait stream error: {}", event.message(), event.cause());
    }
}
