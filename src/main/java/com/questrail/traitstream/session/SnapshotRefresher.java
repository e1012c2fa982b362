package com.questrail.traitstream.session;

import com.questrail.traitstream.api.StateSnapshot;
import com.questrail.traitstream.codec.FrameBuffer;
import com.questrail.traitstream.codec.FramingException;
import com.questrail.traitstream.config.StreamSessionConfig;
import com.questrail.traitstream.internal.decode.EnvelopeDecoder;
import com.questrail.traitstream.internal.decode.FrameDecodeException;
import com.questrail.traitstream.internal.dispatch.TraitDispatcher;
import com.questrail.traitstream.internal.state.StateAggregator;
import com.questrail.traitstream.internal.time.MonotonicClock;
import com.questrail.traitstream.internal.time.SystemWallClock;
import com.questrail.traitstream.observability.TraitStreamErrorEvent;
import com.questrail.traitstream.observability.TraitStreamObservabilitySink;
import com.questrail.traitstream.schema.SchemaRegistry;
import com.questrail.traitstream.transport.ChunkRead;
import com.questrail.traitstream.transport.ChunkStream;
import com.questrail.traitstream.transport.StreamRequest;
import com.questrail.traitstream.transport.StreamTransport;
import com.questrail.traitstream.transport.TransportException;

import java.util.Objects;

/**
 * SnapshotRefresher
 * -----------------------------------------------------------------------------
 * One-shot fetch of the current lock state.
 *
 * <p>Opens a single connection, decodes frames until a snapshot carries at
 * least one device summary, and returns it. Returns
 * {@link StateSnapshot#empty()} if the stream ends, the read timeout
 * elapses, or the transport fails first. Never retries; always closes the
 * connection.</p>
 *
 * <p>Each call starts from empty state.</p>
 */
public final class SnapshotRefresher
{
    private final StreamTransport transport;
    private final StreamSessionConfig config;
    private final SchemaRegistry registry;
    private final TraitStreamObservabilitySink sink;
    private final MonotonicClock clock;

    public SnapshotRefresher(StreamTransport transport,
                             StreamSessionConfig config,
                             SchemaRegistry registry,
                             TraitStreamObservabilitySink sink,
                             MonotonicClock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public StateSnapshot refresh(StreamRequest request) throws InterruptedException {
        Objects.requireNonNull(request, "request");

        EnvelopeDecoder decoder = new EnvelopeDecoder(registry, sink);
        StateAggregator aggregator = new StateAggregator(TraitDispatcher.standard(registry), sink);
        long deadline = clock.nowNanos() + config.readTimeout().toNanos();

        try (FrameBuffer buffer = new FrameBuffer(config.catalogThreshold());
             ChunkStream stream = transport.open(request)) {

            while (clock.nowNanos() - deadline < 0) {
                ChunkRead read = stream.read(config.keepaliveInterval());
                if (read == ChunkRead.End.INSTANCE) {
                    break;
                }
                if (!(read instanceof ChunkRead.Data data)) {
                    continue;
                }

                buffer.ingest(data.bytes());
                for (byte[] frame : buffer.extractReady()) {
                    StateAggregator.ApplyResult result;
                    try {
                        result = aggregator.apply(decoder.decode(frame));
                    } catch (FrameDecodeException e) {
                        sink.onError(new TraitStreamErrorEvent(
                                SystemWallClock.INSTANCE.now(), "Dropped undecodable frame", e));
                        continue;
                    }
                    if (!result.snapshot().deviceSummaries().isEmpty()) {
                        return result.snapshot();
                    }
                }
                if (buffer.framingError().isPresent()) {
                    throw buffer.framingError().get();
                }
            }
        } catch (TransportException | FramingException e) {
            sink.onError(new TraitStreamErrorEvent(SystemWallClock.INSTANCE.now(), "Refresh failed", e));
        }
        return StateSnapshot.empty();
    }
}
