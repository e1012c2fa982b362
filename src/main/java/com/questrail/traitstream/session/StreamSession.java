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
import com.questrail.traitstream.internal.time.SystemMonotonicClock;
import com.questrail.traitstream.internal.time.SystemWallClock;
import com.questrail.traitstream.internal.time.WallClock;
import com.questrail.traitstream.model.Envelope;
import com.questrail.traitstream.model.StreamStatus;
import com.questrail.traitstream.observability.NullTraitStreamObservabilitySink;
import com.questrail.traitstream.observability.ProtocolObservabilityEvent;
import com.questrail.traitstream.observability.SessionStateTransitionEvent;
import com.questrail.traitstream.observability.TraitStreamErrorEvent;
import com.questrail.traitstream.observability.TraitStreamObservabilitySink;
import com.questrail.traitstream.observability.TransportObservabilityEvent;
import com.questrail.traitstream.schema.ProtobufSchemaRegistry;
import com.questrail.traitstream.schema.SchemaRegistry;
import com.questrail.traitstream.transport.ChunkRead;
import com.questrail.traitstream.transport.ChunkStream;
import com.questrail.traitstream.transport.StreamRequest;
import com.questrail.traitstream.transport.StreamTransport;
import com.questrail.traitstream.transport.TransportException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * StreamSession
 * =============================================================================
 * Drives one observe stream end to end: transport reads, frame reassembly,
 * envelope decoding, state aggregation and reconnects.
 *
 * <h2>Pull model</h2>
 * The caller pulls snapshots with {@link #next()}. All work happens inside
 * that call on the caller's thread: a consumer that stops pulling simply
 * delays the next transport read. Exactly one thread may call {@link #next()}.
 *
 * <h2>State machine</h2>
 * <pre>
 * CONNECTING --open ok--> STREAMING --failure--> DISCONNECTED --delay--> CONNECTING
 *      |                                              |
 *      +--open failed---------------------------------+
 * </pre>
 * <ul>
 *   <li><b>CONNECTING</b>: opens the transport; on success the frame buffer is
 *       reset and the aggregated state is kept.</li>
 *   <li><b>STREAMING</b>: each read waits at most the keepalive interval. Every
 *       frame is decoded and applied; a snapshot is queued whenever the
 *       envelope produced at least one record.</li>
 *   <li><b>DISCONNECTED</b>: entered on a transport exception, a read timeout,
 *       the end of the stream, or an unrecoverable framing error. An empty
 *       sentinel snapshot is queued first. The reconnect policy then picks the
 *       delay, or ends the session.</li>
 * </ul>
 *
 * <h2>Failure semantics</h2>
 * A frame that does not parse is reported and dropped; it never ends the
 * connection. Only transport-level failures trigger a reconnect.
 *
 * <h2>Cancellation</h2>
 * {@link #close()} may be called from any thread. It closes the open
 * connection, wakes a pending reconnect delay, and makes {@link #next()}
 * return empty.
 */
public final class StreamSession implements AutoCloseable
{
    private final StreamTransport transport;
    private final StreamRequest request;
    private final StreamSessionConfig config;
    private final TraitStreamObservabilitySink sink;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    private final FrameBuffer frameBuffer;
    private final EnvelopeDecoder decoder;
    private final StateAggregator aggregator;

    private final Deque<StateSnapshot> outbox = new ArrayDeque<>();
    private final CountDownLatch closeSignal = new CountDownLatch(1);
    private final ReentrantLock consumerLock = new ReentrantLock();

    private volatile SessionState state = SessionState.CONNECTING;
    private volatile boolean closed;
    private volatile ChunkStream connection;

    // Consumer-thread only.
    private int attempt;
    private int consecutiveFailures;
    private long lastDataNanos;
    private boolean highWaterReported;

    private StreamSession(Builder b) {
        this.transport = Objects.requireNonNull(b.transport, "transport");
        this.request = Objects.requireNonNull(b.request, "request");
        this.config = Objects.requireNonNull(b.config, "config");
        this.sink = Objects.requireNonNullElse(b.observabilitySink, NullTraitStreamObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");

        SchemaRegistry registry = Objects.requireNonNull(b.schemaRegistry, "schemaRegistry");
        this.frameBuffer = new FrameBuffer(config.catalogThreshold());
        this.decoder = new EnvelopeDecoder(registry, sink);
        this.aggregator = new StateAggregator(TraitDispatcher.standard(registry), sink);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Blocks until the next snapshot is available.
     *
     * @return the next snapshot (possibly the empty disconnect sentinel), or
     *         empty once the session is closed or the reconnect policy gave up
     */
    public Optional<StateSnapshot> next() throws InterruptedException {
        consumerLock.lockInterruptibly();
        try {
            while (true) {
                if (closed) {
                    frameBuffer.close();
                    return Optional.empty();
                }
                StateSnapshot ready = outbox.poll();
                if (ready != null) {
                    return Optional.of(ready);
                }
                step();
            }
        } finally {
            consumerLock.unlock();
        }
    }

    public SessionState state() {
        return state;
    }

    public boolean isClosed() {
        return closed;
    }

    private void step() throws InterruptedException {
        switch (state) {
            case CONNECTING -> connect();
            case STREAMING -> readOnce();
            case DISCONNECTED -> awaitReconnect();
            case CLOSED -> closed = true;
        }
    }

    // ------------------------------------------------------------------
    // CONNECTING
    // ------------------------------------------------------------------

    private void connect() throws InterruptedException {
        attempt++;
        ChunkStream opened;
        try {
            opened = transport.open(request);
        } catch (TransportException e) {
            sink.onTransportEvent(new TransportObservabilityEvent.ConnectFailed(
                    wallClock.now(), request.endpoint(), attempt, String.valueOf(e.getMessage())));
            disconnect("connect failed", e);
            return;
        }

        // Publish before re-checking, so a concurrent close() either sees the
        // connection or is seen here.
        connection = opened;
        if (closed) {
            closeConnection();
            return;
        }

        frameBuffer.reset();
        highWaterReported = false;
        lastDataNanos = clock.nowNanos();

        sink.onTransportEvent(new TransportObservabilityEvent.Connected(wallClock.now(), request.endpoint(), attempt));
        transition(SessionState.STREAMING, "connected");
    }

    // ------------------------------------------------------------------
    // STREAMING
    // ------------------------------------------------------------------

    private void readOnce() throws InterruptedException {
        ChunkStream stream = connection;
        if (stream == null) {
            disconnect("connection lost", null);
            return;
        }

        ChunkRead read;
        try {
            read = stream.read(config.keepaliveInterval());
        } catch (TransportException e) {
            if (!closed) {
                disconnect("transport error", e);
            }
            return;
        }
        if (closed) {
            return;
        }

        if (read instanceof ChunkRead.Data data) {
            lastDataNanos = clock.nowNanos();
            ingest(data.bytes());
        } else if (read == ChunkRead.End.INSTANCE) {
            sink.onTransportEvent(new TransportObservabilityEvent.StreamEnded(wallClock.now(), "server closed stream"));
            disconnect("end of stream", null);
        } else if (clock.nowNanos() - lastDataNanos >= config.readTimeout().toNanos()) {
            disconnect("read timeout", null);
        }
    }

    private void ingest(byte[] chunk) {
        frameBuffer.ingest(chunk);

        List<byte[]> frames;
        try {
            frames = frameBuffer.extractReady();
        } catch (FramingException e) {
            disconnect("framing error", e);
            return;
        }

        reportHighWater();

        for (byte[] frame : frames) {
            consecutiveFailures = 0;
            sink.onProtocolEvent(new ProtocolObservabilityEvent.FrameReceived(wallClock.now(), frame));
            handleFrame(frame);
        }

        // Frames ahead of a bad prefix are applied before the connection drops.
        Optional<FramingException> framingError = frameBuffer.framingError();
        if (framingError.isPresent()) {
            disconnect("framing error", framingError.get());
        }
    }

    private void handleFrame(byte[] frame) {
        Envelope envelope;
        try {
            envelope = decoder.decode(frame);
        } catch (FrameDecodeException e) {
            sink.onError(new TraitStreamErrorEvent(wallClock.now(), "Dropped undecodable frame", e));
            return;
        }

        Optional<StreamStatus> status = envelope.status();
        if (status.isPresent() && !status.get().isOk()) {
            sink.onProtocolEvent(new ProtocolObservabilityEvent.StreamStatusReceived(
                    wallClock.now(), status.get().code(), status.get().message()));
        }

        StateAggregator.ApplyResult result = aggregator.apply(envelope);
        if (result.changed()) {
            outbox.add(result.snapshot());
        }
    }

    private void reportHighWater() {
        if (!frameBuffer.isStalledAboveHighWater()) {
            highWaterReported = false;
            return;
        }
        if (!highWaterReported) {
            highWaterReported = true;
            sink.onProtocolEvent(new ProtocolObservabilityEvent.BufferHighWater(
                    wallClock.now(),
                    frameBuffer.bufferedBytes(),
                    frameBuffer.pendingLength().orElse(0),
                    frameBuffer.highWaterMark()));
        }
    }

    // ------------------------------------------------------------------
    // DISCONNECTED
    // ------------------------------------------------------------------

    private void disconnect(String reason, Throwable cause) {
        closeConnection();
        if (closed) {
            return;
        }
        consecutiveFailures++;
        outbox.add(StateSnapshot.empty());
        if (cause != null) {
            sink.onError(new TraitStreamErrorEvent(wallClock.now(), "Stream " + reason, cause));
        }
        transition(SessionState.DISCONNECTED, reason);
    }

    private void awaitReconnect() throws InterruptedException {
        Optional<Duration> delay = config.reconnectPolicy().nextDelay(consecutiveFailures);
        if (delay.isEmpty()) {
            sink.onTransportEvent(new TransportObservabilityEvent.ReconnectAbandoned(wallClock.now(), consecutiveFailures));
            transition(SessionState.CLOSED, "reconnect policy exhausted");
            closed = true;
            closeSignal.countDown();
            return;
        }

        sink.onTransportEvent(new TransportObservabilityEvent.ReconnectScheduled(
                wallClock.now(), delay.get(), consecutiveFailures));
        if (closeSignal.await(delay.get().toNanos(), TimeUnit.NANOSECONDS)) {
            return;
        }
        transition(SessionState.CONNECTING, "retry");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    private void transition(SessionState next, String reason) {
        SessionState previous = state;
        if (previous == SessionState.CLOSED) {
            return;
        }
        state = next;
        if (previous != next) {
            sink.onStateTransition(new SessionStateTransitionEvent(wallClock.now(), previous, next, reason));
        }
    }

    private void closeConnection() {
        ChunkStream c = connection;
        connection = null;
        if (c != null) {
            c.close();
        }
    }

    /**
     * Ends the session. Idempotent and callable from any thread.
     */
    @Override
    public void close() {
        closed = true;
        closeSignal.countDown();
        closeConnection();
        transition(SessionState.CLOSED, "closed by caller");

        // The frame buffer belongs to the consumer; release it here only when
        // no consumer is inside next().
        if (consumerLock.tryLock()) {
            try {
                frameBuffer.close();
            } finally {
                consumerLock.unlock();
            }
        }
    }

    public static final class Builder {
        private StreamTransport transport;
        private StreamRequest request;
        private StreamSessionConfig config = StreamSessionConfig.defaults();
        private SchemaRegistry schemaRegistry = new ProtobufSchemaRegistry();
        private TraitStreamObservabilitySink observabilitySink = NullTraitStreamObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withTransport(StreamTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withRequest(StreamRequest request) {
            this.request = request;
            return this;
        }

        public Builder withConfig(StreamSessionConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSchemaRegistry(SchemaRegistry schemaRegistry) {
            this.schemaRegistry = schemaRegistry;
            return this;
        }

        public Builder withObservabilitySink(TraitStreamObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public StreamSession build() {
            return new StreamSession(this);
        }
    }
}
