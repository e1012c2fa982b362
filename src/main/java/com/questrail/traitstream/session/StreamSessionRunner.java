package com.questrail.traitstream.session;

import com.questrail.traitstream.api.SnapshotListener;
import com.questrail.traitstream.api.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * StreamSessionRunner
 * =============================================================================
 * Drives a {@link StreamSession} on a dedicated worker thread and hands every
 * snapshot to a {@link SnapshotListener}.
 *
 * <p>Transport reads block, so the session must never be pulled from a UI or
 * control thread. Decoding runs inline on the same worker; there is no
 * fan-out, so snapshots reach the listener in arrival order.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} launches the worker. Idempotent.</li>
 *   <li>{@link #stop()} closes the session (which closes the transport and
 *       ends any reconnect delay) and waits for the worker to finish.</li>
 * </ul>
 *
 * <p>A listener that throws is logged; the stream keeps running.</p>
 */
public final class StreamSessionRunner
{
    private static final Logger log = LoggerFactory.getLogger(StreamSessionRunner.class);

    public static final String DEFAULT_THREAD_NAME = "traitstream-session";

    private final StreamSession session;
    private final SnapshotListener listener;
    private final ExecutorService worker;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public StreamSessionRunner(StreamSession session, SnapshotListener listener) {
        this(session, listener, DEFAULT_THREAD_NAME);
    }

    public StreamSessionRunner(StreamSession session, SnapshotListener listener, String threadName) {
        this.session = Objects.requireNonNull(session, "session");
        this.listener = Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(threadName, "threadName");
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            worker.execute(this::runLoop);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runLoop() {
        try {
            while (running.get()) {
                Optional<StateSnapshot> next = session.next();
                if (next.isEmpty()) {
                    log.info("Stream session ended");
                    break;
                }
                deliver(next.get());
            }
        } catch (InterruptedException e) {
            // Expected during shutdown
            if (running.get()) {
                Thread.currentThread().interrupt();
            }
        } finally {
            running.set(false);
            session.close();
        }
    }

    private void deliver(StateSnapshot snapshot) {
        try {
            listener.onSnapshot(snapshot);
        } catch (RuntimeException e) {
            log.warn("Snapshot listener failed; continuing", e);
        }
    }

    /**
     * Stops the worker. Blocks for up to five seconds while it terminates.
     */
    public void stop() {
        running.set(false);
        session.close();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
