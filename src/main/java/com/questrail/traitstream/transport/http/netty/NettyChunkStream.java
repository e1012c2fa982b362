package com.questrail.traitstream.transport.http.netty;

import com.questrail.traitstream.transport.ChunkRead;
import com.questrail.traitstream.transport.ChunkStream;
import com.questrail.traitstream.transport.TransportException;

import io.netty.channel.Channel;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyChunkStream
 * -----------------------------------------------------------------------------
 * Hands response chunks from the Netty event loop to the single consumer
 * thread.
 *
 * <h2>Back-pressure</h2>
 * When more than {@code highWater} chunks are queued, auto-read is switched
 * off so the socket stops being drained; the consumer switches it back on once
 * the queue falls to {@code lowWater}. A slow consumer therefore slows the
 * server through TCP flow control rather than growing this queue.
 *
 * <h2>Terminal items</h2>
 * End of stream and failures are queued behind the data that preceded them
 * and stay at the head of the queue once reached, so every later read sees
 * them too.
 */
final class NettyChunkStream implements ChunkStream
{
    private enum Marker { END }

    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final int highWater;
    private final int lowWater;

    private volatile Channel channel;
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile boolean closed;

    NettyChunkStream(int highWater, int lowWater)
    {
        if (lowWater < 0 || highWater <= lowWater) {
            throw new IllegalArgumentException("require 0 <= lowWater < highWater");
        }
        this.highWater = highWater;
        this.lowWater = lowWater;
    }

    void attach(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        if (closed) {
            channel.close();
        }
    }

    // ------------------------------------------------------------------
    // Event-loop side
    // ------------------------------------------------------------------

    void offerChunk(byte[] bytes, Channel source)
    {
        if (terminated.get() || bytes.length == 0) {
            return;
        }
        queue.offer(bytes);
        if (queue.size() > highWater && source.config().isAutoRead()) {
            source.config().setAutoRead(false);
        }
    }

    void end()
    {
        if (terminated.compareAndSet(false, true)) {
            queue.offer(Marker.END);
        }
    }

    void fail(TransportException failure)
    {
        if (terminated.compareAndSet(false, true)) {
            queue.offer(failure);
        }
    }

    boolean isTerminated()
    {
        return terminated.get();
    }

    // ------------------------------------------------------------------
    // Consumer side
    // ------------------------------------------------------------------

    @Override
    public ChunkRead read(Duration wait) throws TransportException, InterruptedException
    {
        Objects.requireNonNull(wait, "wait");

        Object item = queue.poll(wait.toNanos(), TimeUnit.NANOSECONDS);
        if (item == null) {
            return ChunkRead.idle();
        }
        if (item instanceof byte[] bytes) {
            resumeIfDrained();
            return ChunkRead.data(bytes);
        }

        // Terminal item: nothing is queued behind it, so re-queueing keeps it at the head.
        queue.offer(item);
        if (item instanceof TransportException failure) {
            throw failure;
        }
        return ChunkRead.end();
    }

    private void resumeIfDrained()
    {
        Channel ch = channel;
        if (ch != null && queue.size() <= lowWater && !ch.config().isAutoRead()) {
            ch.config().setAutoRead(true);
        }
    }

    @Override
    public void close()
    {
        closed = true;
        end();
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }
}
