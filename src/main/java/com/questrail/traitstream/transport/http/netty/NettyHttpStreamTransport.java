package com.questrail.traitstream.transport.http.netty;

import com.questrail.traitstream.transport.ChunkStream;
import com.questrail.traitstream.transport.StreamRequest;
import com.questrail.traitstream.transport.StreamTransport;
import com.questrail.traitstream.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContentDecompressor;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyHttpStreamTransport
 * =============================================================================
 * Netty-backed implementation of the {@link StreamTransport} port: one
 * HTTP/1.1 POST per {@link #open}, with the response body delivered as raw
 * chunks.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Reassemble or decode frames</li>
 *   <li>Interpret trait payloads</li>
 *   <li>Schedule retries or reconnects</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Response content is copied into
 * {@code byte[]}; all reference-counted buffers are released internally.
 *
 * <h2>Pipeline</h2>
 * {@code SslHandler} (https only) → {@code HttpClientCodec} →
 * {@code HttpContentDecompressor} → {@link ResponseChunkHandler}.
 *
 * <h2>Lifecycle</h2>
 * One event loop group is shared by every stream opened through this
 * transport. {@link #close()} shuts it down.
 */
public final class NettyHttpStreamTransport implements StreamTransport, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyHttpStreamTransport.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    /** Queued chunks above which the channel stops reading from the socket. */
    static final int HIGH_WATER_CHUNKS = 256;

    /** Queued chunks at or below which reading resumes. */
    static final int LOW_WATER_CHUNKS = 64;

    private final Duration connectTimeout;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile SslContext sslContext;

    public NettyHttpStreamTransport() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    public NettyHttpStreamTransport(Duration connectTimeout)
    {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .option(ChannelOption.SO_KEEPALIVE, true);
    }

    @Override
    public ChunkStream open(StreamRequest request) throws TransportException, InterruptedException
    {
        Objects.requireNonNull(request, "request");

        URI uri = request.endpoint();
        boolean tls = "https".equalsIgnoreCase(uri.getScheme());
        String host = uri.getHost();
        if (host == null) {
            throw new TransportException("Endpoint has no host: " + uri);
        }
        int port = uri.getPort() != -1 ? uri.getPort() : (tls ? 443 : 80);
        SslContext ssl = tls ? sslContext() : null;

        NettyChunkStream stream = new NettyChunkStream(HIGH_WATER_CHUNKS, LOW_WATER_CHUNKS);

        ChannelFuture connect = bootstrap.clone()
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast(ssl.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpContentDecompressor());
                        p.addLast(new ResponseChunkHandler(stream));
                    }
                })
                .connect(host, port);

        if (!connect.await(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            connect.cancel(true);
            throw new TransportException("Connect to " + host + ':' + port + " timed out");
        }
        if (!connect.isSuccess()) {
            throw new TransportException("Connect to " + host + ':' + port + " failed", connect.cause());
        }

        Channel channel = connect.channel();
        stream.attach(channel);

        channel.writeAndFlush(toNettyRequest(request, host, port, tls))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.debug("Request write to {} failed", uri, future.cause());
                        stream.fail(new TransportException("Request write failed", future.cause()));
                        future.channel().close();
                    }
                });
        return stream;
    }

    private static FullHttpRequest toNettyRequest(StreamRequest request, String host, int port, boolean tls)
    {
        URI uri = request.endpoint();
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + '?' + uri.getRawQuery();
        }

        byte[] body = request.body();
        FullHttpRequest http = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.POST, path, Unpooled.wrappedBuffer(body));

        boolean defaultPort = (tls && port == 443) || (!tls && port == 80);
        http.headers().set(HttpHeaderNames.HOST, defaultPort ? host : host + ':' + port);
        for (Map.Entry<String, String> h : request.headers().entrySet()) {
            http.headers().set(h.getKey(), h.getValue());
        }
        http.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.length);
        return http;
    }

    private SslContext sslContext() throws TransportException
    {
        SslContext ctx = sslContext;
        if (ctx == null) {
            synchronized (this) {
                ctx = sslContext;
                if (ctx == null) {
                    try {
                        ctx = SslContextBuilder.forClient().build();
                    } catch (SSLException e) {
                        throw new TransportException("Cannot initialise TLS", e);
                    }
                    sslContext = ctx;
                }
            }
        }
        return ctx;
    }

    /**
     * Shuts down the event loop group. Streams still open are closed with it.
     */
    @Override
    public void close()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }
}
