package com.questrail.traitstream.transport.http.netty;

import com.questrail.traitstream.transport.TransportException;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.LastHttpContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ResponseChunkHandler
 * -------------------------------------------------------------------------
 * Receives the streaming HTTP response and forwards raw body bytes to the
 * {@link NettyChunkStream}.
 *
 * <p>A status other than 200 fails the stream with a
 * {@link TransportException} carrying that status; the body is discarded.</p>
 */
final class ResponseChunkHandler extends SimpleChannelInboundHandler<HttpObject>
{
    private static final Logger log = LoggerFactory.getLogger(ResponseChunkHandler.class);

    private final NettyChunkStream stream;

    ResponseChunkHandler(NettyChunkStream stream)
    {
        this.stream = stream;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, HttpObject msg)
    {
        if (msg instanceof HttpResponse response) {
            HttpResponseStatus status = response.status();
            if (status.code() != HttpResponseStatus.OK.code()) {
                stream.fail(new TransportException("HTTP " + status, status.code(), null));
                ctx.close();
                return;
            }
        }

        if (msg instanceof HttpContent content) {
            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf buf = content.content();
            if (buf.isReadable()) {
                byte[] bytes = new byte[buf.readableBytes()];
                buf.getBytes(buf.readerIndex(), bytes);
                stream.offerChunk(bytes, ctx.channel());
            }
            if (msg instanceof LastHttpContent) {
                stream.end();
                ctx.close();
            }
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        if (!stream.isTerminated()) {
            stream.fail(new TransportException("Connection closed before the response ended"));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.debug("Channel {} failed", ctx.channel(), cause);
        stream.fail(new TransportException("Channel error: " + cause.getMessage(), cause));
        ctx.close();
    }
}
