package org.tlsfixtures.impl;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslHandshakeCompletionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlsfixtures.HttpApplication;

import java.nio.charset.StandardCharsets;

/**
 * Last handler of a test server's pipeline. Hands aggregated requests to the {@link HttpApplication} and writes
 * back its response, honoring keep-alive.
 */
public class HttpApplicationHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger LOG = LoggerFactory.getLogger(HttpApplicationHandler.class);

    private final HttpApplication application;

    public HttpApplicationHandler(HttpApplication application) {
        this.application = application;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (!request.decoderResult().isSuccess()) {
            LOG.debug("Rejecting undecodable request from {}", ctx.channel().remoteAddress());
            writeResponse(ctx, errorResponse(HttpResponseStatus.BAD_REQUEST), false);
            return;
        }

        FullHttpResponse response;
        try {
            response = application.handle(request);
        } catch (RuntimeException e) {
            LOG.warn("Application failed to handle {} {}", request.method(), request.uri(), e);
            response = errorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR);
        }
        if (response == null) {
            LOG.warn("Application returned no response for {} {}", request.method(), request.uri());
            response = errorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR);
        }

        writeResponse(ctx, response, HttpUtil.isKeepAlive(request));
    }

    private static void writeResponse(ChannelHandlerContext ctx, FullHttpResponse response, boolean keepAlive) {
        HttpUtil.setContentLength(response, response.content().readableBytes());
        HttpUtil.setKeepAlive(response, keepAlive);

        ChannelFuture future = ctx.writeAndFlush(response);
        if (!keepAlive) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }

    private static FullHttpResponse errorResponse(HttpResponseStatus status) {
        return new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(status.toString(), StandardCharsets.UTF_8));
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof SslHandshakeCompletionEvent) {
            SslHandshakeCompletionEvent handshake = (SslHandshakeCompletionEvent) evt;
            if (handshake.isSuccess()) {
                LOG.debug("TLS handshake with {} completed", ctx.channel().remoteAddress());
            } else {
                // clients rejecting our certificate or protocol end up here, which is what many tests want
                LOG.debug("TLS handshake with {} failed: {}", ctx.channel().remoteAddress(),
                        handshake.cause().toString());
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.debug("Closing connection from {} after error", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
