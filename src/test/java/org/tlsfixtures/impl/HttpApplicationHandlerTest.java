package org.tlsfixtures.impl;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderResult;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.Test;
import org.tlsfixtures.HttpApplication;
import org.tlsfixtures.TestingApplication;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class HttpApplicationHandlerTest {

    @Test
    public void testWritesApplicationResponse() {
        EmbeddedChannel channel = new EmbeddedChannel(new HttpApplicationHandler(new TestingApplication()));

        channel.writeInbound(request(HttpVersion.HTTP_1_1, "/"));
        FullHttpResponse response = channel.readOutbound();
        try {
            assertEquals(HttpResponseStatus.OK, response.status());
            assertEquals(String.valueOf(TestingApplication.ROOT_RESPONSE.length()),
                    response.headers().get(HttpHeaderNames.CONTENT_LENGTH));
            assertTrue("HTTP/1.1 connection should stay open", channel.isOpen());
        } finally {
            response.release();
            channel.finishAndReleaseAll();
        }
    }

    @Test
    public void testClosesWithoutKeepAlive() {
        EmbeddedChannel channel = new EmbeddedChannel(new HttpApplicationHandler(new TestingApplication()));

        channel.writeInbound(request(HttpVersion.HTTP_1_0, "/"));
        FullHttpResponse response = channel.readOutbound();
        try {
            assertEquals(HttpResponseStatus.OK, response.status());
            assertFalse(channel.isOpen());
        } finally {
            response.release();
        }
    }

    @Test
    public void testFailingApplicationGets500() {
        HttpApplication application = mock(HttpApplication.class);
        when(application.handle(any(FullHttpRequest.class))).thenThrow(new IllegalStateException("broken"));
        EmbeddedChannel channel = new EmbeddedChannel(new HttpApplicationHandler(application));

        channel.writeInbound(request(HttpVersion.HTTP_1_1, "/"));
        FullHttpResponse response = channel.readOutbound();
        try {
            assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        } finally {
            response.release();
            channel.finishAndReleaseAll();
        }
    }

    @Test
    public void testNullResponseGets500() {
        HttpApplication application = mock(HttpApplication.class);
        EmbeddedChannel channel = new EmbeddedChannel(new HttpApplicationHandler(application));

        channel.writeInbound(request(HttpVersion.HTTP_1_1, "/"));
        FullHttpResponse response = channel.readOutbound();
        try {
            assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        } finally {
            response.release();
            channel.finishAndReleaseAll();
        }
    }

    @Test
    public void testUndecodableRequestGets400() {
        EmbeddedChannel channel = new EmbeddedChannel(new HttpApplicationHandler(new TestingApplication()));
        FullHttpRequest request = request(HttpVersion.HTTP_1_1, "/");
        request.setDecoderResult(DecoderResult.failure(new IllegalArgumentException("bad request line")));

        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        try {
            assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
            assertFalse(channel.isOpen());
        } finally {
            response.release();
        }
    }

    private static FullHttpRequest request(HttpVersion version, String uri) {
        return new DefaultFullHttpRequest(version, HttpMethod.GET, uri,
                Unpooled.copiedBuffer("", StandardCharsets.UTF_8));
    }
}
