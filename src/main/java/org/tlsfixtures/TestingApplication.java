package org.tlsfixtures;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Default {@link HttpApplication} for test servers. Knows three paths:
 * <ul>
 *     <li>{@code /} answers "Dummy server!"</li>
 *     <li>{@code /echo} answers with the request body</li>
 *     <li>{@code /headers} answers with one {@code name: value} line per request header</li>
 * </ul>
 * Everything else is a 404.
 */
public class TestingApplication implements HttpApplication {
    public static final String ROOT_RESPONSE = "Dummy server!";

    @Override
    public FullHttpResponse handle(FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        switch (path) {
            case "":
            case "/":
                return response(HttpResponseStatus.OK, Unpooled.copiedBuffer(ROOT_RESPONSE, StandardCharsets.UTF_8));
            case "/echo":
                return response(HttpResponseStatus.OK, request.content().retainedDuplicate());
            case "/headers":
                StringBuilder sb = new StringBuilder();
                for (Map.Entry<String, String> header : request.headers()) {
                    sb.append(header.getKey()).append(": ").append(header.getValue()).append('\n');
                }
                return response(HttpResponseStatus.OK, Unpooled.copiedBuffer(sb, StandardCharsets.UTF_8));
            default:
                return response(HttpResponseStatus.NOT_FOUND,
                        Unpooled.copiedBuffer("Not found: " + path, StandardCharsets.UTF_8));
        }
    }

    private static FullHttpResponse response(HttpResponseStatus status, ByteBuf content) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        return response;
    }
}
