package org.tlsfixtures;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;

/**
 * Request handler served by a {@link TlsServer}. Called on the server's event loop thread, so implementations
 * must not block.
 */
public interface HttpApplication {

    /**
     * Produces the response for a fully aggregated request. The request is released by the caller after this
     * method returns; copy any content that has to outlive the call.
     */
    FullHttpResponse handle(FullHttpRequest request);
}
