package org.tlsfixtures;

import java.net.InetSocketAddress;

/**
 * This exception indicates that a {@link TlsServer} could not be started, either because its TLS material could not
 * be loaded or because the listener could not be bound.
 */
public class TlsServerStartException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public TlsServerStartException(String message, Throwable cause) {
        super(message, cause);
    }

    public TlsServerStartException(InetSocketAddress requestedAddress, Throwable cause) {
        super(String.format("Unable to bind to %1$s", requestedAddress), cause);
    }
}
