package org.tlsfixtures;

/**
 * This exception indicates that a {@link TlsServer}'s event loop thread did not exit within the stop timeout.
 */
public class ServerStopTimeoutException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ServerStopTimeoutException(String serverName, long stopTimeoutMs) {
        super(String.format("Server %1$s did not stop within %2$d ms", serverName, stopTimeoutMs));
    }
}
