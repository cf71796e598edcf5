package org.tlsfixtures;

import java.net.InetSocketAddress;

/**
 * Interface for a running TLS-terminating test server.
 */
public interface TlsServer {

    /**
     * Returns the URL scheme clients use to reach this server.
     */
    String getScheme();

    /**
     * Returns the host the server was asked to bind to, exactly as given (e.g. "localhost" or "::1").
     */
    String getHost();

    /**
     * Returns the port the server is listening on. When started with port 0 this is the OS-assigned port.
     */
    int getPort();

    /**
     * Return the address on which this server is listening.
     */
    InetSocketAddress getListenAddress();

    /**
     * @return true once {@link #stop()} has been called
     */
    boolean isStopped();

    /**
     * Stops the server and waits until its event loop thread has exited. When this method returns, the listening
     * port is released. Calling stop on a stopped server does nothing.
     *
     * @throws ServerStopTimeoutException if the event loop thread does not exit within the configured stop timeout
     */
    void stop();
}
