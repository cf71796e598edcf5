package org.tlsfixtures;

import org.tlsfixtures.extras.CertificateFiles;

import java.util.List;

/**
 * Configures and starts a {@link TlsServer}. The TlsServer is built using {@link #start()}. Everything except the
 * certificate files has a default, so a bootstrap only needs {@link #withCertificateFiles(CertificateFiles)}
 * before it can be started.
 */
public interface TlsServerBootstrap {

    /**
     * <p>
     * Give the server a name (used for naming threads, useful for logging).
     * </p>
     *
     * <p>
     * Default = TlsServer
     * </p>
     */
    TlsServerBootstrap withName(String name);

    /**
     * <p>
     * Scheme reported to clients. Only affects {@link TlsServer#getScheme()}; the listener always terminates TLS.
     * </p>
     *
     * <p>
     * Default = https
     * </p>
     */
    TlsServerBootstrap withScheme(String scheme);

    /**
     * <p>
     * Host to bind to: a hostname, an IPv4 literal or an IPv6 literal without brackets.
     * </p>
     *
     * <p>
     * Default = localhost
     * </p>
     */
    TlsServerBootstrap withHost(String host);

    /**
     * <p>
     * Listen for incoming connections on the given port.
     * </p>
     *
     * <p>
     * Default = 0 (OS-assigned)
     * </p>
     */
    TlsServerBootstrap withPort(int port);

    /**
     * Certificate chain and private key presented by the server. Required.
     */
    TlsServerBootstrap withCertificateFiles(CertificateFiles certificateFiles);

    /**
     * <p>
     * Handler for decrypted requests.
     * </p>
     *
     * <p>
     * Default = {@link TestingApplication}
     * </p>
     */
    TlsServerBootstrap withApplication(HttpApplication application);

    /**
     * <p>
     * Protocol names the server accepts, e.g. "TLSv1.2". Names the TLS provider does not know are dropped.
     * </p>
     *
     * <p>
     * Default = the provider's defaults
     * </p>
     */
    TlsServerBootstrap withProtocols(List<String> protocols);

    /**
     * <p>
     * Maximum time in milliseconds {@link TlsServer#stop()} waits for the event loop thread to exit.
     * </p>
     *
     * <p>
     * Default = 30000
     * </p>
     */
    TlsServerBootstrap withStopTimeout(long stopTimeoutMs);

    /**
     * <p>
     * Build and start the server.
     * </p>
     *
     * @return the newly built and started server, bound to its port
     * @throws TlsServerStartException if the TLS material cannot be loaded or the listener cannot be bound
     */
    TlsServer start();
}
