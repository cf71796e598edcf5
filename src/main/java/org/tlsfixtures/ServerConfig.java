package org.tlsfixtures;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Connection parameters of a running test server, as handed to the test using it. Instances are immutable and
 * only meaningful until the server they describe is stopped.
 */
public final class ServerConfig {
    private final String scheme;
    private final String host;
    private final int port;
    private final Path caCertPath;

    public ServerConfig(String scheme, String host, int port, Path caCertPath) {
        this.scheme = Preconditions.checkNotNull(scheme, "scheme");
        this.host = Preconditions.checkNotNull(host, "host");
        Preconditions.checkArgument(port > 0 && port <= 65535, "Invalid port: %s", port);
        this.port = port;
        this.caCertPath = Preconditions.checkNotNull(caCertPath, "caCertPath");
    }

    public String getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /**
     * Path to the PEM-encoded root certificate the server's chain was issued from. Clients under test use it as
     * their trust anchor.
     */
    public Path getCaCertPath() {
        return caCertPath;
    }

    /**
     * Returns the URL of the server root without a trailing slash. IPv6 literals are bracketed, so
     * {@code ::1} on port 8443 renders as {@code https://[::1]:8443}.
     */
    public String getBaseUrl() {
        return scheme + "://" + HostAndPort.fromParts(host, port);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServerConfig)) {
            return false;
        }
        ServerConfig that = (ServerConfig) o;
        return port == that.port
                && scheme.equals(that.scheme)
                && host.equals(that.host)
                && caCertPath.equals(that.caCertPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, host, port, caCertPath);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("baseUrl", getBaseUrl())
                .add("caCertPath", caCertPath)
                .toString();
    }
}
