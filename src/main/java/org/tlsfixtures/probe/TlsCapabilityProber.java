package org.tlsfixtures.probe;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlsfixtures.LoopbackHosts;
import org.tlsfixtures.TlsServer;
import org.tlsfixtures.extras.CertificateAuthority;
import org.tlsfixtures.extras.CertificateFiles;
import org.tlsfixtures.extras.CertificateSubject;
import org.tlsfixtures.impl.DefaultTlsServer;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Finds out which TLS protocol versions complete a handshake in this JVM. Knowing that the provider supports a
 * version is not enough: security policy (the {@code jdk.tls.disabledAlgorithms} property, or an OS crypto policy)
 * can disable versions the provider implements. The prober therefore starts a throwaway server and tries a real
 * handshake per candidate version.
 *
 * <p>
 * Prefer {@link SupportedTlsVersions#get()}, which probes once per JVM.
 * </p>
 */
public class TlsCapabilityProber {
    private static final Logger LOG = LoggerFactory.getLogger(TlsCapabilityProber.class);

    /**
     * Versions tried, in order. The generic selector reports whatever the best negotiable version is.
     */
    static final List<TlsProtocolVersion> CANDIDATES = ImmutableList.of(
            TlsProtocolVersion.TLS_V1,
            TlsProtocolVersion.TLS_V1_1,
            TlsProtocolVersion.TLS_V1_2,
            TlsProtocolVersion.TLS);

    private static final List<TlsProtocolVersion> SERVER_PROTOCOLS = ImmutableList.of(
            TlsProtocolVersion.TLS_V1_3,
            TlsProtocolVersion.TLS_V1_2,
            TlsProtocolVersion.TLS_V1_1,
            TlsProtocolVersion.TLS_V1);

    private static final int TIMEOUT_MS = 10_000;

    private final Predicate<TlsProtocolVersion> isDefined;

    public TlsCapabilityProber() {
        this(TlsProtocolVersion::isDefined);
    }

    /**
     * @param isDefined capability query deciding whether the TLS provider defines a version
     */
    TlsCapabilityProber(Predicate<TlsProtocolVersion> isDefined) {
        this.isDefined = isDefined;
    }

    /**
     * Runs one handshake per defined candidate against a throwaway server and collects the negotiated versions.
     *
     * @throws org.tlsfixtures.extras.ProvisioningException if the server's certificate cannot be created
     * @throws org.tlsfixtures.TlsServerStartException if the throwaway server cannot be started
     * @throws UncheckedIOException if the probe cannot connect to the throwaway server
     */
    public SupportedTlsVersions probe() {
        Path certDirectory = null;
        try {
            certDirectory = Files.createTempDirectory("tls-probe");
            CertificateAuthority ca = CertificateAuthority.create();
            CertificateFiles files = ca.export(
                    ca.issue(CertificateSubject.forHost(LoopbackHosts.IPV4_LOOPBACK)), certDirectory);

            TlsServer server = DefaultTlsServer.bootstrap()
                    .withName("TlsProbe")
                    .withHost(LoopbackHosts.IPV4_LOOPBACK)
                    .withCertificateFiles(files)
                    .withProtocols(definedProtocolNames())
                    .start();
            try {
                SupportedTlsVersions versions = probe(server.getListenAddress());
                LOG.info("Negotiable TLS versions: {}", versions.asSet());
                return versions;
            } finally {
                server.stop();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to probe TLS versions", e);
        } finally {
            if (certDirectory != null) {
                FileUtils.deleteQuietly(certDirectory.toFile());
            }
        }
    }

    private SupportedTlsVersions probe(InetSocketAddress address) throws IOException {
        ImmutableSet.Builder<String> versions = ImmutableSet.builder();
        for (TlsProtocolVersion candidate : CANDIDATES) {
            if (!isDefined.test(candidate)) {
                LOG.debug("{} is not defined by the TLS provider, skipping", candidate.protocolName());
                continue;
            }
            Optional<String> negotiated = negotiate(candidate, address);
            if (negotiated.isPresent() && isNegotiatedVersionDefined(negotiated.get())) {
                versions.add(negotiated.get());
            }
        }
        return new SupportedTlsVersions(versions.build());
    }

    /**
     * Handshakes over a fresh TCP connection, forcing the candidate version. Certificate validation is off, this is
     * only about protocol versions.
     *
     * @return the version the session settled on, or empty if the handshake was refused
     */
    Optional<String> negotiate(TlsProtocolVersion candidate, InetSocketAddress address) throws IOException {
        SSLSocketFactory factory = insecureSocketFactory();
        try (Socket socket = new Socket()) {
            socket.connect(address, TIMEOUT_MS);
            socket.setSoTimeout(TIMEOUT_MS);
            try (SSLSocket sslSocket = (SSLSocket) factory.createSocket(socket,
                    address.getHostString(), address.getPort(), true)) {
                if (!candidate.isGeneric()) {
                    sslSocket.setEnabledProtocols(new String[] { candidate.protocolName() });
                }
                sslSocket.startHandshake();
                String protocol = sslSocket.getSession().getProtocol();
                LOG.debug("Requested {}, negotiated {}", candidate.protocolName(), protocol);
                return Optional.of(protocol);
            } catch (SSLException | IllegalArgumentException e) {
                LOG.debug("Handshake with {} failed: {}", candidate.protocolName(), e.toString());
                return Optional.empty();
            }
        }
    }

    private boolean isNegotiatedVersionDefined(String protocol) {
        TlsProtocolVersion version = TlsProtocolVersion.fromProtocolName(protocol);
        return version != null && isDefined.test(version);
    }

    private List<String> definedProtocolNames() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (TlsProtocolVersion version : SERVER_PROTOCOLS) {
            if (isDefined.test(version)) {
                names.add(version.protocolName());
            }
        }
        return names.build();
    }

    private static SSLSocketFactory insecureSocketFactory() {
        try {
            SSLContext context = SSLContext.getInstance(TlsProtocolVersion.TLS.protocolName());
            context.init(null, InsecureTrustManagerFactory.INSTANCE.getTrustManagers(), null);
            return context.getSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to create probe SSLContext", e);
        }
    }
}
