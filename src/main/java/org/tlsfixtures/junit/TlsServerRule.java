package org.tlsfixtures.junit;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import org.junit.rules.ExternalResource;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlsfixtures.HttpApplication;
import org.tlsfixtures.LoopbackHosts;
import org.tlsfixtures.ServerConfig;
import org.tlsfixtures.SetupOutcome;
import org.tlsfixtures.TestingApplication;
import org.tlsfixtures.TlsServer;
import org.tlsfixtures.extras.CertificateAuthority;
import org.tlsfixtures.extras.CertificateFiles;
import org.tlsfixtures.extras.CertificateSubject;
import org.tlsfixtures.extras.LeafCertificate;
import org.tlsfixtures.impl.DefaultTlsServer;

import java.io.File;

/**
 * <p>
 * Runs a TLS server for the duration of a test (as a {@code @Rule}) or a test class (as a {@code @ClassRule}). Before
 * the tests, the rule creates a fresh CA, issues a leaf certificate for the host, writes the PEM files into a
 * temporary directory and starts a server on an ephemeral port. Afterwards it stops the server and removes the
 * directory.
 * </p>
 *
 * <p>
 * Tests connect using {@link #getConfig()}, which carries the base URL and the CA certificate file to trust.
 * </p>
 */
public class TlsServerRule extends ExternalResource {
    private static final Logger LOG = LoggerFactory.getLogger(TlsServerRule.class);

    private final String host;
    private final CertificateSubject subject;
    private final Supplier<SetupOutcome> precondition;
    private HttpApplication application = new TestingApplication();

    private TemporaryFolder folder;
    private CertificateAuthority authority;
    private CertificateFiles certificateFiles;
    private TlsServer server;
    private ServerConfig config;

    TlsServerRule(String host, CertificateSubject subject, Supplier<SetupOutcome> precondition) {
        this.host = Preconditions.checkNotNull(host);
        this.subject = Preconditions.checkNotNull(subject);
        this.precondition = precondition;
    }

    /**
     * A server on {@code host} whose certificate names the host in a SAN entry of the matching type.
     */
    public static TlsServerRule sanServer(String host) {
        return new TlsServerRule(host, CertificateSubject.forHost(host), () -> LoopbackHosts.check(host));
    }

    /**
     * A server on {@code host} whose certificate carries the host only as its Common Name. Clients that follow
     * RFC 6125 reject it.
     */
    public static TlsServerRule noSanServer(String host) {
        return new TlsServerRule(host, CertificateSubject.commonNameOnly(host), () -> LoopbackHosts.check(host));
    }

    /**
     * A server on {@code 127.0.0.1} with an IP address SAN.
     */
    public static TlsServerRule ipSanServer() {
        return sanServer(LoopbackHosts.IPV4_LOOPBACK);
    }

    /**
     * A server on {@code ::1} with an IP address SAN. Skips on hosts without IPv6.
     */
    public static TlsServerRule ipv6SanServer() {
        return ipv6SanServer(LoopbackHosts::hasIpv6);
    }

    /**
     * @param hasIpv6 whether the host can serve on {@code ::1}
     */
    static TlsServerRule ipv6SanServer(Supplier<Boolean> hasIpv6) {
        return new TlsServerRule(LoopbackHosts.IPV6_LOOPBACK,
                CertificateSubject.ipAddress(LoopbackHosts.IPV6_LOOPBACK),
                () -> LoopbackHosts.requireIpv6(hasIpv6.get()));
    }

    /**
     * A server on {@code host} presenting a certificate for an arbitrary subject, which need not match the host.
     */
    public static TlsServerRule forSubject(String host, CertificateSubject subject) {
        return new TlsServerRule(host, subject, () -> LoopbackHosts.check(host));
    }

    /**
     * Serves requests with the given application instead of {@link TestingApplication}.
     */
    public TlsServerRule withApplication(HttpApplication application) {
        this.application = Preconditions.checkNotNull(application);
        return this;
    }

    @Override
    protected void before() throws Throwable {
        JUnitOutcomes.apply(precondition.get());
        JUnitOutcomes.apply(setUp());
    }

    @Override
    protected void after() {
        try {
            if (server != null) {
                server.stop();
            }
        } finally {
            server = null;
            config = null;
            if (folder != null) {
                folder.delete();
                folder = null;
            }
        }
    }

    private SetupOutcome setUp() {
        try {
            folder = new TemporaryFolder();
            folder.create();
            File certDirectory = folder.newFolder("certs");

            authority = CertificateAuthority.create();
            LeafCertificate leaf = authority.issue(subject);
            certificateFiles = authority.export(leaf, certDirectory.toPath());

            server = DefaultTlsServer.bootstrap()
                    .withName("TlsServerRule")
                    .withHost(host)
                    .withCertificateFiles(certificateFiles)
                    .withApplication(application)
                    .start();
            config = new ServerConfig(server.getScheme(), host, server.getPort(),
                    certificateFiles.getCaCertificate());
            LOG.debug("Serving {} with certificate for {}", config.getBaseUrl(), subject);
            return SetupOutcome.proceed();
        } catch (Exception e) {
            after();
            return SetupOutcome.fail(e);
        }
    }

    public ServerConfig getConfig() {
        Preconditions.checkState(config != null, "Server is not running");
        return config;
    }

    public CertificateAuthority getAuthority() {
        return authority;
    }

    public TlsServer getServer() {
        return server;
    }

    public CertificateFiles getCertificateFiles() {
        return certificateFiles;
    }
}
