package org.tlsfixtures.extras;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.nio.file.Path;

/**
 * Locations of the PEM files written by {@link CertificateAuthority#export(LeafCertificate, Path)}.
 */
public final class CertificateFiles {
    public static final String CA_CERT_FILE_NAME = "ca.pem";
    public static final String SERVER_CERT_FILE_NAME = "server.pem";
    public static final String SERVER_KEY_FILE_NAME = "server.key";

    private final Path caCertificate;
    private final Path serverCertificateChain;
    private final Path serverPrivateKey;

    public CertificateFiles(Path caCertificate, Path serverCertificateChain, Path serverPrivateKey) {
        this.caCertificate = Preconditions.checkNotNull(caCertificate);
        this.serverCertificateChain = Preconditions.checkNotNull(serverCertificateChain);
        this.serverPrivateKey = Preconditions.checkNotNull(serverPrivateKey);
    }

    /**
     * The standard file names inside the given directory.
     */
    public static CertificateFiles in(Path directory) {
        return new CertificateFiles(directory.resolve(CA_CERT_FILE_NAME),
                directory.resolve(SERVER_CERT_FILE_NAME),
                directory.resolve(SERVER_KEY_FILE_NAME));
    }

    /** Root certificate, PEM. */
    public Path getCaCertificate() {
        return caCertificate;
    }

    /** Leaf certificate followed by the root, PEM. */
    public Path getServerCertificateChain() {
        return serverCertificateChain;
    }

    /** Unencrypted PKCS#8 leaf private key, PEM. */
    public Path getServerPrivateKey() {
        return serverPrivateKey;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("caCertificate", caCertificate)
                .add("serverCertificateChain", serverCertificateChain)
                .add("serverPrivateKey", serverPrivateKey)
                .toString();
    }
}
