package org.tlsfixtures.extras;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * An end-entity certificate issued by a {@link CertificateAuthority}, together with its private key.
 */
public final class LeafCertificate {
    private final CertificateSubject subject;
    private final PrivateKey privateKey;
    private final ImmutableList<X509Certificate> chain;

    LeafCertificate(CertificateSubject subject, PrivateKey privateKey, X509Certificate certificate,
            X509Certificate issuer) {
        this.subject = subject;
        this.privateKey = privateKey;
        this.chain = ImmutableList.of(certificate, issuer);
    }

    public CertificateSubject getSubject() {
        return subject;
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    public X509Certificate getCertificate() {
        return chain.get(0);
    }

    /**
     * The leaf certificate first, then the root it was issued by.
     */
    public List<X509Certificate> getChain() {
        return chain;
    }

    public String getChainPem() {
        return PemUtils.toPem(chain);
    }

    public String getPrivateKeyPem() {
        return PemUtils.toPem(privateKey);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("subject", subject)
                .add("serial", getCertificate().getSerialNumber())
                .toString();
    }
}
