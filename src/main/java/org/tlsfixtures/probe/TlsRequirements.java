package org.tlsfixtures.probe;

import com.google.common.base.Supplier;
import org.tlsfixtures.SetupOutcome;

/**
 * Gates for tests that need a specific TLS version. Each gate proceeds when the version is both defined by the TLS
 * provider and negotiable in this JVM, and asks for a skip otherwise.
 */
public class TlsRequirements {

    private static final TlsRequirements DEFAULT = new TlsRequirements(SupportedTlsVersions::get);

    private final Supplier<SupportedTlsVersions> supportedVersions;

    public TlsRequirements(Supplier<SupportedTlsVersions> supportedVersions) {
        this.supportedVersions = supportedVersions;
    }

    /**
     * Gates against the probed versions of this JVM.
     */
    public static TlsRequirements probed() {
        return DEFAULT;
    }

    public SetupOutcome requireTlsV1() {
        return require(TlsProtocolVersion.TLS_V1);
    }

    public SetupOutcome requireTlsV1_1() {
        return require(TlsProtocolVersion.TLS_V1_1);
    }

    public SetupOutcome requireTlsV1_2() {
        return require(TlsProtocolVersion.TLS_V1_2);
    }

    public SetupOutcome requireTlsV1_3() {
        return require(TlsProtocolVersion.TLS_V1_3);
    }

    public SetupOutcome require(TlsProtocolVersion version) {
        if (!version.isDefined() || !supportedVersions.get().contains(version)) {
            return SetupOutcome.skip("Test requires " + version.protocolName());
        }
        return SetupOutcome.proceed();
    }
}
