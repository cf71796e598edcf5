package org.tlsfixtures.probe;

import com.google.common.base.MoreObjects;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * The TLS protocol versions that actually complete a handshake in this JVM, as reported by the negotiated sessions
 * (e.g. "TLSv1.2"). Computed once per JVM by {@link #get()}; there is no way to recompute it.
 */
public final class SupportedTlsVersions {

    private static final Supplier<SupportedTlsVersions> PROBED =
            Suppliers.memoize(() -> new TlsCapabilityProber().probe());

    private final ImmutableSet<String> versions;

    SupportedTlsVersions(Set<String> versions) {
        this.versions = ImmutableSet.copyOf(versions);
    }

    /**
     * Returns the probed versions, probing on first call.
     */
    public static SupportedTlsVersions get() {
        return PROBED.get();
    }

    /**
     * Builds a set without probing, for callers that already know the answer.
     */
    public static SupportedTlsVersions of(String... versions) {
        return new SupportedTlsVersions(ImmutableSet.copyOf(versions));
    }

    public boolean contains(String protocolName) {
        return versions.contains(protocolName);
    }

    public boolean contains(TlsProtocolVersion version) {
        return versions.contains(version.protocolName());
    }

    public Set<String> asSet() {
        return versions;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .addValue(versions)
                .toString();
    }
}
