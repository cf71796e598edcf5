package org.tlsfixtures.probe;

import org.tlsfixtures.impl.TlsUtils;

import javax.net.ssl.SSLContext;
import java.security.NoSuchAlgorithmException;

/**
 * TLS protocol versions tests can depend on. {@link #TLS} is the generic selector that lets the handshake settle on
 * the best version both sides allow.
 */
public enum TlsProtocolVersion {
    TLS_V1("TLSv1"),
    TLS_V1_1("TLSv1.1"),
    TLS_V1_2("TLSv1.2"),
    TLS_V1_3("TLSv1.3"),
    TLS("TLS");

    private final String protocolName;

    TlsProtocolVersion(String protocolName) {
        this.protocolName = protocolName;
    }

    /**
     * The JSSE name of this version, which is also the string a negotiated session reports.
     */
    public String protocolName() {
        return protocolName;
    }

    public boolean isGeneric() {
        return this == TLS;
    }

    /**
     * Whether the TLS provider knows this version at all. A defined version may still be disabled by security
     * policy; only a handshake tells.
     */
    public boolean isDefined() {
        if (isGeneric()) {
            try {
                SSLContext.getInstance(protocolName);
                return true;
            } catch (NoSuchAlgorithmException e) {
                return false;
            }
        }
        return TlsUtils.supportedProtocols().contains(protocolName);
    }

    /**
     * @return the version with the given JSSE name, or null if none matches
     */
    public static TlsProtocolVersion fromProtocolName(String protocolName) {
        for (TlsProtocolVersion version : values()) {
            if (version.protocolName.equals(protocolName)) {
                return version;
            }
        }
        return null;
    }
}
