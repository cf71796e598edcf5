package org.tlsfixtures.extras;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.net.InetAddresses;

import java.util.Objects;

/**
 * What an issued leaf certificate is valid for. The value always becomes the subject common name; the type decides
 * what goes into the Subject Alternative Name extension.
 */
public final class CertificateSubject {

    public enum Type {
        /** A DNS name SAN. */
        HOSTNAME,
        /** An IP address SAN. */
        IP_ADDRESS,
        /** No SAN extension at all, the name only appears as the common name. */
        COMMON_NAME_ONLY
    }

    private final Type type;
    private final String value;

    private CertificateSubject(Type type, String value) {
        this.type = type;
        this.value = value;
    }

    public static CertificateSubject hostname(String hostname) {
        Preconditions.checkArgument(hostname != null && !hostname.isEmpty(), "hostname must not be empty");
        Preconditions.checkArgument(!InetAddresses.isInetAddress(hostname),
                "%s is an IP literal, use ipAddress()", hostname);
        return new CertificateSubject(Type.HOSTNAME, hostname);
    }

    public static CertificateSubject ipAddress(String ipAddress) {
        Preconditions.checkArgument(ipAddress != null && InetAddresses.isInetAddress(ipAddress),
                "Not an IP literal: %s", ipAddress);
        return new CertificateSubject(Type.IP_ADDRESS, ipAddress);
    }

    public static CertificateSubject commonNameOnly(String commonName) {
        Preconditions.checkArgument(commonName != null && !commonName.isEmpty(), "commonName must not be empty");
        return new CertificateSubject(Type.COMMON_NAME_ONLY, commonName);
    }

    /**
     * Picks the SAN type from the string: IP literals get an IP address SAN, anything else a DNS name SAN.
     */
    public static CertificateSubject forHost(String host) {
        if (host != null && InetAddresses.isInetAddress(host)) {
            return ipAddress(host);
        }
        return hostname(host);
    }

    public Type getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public boolean hasSubjectAlternativeName() {
        return type != Type.COMMON_NAME_ONLY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CertificateSubject)) {
            return false;
        }
        CertificateSubject that = (CertificateSubject) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("type", type)
                .add("value", value)
                .toString();
    }
}
