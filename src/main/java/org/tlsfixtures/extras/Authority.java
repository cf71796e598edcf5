package org.tlsfixtures.extras;

/**
 * Distinguished-name parts of a {@link CertificateAuthority}'s root certificate and of the leaf certificates it
 * issues. The leaf common name is never part of this object; it comes from the {@link CertificateSubject}.
 */
public class Authority {

    private final String commonName;

    private final String organization;

    private final String organizationalUnitName;

    private final String certOrganization;

    private final String certOrganizationalUnitName;

    public Authority(String commonName, String organization,
            String organizationalUnitName, String certOrganization,
            String certOrganizationalUnitName) {
        this.commonName = commonName;
        this.organization = organization;
        this.organizationalUnitName = organizationalUnitName;
        this.certOrganization = certOrganization;
        this.certOrganizationalUnitName = certOrganizationalUnitName;
    }

    /**
     * Names used when the caller does not care: an obviously fake testing authority.
     */
    public static Authority testing() {
        return new Authority("TLS fixtures testing CA", "TLS fixtures",
                "Testing CA", "TLS fixtures", "Testing server");
    }

    public String commonName() {
        return commonName;
    }

    public String organization() {
        return organization;
    }

    public String organizationalUnitName() {
        return organizationalUnitName;
    }

    public String certOrganisation() {
        return certOrganization;
    }

    public String certOrganizationalUnitName() {
        return certOrganizationalUnitName;
    }

}
