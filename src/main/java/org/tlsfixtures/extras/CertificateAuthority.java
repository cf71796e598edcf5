package org.tlsfixtures.extras;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.asn1.x509.SubjectKeyIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.bc.BcX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.Date;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An in-memory certificate authority for tests. Holds a freshly generated RSA root key and self-signed root
 * certificate, and issues leaf certificates whose Subject Alternative Name is controlled by the caller through a
 * {@link CertificateSubject}.
 *
 * <p>
 * Nothing is persisted: the root key only lives as long as this object. {@link #export(LeafCertificate, Path)}
 * writes the root certificate and a leaf's chain and key as PEM files, which is all a server and a client under
 * test need.
 * </p>
 *
 * <pre>
 * CertificateAuthority ca = CertificateAuthority.create();
 * LeafCertificate leaf = ca.issue(CertificateSubject.forHost("127.0.0.1"));
 * CertificateFiles files = ca.export(leaf, directory);
 * </pre>
 */
public class CertificateAuthority {

    private static final Logger LOG = LoggerFactory
            .getLogger(CertificateAuthority.class);

    private static final String KEY_ALGORITHM = "RSA";
    private static final int ROOT_KEYSIZE = 2048;
    private static final int LEAF_KEYSIZE = 2048;
    private static final String SIGNATURE_ALGORITHM = "SHA256WithRSAEncryption";

    private static final long ONE_DAY_MS = TimeUnit.DAYS.toMillis(1);

    /**
     * Root and leaves only have to outlive a test run. A day of backdating absorbs clock skew.
     */
    private static final int ROOT_VALIDITY_DAYS = 3650;
    private static final int LEAF_VALIDITY_DAYS = 825;

    private static final SecureRandom RANDOM = new SecureRandom();

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private final Authority authority;

    private final PrivateKey caPrivKey;

    private final X509Certificate caCert;

    /**
     * Serial numbers must differ between leaves of the same CA, or clients that cache certificates by issuer and
     * serial get confused.
     */
    private final AtomicLong serverCertificateSerial;

    private CertificateAuthority(Authority authority) throws GeneralSecurityException,
            OperatorCreationException, IOException {
        this.authority = authority;
        this.serverCertificateSerial = initRandomSerial(RANDOM);

        Stopwatch stopwatch = Stopwatch.createStarted();
        KeyPair keypair = createKeyPair(ROOT_KEYSIZE);
        this.caPrivKey = keypair.getPrivate();
        this.caCert = createRootCertificate(keypair);
        LOG.debug("Created root certificate authority '{}' in {}", authority.commonName(), stopwatch);
    }

    /**
     * Creates a certificate authority with a new root key and self-signed root certificate.
     *
     * @throws ProvisioningException if key or certificate generation fails
     */
    public static CertificateAuthority create() {
        return create(Authority.testing());
    }

    public static CertificateAuthority create(Authority authority) {
        Preconditions.checkNotNull(authority, "authority");
        try {
            return new CertificateAuthority(authority);
        } catch (GeneralSecurityException | OperatorCreationException | IOException e) {
            throw new ProvisioningException("Unable to create root certificate authority", e);
        }
    }

    public X509Certificate getCertificate() {
        return caCert;
    }

    public String getCertificatePem() {
        return PemUtils.toPem(Collections.singletonList(caCert));
    }

    /**
     * Returns an in-memory key store containing only the root certificate, for clients that take a
     * {@link KeyStore} as their trust material.
     */
    public KeyStore trustStore() {
        try {
            KeyStore ks = KeyStore.getInstance(KeyStore.getDefaultType());
            ks.load(null, null);
            ks.setCertificateEntry("ca", caCert);
            return ks;
        } catch (GeneralSecurityException | IOException e) {
            throw new ProvisioningException("Unable to build trust store", e);
        }
    }

    /**
     * Issues a leaf certificate for the given subject, signed by this authority's root. The subject value becomes the
     * common name. Hostname and IP subjects also get a matching Subject Alternative Name; common-name-only subjects get
     * no SAN extension, so clients doing SAN-based verification reject them.
     *
     * @throws ProvisioningException if key or certificate generation fails
     */
    public LeafCertificate issue(CertificateSubject subject) {
        Preconditions.checkNotNull(subject, "subject");
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            KeyPair keypair = createKeyPair(LEAF_KEYSIZE);
            X509Certificate cert = createLeafCertificate(subject, keypair.getPublic());
            LOG.info("Issued certificate for {} in {}", subject, stopwatch);
            return new LeafCertificate(subject, keypair.getPrivate(), cert, caCert);
        } catch (GeneralSecurityException | OperatorCreationException | IOException e) {
            throw new ProvisioningException("Unable to issue certificate for " + subject, e);
        }
    }

    /**
     * Writes the root certificate, the leaf's chain and the leaf's private key as PEM into {@code directory}, under
     * the names of {@link CertificateFiles#in(Path)}. Existing files are replaced, never appended to.
     *
     * @throws ProvisioningException if the directory cannot be created or a file cannot be written
     */
    public CertificateFiles export(LeafCertificate leaf, Path directory) {
        Preconditions.checkNotNull(leaf, "leaf");
        Preconditions.checkArgument(leaf.getChain().get(1).equals(caCert),
                "Certificate for %s was not issued by this authority", leaf.getSubject());
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ProvisioningException("Unable to create " + directory, e);
        }

        CertificateFiles files = CertificateFiles.in(directory);
        PemUtils.write(getCertificatePem(), files.getCaCertificate());
        PemUtils.write(leaf.getChainPem(), files.getServerCertificateChain());
        PemUtils.write(leaf.getPrivateKeyPem(), files.getServerPrivateKey());
        LOG.debug("Exported certificate for {} to {}", leaf.getSubject(), directory);
        return files;
    }

    private X509Certificate createRootCertificate(KeyPair keypair) throws GeneralSecurityException,
            OperatorCreationException, IOException {
        final Date startDate = new Date(System.currentTimeMillis() - ONE_DAY_MS);
        final Date expireDate = new Date(startDate.getTime() + ROOT_VALIDITY_DAYS * ONE_DAY_MS);

        final PublicKey pubKey = keypair.getPublic();

        X500NameBuilder namebld = new X500NameBuilder(BCStyle.INSTANCE);
        namebld.addRDN(BCStyle.CN, authority.commonName());
        namebld.addRDN(BCStyle.O, authority.organization());
        namebld.addRDN(BCStyle.OU, authority.organizationalUnitName());
        X500Name name = namebld.build();

        X509v3CertificateBuilder certGen = new JcaX509v3CertificateBuilder(
                name, newRootSerial(RANDOM), startDate,
                expireDate, name, pubKey);

        certGen.addExtension(Extension.subjectKeyIdentifier, false,
                createSubjectKeyIdentifier(pubKey));
        certGen.addExtension(Extension.basicConstraints, true,
                new BasicConstraints(true));
        certGen.addExtension(Extension.keyUsage, true, new KeyUsage(
                KeyUsage.keyCertSign | KeyUsage.digitalSignature | KeyUsage.cRLSign));

        return sign(certGen);
    }

    private X509Certificate createLeafCertificate(CertificateSubject subject, PublicKey pubKey)
            throws GeneralSecurityException, OperatorCreationException, IOException {
        X500NameBuilder namebld = new X500NameBuilder(BCStyle.INSTANCE);
        namebld.addRDN(BCStyle.CN, subject.getValue());
        namebld.addRDN(BCStyle.O, authority.certOrganisation());
        namebld.addRDN(BCStyle.OU, authority.certOrganizationalUnitName());

        BigInteger serial = BigInteger.valueOf(serverCertificateSerial.getAndIncrement());
        Date notBefore = new Date(System.currentTimeMillis() - ONE_DAY_MS);
        Date notAfter = new Date(notBefore.getTime() + LEAF_VALIDITY_DAYS * ONE_DAY_MS);
        X509v3CertificateBuilder certGen = new JcaX509v3CertificateBuilder(
                caCert, serial, notBefore, notAfter, namebld.build(), pubKey);

        JcaX509ExtensionUtils extensionUtils = new JcaX509ExtensionUtils();
        certGen.addExtension(Extension.subjectKeyIdentifier, false,
                createSubjectKeyIdentifier(pubKey));
        certGen.addExtension(Extension.authorityKeyIdentifier, false,
                extensionUtils.createAuthorityKeyIdentifier(caCert));
        certGen.addExtension(Extension.basicConstraints, true,
                new BasicConstraints(false));
        certGen.addExtension(Extension.keyUsage, true, new KeyUsage(
                KeyUsage.digitalSignature | KeyUsage.keyEncipherment));

        ASN1EncodableVector eku = new ASN1EncodableVector();
        eku.add(KeyPurposeId.id_kp_serverAuth);
        eku.add(KeyPurposeId.id_kp_clientAuth);
        certGen.addExtension(Extension.extendedKeyUsage, false, new DERSequence(eku));

        addSubjectAlternativeName(certGen, subject);

        X509Certificate cert = sign(certGen);
        cert.checkValidity(new Date());
        cert.verify(caCert.getPublicKey());
        return cert;
    }

    private static void addSubjectAlternativeName(X509v3CertificateBuilder certGen, CertificateSubject subject)
            throws CertIOException {
        final int tag;
        switch (subject.getType()) {
            case HOSTNAME:
                tag = GeneralName.dNSName;
                break;
            case IP_ADDRESS:
                tag = GeneralName.iPAddress;
                break;
            case COMMON_NAME_ONLY:
                return;
            default:
                throw new IllegalArgumentException("Unknown subject type: " + subject.getType());
        }
        DERSequence san = new DERSequence(new GeneralName(tag, subject.getValue()));
        certGen.addExtension(Extension.subjectAlternativeName, false, san);
    }

    private X509Certificate sign(X509v3CertificateBuilder certGen) throws GeneralSecurityException,
            OperatorCreationException {
        final ContentSigner sigGen = new JcaContentSignerBuilder(
                SIGNATURE_ALGORITHM).setProvider(BouncyCastleProvider.PROVIDER_NAME).build(caPrivKey);
        return new JcaX509CertificateConverter()
                .setProvider(BouncyCastleProvider.PROVIDER_NAME).getCertificate(certGen.build(sigGen));
    }

    private static SubjectKeyIdentifier createSubjectKeyIdentifier(PublicKey pub) {
        SubjectPublicKeyInfo info = SubjectPublicKeyInfo.getInstance(pub.getEncoded());
        return new BcX509ExtensionUtils().createSubjectKeyIdentifier(info);
    }

    private static KeyPair createKeyPair(int keysize) throws NoSuchAlgorithmException {
        final KeyPairGenerator keyGen = KeyPairGenerator.getInstance(KEY_ALGORITHM);
        keyGen.initialize(keysize, RANDOM);
        return keyGen.generateKeyPair();
    }

    /**
     * Serial numbers must be positive, so zero is never handed out.
     */
    static BigInteger newRootSerial(SecureRandom random) {
        return new BigInteger(64, random).add(BigInteger.ONE);
    }

    static AtomicLong initRandomSerial(SecureRandom random) {
        // 48 random bits plus one, leaving 15 bits of headroom for increments while staying positive
        long sl = (random.nextLong() & 0x0000FFFFFFFFFFFFL) + 1;
        return new AtomicLong(sl);
    }
}
