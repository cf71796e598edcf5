package org.tlsfixtures.extras;

import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * PEM encoding of certificates and keys.
 */
final class PemUtils {

    private PemUtils() {
    }

    static String toPem(List<X509Certificate> certificates) {
        StringWriter sw = new StringWriter();
        try (JcaPEMWriter pw = new JcaPEMWriter(sw)) {
            for (X509Certificate certificate : certificates) {
                pw.writeObject(certificate);
            }
        } catch (IOException e) {
            throw new ProvisioningException("Unable to PEM-encode certificate", e);
        }
        return sw.toString();
    }

    /**
     * Encodes the key as an unencrypted PKCS#8 "PRIVATE KEY" block, which every TLS stack can read.
     */
    static String toPem(PrivateKey privateKey) {
        StringWriter sw = new StringWriter();
        try (JcaPEMWriter pw = new JcaPEMWriter(sw)) {
            pw.writeObject(new JcaPKCS8Generator(privateKey, null));
        } catch (IOException e) {
            throw new ProvisioningException("Unable to PEM-encode private key", e);
        }
        return sw.toString();
    }

    /**
     * Replaces the contents of the file, creating it if needed.
     */
    static void write(String pem, Path path) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.US_ASCII)) {
            writer.write(pem);
        } catch (IOException e) {
            throw new ProvisioningException("Unable to write " + path, e);
        }
    }
}
