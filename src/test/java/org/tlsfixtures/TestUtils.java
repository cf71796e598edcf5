package org.tlsfixtures;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.conn.ssl.DefaultHostnameVerifier;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.ssl.SSLContextBuilder;
import org.apache.http.util.EntityUtils;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.Collection;

public class TestUtils {
    public static final RequestConfig REQUEST_TIMEOUT_CONFIG = RequestConfig.custom()
            .setConnectTimeout(5000)
            .setSocketTimeout(10000)
            .build();

    private TestUtils() {
    }

    /**
     * Loads a PEM certificate file into a key store usable as trust material.
     */
    public static KeyStore loadTrustStore(Path pemFile) throws Exception {
        KeyStore ks = KeyStore.getInstance(KeyStore.getDefaultType());
        ks.load(null, null);
        CertificateFactory cf = CertificateFactory.getInstance("X.509");
        try (InputStream is = Files.newInputStream(pemFile)) {
            int i = 0;
            for (Certificate cert : cf.generateCertificates(is)) {
                ks.setCertificateEntry("cert-" + i++, cert);
            }
        }
        return ks;
    }

    /**
     * Creates a client trusting only the given CA certificate, with standard hostname verification.
     */
    public static CloseableHttpClient buildHttpClient(Path caCertificate) throws Exception {
        return buildHttpClient(caCertificate, new DefaultHostnameVerifier());
    }

    public static CloseableHttpClient buildHttpClient(Path caCertificate, HostnameVerifier hostnameVerifier)
            throws Exception {
        return HttpClientBuilder.create()
                .setSSLContext(SSLContextBuilder.create()
                        .loadTrustMaterial(loadTrustStore(caCertificate), null)
                        .build())
                .setSSLHostnameVerifier(hostnameVerifier)
                .setDefaultRequestConfig(REQUEST_TIMEOUT_CONFIG)
                .disableAutomaticRetries()
                .build();
    }

    public static ResponseInfo get(CloseableHttpClient client, String url) throws Exception {
        try (CloseableHttpResponse response = client.execute(new HttpGet(url))) {
            return new ResponseInfo(response.getStatusLine().getStatusCode(),
                    EntityUtils.toString(response.getEntity()));
        }
    }

    /**
     * Hostname verification as RFC 6125 clients do it: the name must appear in a Subject Alternative Name, the
     * common name is never consulted. {@link DefaultHostnameVerifier} still falls back to the common name when a
     * certificate has no DNS SAN.
     */
    public static HostnameVerifier sanOnlyHostnameVerifier() {
        final DefaultHostnameVerifier delegate = new DefaultHostnameVerifier();
        return new HostnameVerifier() {
            @Override
            public boolean verify(String host, SSLSession session) {
                try {
                    X509Certificate cert = (X509Certificate) session.getPeerCertificates()[0];
                    Collection<?> sans = cert.getSubjectAlternativeNames();
                    return sans != null && !sans.isEmpty() && delegate.verify(host, session);
                } catch (SSLPeerUnverifiedException | CertificateParsingException e) {
                    return false;
                }
            }
        };
    }
}
