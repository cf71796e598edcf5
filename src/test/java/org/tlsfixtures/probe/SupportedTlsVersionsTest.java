package org.tlsfixtures.probe;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class SupportedTlsVersionsTest {

    @Test
    public void testProbedOncePerJvm() {
        assertSame(SupportedTlsVersions.get(), SupportedTlsVersions.get());
    }

    @Test
    public void testContains() {
        SupportedTlsVersions versions = SupportedTlsVersions.of("TLSv1.2", "TLSv1.3");

        assertTrue(versions.contains("TLSv1.2"));
        assertTrue(versions.contains(TlsProtocolVersion.TLS_V1_3));
        assertFalse(versions.contains(TlsProtocolVersion.TLS_V1));
        assertFalse(versions.contains("TLS"));
    }
}
