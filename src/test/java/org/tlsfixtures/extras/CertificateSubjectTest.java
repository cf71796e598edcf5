package org.tlsfixtures.extras;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CertificateSubjectTest {

    @Test
    public void testForHostPicksSanType() {
        assertEquals(CertificateSubject.Type.HOSTNAME, CertificateSubject.forHost("localhost").getType());
        assertEquals(CertificateSubject.Type.IP_ADDRESS, CertificateSubject.forHost("127.0.0.1").getType());
        assertEquals(CertificateSubject.Type.IP_ADDRESS, CertificateSubject.forHost("::1").getType());
    }

    @Test
    public void testCommonNameOnlyHasNoSan() {
        CertificateSubject subject = CertificateSubject.commonNameOnly("localhost");
        assertFalse(subject.hasSubjectAlternativeName());
        assertEquals("localhost", subject.getValue());
        assertTrue(CertificateSubject.hostname("localhost").hasSubjectAlternativeName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testHostnameRejectsIpLiteral() {
        CertificateSubject.hostname("127.0.0.1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIpAddressRejectsHostname() {
        CertificateSubject.ipAddress("localhost");
    }

    @Test
    public void testEquality() {
        assertEquals(CertificateSubject.hostname("localhost"), CertificateSubject.forHost("localhost"));
        assertFalse(CertificateSubject.hostname("localhost").equals(CertificateSubject.commonNameOnly("localhost")));
    }
}
