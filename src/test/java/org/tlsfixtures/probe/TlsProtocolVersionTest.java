package org.tlsfixtures.probe;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TlsProtocolVersionTest {

    @Test
    public void testProtocolNames() {
        assertEquals("TLSv1", TlsProtocolVersion.TLS_V1.protocolName());
        assertEquals("TLSv1.1", TlsProtocolVersion.TLS_V1_1.protocolName());
        assertEquals("TLSv1.2", TlsProtocolVersion.TLS_V1_2.protocolName());
        assertEquals("TLSv1.3", TlsProtocolVersion.TLS_V1_3.protocolName());
        assertEquals("TLS", TlsProtocolVersion.TLS.protocolName());
    }

    @Test
    public void testFromProtocolName() {
        assertEquals(TlsProtocolVersion.TLS_V1_2, TlsProtocolVersion.fromProtocolName("TLSv1.2"));
        assertNull(TlsProtocolVersion.fromProtocolName("SSLv3"));
    }

    @Test
    public void testOnlyTlsIsGeneric() {
        assertTrue(TlsProtocolVersion.TLS.isGeneric());
        assertFalse(TlsProtocolVersion.TLS_V1_2.isGeneric());
    }

    @Test
    public void testCommonVersionsAreDefined() {
        assertTrue(TlsProtocolVersion.TLS.isDefined());
        assertTrue(TlsProtocolVersion.TLS_V1_2.isDefined());
    }
}
