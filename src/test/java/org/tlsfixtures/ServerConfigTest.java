package org.tlsfixtures;

import org.junit.Test;

import java.nio.file.Paths;

import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThat;

public class ServerConfigTest {

    @Test
    public void testBaseUrlForHostname() {
        ServerConfig config = new ServerConfig("https", "localhost", 8443, Paths.get("ca.pem"));
        assertEquals("https://localhost:8443", config.getBaseUrl());
    }

    @Test
    public void testBaseUrlForIpv4() {
        ServerConfig config = new ServerConfig("https", "127.0.0.1", 443, Paths.get("ca.pem"));
        assertEquals("https://127.0.0.1:443", config.getBaseUrl());
    }

    @Test
    public void testBaseUrlBracketsIpv6() {
        ServerConfig config = new ServerConfig("https", "::1", 8443, Paths.get("ca.pem"));
        assertEquals("https://[::1]:8443", config.getBaseUrl());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsPortZero() {
        new ServerConfig("https", "localhost", 0, Paths.get("ca.pem"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsPortAboveRange() {
        new ServerConfig("https", "localhost", 65536, Paths.get("ca.pem"));
    }

    @Test
    public void testEqualityAndToString() {
        ServerConfig a = new ServerConfig("https", "localhost", 8443, Paths.get("ca.pem"));
        ServerConfig b = new ServerConfig("https", "localhost", 8443, Paths.get("ca.pem"));
        ServerConfig c = new ServerConfig("https", "localhost", 8444, Paths.get("ca.pem"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertThat(a.toString(), containsString("8443"));
    }
}
