package org.tlsfixtures.junit;

import org.apache.http.impl.client.CloseableHttpClient;
import org.junit.ClassRule;
import org.junit.Test;
import org.tlsfixtures.ServerConfig;
import org.tlsfixtures.TestUtils;

import static org.junit.Assert.assertEquals;

public class IpSanServerTest {

    @ClassRule
    public static final TlsServerRule SERVER = TlsServerRule.ipSanServer();

    @Test
    public void testIpv4Literal() throws Exception {
        ServerConfig config = SERVER.getConfig();
        assertEquals("127.0.0.1", config.getHost());
        assertEquals("https://127.0.0.1:" + config.getPort(), config.getBaseUrl());

        try (CloseableHttpClient client = TestUtils.buildHttpClient(config.getCaCertPath())) {
            assertEquals(200, TestUtils.get(client, config.getBaseUrl() + "/").getStatusCode());
        }
    }
}
