package org.tlsfixtures.impl;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.Properties;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

public class TlsUtilsTest {

    @Test
    public void testSupportedProtocolsIncludeTls12() {
        assertThat(TlsUtils.supportedProtocols(), hasItem("TLSv1.2"));
    }

    @Test
    public void testFilterSupportedProtocolsKeepsOrder() {
        assertThat(TlsUtils.filterSupportedProtocols(ImmutableList.of("Bogus", "TLSv1.2", "TLSv1.3")),
                contains("TLSv1.2", "TLSv1.3"));
    }

    @Test
    public void testExtractWithDefaults() {
        Properties props = new Properties();
        props.setProperty("port", " 8443 ");
        props.setProperty("bad_port", "eighty");
        props.setProperty("timeout", "1500");
        props.setProperty("name", "  server ");
        props.setProperty("blank", "   ");

        assertEquals(8443, TlsUtils.extractInt(props, "port", 0));
        assertEquals(0, TlsUtils.extractInt(props, "bad_port", 0));
        assertEquals(1500L, TlsUtils.extractLong(props, "timeout", 1L));
        assertEquals(1L, TlsUtils.extractLong(props, "missing", 1L));
        assertEquals("server", TlsUtils.extractString(props, "name", "default"));
        assertEquals("default", TlsUtils.extractString(props, "blank", "default"));
    }

    @Test
    public void testExtractList() {
        Properties props = new Properties();
        props.setProperty("protocols", "TLSv1.2, TLSv1.3,,");

        assertThat(TlsUtils.extractList(props, "protocols"), contains("TLSv1.2", "TLSv1.3"));
        assertThat(TlsUtils.extractList(props, "missing"), empty());
    }
}
