package org.tlsfixtures.probe;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import java.util.Set;

import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.isIn;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;

public class TlsCapabilityProberTest {
    private static final Set<String> KNOWN_VERSIONS = ImmutableSet.of("TLSv1", "TLSv1.1", "TLSv1.2", "TLSv1.3");

    @Test
    public void testProbeFindsOnlyKnownVersions() {
        SupportedTlsVersions versions = new TlsCapabilityProber().probe();

        assertThat(versions.asSet(), everyItem(isIn(KNOWN_VERSIONS)));
        assertThat(versions.asSet(), hasItem("TLSv1.2"));
    }

    @Test
    public void testUndefinedVersionIsNeverReported() {
        SupportedTlsVersions versions = new TlsCapabilityProber(
                version -> version != TlsProtocolVersion.TLS_V1_2 && version.isDefined()).probe();

        assertThat(versions.asSet(), not(hasItem("TLSv1.2")));
        assertThat(versions.asSet(), everyItem(isIn(KNOWN_VERSIONS)));
    }

    @Test
    public void testNoDefinedCandidateFindsNothing() {
        // TLSv1.3 is only reachable through the generic selector, which is undefined here
        SupportedTlsVersions versions = new TlsCapabilityProber(
                version -> version == TlsProtocolVersion.TLS_V1_3).probe();

        assertThat(versions.asSet(), empty());
    }
}
