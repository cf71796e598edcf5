package org.tlsfixtures;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Collection;
import java.util.List;

/**
 * Loopback host forms used to parameterize server tests: a hostname, the IPv4 literal and the IPv6 literal.
 */
public final class LoopbackHosts {
    private static final Logger LOG = LoggerFactory.getLogger(LoopbackHosts.class);

    public static final String LOCALHOST = "localhost";
    public static final String IPV4_LOOPBACK = "127.0.0.1";
    public static final String IPV6_LOOPBACK = "::1";

    private static final List<String> ALL = ImmutableList.of(LOCALHOST, IPV4_LOOPBACK, IPV6_LOOPBACK);

    private static final Supplier<Boolean> HAS_IPV6 = Suppliers.memoize(LoopbackHosts::canBindIpv6Loopback);

    private LoopbackHosts() {
    }

    /**
     * All three host forms, IPv6 included even when the host has no IPv6. Fixtures for {@code ::1} skip on such hosts.
     */
    public static List<String> all() {
        return ALL;
    }

    /**
     * The host forms usable on this machine: {@link #all()} without {@code ::1} when IPv6 is unavailable.
     */
    public static List<String> available() {
        if (hasIpv6()) {
            return ALL;
        }
        return ImmutableList.of(LOCALHOST, IPV4_LOOPBACK);
    }

    /**
     * {@link #all()} shaped for JUnit's {@code Parameterized} runner.
     */
    public static Collection<Object[]> parameters() {
        ImmutableList.Builder<Object[]> builder = ImmutableList.builder();
        for (String host : ALL) {
            builder.add(new Object[] { host });
        }
        return builder.build();
    }

    /**
     * Whether a socket can be bound to {@code ::1}. Checked once per JVM.
     */
    public static boolean hasIpv6() {
        return HAS_IPV6.get();
    }

    /**
     * Gate for a loopback-parameterized fixture: skips {@code ::1} on hosts without IPv6.
     */
    public static SetupOutcome check(String host) {
        return check(host, hasIpv6());
    }

    /**
     * {@link #check(String)} against a given IPv6 availability instead of the detected one.
     */
    public static SetupOutcome check(String host, boolean ipv6Available) {
        if (IPV6_LOOPBACK.equals(host) && !ipv6Available) {
            return SetupOutcome.skip("Test requires IPv6 on loopback");
        }
        return SetupOutcome.proceed();
    }

    /**
     * Gate for fixtures that only make sense with IPv6.
     */
    public static SetupOutcome requireIpv6() {
        return requireIpv6(hasIpv6());
    }

    /**
     * {@link #requireIpv6()} against a given IPv6 availability instead of the detected one.
     */
    public static SetupOutcome requireIpv6(boolean ipv6Available) {
        if (!ipv6Available) {
            return SetupOutcome.skip("Only runs on IPv6 systems");
        }
        return SetupOutcome.proceed();
    }

    private static boolean canBindIpv6Loopback() {
        try (ServerSocket socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress(InetAddress.getByName(IPV6_LOOPBACK), 0));
            LOG.debug("IPv6 loopback is available");
            return true;
        } catch (IOException e) {
            LOG.info("IPv6 loopback is not available: {}", e.toString());
            return false;
        }
    }
}
