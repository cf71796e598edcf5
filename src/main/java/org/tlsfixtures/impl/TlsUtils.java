package org.tlsfixtures.impl;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import javax.net.ssl.SSLContext;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Utilities for the TLS server and the capability probe.
 */
public class TlsUtils {

    private static final Splitter COMMA_SEPARATED_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private TlsUtils() {
    }

    /**
     * Returns the protocol names the default JSSE provider knows, whether or not they are enabled by policy. A
     * protocol missing here can never be negotiated.
     */
    public static Set<String> supportedProtocols() {
        try {
            return ImmutableSet.copyOf(SSLContext.getDefault().getSupportedSSLParameters().getProtocols());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("No default SSLContext available", e);
        }
    }

    /**
     * Keeps only the names in {@code protocols} that the provider supports, preserving order.
     */
    public static List<String> filterSupportedProtocols(List<String> protocols) {
        Set<String> supported = supportedProtocols();
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (String protocol : protocols) {
            if (supported.contains(protocol)) {
                builder.add(protocol);
            }
        }
        return builder.build();
    }

    public static int extractInt(final Properties props, final String key, int defaultValue) {
        final String value = props.getProperty(key);
        if (StringUtils.isNotBlank(value) && NumberUtils.isCreatable(value.trim())) {
            return Integer.parseInt(value.trim());
        }
        return defaultValue;
    }

    public static long extractLong(final Properties props, final String key, long defaultValue) {
        final String value = props.getProperty(key);
        if (StringUtils.isNotBlank(value) && NumberUtils.isCreatable(value.trim())) {
            return Long.parseLong(value.trim());
        }
        return defaultValue;
    }

    public static String extractString(final Properties props, final String key, String defaultValue) {
        final String value = props.getProperty(key);
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return defaultValue;
    }

    /**
     * Parses a comma-separated property into a list. Returns an empty list when the key is absent.
     */
    public static List<String> extractList(final Properties props, final String key) {
        final String value = props.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(COMMA_SEPARATED_SPLITTER.split(value));
    }
}
