package com.mimecast.wren.domain;

import com.google.common.net.InetAddresses;

import java.util.List;
import java.util.Locale;

/**
 * Stateless domain predicates.
 * <p>Classifies bracketed IP literal domains and reserved documentation/testing domains.
 * <p>No method here performs network access.
 */
public final class DomainClassifier {

    /**
     * Reserved full domains matched exactly.
     */
    private static final List<String> RESERVED_DOMAINS = List.of(
            "example.com",
            "example.net",
            "example.org",
            "example.edu",
            "localhost"
    );

    /**
     * Reserved TLDs matched on a label boundary.
     */
    private static final List<String> RESERVED_TLDS = List.of(
            "test",
            "example",
            "invalid",
            "localhost"
    );

    private static final String IPV6_PREFIX = "IPv6:";

    /**
     * Private constructor.
     */
    private DomainClassifier() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks if the domain is a bracketed IP address literal.
     * <p>Accepts {@code [192.0.2.1]}, {@code [::1]} and {@code [IPv6:2001:db8::1]}.
     * <p>Unbracketed addresses are not IP domains.
     *
     * @param domain Domain string.
     * @return Boolean.
     */
    public static boolean isIpDomain(String domain) {
        if (domain == null || domain.length() < 2) {
            return false;
        }

        if (!domain.startsWith("[") || !domain.endsWith("]")) {
            return false;
        }

        String literal = domain.substring(1, domain.length() - 1);
        if (literal.startsWith(IPV6_PREFIX)) {
            literal = literal.substring(IPV6_PREFIX.length());
        }

        return InetAddresses.isInetAddress(literal);
    }

    /**
     * Checks if the domain is reserved.
     * <p>Case insensitive. Full addresses are accepted and their domain part classified.
     *
     * @param domain Domain or address string.
     * @return Boolean.
     */
    public static boolean isReserved(String domain) {
        if (domain == null || domain.isEmpty()) {
            return false;
        }

        int at = domain.lastIndexOf('@');
        String candidate = (at >= 0 ? domain.substring(at + 1) : domain).toLowerCase(Locale.ROOT);

        if (RESERVED_DOMAINS.contains(candidate)) {
            return true;
        }

        for (String tld : RESERVED_TLDS) {
            if (candidate.equals(tld) || candidate.endsWith("." + tld)) {
                return true;
            }
        }

        return false;
    }
}
