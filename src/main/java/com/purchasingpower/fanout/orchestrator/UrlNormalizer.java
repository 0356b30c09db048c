package com.purchasingpower.fanout.orchestrator;

import com.google.common.net.InternetDomainName;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * URL canonicalization used as the dedup key: lowercase scheme and host, no trailing slash.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * @return the canonical form, or an empty string for a blank input
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String trimmed = url.trim();
        int schemeEnd = trimmed.indexOf("://");
        if (schemeEnd > 0) {
            int hostEnd = indexOfAny(trimmed, schemeEnd + 3, '/', '?', '#');
            String scheme = trimmed.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
            String host = trimmed.substring(schemeEnd + 3, hostEnd).toLowerCase(Locale.ROOT);
            trimmed = scheme + "://" + host + trimmed.substring(hostEnd);
        }
        while (trimmed.endsWith("/") && !trimmed.endsWith("://")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Host without a leading {@code www.}, or an empty string when the URL has no host.
     *
     * <p>URLs that are not strict RFC 2396 (spaces, {@code |} in the path) still yield their host
     * when the authority after the scheme is a valid domain name.
     */
    public static String domainOf(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String trimmed = url.trim();
        String host;
        try {
            host = new URI(trimmed).getHost();
        } catch (URISyntaxException e) {
            host = null;
        }
        if (host == null) {
            host = hostAfterScheme(trimmed);
        }
        if (host == null) {
            return "";
        }
        host = host.toLowerCase(Locale.ROOT);
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    private static String hostAfterScheme(String url) {
        int schemeEnd = url.indexOf("://");
        if (schemeEnd <= 0) {
            return null;
        }
        String authority = url.substring(schemeEnd + 3, indexOfAny(url, schemeEnd + 3, '/', '?', '#'));
        String host = authority.substring(authority.lastIndexOf('@') + 1);
        int port = host.indexOf(':');
        if (port >= 0) {
            host = host.substring(0, port);
        }
        host = host.toLowerCase(Locale.ROOT);
        return InternetDomainName.isValid(host) ? host : null;
    }

    private static int indexOfAny(String text, int from, char... chars) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            for (char candidate : chars) {
                if (c == candidate) {
                    return i;
                }
            }
        }
        return text.length();
    }
}
