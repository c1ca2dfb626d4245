package com.openaasx.harvester.harvest.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    public static URI parse(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(input.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            return uri.getHost() == null ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static String host(String url) {
        URI uri = parse(url);
        if (uri == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }

    public static String pathAndQuery(String url) {
        URI uri = parse(url);
        if (uri == null) {
            return "/";
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }

    public static boolean hasExtension(String url, String extension) {
        if (url == null) {
            return false;
        }
        return url.trim().toLowerCase(Locale.ROOT).endsWith("." + extension.toLowerCase(Locale.ROOT));
    }

    /**
     * Exact host or a proper subdomain of an allowed domain. An empty allowlist allows everything.
     */
    public static boolean isAllowedDomain(String url, Collection<String> allowedDomains) {
        if (allowedDomains == null || allowedDomains.isEmpty()) {
            return true;
        }
        String host = host(url);
        if (host == null) {
            return false;
        }
        for (String allowed : allowedDomains) {
            if (allowed == null || allowed.isBlank()) {
                continue;
            }
            String domain = allowed.trim().toLowerCase(Locale.ROOT);
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Last path segment of the URL, decoded, or {@code null} when the path has none.
     */
    public static String lastPathSegment(String url) {
        URI uri = parse(url);
        if (uri == null || uri.getRawPath() == null) {
            return null;
        }
        String path = uri.getRawPath();
        int idx = path.lastIndexOf('/');
        String segment = idx >= 0 ? path.substring(idx + 1) : path;
        if (segment.isBlank()) {
            return null;
        }
        try {
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return segment;
        }
    }

    /**
     * Reduces a filename hint to a single safe path component.
     */
    public static String safeFilename(String hint) {
        if (hint == null) {
            return null;
        }
        String name = hint.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = name.replaceAll("[\\x00-\\x1f:*?\"<>|]", "_");
        if (name.isBlank() || name.equals(".") || name.equals("..")) {
            return null;
        }
        return name;
    }
}
