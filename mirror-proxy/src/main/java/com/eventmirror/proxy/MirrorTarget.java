package com.eventmirror.proxy;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * The outbound request the mirror copies: a host and a path.
 *
 * <h3>Matching</h3>
 * <ul>
 * <li>host: exact, case-insensitive; any port is ignored</li>
 * <li>path: exact, unless it ends with {@code *}, which makes it a prefix
 * ({@code /v1/*} matches {@code /v1/batch})</li>
 * <li>query strings are ignored</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class MirrorTarget {

    private static final String WILDCARD = "*";

    private final String host;
    private final String path;

    private MirrorTarget(String host, String path) {
        this.host = host.toLowerCase(Locale.ROOT);
        this.path = path;
    }

    /**
     * @param host target host without port, e.g. {@code api.analytics.example}
     * @param path absolute path, optionally ending in {@code *}
     * @return validated target
     * @throws IllegalArgumentException if the host is blank or the path does
     *                                  not start with {@code /}
     */
    public static MirrorTarget of(String host, String path) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Target host must not be null or blank");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Target path must start with '/', got: " + path);
        }
        if (path.indexOf('*') >= 0 && path.indexOf('*') != path.length() - 1) {
            throw new IllegalArgumentException("Wildcard is only allowed at the end of the path, got: " + path);
        }
        return new MirrorTarget(host.trim(), path);
    }

    /**
     * @param uri absolute request URI
     * @return {@code true} if the request should be mirrored
     */
    public boolean matches(URI uri) {
        return uri != null && matches(uri.getHost(), uri.getRawPath());
    }

    /**
     * @param requestHost host as seen on the request, possibly with a port
     * @param requestPath request path, possibly with a query string
     * @return {@code true} if the request should be mirrored
     */
    public boolean matches(String requestHost, String requestPath) {
        if (requestHost == null) {
            return false;
        }
        if (!host.equals(stripPort(requestHost).toLowerCase(Locale.ROOT))) {
            return false;
        }
        String actualPath = stripQuery(requestPath);
        if (isPrefix()) {
            return actualPath.startsWith(path.substring(0, path.length() - 1));
        }
        return actualPath.equals(path);
    }

    public String getHost() {
        return host;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return {@code true} if the path ends with {@code *}
     */
    public boolean isPrefix() {
        return path.endsWith(WILDCARD);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String stripPort(String hostAndPort) {
        String value = hostAndPort.trim();
        if (value.startsWith("[")) {
            int end = value.indexOf(']');
            return end > 0 ? value.substring(0, end + 1) : value;
        }
        int colon = value.indexOf(':');
        // more than one colon is a bare IPv6 literal
        if (colon >= 0 && colon == value.lastIndexOf(':')) {
            return value.substring(0, colon);
        }
        return value;
    }

    private static String stripQuery(String requestPath) {
        if (requestPath == null || requestPath.isEmpty()) {
            return "/";
        }
        int query = requestPath.indexOf('?');
        return query >= 0 ? requestPath.substring(0, query) : requestPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MirrorTarget that))
            return false;
        return host.equals(that.host) && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, path);
    }

    @Override
    public String toString() {
        return host + path;
    }
}
