package com.eventmirror.proxy;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable copy of a proxied request as the {@link RequestHook} sees it.
 *
 * <p>
 * Header names are looked up case-insensitively. The body is copied on the
 * way in and on every read.
 * </p>
 *
 * @since 1.0.0
 */
public final class InterceptedRequest {

    private final String method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final byte[] body;

    public InterceptedRequest(String method, URI uri, Map<String, List<String>> headers, byte[] body) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.uri = Objects.requireNonNull(uri, "uri must not be null");
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body != null ? body.clone() : new byte[0];
    }

    public String getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    /**
     * @return host of the request URI, or of the {@code Host} header when the
     *         URI carries none; may include a port in the latter case
     */
    public String getHost() {
        if (uri.getHost() != null) {
            return uri.getHost();
        }
        return header("Host").orElse(null);
    }

    /**
     * @return raw request path, never empty
     */
    public String getPath() {
        String path = uri.getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    /**
     * @param name header name, any case
     * @return the first value of the header, if present
     */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public byte[] getBody() {
        return body.clone();
    }

    public int getBodyLength() {
        return body.length;
    }

    @Override
    public String toString() {
        return method + " " + uri + " (" + body.length + " byte(s))";
    }
}
