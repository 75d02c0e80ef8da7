package com.eventmirror.proxy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * HTTP/1.1 request reading and response writing over raw streams.
 *
 * <p>
 * Covers what a forward proxy meets on the client side: request lines in
 * absolute, origin and authority form, bodies framed by
 * {@code Content-Length} or chunked transfer coding, and
 * {@code Expect: 100-continue}. Anything else is rejected with a
 * {@link MalformedMessageException}.
 * </p>
 *
 * @since 1.0.0
 */
final class HttpMessages {

    static final int MAX_LINE_LENGTH = 16 * 1024;
    static final int MAX_HEADER_COUNT = 256;
    static final int MAX_BODY_BYTES = 64 * 1024 * 1024;

    private HttpMessages() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Reading
    // ---------------------------------------------------------------

    /**
     * Read a request line and its header fields.
     *
     * @param in client stream, positioned at a message boundary
     * @return the request head, or {@code null} if the stream ended cleanly
     *         before a new request started
     * @throws MalformedMessageException if the head is not valid HTTP/1.x
     */
    static RequestHead readHead(InputStream in) throws IOException {
        String line = readLine(in);
        while (line != null && line.isEmpty()) {
            line = readLine(in);
        }
        if (line == null) {
            return null;
        }

        String[] parts = line.split(" ");
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || !parts[2].startsWith("HTTP/1.")) {
            throw new MalformedMessageException("Bad request line: " + abbreviate(line));
        }

        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        int count = 0;
        String field;
        while (!(field = requireLine(in)).isEmpty()) {
            if (++count > MAX_HEADER_COUNT) {
                throw new MalformedMessageException("More than " + MAX_HEADER_COUNT + " header fields");
            }
            int colon = field.indexOf(':');
            if (colon <= 0 || Character.isWhitespace(field.charAt(0))
                    || Character.isWhitespace(field.charAt(colon - 1))) {
                throw new MalformedMessageException("Bad header field: " + abbreviate(field));
            }
            headers.computeIfAbsent(field.substring(0, colon), k -> new ArrayList<>())
                    .add(field.substring(colon + 1).trim());
        }
        return new RequestHead(parts[0], parts[1], parts[2], headers);
    }

    /**
     * Read the body that follows {@code head}. Chunked bodies are decoded
     * and their trailer fields discarded.
     *
     * @return the body bytes; empty when the request carries none
     * @throws MalformedMessageException if the framing is invalid or the body
     *                                   exceeds {@value #MAX_BODY_BYTES} bytes
     */
    static byte[] readBody(InputStream in, RequestHead head) throws IOException {
        List<String> codings = head.headers("Transfer-Encoding");
        if (!codings.isEmpty()) {
            Set<String> tokens = tokens(codings);
            if (tokens.size() != 1 || !tokens.contains("chunked")) {
                throw new MalformedMessageException("Unsupported transfer coding: " + codings);
            }
            return readChunked(in);
        }

        List<String> lengths = head.headers("Content-Length");
        if (lengths.isEmpty()) {
            return new byte[0];
        }
        long length = contentLength(lengths);
        if (length > MAX_BODY_BYTES) {
            throw new MalformedMessageException("Body of " + length + " bytes exceeds " + MAX_BODY_BYTES);
        }
        byte[] body = in.readNBytes((int) length);
        if (body.length < length) {
            throw new MalformedMessageException("Body ended after " + body.length + " of " + length + " bytes");
        }
        return body;
    }

    private static byte[] readChunked(InputStream in) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        while (true) {
            String sizeLine = requireLine(in);
            int extension = sizeLine.indexOf(';');
            String hex = (extension >= 0 ? sizeLine.substring(0, extension) : sizeLine).trim();
            long size;
            try {
                size = Long.parseLong(hex, 16);
            } catch (NumberFormatException e) {
                throw new MalformedMessageException("Bad chunk size: " + abbreviate(sizeLine));
            }
            if (size < 0) {
                throw new MalformedMessageException("Bad chunk size: " + abbreviate(sizeLine));
            }
            if (size == 0) {
                break;
            }
            if (body.size() + size > MAX_BODY_BYTES) {
                throw new MalformedMessageException("Chunked body exceeds " + MAX_BODY_BYTES + " bytes");
            }
            byte[] chunk = in.readNBytes((int) size);
            if (chunk.length < size) {
                throw new MalformedMessageException("Chunk ended after " + chunk.length + " of " + size + " bytes");
            }
            body.write(chunk);
            if (!requireLine(in).isEmpty()) {
                throw new MalformedMessageException("Missing CRLF after chunk data");
            }
        }
        String trailer;
        do {
            trailer = requireLine(in);
        } while (!trailer.isEmpty());
        return body.toByteArray();
    }

    private static long contentLength(List<String> values) throws MalformedMessageException {
        long length = -1;
        for (String value : values) {
            for (String item : value.split(",")) {
                String digits = item.trim();
                if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit) || digits.length() > 18) {
                    throw new MalformedMessageException("Bad Content-Length: " + values);
                }
                long parsed = Long.parseLong(digits);
                if (length >= 0 && parsed != length) {
                    throw new MalformedMessageException("Conflicting Content-Length values: " + values);
                }
                length = parsed;
            }
        }
        return length;
    }

    /**
     * @return the line without its CRLF or LF, or {@code null} on end of
     *         stream before the first byte
     */
    static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                byte[] bytes = line.toByteArray();
                int length = bytes.length > 0 && bytes[bytes.length - 1] == '\r' ? bytes.length - 1 : bytes.length;
                return new String(bytes, 0, length, StandardCharsets.ISO_8859_1);
            }
            if (line.size() >= MAX_LINE_LENGTH) {
                throw new MalformedMessageException("Line longer than " + MAX_LINE_LENGTH + " bytes");
            }
            line.write(b);
        }
        if (line.size() > 0) {
            throw new MalformedMessageException("Stream ended inside a line");
        }
        return null;
    }

    private static String requireLine(InputStream in) throws IOException {
        String line = readLine(in);
        if (line == null) {
            throw new MalformedMessageException("Stream ended inside a message");
        }
        return line;
    }

    // ---------------------------------------------------------------
    // Writing
    // ---------------------------------------------------------------

    static void writeHead(OutputStream out, int status, Map<String, List<String>> headers) throws IOException {
        StringBuilder head = new StringBuilder(256)
                .append("HTTP/1.1 ").append(status).append(' ').append(reason(status)).append("\r\n");
        headers.forEach((name, values) -> values.forEach(
                value -> head.append(name).append(": ").append(value).append("\r\n")));
        head.append("\r\n");
        out.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Write a complete {@code text/plain} response and flush.
     *
     * @param close whether to announce {@code Connection: close}
     */
    static void writeText(OutputStream out, int status, String message, boolean close) throws IOException {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Content-Type", List.of("text/plain; charset=utf-8"));
        headers.put("Content-Length", List.of(String.valueOf(body.length)));
        if (close) {
            headers.put("Connection", List.of("close"));
        }
        writeHead(out, status, headers);
        out.write(body);
        out.flush();
    }

    static void writeContinue(OutputStream out) throws IOException {
        out.write("HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
    }

    static void writeConnectionEstablished(OutputStream out) throws IOException {
        out.write("HTTP/1.1 200 Connection Established\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
    }

    static String reason(int status) {
        return switch (status) {
            case 100 -> "Continue";
            case 200 -> "OK";
            case 201 -> "Created";
            case 202 -> "Accepted";
            case 204 -> "No Content";
            case 206 -> "Partial Content";
            case 301 -> "Moved Permanently";
            case 302 -> "Found";
            case 303 -> "See Other";
            case 304 -> "Not Modified";
            case 307 -> "Temporary Redirect";
            case 308 -> "Permanent Redirect";
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 405 -> "Method Not Allowed";
            case 408 -> "Request Timeout";
            case 409 -> "Conflict";
            case 413 -> "Payload Too Large";
            case 415 -> "Unsupported Media Type";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 501 -> "Not Implemented";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "";
        };
    }

    // ---------------------------------------------------------------
    // Header helpers
    // ---------------------------------------------------------------

    /**
     * Split comma-separated header values into lower-case tokens.
     *
     * @param values header values, may be {@code null}
     * @return the non-blank tokens
     */
    static Set<String> tokens(List<String> values) {
        Set<String> tokens = new HashSet<>();
        if (values != null) {
            for (String value : values) {
                for (String token : value.split(",")) {
                    if (!token.isBlank()) {
                        tokens.add(token.trim().toLowerCase(Locale.ROOT));
                    }
                }
            }
        }
        return tokens;
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }

    // ---------------------------------------------------------------
    // Types
    // ---------------------------------------------------------------

    /**
     * Request line plus header fields. Header names are looked up
     * case-insensitively.
     */
    static final class RequestHead {
        private final String method;
        private final String target;
        private final String version;
        private final Map<String, List<String>> headers;

        RequestHead(String method, String target, String version, Map<String, List<String>> headers) {
            this.method = method;
            this.target = target;
            this.version = version;
            this.headers = Collections.unmodifiableMap(headers);
        }

        String getMethod() {
            return method;
        }

        /**
         * @return the request target exactly as sent
         */
        String getTarget() {
            return target;
        }

        String getVersion() {
            return version;
        }

        Map<String, List<String>> getHeaders() {
            return headers;
        }

        List<String> headers(String name) {
            return headers.getOrDefault(name, List.of());
        }

        Optional<String> header(String name) {
            List<String> values = headers(name);
            return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
        }

        boolean isConnect() {
            return "CONNECT".equalsIgnoreCase(method);
        }

        boolean expectsContinue() {
            return header("Expect").map(v -> v.equalsIgnoreCase("100-continue")).orElse(false);
        }

        /**
         * HTTP/1.1 connections persist unless {@code close} is requested;
         * HTTP/1.0 ones only when {@code keep-alive} is.
         */
        boolean isKeepAlive() {
            Set<String> tokens = tokens(headers("Connection"));
            tokens.addAll(tokens(headers("Proxy-Connection")));
            if (tokens.contains("close")) {
                return false;
            }
            return !"HTTP/1.0".equals(version) || tokens.contains("keep-alive");
        }

        @Override
        public String toString() {
            return method + " " + target + " " + version;
        }
    }

    /**
     * The client sent something that is not a valid HTTP/1.x request.
     */
    static class MalformedMessageException extends IOException {

        private static final long serialVersionUID = 1L;

        MalformedMessageException(String message) {
            super(message);
        }
    }
}
