package io.pockethive.httpmock.model;

import io.netty.handler.codec.http.QueryStringDecoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable snapshot of an HTTP request received by the mock server.
 * <p>
 * Header names are case-insensitive; the casing of the first occurrence is kept for display. Values keep
 * the order in which they arrived. The body is copied on the way in and on the way out so a recorded
 * request can never change after it has been logged.
 */
public final class RecordedRequest {

    private final long sequence;
    private final String method;
    private final String path;
    private final String query;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final Instant receivedAt;
    private final String remoteAddress;

    private RecordedRequest(Builder builder) {
        this.sequence = builder.sequence;
        this.method = requireText(builder.method, "method");
        this.path = Objects.requireNonNull(builder.path, "path");
        this.query = builder.query == null ? "" : builder.query;
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        builder.headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(copy);
        this.body = builder.body.clone();
        this.receivedAt = Objects.requireNonNull(builder.receivedAt, "receivedAt");
        this.remoteAddress = builder.remoteAddress == null ? "unknown" : builder.remoteAddress;
    }

    public static Builder builder(String method, String uri) {
        return new Builder(method, uri);
    }

    /**
     * Position of the request in the arrival order of the server that received it, starting at 1.
     */
    public long sequence() {
        return sequence;
    }

    public String method() {
        return method;
    }

    /**
     * Request path without the query string, exactly as received; empty for a request target such as
     * {@code ?a=1}.
     */
    public String path() {
        return path;
    }

    /**
     * Raw query string without the leading {@code ?}; empty when the request had none.
     */
    public String query() {
        return query;
    }

    public String uri() {
        return query.isEmpty() ? path : path + "?" + query;
    }

    /**
     * Returns all headers keyed case-insensitively.
     */
    public Map<String, List<String>> headers() {
        return headers;
    }

    public List<String> headerValues(String name) {
        List<String> values = headers.get(name);
        return values == null ? List.of() : values;
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public Map<String, List<String>> queryParameters() {
        if (query.isEmpty()) {
            return Map.of();
        }
        return new QueryStringDecoder(query, StandardCharsets.UTF_8, false).parameters();
    }

    public Optional<String> queryParameter(String name) {
        List<String> values = queryParameters().get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /**
     * Returns a copy of the raw body bytes.
     */
    public byte[] body() {
        return body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    /**
     * Decodes the body using the charset announced in {@code Content-Type}, falling back to UTF-8.
     */
    public String bodyAsString() {
        return new String(body, charset());
    }

    public Instant receivedAt() {
        return receivedAt;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    private Charset charset() {
        return header("Content-Type")
            .flatMap(RecordedRequest::charsetParameter)
            .orElse(StandardCharsets.UTF_8);
    }

    private static Optional<Charset> charsetParameter(String contentType) {
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.regionMatches(true, 0, "charset=", 0, 8)) {
                String name = trimmed.substring(8).replace("\"", "").trim();
                try {
                    return Optional.of(Charset.forName(name));
                } catch (IllegalArgumentException ex) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    @Override
    public String toString() {
        return "RecordedRequest{" + "#" + sequence + " " + method + " " + uri() + ", bodyLength=" + body.length + '}';
    }

    public static final class Builder {

        private final String method;
        private final String path;
        private final String query;
        private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private byte[] body = new byte[0];
        private Instant receivedAt = Instant.now();
        private String remoteAddress;
        private long sequence;

        private Builder(String method, String uri) {
            this.method = method;
            Objects.requireNonNull(uri, "uri");
            int queryStart = uri.indexOf('?');
            if (queryStart >= 0) {
                this.path = uri.substring(0, queryStart);
                this.query = uri.substring(queryStart + 1);
            } else {
                this.path = uri;
                this.query = "";
            }
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            headers.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = Objects.requireNonNull(body, "body").clone();
            return this;
        }

        public Builder body(String body) {
            return body(Objects.requireNonNull(body, "body").getBytes(StandardCharsets.UTF_8));
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public RecordedRequest build() {
            return new RecordedRequest(this);
        }
    }
}
