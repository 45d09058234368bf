package io.pockethive.httpmock.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canned response returned when a rule is selected: status, headers, body and an optional fixed delay.
 */
public final class ResponseTemplate {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final ResponseTemplate NOT_FOUND = status(404).build();

    private final int status;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final Duration delay;

    private ResponseTemplate(Builder builder) {
        this.status = builder.status;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        builder.headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(copy);
        this.body = builder.body.clone();
        this.delay = builder.delay;
    }

    public static Builder status(int status) {
        return new Builder(status);
    }

    public static Builder ok() {
        return new Builder(200);
    }

    /**
     * The fallback answer for requests no rule matched: 404 with an empty body.
     */
    public static ResponseTemplate notFound() {
        return NOT_FOUND;
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public Duration delay() {
        return delay;
    }

    public boolean hasDelay() {
        return !delay.isZero();
    }

    @Override
    public String toString() {
        return "ResponseTemplate{status=" + status + ", headers=" + headers.keySet()
            + ", bodyLength=" + body.length + (hasDelay() ? ", delay=" + delay : "") + '}';
    }

    public static final class Builder {

        private final int status;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private byte[] body = new byte[0];
        private Duration delay = Duration.ZERO;

        private Builder(int status) {
            if (status < 100 || status > 999) {
                throw new IllegalArgumentException("status must be a three digit HTTP status code: " + status);
            }
            this.status = status;
        }

        public Builder header(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("header name must not be blank");
            }
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

        /**
         * Serialises {@code value} with Jackson and sets {@code Content-Type: application/json} unless a content
         * type was already given.
         */
        public Builder jsonBody(Object value) {
            try {
                this.body = MAPPER.writeValueAsBytes(value);
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("Unable to serialise JSON response body", ex);
            }
            if (headers.keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
                header("Content-Type", "application/json");
            }
            return this;
        }

        public Builder delay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
            this.delay = delay;
            return this;
        }

        public ResponseTemplate build() {
            return new ResponseTemplate(this);
        }
    }
}
