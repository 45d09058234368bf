package io.pockethive.httpmock;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Objects;

/**
 * Construction-time settings of a {@link MockServer}.
 *
 * @param host           interface to bind, {@code 127.0.0.1} by default
 * @param port           port to bind; {@code 0} lets the operating system pick a free one
 * @param recordRequests whether received requests are kept in the request log
 * @param drainTimeout   how long {@code stop()} waits for in-flight requests before closing connections
 * @param maxContentLength largest request body accepted, in bytes
 * @param meterRegistry  registry receiving the server metrics
 */
public record MockServerOptions(String host,
                                int port,
                                boolean recordRequests,
                                Duration drainTimeout,
                                int maxContentLength,
                                MeterRegistry meterRegistry) {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_CONTENT_LENGTH = 10 * 1024 * 1024;

    public MockServerOptions {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        validatePort(port);
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must not be negative");
        }
        if (maxContentLength <= 0) {
            throw new IllegalArgumentException("maxContentLength must be positive");
        }
        Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    public static MockServerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    MockServerOptions withAddress(String host, int port) {
        return new MockServerOptions(host, port, recordRequests, drainTimeout, maxContentLength, meterRegistry);
    }

    static void validatePort(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port must be between 0 and 65535: " + port);
        }
    }

    public static final class Builder {

        private String host = DEFAULT_HOST;
        private int port;
        private boolean recordRequests = true;
        private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
        private int maxContentLength = DEFAULT_MAX_CONTENT_LENGTH;
        private MeterRegistry meterRegistry;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder recordRequests(boolean recordRequests) {
            this.recordRequests = recordRequests;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder maxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public MockServerOptions build() {
            MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
            return new MockServerOptions(host, port, recordRequests, drainTimeout, maxContentLength, registry);
        }

        /**
         * Builds the options and creates a server in the {@link ServerState#CREATED} state.
         */
        public MockServer create() {
            return new MockServer(build());
        }
    }
}
