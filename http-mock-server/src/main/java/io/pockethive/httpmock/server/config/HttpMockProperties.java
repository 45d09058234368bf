package io.pockethive.httpmock.server.config;

import io.pockethive.httpmock.MockServerOptions;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "http-mock")
public class HttpMockProperties {

    private String host = MockServerOptions.DEFAULT_HOST;
    private int port = 8080;
    private boolean recordRequests = true;
    private Duration drainTimeout = MockServerOptions.DEFAULT_DRAIN_TIMEOUT;
    private int maxContentLength = MockServerOptions.DEFAULT_MAX_CONTENT_LENGTH;
    private boolean verifyOnShutdown = true;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public boolean isRecordRequests() {
        return recordRequests;
    }

    public void setRecordRequests(boolean recordRequests) {
        this.recordRequests = recordRequests;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public int getMaxContentLength() {
        return maxContentLength;
    }

    public void setMaxContentLength(int maxContentLength) {
        this.maxContentLength = maxContentLength;
    }

    public boolean isVerifyOnShutdown() {
        return verifyOnShutdown;
    }

    public void setVerifyOnShutdown(boolean verifyOnShutdown) {
        this.verifyOnShutdown = verifyOnShutdown;
    }
}
