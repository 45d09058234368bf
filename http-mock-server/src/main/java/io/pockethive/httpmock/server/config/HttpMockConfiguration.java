package io.pockethive.httpmock.server.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.pockethive.httpmock.MockServer;
import io.pockethive.httpmock.server.service.MockServerLifecycle;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(HttpMockProperties.class)
public class HttpMockConfiguration {

    // Shutdown is owned by MockServerLifecycle; no inferred close().
    @Bean(destroyMethod = "")
    public MockServer httpMockServer(HttpMockProperties properties, MeterRegistry meterRegistry) {
        return MockServer.builder()
            .host(properties.getHost())
            .port(properties.getPort())
            .recordRequests(properties.isRecordRequests())
            .drainTimeout(properties.getDrainTimeout())
            .maxContentLength(properties.getMaxContentLength())
            .meterRegistry(meterRegistry)
            .create();
    }

    @Bean
    public MockServerLifecycle mockServerLifecycle(MockServer httpMockServer, HttpMockProperties properties) {
        return new MockServerLifecycle(httpMockServer, properties.isVerifyOnShutdown());
    }
}
