package io.pockethive.httpmock.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties
@SpringBootApplication
public class HttpMockServerApplication {
    public static void main(String[] args) {
        SpringApplication.run(HttpMockServerApplication.class, args);
    }
}
