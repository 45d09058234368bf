package io.pockethive.httpmock.server.service;

import io.pockethive.httpmock.MockServer;
import io.pockethive.httpmock.ServerState;
import io.pockethive.httpmock.model.ExpectationViolation;
import io.pockethive.httpmock.model.VerificationReport;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the embedded mock server with the application context and stops it on shutdown, logging the
 * verification report of the rules that were still mounted.
 */
public final class MockServerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MockServerLifecycle.class);

    private final MockServer server;
    private final boolean verifyOnShutdown;
    private volatile boolean running;

    public MockServerLifecycle(MockServer server, boolean verifyOnShutdown) {
        this.server = Objects.requireNonNull(server, "server");
        this.verifyOnShutdown = verifyOnShutdown;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        server.start();
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (server.state() == ServerState.STOPPED) {
            return;
        }
        VerificationReport report = server.stop();
        if (!verifyOnShutdown) {
            log.info("Mock server stopped; verification on shutdown is disabled");
            return;
        }
        if (report.isSatisfied()) {
            log.info("Mock server stopped: {}", report.summary());
            return;
        }
        for (ExpectationViolation violation : report.violations()) {
            log.warn("Unsatisfied mock rule on shutdown: {}", violation.message());
        }
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
