package io.pockethive.httpmock.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.pockethive.httpmock.model.RecordedRequest;
import io.pockethive.httpmock.service.MockRule;
import io.pockethive.httpmock.service.MountTable;
import java.util.Objects;

/**
 * Micrometer instruments for the mock server.
 */
public final class MockServerMetrics implements MountTable.MatcherFailureListener {

    private final MeterRegistry registry;
    private final Timer requestTimer;
    private final Counter matched;
    private final Counter unmatched;
    private final Counter errors;
    private final Counter matcherFailures;

    public MockServerMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.requestTimer = Timer.builder("http.mock.request.duration")
            .description("HTTP mock request processing duration")
            .register(registry);
        this.matched = outcomeCounter("matched");
        this.unmatched = outcomeCounter("unmatched");
        this.errors = outcomeCounter("error");
        this.matcherFailures = Counter.builder("http.mock.matcher.failures")
            .description("Matcher evaluations that threw and were treated as no match")
            .register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordDuration(Timer.Sample sample) {
        sample.stop(requestTimer);
    }

    public void incrementMatched() { matched.increment(); }
    public void incrementUnmatched() { unmatched.increment(); }
    public void incrementErrors() { errors.increment(); }

    public double matchedCount() { return matched.count(); }
    public double unmatchedCount() { return unmatched.count(); }
    public double errorCount() { return errors.count(); }
    public double matcherFailureCount() { return matcherFailures.count(); }

    @Override
    public void onMatcherFailure(MockRule rule, RecordedRequest request, Throwable error) {
        matcherFailures.increment();
    }

    private Counter outcomeCounter(String outcome) {
        return Counter.builder("http.mock.requests")
            .description("HTTP mock requests by outcome")
            .tag("outcome", outcome)
            .register(registry);
    }
}
