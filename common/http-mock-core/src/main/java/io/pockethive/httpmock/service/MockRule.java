package io.pockethive.httpmock.service;

import io.pockethive.httpmock.model.Expectation;
import io.pockethive.httpmock.model.ExpectationViolation;
import io.pockethive.httpmock.model.MockDefinition;
import io.pockethive.httpmock.model.ResponseTemplate;
import io.pockethive.httpmock.model.Scope;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link MockDefinition} mounted on a server, with its id, scope and call counter.
 */
public final class MockRule {

    private final String id;
    private final MockDefinition definition;
    private final Scope scope;
    private final Instant mountedAt;
    private final AtomicLong calls = new AtomicLong();

    MockRule(String id, MockDefinition definition, Scope scope, Instant mountedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.mountedAt = Objects.requireNonNull(mountedAt, "mountedAt");
    }

    public String id() {
        return id;
    }

    public MockDefinition definition() {
        return definition;
    }

    public Scope scope() {
        return scope;
    }

    public Instant mountedAt() {
        return mountedAt;
    }

    public ResponseTemplate response() {
        return definition.response();
    }

    public Expectation expectation() {
        return definition.expectation();
    }

    public String description() {
        return definition.description();
    }

    public long callCount() {
        return calls.get();
    }

    // Only the mount table increments, under its lock, so the counter only ever grows.
    void recordCall() {
        calls.incrementAndGet();
    }

    /**
     * Compares the current call count with the rule's expectation.
     */
    public Optional<ExpectationViolation> verify() {
        long observed = calls.get();
        if (definition.expectation().contains(observed)) {
            return Optional.empty();
        }
        return Optional.of(new ExpectationViolation(id, description(), definition.expectation(), observed));
    }

    @Override
    public String toString() {
        return "MockRule{" + id + ", " + scope + ", " + description() + ", calls=" + calls.get() + '}';
    }
}
