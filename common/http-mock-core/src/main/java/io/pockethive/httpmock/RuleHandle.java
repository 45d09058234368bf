package io.pockethive.httpmock;

import io.pockethive.httpmock.model.Expectation;
import io.pockethive.httpmock.model.MockDefinition;
import io.pockethive.httpmock.model.Scope;
import io.pockethive.httpmock.model.VerificationReport;
import io.pockethive.httpmock.service.MockRule;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller-side view of a mounted rule.
 */
public class RuleHandle {

    final MockServer server;
    final MockRule rule;

    RuleHandle(MockServer server, MockRule rule) {
        this.server = Objects.requireNonNull(server, "server");
        this.rule = Objects.requireNonNull(rule, "rule");
    }

    public String id() {
        return rule.id();
    }

    public Scope scope() {
        return rule.scope();
    }

    public Optional<String> name() {
        return rule.definition().name();
    }

    public String description() {
        return rule.description();
    }

    public MockDefinition definition() {
        return rule.definition();
    }

    public Expectation expectation() {
        return rule.expectation();
    }

    public long callCount() {
        return rule.callCount();
    }

    public boolean isMounted() {
        return server.isMounted(rule.id());
    }

    /**
     * Checks the rule's expectation now, without unmounting it.
     */
    public VerificationReport verify() {
        return new VerificationReport(1, rule.verify().map(List::of).orElse(List.of()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + rule.id() + ", " + rule.scope() + ", " + rule.description() + '}';
    }
}
