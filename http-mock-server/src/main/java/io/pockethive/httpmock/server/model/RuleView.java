package io.pockethive.httpmock.server.model;

import io.pockethive.httpmock.RuleHandle;
import io.pockethive.httpmock.model.Expectation;

public record RuleView(String id,
                       String name,
                       String description,
                       String scope,
                       long callCount,
                       ExpectationView expectation,
                       int responseStatus) {

    public static RuleView from(RuleHandle handle) {
        return new RuleView(
            handle.id(),
            handle.name().orElse(null),
            handle.description(),
            handle.scope().name(),
            handle.callCount(),
            ExpectationView.from(handle.expectation()),
            handle.definition().response().status());
    }

    /**
     * Call-count range; {@code max} is omitted from the JSON when unbounded.
     */
    public record ExpectationView(long min, Long max) {

        public static ExpectationView from(Expectation expectation) {
            return new ExpectationView(expectation.min(), expectation.isUnbounded() ? null : expectation.max());
        }
    }
}
