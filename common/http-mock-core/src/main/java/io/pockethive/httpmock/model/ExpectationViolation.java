package io.pockethive.httpmock.model;

import java.util.Objects;

/**
 * A rule whose observed call count fell outside its expected range.
 */
public record ExpectationViolation(String ruleId, String description, Expectation expected, long observed) {

    public ExpectationViolation {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(expected, "expected");
    }

    public String message() {
        return String.format("Rule %s (%s) expected %s calls but received %d",
            ruleId, description, expected, observed);
    }
}
