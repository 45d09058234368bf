package io.pockethive.httpmock.model;

import io.pockethive.httpmock.ExpectationViolationException;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of verifying one or more rules. Verification is never fail-fast: every rule is checked and all
 * violations are collected here.
 */
public record VerificationReport(int verifiedRules, List<ExpectationViolation> violations) {

    public VerificationReport {
        if (verifiedRules < 0) {
            throw new IllegalArgumentException("verifiedRules must not be negative");
        }
        violations = List.copyOf(Objects.requireNonNull(violations, "violations"));
    }

    public static VerificationReport empty() {
        return new VerificationReport(0, List.of());
    }

    public boolean isSatisfied() {
        return violations.isEmpty();
    }

    /**
     * Throws {@link ExpectationViolationException} carrying this report when any rule was violated.
     */
    public VerificationReport assertSatisfied() {
        if (!isSatisfied()) {
            throw new ExpectationViolationException(this);
        }
        return this;
    }

    public String summary() {
        if (isSatisfied()) {
            return "All " + verifiedRules + " rule(s) satisfied their expectations";
        }
        StringBuilder summary = new StringBuilder()
            .append(violations.size()).append(" of ").append(verifiedRules)
            .append(" rule(s) violated their expectations:");
        for (ExpectationViolation violation : violations) {
            summary.append(System.lineSeparator()).append("  - ").append(violation.message());
        }
        return summary.toString();
    }
}
