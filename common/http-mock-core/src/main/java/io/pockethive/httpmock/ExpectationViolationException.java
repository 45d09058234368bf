package io.pockethive.httpmock;

import io.pockethive.httpmock.model.ExpectationViolation;
import io.pockethive.httpmock.model.VerificationReport;
import java.util.List;
import java.util.Objects;

/**
 * Raised when a caller asserts a {@link VerificationReport} that contains violations.
 */
public class ExpectationViolationException extends AssertionError {

    private final transient VerificationReport report;

    public ExpectationViolationException(VerificationReport report) {
        super(Objects.requireNonNull(report, "report").summary());
        this.report = report;
    }

    public VerificationReport report() {
        return report;
    }

    public List<ExpectationViolation> violations() {
        return report.violations();
    }
}
