package io.pockethive.httpmock.server.model;

import io.pockethive.httpmock.model.ExpectationViolation;
import io.pockethive.httpmock.model.VerificationReport;
import java.util.List;

public record VerificationView(boolean satisfied,
                               int verifiedRules,
                               List<ViolationView> violations,
                               String summary) {

    public static VerificationView from(VerificationReport report) {
        return new VerificationView(
            report.isSatisfied(),
            report.verifiedRules(),
            report.violations().stream().map(ViolationView::from).toList(),
            report.summary());
    }

    public record ViolationView(String ruleId,
                                String description,
                                RuleView.ExpectationView expected,
                                long observed,
                                String message) {

        static ViolationView from(ExpectationViolation violation) {
            return new ViolationView(
                violation.ruleId(),
                violation.description(),
                RuleView.ExpectationView.from(violation.expected()),
                violation.observed(),
                violation.message());
        }
    }
}
