package io.pockethive.httpmock.matching;

import io.pockethive.httpmock.model.RecordedRequest;
import java.util.Objects;

/**
 * Predicate evaluated against an incoming request.
 * <p>
 * Implementations must only read the request. They may throw while inspecting it, for example when a body
 * is not valid JSON or an assertion fails; the mount table treats any exception or {@link AssertionError}
 * as "does not match" and never lets it reach the client.
 */
@FunctionalInterface
public interface RequestMatcher {

    boolean matches(RecordedRequest request) throws Exception;

    /**
     * Human-readable form used in verification failures.
     */
    default String description() {
        return "custom matcher";
    }

    default RequestMatcher and(RequestMatcher other) {
        return RequestMatchers.allOf(this, Objects.requireNonNull(other, "other"));
    }

    default RequestMatcher or(RequestMatcher other) {
        return RequestMatchers.anyOf(this, Objects.requireNonNull(other, "other"));
    }

    default RequestMatcher negate() {
        return RequestMatchers.not(this);
    }
}
