package io.pockethive.httpmock.service;

import io.pockethive.httpmock.matching.RequestMatcher;
import io.pockethive.httpmock.model.RecordedRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only record of received requests.
 * <p>
 * Appends are lock-free and preserve the order of causally ordered arrivals. Readers get copies, so a
 * snapshot never shows requests appended after it was taken.
 */
public final class RequestLog {

    private final ConcurrentLinkedQueue<RecordedRequest> requests = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<RecordedRequest> unmatchedRequests = new ConcurrentLinkedQueue<>();

    public void append(RecordedRequest request) {
        requests.offer(Objects.requireNonNull(request, "request"));
    }

    public void appendUnmatched(RecordedRequest request) {
        unmatchedRequests.offer(Objects.requireNonNull(request, "request"));
    }

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    /**
     * Requests that no rule matched and that were answered with the fallback response.
     */
    public List<RecordedRequest> unmatchedRequests() {
        return List.copyOf(unmatchedRequests);
    }

    public int size() {
        return requests.size();
    }

    /**
     * Logged requests accepted by {@code matcher}. A matcher that throws counts as not matching.
     */
    public List<RecordedRequest> matching(RequestMatcher matcher) {
        Objects.requireNonNull(matcher, "matcher");
        List<RecordedRequest> result = new ArrayList<>();
        for (RecordedRequest request : requests) {
            if (safeMatches(matcher, request)) {
                result.add(request);
            }
        }
        return List.copyOf(result);
    }

    private static boolean safeMatches(RequestMatcher matcher, RecordedRequest request) {
        try {
            return matcher.matches(request);
        } catch (Exception | AssertionError ex) {
            return false;
        }
    }
}
