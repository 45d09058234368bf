package io.pockethive.httpmock.service;

import static io.pockethive.httpmock.matching.RequestMatchers.jsonPath;
import static io.pockethive.httpmock.matching.RequestMatchers.method;
import static org.assertj.core.api.Assertions.assertThat;

import io.pockethive.httpmock.model.RecordedRequest;
import java.util.List;
import org.junit.jupiter.api.Test;

class RequestLogTest {

    private final RequestLog log = new RequestLog();

    @Test
    void keepsArrivalOrder() {
        RecordedRequest first = request("GET", "/a", 1);
        RecordedRequest second = request("POST", "/b", 2);
        log.append(first);
        log.append(second);

        assertThat(log.requests()).containsExactly(first, second);
        assertThat(log.size()).isEqualTo(2);
    }

    @Test
    void snapshotsDoNotSeeLaterAppends() {
        log.append(request("GET", "/a", 1));
        List<RecordedRequest> snapshot = log.requests();

        log.append(request("GET", "/b", 2));

        assertThat(snapshot).hasSize(1);
        assertThat(log.requests()).hasSize(2);
    }

    @Test
    void unmatchedRequestsAreTrackedSeparately() {
        RecordedRequest matched = request("GET", "/a", 1);
        RecordedRequest missed = request("GET", "/missing", 2);
        log.append(matched);
        log.append(missed);
        log.appendUnmatched(missed);

        assertThat(log.unmatchedRequests()).containsExactly(missed);
        assertThat(log.requests()).containsExactly(matched, missed);
    }

    @Test
    void matchingFiltersAndTreatsFailuresAsNoMatch() {
        RecordedRequest get = request("GET", "/a", 1);
        RecordedRequest json = RecordedRequest.builder("POST", "/b").body("{\"id\":1}").sequence(2).build();
        log.append(get);
        log.append(json);

        assertThat(log.matching(method("GET"))).containsExactly(get);
        assertThat(log.matching(jsonPath("$.id", "1"))).containsExactly(json);
    }

    private static RecordedRequest request(String method, String uri, long sequence) {
        return RecordedRequest.builder(method, uri).sequence(sequence).build();
    }
}
