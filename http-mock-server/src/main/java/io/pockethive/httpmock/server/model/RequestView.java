package io.pockethive.httpmock.server.model;

import io.pockethive.httpmock.model.RecordedRequest;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record RequestView(long sequence,
                          String method,
                          String path,
                          String query,
                          Map<String, List<String>> headers,
                          String body,
                          int bodyLength,
                          Instant receivedAt,
                          String remoteAddress) {

    public static RequestView from(RecordedRequest request) {
        return new RequestView(
            request.sequence(),
            request.method(),
            request.path(),
            request.query(),
            request.headers(),
            request.bodyAsString(),
            request.bodyLength(),
            request.receivedAt(),
            request.remoteAddress());
    }
}
