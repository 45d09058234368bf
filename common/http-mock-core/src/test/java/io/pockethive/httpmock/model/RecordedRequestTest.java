package io.pockethive.httpmock.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecordedRequestTest {

    @Test
    void splitsUriIntoPathAndQuery() {
        RecordedRequest request = RecordedRequest.builder("GET", "/search?q=hive%20mock&page=2").build();

        assertThat(request.path()).isEqualTo("/search");
        assertThat(request.query()).isEqualTo("q=hive%20mock&page=2");
        assertThat(request.uri()).isEqualTo("/search?q=hive%20mock&page=2");
        assertThat(request.queryParameter("q")).contains("hive mock");
        assertThat(request.queryParameters()).containsEntry("page", List.of("2"));
    }

    @Test
    void requestTargetWithoutPathIsKeptAsReceived() {
        RecordedRequest request = RecordedRequest.builder("GET", "?a=1").build();

        assertThat(request.path()).isEmpty();
        assertThat(request.query()).isEqualTo("a=1");
        assertThat(request.uri()).isEqualTo("?a=1");
        assertThat(request.queryParameter("a")).contains("1");
    }

    @Test
    void headersAreCaseInsensitiveAndKeepValueOrder() {
        RecordedRequest request = RecordedRequest.builder("GET", "/")
            .header("Accept", "text/plain")
            .header("ACCEPT", "application/json")
            .build();

        assertThat(request.headerValues("accept")).containsExactly("text/plain", "application/json");
        assertThat(request.header("Accept")).contains("text/plain");
        assertThat(request.headers()).containsOnlyKeys("Accept");
        assertThat(request.header("Missing")).isEmpty();
    }

    @Test
    void bodyIsCopiedInAndOut() {
        byte[] source = "payload".getBytes(StandardCharsets.UTF_8);
        RecordedRequest request = RecordedRequest.builder("POST", "/").body(source).build();

        source[0] = 'X';
        request.body()[1] = 'Y';

        assertThat(request.bodyAsString()).isEqualTo("payload");
        assertThat(request.bodyLength()).isEqualTo(7);
    }

    @Test
    void bodyDecodingHonoursDeclaredCharset() {
        byte[] latin1 = "café".getBytes(StandardCharsets.ISO_8859_1);
        RecordedRequest request = RecordedRequest.builder("POST", "/")
            .header("Content-Type", "text/plain; charset=ISO-8859-1")
            .body(latin1)
            .build();

        assertThat(request.bodyAsString()).isEqualTo("café");
    }

    @Test
    void keepsArrivalMetadata() {
        Instant receivedAt = Instant.parse("2024-05-01T10:15:30Z");
        RecordedRequest request = RecordedRequest.builder("DELETE", "/items/1")
            .sequence(7)
            .receivedAt(receivedAt)
            .remoteAddress("/127.0.0.1:53000")
            .build();

        assertThat(request.sequence()).isEqualTo(7);
        assertThat(request.receivedAt()).isEqualTo(receivedAt);
        assertThat(request.remoteAddress()).isEqualTo("/127.0.0.1:53000");
        assertThat(request.toString()).contains("#7", "DELETE", "/items/1");
    }

    @Test
    void rejectsBlankMethod() {
        assertThatThrownBy(() -> RecordedRequest.builder(" ", "/").build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("method");
    }
}
