package io.pockethive.httpmock.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pockethive.httpmock.model.Expectation;
import io.pockethive.httpmock.model.MockDefinition;
import io.pockethive.httpmock.model.RecordedRequest;
import io.pockethive.httpmock.server.model.MappingDefinition;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class MappingTranslatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final MappingTranslator translator = new MappingTranslator();

    @Test
    void emptyMappingMatchesEverythingWithOk() throws Exception {
        MockDefinition definition = translator.translate(read("{}"));

        assertThat(definition.matcher().matches(RecordedRequest.builder("DELETE", "/anything").build())).isTrue();
        assertThat(definition.response().status()).isEqualTo(200);
        assertThat(definition.expectation()).isEqualTo(Expectation.any());
        assertThat(definition.name()).isEmpty();
    }

    @Test
    void criteriaAreCombined() throws Exception {
        MockDefinition definition = translator.translate(read("""
            {
              "request": {
                "method": "POST",
                "pathPrefix": "/orders",
                "queryParameters": { "dryRun": "true" },
                "jsonPath": [ { "expression": "$.order.sku", "equalTo": "A-1" }, { "expression": "$.order.qty" } ]
              }
            }
            """));
        RecordedRequest matching = RecordedRequest.builder("POST", "/orders/new?dryRun=true")
            .body("{\"order\":{\"sku\":\"A-1\",\"qty\":2}}")
            .build();
        RecordedRequest wrongSku = RecordedRequest.builder("POST", "/orders/new?dryRun=true")
            .body("{\"order\":{\"sku\":\"B-2\",\"qty\":2}}")
            .build();

        assertThat(definition.matchers()).hasSize(5);
        assertThat(definition.matcher().matches(matching)).isTrue();
        assertThat(definition.matcher().matches(wrongSku)).isFalse();
    }

    @Test
    void jsonBodyCriterionIgnoresFieldOrder() throws Exception {
        MockDefinition definition = translator.translate(read("{\"request\": {\"jsonBody\": {\"a\": 1, \"b\": [true]}}}"));

        assertThat(definition.matcher().matches(
            RecordedRequest.builder("PUT", "/").body("{\"b\":[true],\"a\":1}").build())).isTrue();
    }

    @Test
    void responseAndExpectationAreTranslated() throws Exception {
        MockDefinition definition = translator.translate(read("""
            {
              "name": "slow create",
              "response": { "status": 201, "headers": { "Location": "/orders/9" }, "body": "created", "delayMs": 150 },
              "expectation": { "min": 2 }
            }
            """));

        assertThat(definition.description()).isEqualTo("slow create (any request)");
        assertThat(definition.response().status()).isEqualTo(201);
        assertThat(definition.response().headers()).containsEntry("Location", List.of("/orders/9"));
        assertThat(definition.response().bodyAsString()).isEqualTo("created");
        assertThat(definition.response().delay()).isEqualTo(Duration.ofMillis(150));
        assertThat(definition.expectation()).isEqualTo(Expectation.atLeast(2));
    }

    @Test
    void rejectsContradictoryOrMalformedMappings() {
        assertThatThrownBy(() -> translator.translate(read("{\"response\": {\"body\": \"x\", \"jsonBody\": {}}}")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jsonBody");
        assertThatThrownBy(() -> translator.translate(read("{\"request\": {\"bodyPattern\": \"[\"}}")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> translator.translate(read("{\"expectation\": {\"min\": 5, \"max\": 2}}")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private MappingDefinition read(String json) throws Exception {
        return mapper.readValue(json, MappingDefinition.class);
    }
}
