package io.pockethive.httpmock.server.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a rule accepted by {@code POST /__admin/mappings}. Every request criterion is optional and
 * the ones present are AND-combined; a mapping without criteria matches every request.
 */
public record MappingDefinition(String name,
                                @Valid RequestCriteria request,
                                @Valid ResponseDefinition response,
                                @Valid ExpectationDefinition expectation) {

    public record RequestCriteria(String method,
                                  String path,
                                  String pathPrefix,
                                  String pathPattern,
                                  Map<String, String> headers,
                                  Map<String, String> queryParameters,
                                  String bodyEquals,
                                  String bodyContains,
                                  String bodyPattern,
                                  JsonNode jsonBody,
                                  List<@Valid JsonPathCriterion> jsonPath) {
    }

    public record JsonPathCriterion(@NotBlank String expression, String equalTo) {
    }

    public record ResponseDefinition(@Min(100) @Max(999) Integer status,
                                     Map<String, String> headers,
                                     String body,
                                     JsonNode jsonBody,
                                     @PositiveOrZero Long delayMs) {
    }

    public record ExpectationDefinition(@PositiveOrZero Long min, @PositiveOrZero Long max) {
    }
}
