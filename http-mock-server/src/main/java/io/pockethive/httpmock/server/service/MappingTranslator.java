package io.pockethive.httpmock.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.pockethive.httpmock.matching.RequestMatcher;
import io.pockethive.httpmock.matching.RequestMatchers;
import io.pockethive.httpmock.model.Expectation;
import io.pockethive.httpmock.model.MockDefinition;
import io.pockethive.httpmock.model.ResponseTemplate;
import io.pockethive.httpmock.server.model.MappingDefinition;
import io.pockethive.httpmock.server.model.MappingDefinition.ExpectationDefinition;
import io.pockethive.httpmock.server.model.MappingDefinition.JsonPathCriterion;
import io.pockethive.httpmock.server.model.MappingDefinition.RequestCriteria;
import io.pockethive.httpmock.server.model.MappingDefinition.ResponseDefinition;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Turns admin API mappings into {@link MockDefinition}s.
 * <p>
 * Invalid input (bad regular expressions, malformed expected JSON, an inverted expectation range or a
 * response with both a text and a JSON body) is reported as {@link IllegalArgumentException}.
 */
@Component
public class MappingTranslator {

    public MockDefinition translate(MappingDefinition mapping) {
        Objects.requireNonNull(mapping, "mapping");
        MockDefinition definition = MockDefinition.given(matchers(mapping.request()))
            .respond(response(mapping.response()))
            .expect(expectation(mapping.expectation()));
        return hasText(mapping.name()) ? definition.named(mapping.name()) : definition;
    }

    private static List<RequestMatcher> matchers(RequestCriteria request) {
        List<RequestMatcher> matchers = new ArrayList<>();
        if (request == null) {
            return matchers;
        }
        if (hasText(request.method())) {
            matchers.add(RequestMatchers.method(request.method()));
        }
        if (hasText(request.path())) {
            matchers.add(RequestMatchers.path(request.path()));
        }
        if (hasText(request.pathPrefix())) {
            matchers.add(RequestMatchers.pathPrefix(request.pathPrefix()));
        }
        if (hasText(request.pathPattern())) {
            matchers.add(RequestMatchers.pathMatching(request.pathPattern()));
        }
        if (request.headers() != null) {
            request.headers().forEach((name, value) -> matchers.add(RequestMatchers.header(name, value)));
        }
        if (request.queryParameters() != null) {
            request.queryParameters().forEach((name, value) -> matchers.add(RequestMatchers.queryParameter(name, value)));
        }
        if (request.bodyEquals() != null) {
            matchers.add(RequestMatchers.body(request.bodyEquals()));
        }
        if (request.bodyContains() != null) {
            matchers.add(RequestMatchers.bodyContains(request.bodyContains()));
        }
        if (hasText(request.bodyPattern())) {
            matchers.add(RequestMatchers.bodyMatching(request.bodyPattern()));
        }
        if (isPresent(request.jsonBody())) {
            matchers.add(RequestMatchers.jsonBody(request.jsonBody().toString()));
        }
        if (request.jsonPath() != null) {
            for (JsonPathCriterion criterion : request.jsonPath()) {
                matchers.add(criterion.equalTo() == null
                    ? RequestMatchers.jsonPath(criterion.expression())
                    : RequestMatchers.jsonPath(criterion.expression(), criterion.equalTo()));
            }
        }
        return matchers;
    }

    private static ResponseTemplate response(ResponseDefinition response) {
        if (response == null) {
            return ResponseTemplate.ok().build();
        }
        ResponseTemplate.Builder builder = ResponseTemplate.status(response.status() == null ? 200 : response.status());
        if (response.headers() != null) {
            response.headers().forEach(builder::header);
        }
        if (isPresent(response.jsonBody())) {
            if (response.body() != null) {
                throw new IllegalArgumentException("response must not declare both body and jsonBody");
            }
            builder.jsonBody(response.jsonBody());
        } else if (response.body() != null) {
            builder.body(response.body());
        }
        if (response.delayMs() != null) {
            builder.delay(Duration.ofMillis(response.delayMs()));
        }
        return builder.build();
    }

    private static Expectation expectation(ExpectationDefinition expectation) {
        if (expectation == null) {
            return Expectation.any();
        }
        long min = expectation.min() == null ? 0 : expectation.min();
        long max = expectation.max() == null ? Expectation.UNBOUNDED : expectation.max();
        return Expectation.between(min, max);
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
