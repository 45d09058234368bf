package io.pockethive.httpmock.model;

import io.pockethive.httpmock.matching.RequestMatcher;
import io.pockethive.httpmock.matching.RequestMatchers;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What a test wants the server to do: request criteria, the response to send and how often the rule must be hit.
 * <p>
 * Matchers are AND-combined; a definition without matchers answers every request.
 * <pre>{@code
 * MockDefinition health = MockDefinition.given(method("GET"), path("/health"))
 *     .respond(ResponseTemplate.ok().body("UP").build())
 *     .expect(Expectation.once())
 *     .named("health probe");
 * }</pre>
 */
public final class MockDefinition {

    private final List<RequestMatcher> matchers;
    private final RequestMatcher combined;
    private final ResponseTemplate response;
    private final Expectation expectation;
    private final String name;

    private MockDefinition(List<RequestMatcher> matchers, ResponseTemplate response, Expectation expectation, String name) {
        this.matchers = List.copyOf(matchers);
        this.combined = RequestMatchers.allOf(this.matchers);
        this.response = Objects.requireNonNull(response, "response");
        this.expectation = Objects.requireNonNull(expectation, "expectation");
        this.name = name;
    }

    public static MockDefinition given(RequestMatcher... matchers) {
        return given(List.of(matchers));
    }

    public static MockDefinition given(List<? extends RequestMatcher> matchers) {
        Objects.requireNonNull(matchers, "matchers");
        List<RequestMatcher> copy = new ArrayList<>(matchers.size());
        for (RequestMatcher matcher : matchers) {
            copy.add(Objects.requireNonNull(matcher, "matcher"));
        }
        return new MockDefinition(copy, ResponseTemplate.ok().build(), Expectation.any(), null);
    }

    public MockDefinition respond(ResponseTemplate response) {
        return new MockDefinition(matchers, response, expectation, name);
    }

    public MockDefinition expect(Expectation expectation) {
        return new MockDefinition(matchers, response, expectation, name);
    }

    public MockDefinition named(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        return new MockDefinition(matchers, response, expectation, name);
    }

    public List<RequestMatcher> matchers() {
        return matchers;
    }

    /**
     * The AND of all matchers.
     */
    public RequestMatcher matcher() {
        return combined;
    }

    public ResponseTemplate response() {
        return response;
    }

    public Expectation expectation() {
        return expectation;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    /**
     * The matcher description, prefixed with the rule name when one was given: {@code health probe (path /health)}.
     */
    public String description() {
        return name != null ? name + " (" + combined.description() + ")" : combined.description();
    }

    @Override
    public String toString() {
        return "MockDefinition{" + description() + " -> " + response.status() + ", expect " + expectation + '}';
    }
}
