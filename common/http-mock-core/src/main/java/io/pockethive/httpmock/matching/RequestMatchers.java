package io.pockethive.httpmock.matching;

import com.fasterxml.jackson.databind.JsonNode;
import io.pockethive.httpmock.model.RecordedRequest;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Built-in {@link RequestMatcher} factories.
 */
public final class RequestMatchers {

    private static final RequestMatcher ANY = described("any request", request -> true);

    private RequestMatchers() {
    }

    public static RequestMatcher any() {
        return ANY;
    }

    public static RequestMatcher method(String method) {
        String expected = requireText(method, "method");
        return described("method " + expected.toUpperCase(),
            request -> request.method().equalsIgnoreCase(expected));
    }

    public static RequestMatcher path(String path) {
        String expected = requireText(path, "path");
        return described("path " + expected, request -> request.path().equals(expected));
    }

    public static RequestMatcher pathPrefix(String prefix) {
        String expected = requireText(prefix, "prefix");
        return described("path starting with " + expected, request -> request.path().startsWith(expected));
    }

    public static RequestMatcher pathMatching(String regex) {
        Pattern pattern = Pattern.compile(requireText(regex, "regex"));
        return described("path matching /" + regex + "/", request -> pattern.matcher(request.path()).matches());
    }

    /**
     * Matches when any value of the header equals {@code value}.
     */
    public static RequestMatcher header(String name, String value) {
        String header = requireText(name, "name");
        Objects.requireNonNull(value, "value");
        return described("header " + header + "=" + value,
            request -> request.headerValues(header).contains(value));
    }

    public static RequestMatcher headerPresent(String name) {
        String header = requireText(name, "name");
        return described("header " + header + " present", request -> !request.headerValues(header).isEmpty());
    }

    public static RequestMatcher headerMatching(String name, String regex) {
        String header = requireText(name, "name");
        Pattern pattern = Pattern.compile(requireText(regex, "regex"));
        return described("header " + header + " matching /" + regex + "/",
            request -> request.headerValues(header).stream().anyMatch(v -> pattern.matcher(v).matches()));
    }

    public static RequestMatcher queryParameter(String name, String value) {
        String parameter = requireText(name, "name");
        Objects.requireNonNull(value, "value");
        return described("query " + parameter + "=" + value, request -> {
            List<String> values = request.queryParameters().get(parameter);
            return values != null && values.contains(value);
        });
    }

    public static RequestMatcher body(String body) {
        Objects.requireNonNull(body, "body");
        return body(body.getBytes(StandardCharsets.UTF_8));
    }

    public static RequestMatcher body(byte[] body) {
        byte[] expected = Objects.requireNonNull(body, "body").clone();
        return described("body of " + expected.length + " bytes", request -> Arrays.equals(request.body(), expected));
    }

    public static RequestMatcher bodyContains(String fragment) {
        Objects.requireNonNull(fragment, "fragment");
        return described("body containing '" + fragment + "'", request -> request.bodyAsString().contains(fragment));
    }

    public static RequestMatcher bodyMatching(String regex) {
        Pattern pattern = Pattern.compile(requireText(regex, "regex"), Pattern.DOTALL);
        return described("body matching /" + regex + "/", request -> pattern.matcher(request.bodyAsString()).matches());
    }

    /**
     * Structural JSON equality: field order and whitespace are ignored. A body that is not JSON fails to match.
     */
    public static RequestMatcher jsonBody(String json) {
        JsonNode expected;
        try {
            expected = JsonPaths.MAPPER.readTree(Objects.requireNonNull(json, "json"));
        } catch (Exception ex) {
            throw new IllegalArgumentException("Expected body is not valid JSON", ex);
        }
        return described("JSON body " + expected, request -> expected.equals(JsonPaths.parse(request.body())));
    }

    public static RequestMatcher jsonPath(String expression) {
        String path = requireText(expression, "expression");
        return described("JSON path " + path + " present",
            request -> JsonPaths.evaluate(JsonPaths.parse(request.body()), path).isPresent());
    }

    /**
     * Matches when the node at {@code expression} renders as {@code expectedValue} (text nodes by value, other
     * nodes by their JSON form).
     */
    public static RequestMatcher jsonPath(String expression, String expectedValue) {
        String path = requireText(expression, "expression");
        Objects.requireNonNull(expectedValue, "expectedValue");
        return described("JSON path " + path + "=" + expectedValue,
            request -> JsonPaths.evaluate(JsonPaths.parse(request.body()), path)
                .map(node -> node.isValueNode() ? node.asText() : node.toString())
                .filter(expectedValue::equals)
                .isPresent());
    }

    public static RequestMatcher allOf(RequestMatcher... matchers) {
        return allOf(List.of(matchers));
    }

    public static RequestMatcher allOf(List<? extends RequestMatcher> matchers) {
        List<RequestMatcher> all = List.copyOf(matchers);
        if (all.isEmpty()) {
            return ANY;
        }
        if (all.size() == 1) {
            return all.get(0);
        }
        return described(join(all, " and "), request -> {
            for (RequestMatcher matcher : all) {
                if (!matcher.matches(request)) {
                    return false;
                }
            }
            return true;
        });
    }

    public static RequestMatcher anyOf(RequestMatcher... matchers) {
        List<RequestMatcher> all = List.of(matchers);
        if (all.isEmpty()) {
            throw new IllegalArgumentException("anyOf requires at least one matcher");
        }
        return described("(" + join(all, " or ") + ")", request -> {
            for (RequestMatcher matcher : all) {
                if (matcher.matches(request)) {
                    return true;
                }
            }
            return false;
        });
    }

    public static RequestMatcher not(RequestMatcher matcher) {
        Objects.requireNonNull(matcher, "matcher");
        return described("not (" + matcher.description() + ")", request -> !matcher.matches(request));
    }

    /**
     * Wraps an arbitrary predicate with a description for verification reports.
     */
    public static RequestMatcher matching(String description, Predicate<RecordedRequest> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return described(requireText(description, "description"), predicate::test);
    }

    private static RequestMatcher described(String description, RequestMatcher delegate) {
        return new DescribedMatcher(description, delegate);
    }

    private static String join(List<RequestMatcher> matchers, String separator) {
        return matchers.stream().map(RequestMatcher::description).collect(Collectors.joining(separator));
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    private record DescribedMatcher(String description, RequestMatcher delegate) implements RequestMatcher {

        @Override
        public boolean matches(RecordedRequest request) throws Exception {
            return delegate.matches(request);
        }

        @Override
        public String toString() {
            return description;
        }
    }
}
