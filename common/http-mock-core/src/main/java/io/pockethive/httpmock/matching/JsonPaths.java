package io.pockethive.httpmock.matching;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;

/**
 * Minimal dotted-path navigation over Jackson trees: {@code $.order.items[0].sku}.
 * <p>
 * Supports object fields and array indexes only; the {@code $.} prefix is optional.
 */
public final class JsonPaths {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonPaths() {
    }

    public static JsonNode parse(byte[] json) throws IOException {
        return MAPPER.readTree(json);
    }

    public static Optional<JsonNode> evaluate(JsonNode root, String expression) {
        String path = expression.trim();
        if (path.equals("$")) {
            return Optional.of(root);
        }
        if (path.startsWith("$.")) {
            path = path.substring(2);
        } else if (path.startsWith("$[")) {
            path = path.substring(1);
        }

        JsonNode current = root;
        for (String part : path.split("\\.")) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in JSON path '" + expression + "'");
            }
            int bracket = part.indexOf('[');
            String field = bracket < 0 ? part : part.substring(0, bracket);
            if (!field.isEmpty()) {
                current = current.get(field);
                if (current == null) {
                    return Optional.empty();
                }
            }
            while (bracket >= 0) {
                int close = part.indexOf(']', bracket);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed index in JSON path '" + expression + "'");
                }
                int index = Integer.parseInt(part.substring(bracket + 1, close));
                current = current.get(index);
                if (current == null) {
                    return Optional.empty();
                }
                bracket = part.indexOf('[', close);
            }
        }
        return Optional.of(current);
    }
}
