package assistant.adapter.out.http;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import assistant.core.model.auth.AuthDecision;
import assistant.core.model.auth.AuthRequest;
import assistant.core.model.auth.InvalidAuthResponseException;

/**
 * JSON codec for the llama-stack external authentication contract.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * {
 *   "api_key": "<token>",
 *   "request": { "path": "/", "headers": { ... }, "params": { ... } }
 * }
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * {
 *   "principal": "alice",
 *   "attributes": { "roles": ["admin"] },
 *   "message": "Authentication successful"
 * }
 * }</pre>
 */
final class AuthRequestJson {

    private AuthRequestJson() {
        // Utility class - prevent instantiation
    }

    static JsonObject toJson(AuthRequest request) {
        final var context = request.request();
        return new JsonObject()
                .put("api_key", request.apiKey())
                .put(
                        "request",
                        new JsonObject()
                                .put("path", context.path())
                                .put("headers", new JsonObject(new LinkedHashMap<>(context.headers())))
                                .put("params", new JsonObject(new LinkedHashMap<>(context.params()))));
    }

    /**
     * Parse a decision body.
     *
     * @param json response body
     * @return the decision
     * @throws InvalidAuthResponseException when the body does not match the contract
     */
    static AuthDecision decisionFromJson(JsonObject json) {
        if (json == null) {
            throw new InvalidAuthResponseException("empty body");
        }

        final Object principal = json.getValue("principal");
        if (!(principal instanceof String name) || name.isBlank()) {
            throw new InvalidAuthResponseException("missing principal");
        }

        final Object message = json.getValue("message");
        if (message != null && !(message instanceof String)) {
            throw new InvalidAuthResponseException("message is not a string");
        }

        return new AuthDecision(name, parseAttributes(json.getValue("attributes")), (String) message);
    }

    private static Map<String, List<String>> parseAttributes(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof JsonObject attributes)) {
            throw new InvalidAuthResponseException("attributes is not an object");
        }

        final var result = new LinkedHashMap<String, List<String>>();
        for (String key : attributes.fieldNames()) {
            final Object entry = attributes.getValue(key);
            if (entry instanceof JsonArray array) {
                final var values = new ArrayList<String>(array.size());
                for (int i = 0; i < array.size(); i++) {
                    final var item = array.getValue(i);
                    if (item != null) {
                        values.add(item.toString());
                    }
                }
                result.put(key, List.copyOf(values));
            } else if (entry instanceof String single) {
                result.put(key, List.of(single));
            } else if (entry != null) {
                throw new InvalidAuthResponseException("attribute '" + key + "' is not a list of strings");
            }
        }
        return result;
    }
}
