package assistant.core.model.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The original HTTP request being authorized.
 *
 * @param path    request path
 * @param headers request headers
 * @param params  query parameters
 */
public record AuthRequestContext(String path, Map<String, String> headers, Map<String, String> params) {

    public AuthRequestContext {
        if (path == null || path.isBlank()) {
            path = "/";
        }
        headers = headers == null ? Map.of() : copyWithoutNulls(headers);
        params = params == null ? Map.of() : copyWithoutNulls(params);
    }

    public ForwardedIdentity forwardedIdentity() {
        return ForwardedIdentity.fromHeaders(headers);
    }

    private static Map<String, String> copyWithoutNulls(Map<String, String> source) {
        final var copy = new LinkedHashMap<String, String>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
