package assistant.core.service.auth;

import java.util.LinkedHashMap;
import java.util.Map;

import assistant.core.model.auth.ForwardedIdentity;

/**
 * Builds the header set for calls made on behalf of a caller.
 *
 * <p>The set is {@code Authorization: Bearer <token>} followed by the forwarded
 * identity headers. Forwarded identity entries win on key collision.
 */
public final class OutboundHeaders {

    public static final String AUTHORIZATION = "Authorization";
    public static final String BEARER_PREFIX = "Bearer ";

    private OutboundHeaders() {
        // Utility class - prevent instantiation
    }

    /**
     * Prefix a token with the bearer scheme unless it already carries it.
     *
     * @param token raw or already prefixed token
     * @return the Authorization header value
     */
    public static String normalizeBearer(String token) {
        final var value = token == null ? "" : token;
        if (value.startsWith(BEARER_PREFIX)) {
            return value;
        }
        return BEARER_PREFIX + value;
    }

    /**
     * @param token raw or already prefixed token
     * @return a single-entry Authorization header map
     */
    public static Map<String, String> authorizationHeader(String token) {
        final var headers = new LinkedHashMap<String, String>();
        headers.put(AUTHORIZATION, normalizeBearer(token));
        return headers;
    }

    /**
     * Merge a credential with a forwarded identity.
     *
     * <p>A null or blank token produces no Authorization header.
     *
     * @param token    credential to present, may be null
     * @param identity forwarded identity of the original request
     * @return ordered, mutable header map
     */
    public static Map<String, String> merge(String token, ForwardedIdentity identity) {
        final Map<String, String> headers =
                token == null || token.isBlank() ? new LinkedHashMap<>() : authorizationHeader(token.strip());
        if (identity != null) {
            headers.putAll(identity.toHeaders());
        }
        return headers;
    }
}
