package assistant.core.model.auth;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request to authenticate a caller.
 *
 * <p>This is the shape llama-stack sends to its external authentication provider.
 *
 * @param apiKey  the bearer credential presented by the caller, may be empty
 * @param request the original request context
 */
public record AuthRequest(String apiKey, AuthRequestContext request) {

    public AuthRequest {
        if (apiKey == null) {
            apiKey = "";
        }
        if (request == null) {
            request = new AuthRequestContext("/", Map.of(), Map.of());
        }
    }

    /**
     * Build a request on behalf of a forwarded identity, as the self-test does.
     *
     * <p>Only present identity entries are written, under lowercase header names.
     *
     * @param apiKey   the credential to present
     * @param identity the forwarded identity
     * @return a request for path {@code /} with no query parameters
     */
    public static AuthRequest forIdentity(String apiKey, ForwardedIdentity identity) {
        final var headers = new LinkedHashMap<String, String>();
        identity.userOptional().ifPresent(user -> headers.put(ForwardedIdentity.USER_HEADER.toLowerCase(), user));
        identity.emailOptional().ifPresent(email -> headers.put(ForwardedIdentity.EMAIL_HEADER.toLowerCase(), email));
        return new AuthRequest(apiKey, new AuthRequestContext("/", headers, Map.of()));
    }
}
