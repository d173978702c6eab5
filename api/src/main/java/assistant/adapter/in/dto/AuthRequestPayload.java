package assistant.adapter.in.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import assistant.core.model.auth.AuthRequest;
import assistant.core.model.auth.AuthRequestContext;

/**
 * Body llama-stack posts to its external authentication provider.
 *
 * @param apiKey  the caller's bearer credential
 * @param request the original request context
 */
public record AuthRequestPayload(@JsonProperty("api_key") String apiKey, RequestContext request) {

    public static AuthRequestPayload from(AuthRequest request) {
        final var context = request.request();
        return new AuthRequestPayload(
                request.apiKey(), new RequestContext(context.path(), context.headers(), context.params()));
    }

    public AuthRequest toAuthRequest() {
        final var context = request == null
                ? null
                : new AuthRequestContext(request.path(), request.headers(), request.params());
        return new AuthRequest(apiKey, context);
    }

    /**
     * @param path    request path
     * @param headers request headers
     * @param params  query parameters
     */
    public record RequestContext(String path, Map<String, String> headers, Map<String, String> params) {}
}
