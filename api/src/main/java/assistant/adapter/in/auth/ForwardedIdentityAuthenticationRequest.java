package assistant.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

import assistant.core.model.auth.AuthRequest;

/**
 * Authentication request carrying the caller's bearer token and forwarded identity.
 *
 * <p>This is the credential holder passed from {@link BearerAuthenticationMechanism}
 * to {@link ForwardedIdentityProvider} during Quarkus Security authentication.
 */
public class ForwardedIdentityAuthenticationRequest extends BaseAuthenticationRequest {

    private final AuthRequest authRequest;

    public ForwardedIdentityAuthenticationRequest(AuthRequest authRequest) {
        this.authRequest = authRequest;
    }

    public AuthRequest getAuthRequest() {
        return authRequest;
    }
}
