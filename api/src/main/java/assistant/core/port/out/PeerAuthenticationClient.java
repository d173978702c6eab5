package assistant.core.port.out;

import io.smallrye.mutiny.Uni;

import assistant.core.model.auth.AuthDecision;
import assistant.core.model.auth.AuthRequest;

/**
 * Port for an external authentication provider that accepts {@link AuthRequest} bodies.
 */
public interface PeerAuthenticationClient {

    /**
     * Send an authentication request and parse the decision.
     *
     * <p>Failure kinds are kept distinct:
     * <ul>
     *   <li>{@link assistant.core.model.auth.AuthenticationRejectedException} - non-200 status</li>
     *   <li>{@link assistant.core.model.auth.InvalidAuthResponseException} - unparseable body</li>
     *   <li>{@link assistant.core.model.auth.AuthServiceTimeoutException} - deadline passed</li>
     *   <li>{@link assistant.core.model.auth.AuthServiceException} - anything else</li>
     * </ul>
     *
     * @param request the authentication request
     * @return the decision returned by the peer
     */
    Uni<AuthDecision> authenticate(AuthRequest request);
}
