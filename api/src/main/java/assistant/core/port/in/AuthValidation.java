package assistant.core.port.in;

import io.smallrye.mutiny.Uni;

import assistant.core.model.auth.AuthDecision;
import assistant.core.model.auth.AuthRequest;
import assistant.core.model.auth.ForwardedIdentity;

/**
 * Port for authenticating callers.
 */
public interface AuthValidation {

    /**
     * Validate a credential and reconcile it with the local user directory.
     *
     * <p>Fails with {@link assistant.core.model.auth.AuthenticationRejectedException}
     * when the introspection endpoint rejects the token and with
     * {@link assistant.core.model.auth.UserNotFoundException} when no local user
     * matches the forwarded identity.
     *
     * @param request the authentication request
     * @return the decision for the caller
     */
    Uni<AuthDecision> validate(AuthRequest request);

    /**
     * Authenticate against the external peer endpoint the way llama-stack does,
     * presenting the service-account token on behalf of the forwarded identity.
     *
     * @param identity forwarded identity of the current request
     * @return the decision returned by the peer
     */
    Uni<AuthDecision> validatePeer(ForwardedIdentity identity);
}
