package assistant.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import assistant.adapter.in.dto.AuthRequestPayload;
import assistant.adapter.in.dto.AuthResponsePayload;
import assistant.adapter.in.dto.PeerUserResponse;
import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.port.in.AuthValidation;

/**
 * External authentication provider endpoint for llama-stack.
 *
 * <p>llama-stack posts every inbound request's credential and headers here and
 * admits the request only on a 200 answer. Rejections are 403 problems whose
 * detail tells a rejected token apart from an unknown user.
 *
 * <p>The trailing-slash form {@code /validate/} is matched by the same method.
 * A request without a body is refused with 400 before the sidecar is called.
 */
@Path("/validate")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ValidationResource {

    private final AuthValidation authValidation;

    @Inject
    public ValidationResource(AuthValidation authValidation) {
        this.authValidation = authValidation;
    }

    /**
     * Validate a caller on behalf of llama-stack.
     *
     * @param payload the authentication request
     * @return the decision
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<AuthResponsePayload> validate(@NotNull(message = "request body is required") AuthRequestPayload payload) {
        return authValidation.validate(payload.toAuthRequest()).map(AuthResponsePayload::from);
    }

    /**
     * Run the peer authentication flow for the forwarded identity of this request.
     *
     * @param headers request headers
     * @return principal and attributes returned by the peer
     */
    @POST
    @Path("/test")
    public Uni<PeerUserResponse> validateTest(@Context HttpHeaders headers) {
        final var identity = ForwardedIdentity.from(headers::getHeaderString);
        return authValidation.validatePeer(identity).map(PeerUserResponse::from);
    }
}
