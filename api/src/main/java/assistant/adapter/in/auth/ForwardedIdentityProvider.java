package assistant.adapter.in.auth;

import java.util.HashSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import assistant.core.model.auth.AuthDecision;
import assistant.core.model.auth.AuthenticationRejectedException;
import assistant.core.model.auth.UserNotFoundException;
import assistant.core.port.in.AuthValidation;

/**
 * Quarkus identity provider that runs the caller through {@link AuthValidation}.
 *
 * <p>The resulting {@link SecurityIdentity} contains:
 * <ul>
 *   <li>Principal name: the local username</li>
 *   <li>Roles: the decision's {@code roles} attribute</li>
 *   <li>Attributes: every decision attribute, keyed by name</li>
 * </ul>
 *
 * <p>Rejected tokens and unknown users fail authentication. Errors reaching the
 * introspection endpoint propagate unchanged so the REST problem mappers answer
 * them with 502 or 504.
 */
@ApplicationScoped
public class ForwardedIdentityProvider implements IdentityProvider<ForwardedIdentityAuthenticationRequest> {

    private static final Logger LOG = Logger.getLogger(ForwardedIdentityProvider.class);

    private final AuthValidation authValidation;

    @Inject
    public ForwardedIdentityProvider(AuthValidation authValidation) {
        this.authValidation = authValidation;
    }

    @Override
    public Class<ForwardedIdentityAuthenticationRequest> getRequestType() {
        return ForwardedIdentityAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            ForwardedIdentityAuthenticationRequest request, AuthenticationRequestContext context) {
        return authValidation
                .validate(request.getAuthRequest())
                .onFailure(e -> e instanceof AuthenticationRejectedException || e instanceof UserNotFoundException)
                .transform(e -> {
                    LOG.debugf(
                            "Authentication failed for %s: %s",
                            request.getAuthRequest().request().path(), e.getMessage());
                    return new AuthenticationFailedException(e.getMessage(), e);
                })
                .map(ForwardedIdentityProvider::buildIdentity);
    }

    static SecurityIdentity buildIdentity(AuthDecision decision) {
        final var builder = QuarkusSecurityIdentity.builder()
                .setPrincipal(decision::principal)
                .addRoles(new HashSet<>(decision.roles()));
        decision.attributes().forEach(builder::addAttribute);
        return builder.build();
    }
}
