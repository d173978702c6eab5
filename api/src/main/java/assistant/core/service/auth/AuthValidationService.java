package assistant.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import assistant.core.model.auth.AuthDecision;
import assistant.core.model.auth.AuthRequest;
import assistant.core.model.auth.AuthServiceTimeoutException;
import assistant.core.model.auth.AuthenticationRejectedException;
import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.model.auth.InvalidAuthResponseException;
import assistant.core.model.auth.UserNotFoundException;
import assistant.core.port.in.AuthValidation;
import assistant.core.port.in.UserManagement;
import assistant.core.port.out.AuthMetrics;
import assistant.core.port.out.PeerAuthenticationClient;
import assistant.core.port.out.ServiceAccountCredentials;
import assistant.core.port.out.TokenIntrospectionClient;

/**
 * Authenticates callers against the token introspection sidecar and the local
 * user directory.
 *
 * <p>A decision is produced only when the sidecar accepts the token <em>and</em> a
 * local user matches the forwarded identity of the original request.
 */
@ApplicationScoped
public class AuthValidationService implements AuthValidation {

    private static final Logger LOG = Logger.getLogger(AuthValidationService.class);

    static final String FLOW_INTROSPECTION = "introspection";
    static final String FLOW_PEER = "peer";

    private final TokenIntrospectionClient introspectionClient;
    private final PeerAuthenticationClient peerClient;
    private final UserManagement users;
    private final ServiceAccountCredentials credentials;
    private final AuthMetrics metrics;

    @Inject
    public AuthValidationService(
            TokenIntrospectionClient introspectionClient,
            PeerAuthenticationClient peerClient,
            UserManagement users,
            ServiceAccountCredentials credentials,
            AuthMetrics metrics) {
        this.introspectionClient = introspectionClient;
        this.peerClient = peerClient;
        this.users = users;
        this.credentials = credentials;
        this.metrics = metrics;
    }

    @Override
    public Uni<AuthDecision> validate(AuthRequest request) {
        final var identity = request.request().forwardedIdentity();
        final var headers = OutboundHeaders.merge(request.apiKey(), identity);
        final var startTime = System.currentTimeMillis();

        return introspectionClient
                .introspect(headers)
                .invoke(status -> metrics.recordIntrospection(status, System.currentTimeMillis() - startTime))
                .flatMap(status -> {
                    if (status != 200) {
                        LOG.debugf(
                                "Token introspection rejected request: status=%d, path=%s",
                                status, request.request().path());
                        return Uni.createFrom().failure(new AuthenticationRejectedException(status));
                    }
                    return users.findByIdentity(identity).map(user -> user.map(AuthDecision::forUser)
                            .orElseThrow(() -> {
                                LOG.debugf("Token accepted but no local user matches: user=%s, email=%s",
                                        identity.user(), identity.email());
                                return new UserNotFoundException();
                            }));
                })
                .invoke(decision -> metrics.recordValidation(FLOW_INTROSPECTION, "success"))
                .onFailure()
                .invoke(error -> metrics.recordValidation(FLOW_INTROSPECTION, outcomeOf(error)));
    }

    @Override
    public Uni<AuthDecision> validatePeer(ForwardedIdentity identity) {
        final var token = credentials.token();
        if (token.isEmpty()) {
            LOG.warn("No service account token available; peer authentication proceeds without one");
        }

        final var request = AuthRequest.forIdentity(token.orElse(""), identity);

        return peerClient
                .authenticate(request)
                .invoke(decision -> {
                    metrics.recordValidation(FLOW_PEER, "success");
                    LOG.debugf("Peer authentication succeeded: principal=%s", decision.principal());
                })
                .onFailure()
                .invoke(error -> {
                    metrics.recordValidation(FLOW_PEER, outcomeOf(error));
                    LOG.warnf("Peer authentication failed: %s", error.getMessage());
                });
    }

    static String outcomeOf(Throwable error) {
        if (error instanceof AuthenticationRejectedException) {
            return "rejected";
        }
        if (error instanceof UserNotFoundException) {
            return "user_not_found";
        }
        if (error instanceof AuthServiceTimeoutException) {
            return "timeout";
        }
        if (error instanceof InvalidAuthResponseException) {
            return "invalid_response";
        }
        return "error";
    }
}
