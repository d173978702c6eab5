package assistant.adapter.out.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import assistant.core.config.AuthConfig;
import assistant.core.model.auth.AuthDecision;
import assistant.core.model.auth.AuthRequest;
import assistant.core.model.auth.AuthenticationRejectedException;
import assistant.core.model.auth.InvalidAuthResponseException;
import assistant.core.port.out.PeerAuthenticationClient;

/**
 * Authenticates against an external provider speaking the llama-stack
 * authentication contract (see {@link AuthRequestJson}).
 */
@ApplicationScoped
public class VertxPeerAuthenticationClient implements PeerAuthenticationClient {

    private static final Logger LOG = Logger.getLogger(VertxPeerAuthenticationClient.class);

    private final WebClient webClient;
    private final AuthConfig config;

    @Inject
    public VertxPeerAuthenticationClient(Vertx vertx, AuthConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public Uni<AuthDecision> authenticate(AuthRequest request) {
        final var url = config.peer().url();

        LOG.debugf("Calling peer authentication: url=%s, path=%s", url, request.request().path());

        return webClient
                .postAbs(url)
                .timeout(config.timeout().toMillis())
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "application/json")
                .sendJsonObject(AuthRequestJson.toJson(request))
                .map(response -> {
                    if (response.statusCode() != 200) {
                        LOG.warnf("Authentication failed with status code: %d", response.statusCode());
                        throw new AuthenticationRejectedException(response.statusCode());
                    }
                    try {
                        return AuthRequestJson.decisionFromJson(response.bodyAsJsonObject());
                    } catch (DecodeException | ClassCastException e) {
                        LOG.warn("Error parsing authentication response");
                        throw new InvalidAuthResponseException(e);
                    }
                })
                .onFailure()
                .transform(error -> AuthCallFailures.translate(error, url));
    }
}
