package assistant.adapter.in.auth;

import java.util.LinkedHashMap;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.security.identity.IdentityProviderManager;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.identity.request.AuthenticationRequest;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.quarkus.vertx.http.runtime.security.ChallengeData;
import io.quarkus.vertx.http.runtime.security.HttpAuthenticationMechanism;
import io.quarkus.vertx.http.runtime.security.HttpCredentialTransport;
import io.smallrye.mutiny.Uni;
import io.vertx.ext.web.RoutingContext;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

import assistant.core.model.auth.AuthRequest;
import assistant.core.model.auth.AuthRequestContext;
import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.model.auth.UserRecord;
import assistant.core.service.auth.OutboundHeaders;

/**
 * Quarkus HTTP authentication mechanism for console API requests.
 *
 * <p>Only paths under {@code /api/} are authenticated here. The bearer token
 * from the Authorization header and the proxy's forwarded identity headers are
 * packed into a {@link ForwardedIdentityAuthenticationRequest} for
 * {@link ForwardedIdentityProvider}.
 *
 * <pre>
 * Authorization: Bearer eyJhbGciOi...
 * X-Forwarded-User: alice
 * X-Forwarded-Email: alice@example.com
 * </pre>
 */
@ApplicationScoped
@Priority(1)
public class BearerAuthenticationMechanism implements HttpAuthenticationMechanism {

    private static final Logger LOG = Logger.getLogger(BearerAuthenticationMechanism.class);

    static final String API_PATH_PREFIX = "/api/";
    static final String NOOP_PRINCIPAL = "development-mode";

    private final AtomicBoolean noopWarningLogged = new AtomicBoolean();

    private boolean isDangerousNoopEnabled() {
        return ConfigProvider.getConfig()
                .getOptionalValue("assistant.auth.dangerous-noop", Boolean.class)
                .orElse(false);
    }

    private SecurityIdentity createNoopIdentity() {
        if (noopWarningLogged.compareAndSet(false, true)) {
            LOG.warn("DANGEROUS: Authentication is DISABLED (assistant.auth.dangerous-noop=true)");
            LOG.warn("All API requests are treated as an admin. Do NOT use this setting in production!");
        }

        return QuarkusSecurityIdentity.builder()
                .setPrincipal(() -> NOOP_PRINCIPAL)
                .addRole(UserRecord.ADMIN_ROLE)
                .build();
    }

    @Override
    public Uni<SecurityIdentity> authenticate(RoutingContext context, IdentityProviderManager identityProviderManager) {
        final var path = context.normalizedPath();
        if (path == null || !path.startsWith(API_PATH_PREFIX)) {
            return Uni.createFrom().nullItem();
        }

        if (isDangerousNoopEnabled()) {
            return Uni.createFrom().item(createNoopIdentity());
        }

        final var token = bearerToken(context.request().getHeader(OutboundHeaders.AUTHORIZATION));
        final var identity = ForwardedIdentity.from(context.request()::getHeader);
        if (token.isEmpty() && identity.isEmpty()) {
            // Nothing to validate; the permission policy answers with a challenge
            return Uni.createFrom().nullItem();
        }

        final var params = new LinkedHashMap<String, String>();
        context.queryParams().forEach(entry -> params.putIfAbsent(entry.getKey(), entry.getValue()));
        final var request = new AuthRequest(token, new AuthRequestContext(path, identity.toHeaders(), params));
        return identityProviderManager.authenticate(new ForwardedIdentityAuthenticationRequest(request));
    }

    @Override
    public Uni<ChallengeData> getChallenge(RoutingContext context) {
        return Uni.createFrom()
                .item(new ChallengeData(401, "WWW-Authenticate", "Bearer realm=\"ai-virtual-assistant\""));
    }

    @Override
    public Set<Class<? extends AuthenticationRequest>> getCredentialTypes() {
        return Set.of(ForwardedIdentityAuthenticationRequest.class);
    }

    @Override
    public Uni<HttpCredentialTransport> getCredentialTransport(RoutingContext context) {
        return Uni.createFrom()
                .item(new HttpCredentialTransport(HttpCredentialTransport.Type.AUTHORIZATION, "Bearer"));
    }

    static String bearerToken(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            return "";
        }
        final var trimmed = authorization.trim();
        if (trimmed.startsWith(OutboundHeaders.BEARER_PREFIX)) {
            return trimmed.substring(OutboundHeaders.BEARER_PREFIX.length()).trim();
        }
        return trimmed;
    }
}
