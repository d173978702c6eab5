package assistant.adapter.out.http;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import assistant.core.config.AuthConfig;
import assistant.core.port.out.TokenIntrospectionClient;

/**
 * Token introspection client that calls the authentication sidecar with GET.
 *
 * <p>The sidecar answers 200 for a valid token and any other status otherwise.
 * The response body is ignored.
 */
@ApplicationScoped
public class VertxTokenIntrospectionClient implements TokenIntrospectionClient {

    private static final Logger LOG = Logger.getLogger(VertxTokenIntrospectionClient.class);

    private final WebClient webClient;
    private final AuthConfig config;

    @Inject
    public VertxTokenIntrospectionClient(Vertx vertx, AuthConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public Uni<Integer> introspect(Map<String, String> headers) {
        final var url = config.introspection().url();
        final var startTime = System.currentTimeMillis();

        final var request = webClient.getAbs(url).timeout(config.timeout().toMillis());
        headers.forEach(request::putHeader);

        return request.send()
                .map(response -> {
                    LOG.debugf(
                            "Token introspection: url=%s, status=%d, duration=%dms",
                            url, response.statusCode(), System.currentTimeMillis() - startTime);
                    return response.statusCode();
                })
                .onFailure()
                .invoke(error -> LOG.warnf(
                        "Token introspection error: url=%s, duration=%dms, error=%s",
                        url, System.currentTimeMillis() - startTime, error.toString()))
                .onFailure()
                .transform(error -> AuthCallFailures.translate(error, url));
    }
}
