package assistant.core.service.auth;

import java.util.Collections;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import assistant.core.config.LlamaStackConfig;
import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.port.out.ServiceAccountCredentials;

/**
 * Header set for calls the service makes on its own behalf.
 *
 * <p>Presents the service-account token and asserts the configured admin user as
 * the forwarded identity. Built once, on first use, and kept for the lifetime of
 * the process.
 */
@ApplicationScoped
public class ServiceIdentityHeaders {

    private static final Logger LOG = Logger.getLogger(ServiceIdentityHeaders.class);

    private final ServiceAccountCredentials credentials;
    private final LlamaStackConfig config;

    private volatile Map<String, String> headers;
    private final Object initLock = new Object();

    @Inject
    public ServiceIdentityHeaders(ServiceAccountCredentials credentials, LlamaStackConfig config) {
        this.credentials = credentials;
        this.config = config;
    }

    /**
     * @return immutable header set, built on first call
     */
    public Map<String, String> headers() {
        var current = headers;
        if (current != null) {
            return current;
        }
        synchronized (initLock) {
            if (headers == null) {
                headers = build();
            }
            return headers;
        }
    }

    private Map<String, String> build() {
        final var token = credentials.token();
        final var adminUser = config.adminUsername().filter(name -> !name.isBlank());

        if (token.isEmpty()) {
            LOG.warn("No service account token available; calling llama-stack without a bearer token");
        }
        if (adminUser.isEmpty()) {
            LOG.warn("ADMIN_USERNAME is not set; calling llama-stack without a forwarded user");
        }

        final var identity = new ForwardedIdentity(adminUser.orElse(null), null);
        final var built = OutboundHeaders.merge(token.orElse(null), identity);
        LOG.infof(
                "Service identity headers initialized: token=%s, user=%s",
                token.isPresent() ? "present" : "absent", adminUser.orElse("<none>"));
        return Collections.unmodifiableMap(built);
    }
}
