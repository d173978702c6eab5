package assistant.adapter.in.bootstrap;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import assistant.core.config.LlamaStackConfig;
import assistant.core.model.auth.UserRecord;
import assistant.core.port.in.UserManagement;

/**
 * Registers the configured admin user on startup.
 *
 * <p>When {@code ADMIN_USERNAME} is set and no such user exists, it is created
 * with the {@code admin} role. Failures are logged and do not stop startup.
 */
@ApplicationScoped
public class AdminUserInitializer {

    private static final Logger LOG = Logger.getLogger(AdminUserInitializer.class);
    private static final Duration STORAGE_TIMEOUT = Duration.ofSeconds(10);

    private final UserManagement users;
    private final LlamaStackConfig config;

    @Inject
    public AdminUserInitializer(UserManagement users, LlamaStackConfig config) {
        this.users = users;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        final var adminUsername = config.adminUsername().filter(name -> !name.isBlank());
        if (adminUsername.isEmpty()) {
            LOG.debug("ADMIN_USERNAME is not set; skipping admin user registration");
            return;
        }
        ensureAdmin(adminUsername.get());
    }

    void ensureAdmin(String username) {
        try {
            final var existing = users.get(username).await().atMost(STORAGE_TIMEOUT);
            if (existing.isPresent()) {
                LOG.debugf("Admin user %s already exists", username);
                return;
            }
            users.create(username, null, UserRecord.ADMIN_ROLE).await().atMost(STORAGE_TIMEOUT);
            LOG.infof("Registered admin user %s", username);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to register admin user %s: %s", username, e.getMessage());
        }
    }
}
