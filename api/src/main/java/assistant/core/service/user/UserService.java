package assistant.core.service.user;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.model.auth.UserAlreadyExistsException;
import assistant.core.model.auth.UserRecord;
import assistant.core.port.in.UserManagement;
import assistant.core.port.out.UserRepository;

/**
 * Service for managing local console users.
 */
@ApplicationScoped
public class UserService implements UserManagement {

    private static final Logger LOG = Logger.getLogger(UserService.class);

    private final UserRepository repository;

    @Inject
    public UserService(UserRepository repository) {
        this.repository = repository;
    }

    @Override
    public Uni<UserRecord> create(String username, String email, String role) {
        if (username == null || username.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Username cannot be null or blank"));
        }

        final var user = UserRecord.create(username, email, role);
        return repository.saveIfAbsent(user).map(stored -> {
            if (!stored) {
                throw new UserAlreadyExistsException(username);
            }
            LOG.infof("Created user: username=%s, role=%s", user.username(), user.role());
            return user;
        });
    }

    @Override
    public Uni<Optional<UserRecord>> get(String username) {
        return repository.findByUsername(username);
    }

    @Override
    public Uni<List<UserRecord>> list() {
        return repository.findAll();
    }

    @Override
    public Uni<Boolean> delete(String username) {
        return repository.delete(username).invoke(deleted -> {
            if (deleted) {
                LOG.infof("Deleted user: username=%s", username);
            }
        });
    }

    @Override
    public Uni<Optional<UserRecord>> findByIdentity(ForwardedIdentity identity) {
        if (identity == null || identity.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }

        final Uni<Optional<UserRecord>> byUsername = identity.userOptional()
                .map(repository::findByUsername)
                .orElseGet(() -> Uni.createFrom().item(Optional.empty()));

        return byUsername.flatMap(found -> {
            if (found.isPresent() || identity.email() == null) {
                return Uni.createFrom().item(found);
            }
            return repository.findByEmail(identity.email());
        });
    }
}
