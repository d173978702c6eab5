package assistant.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import assistant.core.model.auth.UserRecord;
import assistant.core.port.out.UserRepository;

/**
 * In-memory implementation of UserRepository.
 *
 * <p>Data is NOT persisted across restarts. Users registered at startup
 * (such as the admin user) are recreated on every boot.
 */
public class InMemoryUserRepository implements UserRepository {

    private final ConcurrentHashMap<String, UserRecord> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(UserRecord user) {
        return Uni.createFrom().item(() -> {
            storage.put(user.username(), user);
            return null;
        });
    }

    @Override
    public Uni<Boolean> saveIfAbsent(UserRecord user) {
        return Uni.createFrom().item(() -> storage.putIfAbsent(user.username(), user) == null);
    }

    @Override
    public Uni<Optional<UserRecord>> findByUsername(String username) {
        return Uni.createFrom()
                .item(() -> username == null ? Optional.empty() : Optional.ofNullable(storage.get(username)));
    }

    @Override
    public Uni<Optional<UserRecord>> findByEmail(String email) {
        return Uni.createFrom().item(() -> {
            if (email == null || email.isBlank()) {
                return Optional.<UserRecord>empty();
            }
            final var wanted = email.toLowerCase(Locale.ROOT);
            return storage.values().stream()
                    .filter(user -> user.email() != null)
                    .filter(user -> user.email().toLowerCase(Locale.ROOT).equals(wanted))
                    .findFirst();
        });
    }

    @Override
    public Uni<List<UserRecord>> findAll() {
        return Uni.createFrom().item(() -> new ArrayList<>(storage.values()));
    }

    @Override
    public Uni<Boolean> delete(String username) {
        return Uni.createFrom().item(() -> storage.remove(username) != null);
    }
}
