package assistant.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import assistant.core.model.auth.UserRecord;

/**
 * Port interface for persistent storage of console users.
 */
public interface UserRepository {

    /**
     * Save or update a user.
     *
     * @param user the user to persist
     * @return Uni completing when the save is durable
     */
    Uni<Void> save(UserRecord user);

    /**
     * Store a user only if no user with the same username exists.
     *
     * <p>The check and the write are a single atomic step.
     *
     * @param user the user to persist
     * @return Uni with true if stored, false if the username was taken
     */
    Uni<Boolean> saveIfAbsent(UserRecord user);

    Uni<Optional<UserRecord>> findByUsername(String username);

    /**
     * Find a user by email address, ignoring case.
     *
     * @param email the email address
     * @return Uni with the user if found
     */
    Uni<Optional<UserRecord>> findByEmail(String email);

    Uni<List<UserRecord>> findAll();

    /**
     * Delete a user.
     *
     * @param username the username
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String username);
}
