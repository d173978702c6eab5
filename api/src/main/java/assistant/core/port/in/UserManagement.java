package assistant.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.model.auth.UserRecord;

/**
 * Port for managing local console users.
 */
public interface UserManagement {

    Uni<UserRecord> create(String username, String email, String role);

    Uni<Optional<UserRecord>> get(String username);

    Uni<List<UserRecord>> list();

    Uni<Boolean> delete(String username);

    /**
     * Find the user matching a forwarded identity, by username first and then by email.
     *
     * @param identity the forwarded identity
     * @return the matching user, if any
     */
    Uni<Optional<UserRecord>> findByIdentity(ForwardedIdentity identity);
}
