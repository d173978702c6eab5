package assistant.core.model.auth;

import java.time.Instant;

/**
 * A locally registered console user.
 *
 * @param username  unique username, matched against {@code X-Forwarded-User}
 * @param email     email address, matched against {@code X-Forwarded-Email}
 * @param role      the user's role (e.g. "admin", "user")
 * @param createdAt when the user was registered
 */
public record UserRecord(String username, String email, String role, Instant createdAt) {

    public static final String DEFAULT_ROLE = "user";
    public static final String ADMIN_ROLE = "admin";

    public UserRecord {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (role == null || role.isBlank()) {
            role = DEFAULT_ROLE;
        }
        if (email != null && email.isBlank()) {
            email = null;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static UserRecord create(String username, String email, String role) {
        return new UserRecord(username, email, role, Instant.now());
    }
}
