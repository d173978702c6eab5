package assistant.core.model.auth;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful authentication.
 *
 * @param principal  the authenticated username
 * @param attributes role attributes, at minimum {@code roles}
 * @param message    human-readable outcome
 */
public record AuthDecision(String principal, Map<String, List<String>> attributes, String message) {

    public static final String ROLES = "roles";
    public static final String SUCCESS_MESSAGE = "Authentication successful";

    public AuthDecision {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("Principal cannot be null or blank");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        if (message == null) {
            message = "";
        }
    }

    public static AuthDecision forUser(UserRecord user) {
        return new AuthDecision(user.username(), Map.of(ROLES, List.of(user.role())), SUCCESS_MESSAGE);
    }

    public List<String> roles() {
        return attributes.getOrDefault(ROLES, List.of());
    }
}
