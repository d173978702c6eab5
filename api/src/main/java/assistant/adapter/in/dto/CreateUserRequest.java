package assistant.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * DTO for user registration requests.
 *
 * @param username unique username (required)
 * @param email    email address (optional)
 * @param role     role name (optional, defaults to "user")
 */
public record CreateUserRequest(
        @NotBlank(message = "username is required") String username, String email, String role) {}
