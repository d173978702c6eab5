package assistant.core.model.auth;

/**
 * A local user with the requested username is already registered.
 */
public class UserAlreadyExistsException extends RuntimeException {

    private final String username;

    public UserAlreadyExistsException(String username) {
        super("User '" + username + "' already exists");
        this.username = username;
    }

    public String username() {
        return username;
    }
}
