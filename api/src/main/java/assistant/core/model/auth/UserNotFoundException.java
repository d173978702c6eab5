package assistant.core.model.auth;

/**
 * The credential was accepted but no local user matches the forwarded identity.
 */
public class UserNotFoundException extends AuthenticationException {

    public static final String MESSAGE = "User not found";

    public UserNotFoundException() {
        super(MESSAGE);
    }
}
