package assistant.core.model.auth;

/**
 * The authentication service could not be reached or failed unexpectedly.
 *
 * <p>The message is deliberately generic; the underlying cause is kept for logging
 * but never rendered to clients.
 */
public class AuthServiceException extends AuthenticationException {

    public static final String MESSAGE = "Authentication service error";

    public AuthServiceException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
