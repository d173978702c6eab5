package assistant.core.model.auth;

/**
 * The authentication service did not answer within the deadline.
 */
public class AuthServiceTimeoutException extends AuthenticationException {

    public AuthServiceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
