package assistant.core.model.auth;

/**
 * Base type for failures while authenticating a caller.
 */
public abstract class AuthenticationException extends RuntimeException {

    protected AuthenticationException(String message) {
        super(message);
    }

    protected AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
