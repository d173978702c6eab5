package assistant.core.model.auth;

/**
 * The authentication service answered with a body that is not a valid decision.
 */
public class InvalidAuthResponseException extends AuthenticationException {

    public static final String MESSAGE = "Invalid authentication response format";

    public InvalidAuthResponseException(Throwable cause) {
        super(MESSAGE, cause);
    }

    public InvalidAuthResponseException(String detail) {
        super(MESSAGE + ": " + detail);
    }
}
