package assistant.core.model.auth;

/**
 * The authentication service rejected the credential.
 */
public class AuthenticationRejectedException extends AuthenticationException {

    private final int status;

    public AuthenticationRejectedException(int status) {
        super("Authentication failed: " + status);
        this.status = status;
    }

    /**
     * @return the status code returned by the authentication service
     */
    public int status() {
        return status;
    }
}
