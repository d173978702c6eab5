package assistant.core.model.readiness;

/**
 * Exception thrown when the cluster API cannot be queried for a service's endpoints.
 */
public class EndpointsLookupException extends RuntimeException {

    private final int status;

    public EndpointsLookupException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * @return HTTP status reported by the API server, 0 when none
     */
    public int status() {
        return status;
    }
}
