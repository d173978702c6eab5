package assistant.core.port.out;

/**
 * Port for recording authentication and sync metrics.
 */
public interface AuthMetrics {

    /**
     * Record the outcome of a validation.
     *
     * @param flow    "introspection" or "peer"
     * @param outcome outcome label (e.g. "success", "rejected", "user_not_found")
     */
    void recordValidation(String flow, String outcome);

    /**
     * Record an introspection call.
     *
     * @param status     HTTP status, 0 when no response was received
     * @param durationMs call duration
     */
    void recordIntrospection(int status, long durationMs);

    void recordSync(String label, boolean succeeded);
}
