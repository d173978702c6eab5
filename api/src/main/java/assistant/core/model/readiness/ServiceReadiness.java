package assistant.core.model.readiness;

/**
 * Terminal outcome of waiting for a cluster service.
 */
public enum ServiceReadiness {
    /** At least one backing address is registered. */
    READY,
    /** The deadline passed before any address was registered. */
    TIMED_OUT;

    public boolean isReady() {
        return this == READY;
    }
}
