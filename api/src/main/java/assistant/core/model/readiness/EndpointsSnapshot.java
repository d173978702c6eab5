package assistant.core.model.readiness;

/**
 * Point-in-time view of a service's Endpoints object.
 *
 * @param serviceName    service name
 * @param namespace      namespace of the service
 * @param readyAddresses number of addresses across all subsets
 */
public record EndpointsSnapshot(String serviceName, String namespace, int readyAddresses) {

    public EndpointsSnapshot {
        if (readyAddresses < 0) {
            throw new IllegalArgumentException("readyAddresses cannot be negative");
        }
    }

    public boolean isReady() {
        return readyAddresses > 0;
    }
}
