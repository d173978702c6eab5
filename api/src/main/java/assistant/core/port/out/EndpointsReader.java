package assistant.core.port.out;

import java.util.Optional;

import assistant.core.model.readiness.EndpointsLookupException;
import assistant.core.model.readiness.EndpointsSnapshot;

/**
 * Port for reading a Service's Endpoints from the cluster API.
 */
public interface EndpointsReader {

    /**
     * Read the current endpoints of a service.
     *
     * <p>This call blocks.
     *
     * @param serviceName service name
     * @param namespace   namespace of the service
     * @return the snapshot, or empty when the Endpoints object does not exist
     * @throws EndpointsLookupException when the cluster API call fails
     */
    Optional<EndpointsSnapshot> read(String serviceName, String namespace);
}
