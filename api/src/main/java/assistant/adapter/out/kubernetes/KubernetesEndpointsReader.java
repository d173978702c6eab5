package assistant.adapter.out.kubernetes;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.fabric8.kubernetes.api.model.EndpointSubset;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.jboss.logging.Logger;

import assistant.core.model.readiness.EndpointsLookupException;
import assistant.core.model.readiness.EndpointsSnapshot;
import assistant.core.port.out.EndpointsReader;

/**
 * Reads Endpoints objects through the fabric8 client.
 *
 * <p>The client is configured from the in-cluster service account when running in a pod.
 */
@ApplicationScoped
public class KubernetesEndpointsReader implements EndpointsReader {

    private static final Logger LOG = Logger.getLogger(KubernetesEndpointsReader.class);

    private final KubernetesClient client;

    @Inject
    public KubernetesEndpointsReader(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<EndpointsSnapshot> read(String serviceName, String namespace) {
        try {
            final var endpoints = client.endpoints()
                    .inNamespace(namespace)
                    .withName(serviceName)
                    .get();
            if (endpoints == null) {
                return Optional.empty();
            }

            int ready = 0;
            if (endpoints.getSubsets() != null) {
                for (EndpointSubset subset : endpoints.getSubsets()) {
                    if (subset.getAddresses() != null) {
                        ready += subset.getAddresses().size();
                    }
                }
            }
            LOG.debugf("Endpoints %s/%s have %d ready addresses", namespace, serviceName, ready);
            return Optional.of(new EndpointsSnapshot(serviceName, namespace, ready));
        } catch (KubernetesClientException e) {
            throw new EndpointsLookupException(
                    "Failed to read endpoints " + namespace + "/" + serviceName + ": " + e.getMessage(),
                    e.getCode(),
                    e);
        }
    }
}
