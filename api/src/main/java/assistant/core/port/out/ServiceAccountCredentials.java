package assistant.core.port.out;

import java.util.Optional;

/**
 * Port for the credentials mounted into the pod by Kubernetes.
 *
 * <p>Both lookups re-read their source on every call. A missing or unreadable
 * source is a normal outcome and yields an empty result.
 */
public interface ServiceAccountCredentials {

    /**
     * @return the service-account bearer token, if mounted
     */
    Optional<String> token();

    /**
     * @return the namespace the pod runs in, if mounted
     */
    Optional<String> namespace();
}
