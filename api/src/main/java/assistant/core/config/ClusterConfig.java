package assistant.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for in-cluster identity and service readiness.
 *
 * <p>Configuration prefix: {@code assistant.cluster}
 */
@ConfigMapping(prefix = "assistant.cluster")
public interface ClusterConfig {

    /**
     * Namespace used when the mounted namespace file cannot be read.
     *
     * @return fallback namespace (default: default)
     */
    @WithDefault("default")
    String defaultNamespace();

    ServiceAccount serviceAccount();

    Readiness readiness();

    interface ServiceAccount {

        /**
         * @return path of the mounted service-account token
         */
        @WithDefault("/var/run/secrets/kubernetes.io/serviceaccount/token")
        String tokenPath();

        /**
         * @return path of the mounted namespace file
         */
        @WithDefault("/var/run/secrets/kubernetes.io/serviceaccount/namespace")
        String namespacePath();
    }

    interface Readiness {

        /**
         * Service whose endpoints gate the startup sync.
         *
         * @return companion service name
         */
        @WithDefault("ai-virtual-assistant-authenticated")
        String serviceName();

        /**
         * @return total time to wait for the service (default: 5 minutes)
         */
        @WithDefault("PT300S")
        Duration timeout();

        /**
         * @return pause between endpoint lookups (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration interval();
    }
}
