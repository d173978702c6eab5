package assistant.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for caller authentication.
 *
 * <p>Configuration prefix: {@code assistant.auth}
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * assistant.auth.introspection.url=http://localhost:8887/validate-token
 * assistant.auth.peer.url=http://localhost:8887/validate
 * assistant.auth.timeout=PT10S
 * </pre>
 *
 * <p>The introspection URL is the token check this service performs for every
 * request it validates. The peer URL is the external authentication endpoint
 * exercised by the self-test; the two are distinct endpoints on the same sidecar.
 */
@ConfigMapping(prefix = "assistant.auth")
public interface AuthConfig {

    /**
     * Disable inbound authentication entirely.
     *
     * <p>Every request is treated as an admin. Development and test use only.
     *
     * @return true to skip authentication (default: false)
     */
    @WithDefault("false")
    boolean dangerousNoop();

    /**
     * Deadline for calls to the authentication sidecar.
     *
     * @return call timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration timeout();

    Introspection introspection();

    Peer peer();

    interface Introspection {

        /**
         * Token introspection endpoint, called with GET.
         *
         * @return introspection URL
         */
        @WithDefault("http://localhost:8887/validate-token")
        String url();
    }

    interface Peer {

        /**
         * Peer authentication endpoint, called with POST by the self-test.
         *
         * @return peer validation URL
         */
        @WithDefault("http://localhost:8887/validate")
        String url();
    }
}
