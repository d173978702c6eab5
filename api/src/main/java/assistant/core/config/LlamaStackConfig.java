package assistant.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the llama-stack connection.
 *
 * <p>Configuration prefix: {@code assistant.llama-stack}
 *
 * <h2>Environment Variables</h2>
 * <pre>
 * LLAMASTACK_URL=http://llamastack:8321
 * ADMIN_USERNAME=admin
 * </pre>
 */
@ConfigMapping(prefix = "assistant.llama-stack")
public interface LlamaStackConfig {

    /**
     * @return llama-stack base URL (default: http://localhost:8321)
     */
    @WithDefault("http://localhost:8321")
    String url();

    /**
     * Username the service acts as when calling llama-stack on its own behalf.
     *
     * @return admin username, empty when unset
     */
    Optional<String> adminUsername();

    /**
     * @return timeout for llama-stack calls (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration timeout();
}
