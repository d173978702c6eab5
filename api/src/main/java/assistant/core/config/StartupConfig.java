package assistant.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the post-startup sync.
 *
 * <p>Configuration prefix: {@code assistant.startup}
 *
 * <h2>Environment Variables</h2>
 * <pre>
 * ASSISTANT_STARTUP_SYNC_ENABLED=false
 * ASSISTANT_STARTUP_SELF_CHECK_URL=http://localhost:8000/
 * </pre>
 */
@ConfigMapping(prefix = "assistant.startup")
public interface StartupConfig {

    /**
     * Run the MCP server, model server and knowledge base sync after startup.
     *
     * @return true to sync (default: true)
     */
    @WithDefault("true")
    boolean syncEnabled();

    SelfCheck selfCheck();

    interface SelfCheck {

        /**
         * URL of this server's own root endpoint.
         *
         * @return self-check URL
         */
        @WithDefault("http://localhost:8000/")
        String url();

        /**
         * @return number of probes before giving up (default: 20)
         */
        @WithDefault("20")
        int attempts();

        /**
         * @return pause between probes (default: 500ms)
         */
        @WithDefault("PT0.5S")
        Duration interval();

        /**
         * @return pause after the server answers, before syncing starts (default: 1s)
         */
        @WithDefault("PT1S")
        Duration settleDelay();
    }
}
