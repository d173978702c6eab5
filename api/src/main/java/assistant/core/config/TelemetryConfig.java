package assistant.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for metrics.
 *
 * <p>Configuration prefix: {@code assistant.telemetry}
 */
@ConfigMapping(prefix = "assistant.telemetry")
public interface TelemetryConfig {

    Metrics metrics();

    interface Metrics {

        /**
         * @return true to record Micrometer metrics (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
