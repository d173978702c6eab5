package assistant.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import assistant.core.config.TelemetryConfig;
import assistant.core.port.out.AuthMetrics;

/**
 * Micrometer metrics for authentication and startup sync.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code assistant.auth.validation.total} - validations by flow and outcome</li>
 *   <li>{@code assistant.auth.introspection.total} - introspection calls by status</li>
 *   <li>{@code assistant.auth.introspection.duration} - introspection latency</li>
 *   <li>{@code assistant.sync.total} - sync routine runs by label and result</li>
 * </ul>
 */
@ApplicationScoped
public class AssistantMetrics implements AuthMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public AssistantMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordValidation(String flow, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("assistant.auth.validation.total")
                .description("Authentication validations")
                .tag("flow", nullSafe(flow))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordIntrospection(int status, long durationMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("assistant.auth.introspection.total")
                .description("Token introspection calls")
                .tag("status", String.valueOf(status))
                .tag("status_class", statusClass(status))
                .register(registry)
                .increment();

        Timer.builder("assistant.auth.introspection.duration")
                .description("Token introspection latency")
                .tag("status_class", statusClass(status))
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordSync(String label, boolean succeeded) {
        if (!enabled) {
            return;
        }

        Counter.builder("assistant.sync.total")
                .description("Startup sync routine runs")
                .tag("resource", nullSafe(label))
                .tag("result", succeeded ? "success" : "failure")
                .register(registry)
                .increment();
    }

    private static String statusClass(int status) {
        if (status <= 0) {
            return "none";
        }
        return (status / 100) + "xx";
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
