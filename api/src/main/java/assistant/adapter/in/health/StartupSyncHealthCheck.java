package assistant.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import assistant.core.port.in.StartupSynchronization;

/**
 * Reports the outcome of the last startup sync.
 *
 * <p>Always UP: the sync is best-effort and a failed or pending run must not take
 * the API out of rotation. Failures are visible in the check's data.
 */
@Readiness
@ApplicationScoped
public class StartupSyncHealthCheck implements HealthCheck {

    private final StartupSynchronization synchronization;

    @Inject
    public StartupSyncHealthCheck(StartupSynchronization synchronization) {
        this.synchronization = synchronization;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("startup-sync");
        final var last = synchronization.lastReport();
        if (last.isEmpty()) {
            builder.withData("status", "pending");
            return builder.up().build();
        }

        final var report = last.get();
        builder.withData("status", report.fullySucceeded() ? "completed" : "degraded");
        builder.withData("readiness", report.readiness().name());
        builder.withData("completedAt", report.completedAt().toString());
        for (var outcome : report.outcomes()) {
            builder.withData(outcome.label(), outcome.succeeded() ? "synced " + outcome.synced() : "failed");
        }
        return builder.up().build();
    }
}
