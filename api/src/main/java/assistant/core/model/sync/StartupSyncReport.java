package assistant.core.model.sync;

import java.time.Instant;
import java.util.List;

import assistant.core.model.readiness.ServiceReadiness;

/**
 * Summary of one post-startup sync run.
 *
 * @param readiness   whether the companion service became ready
 * @param outcomes    per-routine outcomes in execution order, empty when skipped
 * @param completedAt when the run finished
 */
public record StartupSyncReport(ServiceReadiness readiness, List<SyncOutcome> outcomes, Instant completedAt) {

    public StartupSyncReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    public boolean fullySucceeded() {
        return readiness.isReady() && outcomes.stream().allMatch(SyncOutcome::succeeded);
    }
}
