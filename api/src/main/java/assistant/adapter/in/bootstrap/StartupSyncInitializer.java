package assistant.adapter.in.bootstrap;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import assistant.core.config.StartupConfig;
import assistant.core.port.in.StartupSynchronization;

/**
 * Launches the post-startup resource sync.
 *
 * <p>The sync waits for this server to answer and for the companion service to
 * become ready, so it runs on its own thread and is never awaited. Failures are
 * logged and never stop the server.
 */
@ApplicationScoped
public class StartupSyncInitializer {

    private static final Logger LOG = Logger.getLogger(StartupSyncInitializer.class);

    private final StartupSynchronization synchronization;
    private final StartupConfig config;
    private volatile ExecutorService executor;

    @Inject
    public StartupSyncInitializer(StartupSynchronization synchronization, StartupConfig config) {
        this.synchronization = synchronization;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.syncEnabled()) {
            LOG.info("Startup sync is disabled");
            return;
        }

        executor = Executors.newSingleThreadExecutor(runnable -> {
            final var thread = new Thread(runnable, "startup-sync");
            thread.setDaemon(true);
            return thread;
        });
        executor.submit(this::runSync);
        LOG.info("Startup sync scheduled");
    }

    void onStop(@Observes ShutdownEvent event) {
        final var current = executor;
        if (current == null) {
            return;
        }
        current.shutdownNow();
        try {
            if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Startup sync did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runSync() {
        try {
            final var report = synchronization.run();
            if (report.fullySucceeded()) {
                LOG.info("Startup sync completed");
            } else {
                LOG.warnf("Startup sync completed with problems: readiness=%s, outcomes=%s",
                        report.readiness(), report.outcomes());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Startup sync failed: %s", e.getMessage());
        }
    }
}
