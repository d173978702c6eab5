package assistant.core.service.sync;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import assistant.core.config.ClusterConfig;
import assistant.core.config.StartupConfig;
import assistant.core.model.readiness.ServiceReadiness;
import assistant.core.model.sync.StartupSyncReport;
import assistant.core.model.sync.SyncOutcome;
import assistant.core.port.in.StartupSynchronization;
import assistant.core.port.out.AuthMetrics;
import assistant.core.port.out.ServerProbe;
import assistant.core.port.out.ServiceAccountCredentials;
import assistant.core.port.out.StorageSession;
import assistant.core.port.out.StorageSessionFactory;
import assistant.core.service.readiness.ReadinessGate;
import assistant.core.service.readiness.Sleeper;

/**
 * Runs the post-startup sync of MCP servers, model servers and knowledge bases.
 *
 * <h2>Sequence</h2>
 * <ol>
 *   <li>Probe this server's own root endpoint until it answers</li>
 *   <li>Resolve the pod namespace from the mounted file</li>
 *   <li>Wait for the companion service through the {@link ReadinessGate}</li>
 *   <li>Run each routine in order, each in its own storage session</li>
 * </ol>
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>If the companion service never becomes ready, every routine is skipped</li>
 *   <li>A failing routine is logged and recorded; the next routine still runs</li>
 *   <li>Nothing here ever fails application startup</li>
 * </ul>
 */
@ApplicationScoped
public class StartupSyncService implements StartupSynchronization {

    private static final Logger LOG = Logger.getLogger(StartupSyncService.class);

    private final ReadinessGate readinessGate;
    private final List<ResourceSync> routines;
    private final StorageSessionFactory sessions;
    private final ServiceAccountCredentials credentials;
    private final ServerProbe serverProbe;
    private final ClusterConfig clusterConfig;
    private final StartupConfig startupConfig;
    private final AuthMetrics metrics;
    private final Sleeper sleeper;

    private volatile StartupSyncReport lastReport;

    @Inject
    public StartupSyncService(
            ReadinessGate readinessGate,
            McpServerSync mcpServerSync,
            ModelServerSync modelServerSync,
            KnowledgeBaseSync knowledgeBaseSync,
            StorageSessionFactory sessions,
            ServiceAccountCredentials credentials,
            ServerProbe serverProbe,
            ClusterConfig clusterConfig,
            StartupConfig startupConfig,
            AuthMetrics metrics) {
        this(
                readinessGate,
                List.of(mcpServerSync, modelServerSync, knowledgeBaseSync),
                sessions,
                credentials,
                serverProbe,
                clusterConfig,
                startupConfig,
                metrics,
                Sleeper.SYSTEM);
    }

    public StartupSyncService(
            ReadinessGate readinessGate,
            List<ResourceSync> routines,
            StorageSessionFactory sessions,
            ServiceAccountCredentials credentials,
            ServerProbe serverProbe,
            ClusterConfig clusterConfig,
            StartupConfig startupConfig,
            AuthMetrics metrics,
            Sleeper sleeper) {
        this.readinessGate = readinessGate;
        this.routines = List.copyOf(routines);
        this.sessions = sessions;
        this.credentials = credentials;
        this.serverProbe = serverProbe;
        this.clusterConfig = clusterConfig;
        this.startupConfig = startupConfig;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    @Override
    public StartupSyncReport run() {
        if (!awaitServing()) {
            return record(new StartupSyncReport(ServiceReadiness.TIMED_OUT, List.of(), null));
        }

        final var namespace = credentials.namespace().orElseGet(() -> {
            LOG.infof("Namespace file not readable, using '%s'", clusterConfig.defaultNamespace());
            return clusterConfig.defaultNamespace();
        });

        final var readiness = clusterConfig.readiness();
        final var outcome = readinessGate.awaitReady(
                readiness.serviceName(), namespace, readiness.timeout(), readiness.interval());

        if (!outcome.isReady()) {
            LOG.warnf(
                    "Service '%s' did not become ready within %s; skipping startup sync",
                    readiness.serviceName(), readiness.timeout());
            return record(new StartupSyncReport(outcome, List.of(), null));
        }

        LOG.info("Companion service is ready, proceeding with startup sync");

        final var outcomes = new ArrayList<SyncOutcome>(routines.size());
        for (ResourceSync routine : routines) {
            outcomes.add(runIsolated(routine));
        }

        final var report = record(new StartupSyncReport(outcome, outcomes, null));
        LOG.infof(
                "Startup sync finished: %d/%d routines succeeded",
                outcomes.stream().filter(SyncOutcome::succeeded).count(), outcomes.size());
        return report;
    }

    @Override
    public Optional<StartupSyncReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    private SyncOutcome runIsolated(ResourceSync routine) {
        try (StorageSession session = sessions.open()) {
            final var synced = routine.sync(session);
            session.commit();
            metrics.recordSync(routine.label(), true);
            LOG.infof("Synced %d %s on startup", synced, routine.label());
            return SyncOutcome.success(routine.label(), synced);
        } catch (RuntimeException e) {
            metrics.recordSync(routine.label(), false);
            LOG.errorf(e, "Failed to sync %s on startup: %s", routine.label(), e.getMessage());
            return SyncOutcome.failure(routine.label(), e);
        }
    }

    /**
     * Probe this server's root endpoint until it answers, then let it settle.
     *
     * @return false only when interrupted
     */
    private boolean awaitServing() {
        final var selfCheck = startupConfig.selfCheck();
        try {
            var serving = false;
            for (int attempt = 0; attempt < selfCheck.attempts() && !serving; attempt++) {
                serving = serverProbe.respondsOk(selfCheck.url());
                if (!serving) {
                    sleeper.sleep(selfCheck.interval());
                }
            }

            if (serving) {
                LOG.info("Server is now accepting connections");
            } else {
                LOG.warnf("Server did not answer at %s; continuing with startup sync", selfCheck.url());
            }

            sleeper.sleep(selfCheck.settleDelay());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted before startup sync could run");
            return false;
        }
    }

    private StartupSyncReport record(StartupSyncReport report) {
        lastReport = report;
        return report;
    }
}
