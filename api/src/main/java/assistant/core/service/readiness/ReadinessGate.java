package assistant.core.service.readiness;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import assistant.core.model.readiness.EndpointsLookupException;
import assistant.core.model.readiness.EndpointsSnapshot;
import assistant.core.model.readiness.ServiceReadiness;
import assistant.core.port.out.EndpointsReader;

/**
 * Waits until a cluster Service has at least one registered endpoint address.
 *
 * <p>Polls the Service's Endpoints every {@code interval} until an address shows up
 * or {@code timeout} elapses. A missing Endpoints object and cluster API errors are
 * both treated as transient. The gate keeps no state between calls.
 *
 * <p>Polling blocks the calling thread; run it on a worker, never on an event loop.
 */
@ApplicationScoped
public class ReadinessGate {

    private static final Logger LOG = Logger.getLogger(ReadinessGate.class);
    private static final int NOT_FOUND = 404;

    private final EndpointsReader endpointsReader;
    private final Clock clock;
    private final Sleeper sleeper;

    @Inject
    public ReadinessGate(EndpointsReader endpointsReader) {
        this(endpointsReader, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public ReadinessGate(EndpointsReader endpointsReader, Clock clock, Sleeper sleeper) {
        this.endpointsReader = endpointsReader;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Block until the service is ready or the timeout elapses.
     *
     * @param serviceName service to wait for
     * @param namespace   namespace of the service
     * @param timeout     total time to wait
     * @param interval    pause between lookups
     * @return {@link ServiceReadiness#READY} or {@link ServiceReadiness#TIMED_OUT}
     */
    public ServiceReadiness awaitReady(String serviceName, String namespace, Duration timeout, Duration interval) {
        final var deadline = clock.instant().plus(timeout);

        while (clock.instant().isBefore(deadline)) {
            if (isReady(serviceName, namespace)) {
                LOG.infof("Service '%s' in namespace '%s' is ready", serviceName, namespace);
                return ServiceReadiness.READY;
            }

            LOG.infof("Waiting for service '%s' in namespace '%s' to be ready...", serviceName, namespace);
            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warnf("Interrupted while waiting for service '%s' in namespace '%s'", serviceName, namespace);
                return ServiceReadiness.TIMED_OUT;
            }
        }

        LOG.warnf("Timeout waiting for service '%s' in namespace '%s' after %s", serviceName, namespace, timeout);
        return ServiceReadiness.TIMED_OUT;
    }

    private boolean isReady(String serviceName, String namespace) {
        try {
            return endpointsReader
                    .read(serviceName, namespace)
                    .map(EndpointsSnapshot::isReady)
                    .orElse(false);
        } catch (EndpointsLookupException e) {
            // 404 means the Service has not been created yet
            if (e.status() != NOT_FOUND) {
                LOG.warnf("Error checking endpoints: status=%d, message=%s", e.status(), e.getMessage());
            }
            return false;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Error checking endpoints for service '%s'", serviceName);
            return false;
        }
    }
}
