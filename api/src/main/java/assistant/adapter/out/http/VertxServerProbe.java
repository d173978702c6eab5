package assistant.adapter.out.http;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import assistant.core.port.out.ServerProbe;

/**
 * Blocking HTTP probe used by the startup self-check.
 */
@ApplicationScoped
public class VertxServerProbe implements ServerProbe {

    private static final Logger LOG = Logger.getLogger(VertxServerProbe.class);
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(2);

    private final WebClient webClient;

    @Inject
    public VertxServerProbe(Vertx vertx) {
        this.webClient = WebClient.create(vertx);
    }

    @Override
    public boolean respondsOk(String url) {
        try {
            final var response = webClient
                    .getAbs(url)
                    .timeout(PROBE_TIMEOUT.toMillis())
                    .send()
                    .await()
                    .atMost(PROBE_TIMEOUT.plusSeconds(1));
            return response.statusCode() == 200;
        } catch (RuntimeException e) {
            LOG.debugf("Probe of %s failed: %s", url, e.toString());
            return false;
        }
    }
}
