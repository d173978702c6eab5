package assistant.core.service.agent;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import assistant.core.model.agent.AgentConfig;
import assistant.core.model.agent.AgentHandle;
import assistant.core.model.agent.AgentKind;
import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.port.in.AgentManagement;
import assistant.core.port.out.LlamaStackGateway;
import assistant.core.port.out.ServiceAccountCredentials;
import assistant.core.service.auth.OutboundHeaders;

/**
 * Hands out {@link AgentHandle}s for llama-stack agents.
 *
 * <p>{@link #create} performs the remote creation handshake. {@link #attach} binds
 * to an identifier the caller already holds and never calls llama-stack.
 */
@ApplicationScoped
public class AgentService implements AgentManagement {

    private static final Logger LOG = Logger.getLogger(AgentService.class);

    private final LlamaStackGateway gateway;
    private final ServiceAccountCredentials credentials;

    @Inject
    public AgentService(LlamaStackGateway gateway, ServiceAccountCredentials credentials) {
        this.gateway = gateway;
        this.credentials = credentials;
    }

    @Override
    public Uni<AgentHandle> create(AgentKind kind, AgentConfig config, ForwardedIdentity identity) {
        final var headers = OutboundHeaders.merge(credentials.token().orElse(null), identity);

        return gateway.createAgent(kind, config, headers).map(agentId -> {
            LOG.infof("Created %s agent: agentId=%s, model=%s", kind, agentId, config.model());
            return new AgentHandle(agentId, kind, config, false);
        });
    }

    @Override
    public AgentHandle attach(AgentKind kind, String existingId, AgentConfig config) {
        if (existingId == null || existingId.isBlank()) {
            throw new IllegalArgumentException("Agent ID cannot be null or blank");
        }
        LOG.debugf("Attached to existing %s agent: agentId=%s", kind, existingId);
        return new AgentHandle(existingId, kind, config, true);
    }
}
