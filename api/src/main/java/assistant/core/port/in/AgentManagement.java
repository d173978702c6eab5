package assistant.core.port.in;

import io.smallrye.mutiny.Uni;

import assistant.core.model.agent.AgentConfig;
import assistant.core.model.agent.AgentHandle;
import assistant.core.model.agent.AgentKind;
import assistant.core.model.auth.ForwardedIdentity;

/**
 * Port for obtaining handles on llama-stack agents.
 */
public interface AgentManagement {

    /**
     * Create a new agent in llama-stack.
     *
     * @param kind     agent flavour
     * @param config   agent configuration
     * @param identity identity the agent is created for
     * @return handle on the newly created agent
     */
    Uni<AgentHandle> create(AgentKind kind, AgentConfig config, ForwardedIdentity identity);

    /**
     * Bind a handle to an agent that already exists in llama-stack.
     *
     * <p>No remote call is made; the identifier is trusted as valid.
     *
     * @param kind       agent flavour
     * @param existingId remote agent identifier
     * @param config     agent configuration
     * @return handle on the existing agent
     */
    AgentHandle attach(AgentKind kind, String existingId, AgentConfig config);
}
