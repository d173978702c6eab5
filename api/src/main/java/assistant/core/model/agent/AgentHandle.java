package assistant.core.model.agent;

/**
 * A handle on a remote llama-stack agent.
 *
 * @param agentId  remote agent identifier
 * @param kind     agent flavour
 * @param config   agent configuration
 * @param attached true when bound to an existing agent rather than created
 */
public record AgentHandle(String agentId, AgentKind kind, AgentConfig config, boolean attached) {

    public AgentHandle {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Agent ID cannot be null or blank");
        }
        if (kind == null) {
            kind = AgentKind.STANDARD;
        }
    }
}
