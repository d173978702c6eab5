package assistant.core.port.out;

import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import assistant.core.model.agent.AgentConfig;
import assistant.core.model.agent.AgentKind;
import assistant.core.model.sync.KnowledgeBase;
import assistant.core.model.sync.McpServer;
import assistant.core.model.sync.ProviderDescriptor;

/**
 * Port for the llama-stack server.
 *
 * <p>Every call takes the outbound header set so callers decide which identity
 * llama-stack sees.
 */
public interface LlamaStackGateway {

    /**
     * List all registered tool groups. MCP servers are the entries whose provider
     * is {@link McpServer#PROVIDER_ID}.
     */
    Uni<List<McpServer>> listToolGroups(Map<String, String> headers);

    Uni<List<ProviderDescriptor>> listProviders(Map<String, String> headers);

    Uni<List<KnowledgeBase>> listVectorDatabases(Map<String, String> headers);

    /**
     * Create an agent.
     *
     * @return the new agent identifier
     */
    Uni<String> createAgent(AgentKind kind, AgentConfig config, Map<String, String> headers);
}
