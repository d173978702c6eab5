package assistant.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import assistant.core.model.sync.KnowledgeBase;
import assistant.core.model.sync.McpServer;
import assistant.core.model.sync.ModelServer;

/**
 * Read access to the resources synced from llama-stack.
 */
public interface ResourceCatalog {

    Uni<List<McpServer>> mcpServers();

    Uni<List<ModelServer>> modelServers();

    Uni<List<KnowledgeBase>> knowledgeBases();
}
