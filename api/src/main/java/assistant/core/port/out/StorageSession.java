package assistant.core.port.out;

import assistant.core.model.sync.KnowledgeBase;
import assistant.core.model.sync.McpServer;
import assistant.core.model.sync.ModelServer;

/**
 * A unit of work against local storage.
 *
 * <p>Sessions are not thread-safe. Uncommitted writes are discarded on close.
 */
public interface StorageSession extends AutoCloseable {

    ResourceStore<McpServer> mcpServers();

    ResourceStore<ModelServer> modelServers();

    ResourceStore<KnowledgeBase> knowledgeBases();

    /**
     * Make this session's writes visible to other sessions.
     */
    void commit();

    /**
     * Release the session. Never throws.
     */
    @Override
    void close();
}
