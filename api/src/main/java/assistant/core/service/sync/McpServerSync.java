package assistant.core.service.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import assistant.core.config.LlamaStackConfig;
import assistant.core.model.sync.McpServer;
import assistant.core.port.out.LlamaStackGateway;
import assistant.core.port.out.StorageSession;
import assistant.core.service.auth.ServiceIdentityHeaders;

/**
 * Syncs MCP servers from the llama-stack tool groups served by the
 * model-context-protocol provider.
 */
@ApplicationScoped
public class McpServerSync implements ResourceSync {

    private static final Logger LOG = Logger.getLogger(McpServerSync.class);

    private final LlamaStackGateway gateway;
    private final ServiceIdentityHeaders identityHeaders;
    private final LlamaStackConfig config;

    @Inject
    public McpServerSync(LlamaStackGateway gateway, ServiceIdentityHeaders identityHeaders, LlamaStackConfig config) {
        this.gateway = gateway;
        this.identityHeaders = identityHeaders;
        this.config = config;
    }

    @Override
    public String label() {
        return "MCP servers";
    }

    @Override
    public int sync(StorageSession session) {
        final var toolGroups =
                gateway.listToolGroups(identityHeaders.headers()).await().atMost(config.timeout());

        var synced = 0;
        for (McpServer toolGroup : toolGroups) {
            if (!McpServer.PROVIDER_ID.equals(toolGroup.providerId())) {
                continue;
            }
            session.mcpServers().upsert(toolGroup);
            synced++;
        }

        LOG.debugf("MCP server sync: toolGroups=%d, mcpServers=%d", toolGroups.size(), synced);
        return synced;
    }
}
