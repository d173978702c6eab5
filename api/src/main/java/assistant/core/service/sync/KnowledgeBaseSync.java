package assistant.core.service.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import assistant.core.config.LlamaStackConfig;
import assistant.core.port.out.LlamaStackGateway;
import assistant.core.port.out.StorageSession;
import assistant.core.service.auth.ServiceIdentityHeaders;

/**
 * Syncs knowledge bases from the llama-stack vector databases.
 */
@ApplicationScoped
public class KnowledgeBaseSync implements ResourceSync {

    private final LlamaStackGateway gateway;
    private final ServiceIdentityHeaders identityHeaders;
    private final LlamaStackConfig config;

    @Inject
    public KnowledgeBaseSync(
            LlamaStackGateway gateway, ServiceIdentityHeaders identityHeaders, LlamaStackConfig config) {
        this.gateway = gateway;
        this.identityHeaders = identityHeaders;
        this.config = config;
    }

    @Override
    public String label() {
        return "knowledge bases";
    }

    @Override
    public int sync(StorageSession session) {
        final var vectorDatabases =
                gateway.listVectorDatabases(identityHeaders.headers()).await().atMost(config.timeout());
        vectorDatabases.forEach(session.knowledgeBases()::upsert);
        return vectorDatabases.size();
    }
}
