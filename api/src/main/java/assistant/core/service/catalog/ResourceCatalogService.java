package assistant.core.service.catalog;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import assistant.core.model.sync.KnowledgeBase;
import assistant.core.model.sync.McpServer;
import assistant.core.model.sync.ModelServer;
import assistant.core.port.in.ResourceCatalog;
import assistant.core.port.out.StorageSession;
import assistant.core.port.out.StorageSessionFactory;

/**
 * Lists the resources synced from llama-stack, sorted by identifier.
 */
@ApplicationScoped
public class ResourceCatalogService implements ResourceCatalog {

    private final StorageSessionFactory sessions;

    @Inject
    public ResourceCatalogService(StorageSessionFactory sessions) {
        this.sessions = sessions;
    }

    @Override
    public Uni<List<McpServer>> mcpServers() {
        return read(session -> session.mcpServers().findAll().stream()
                .sorted(Comparator.comparing(McpServer::toolgroupId))
                .toList());
    }

    @Override
    public Uni<List<ModelServer>> modelServers() {
        return read(session -> session.modelServers().findAll().stream()
                .sorted(Comparator.comparing(ModelServer::providerId))
                .toList());
    }

    @Override
    public Uni<List<KnowledgeBase>> knowledgeBases() {
        return read(session -> session.knowledgeBases().findAll().stream()
                .sorted(Comparator.comparing(KnowledgeBase::vectorDbId))
                .toList());
    }

    private <T> Uni<List<T>> read(Function<StorageSession, List<T>> query) {
        return Uni.createFrom().item(() -> {
            try (StorageSession session = sessions.open()) {
                return query.apply(session);
            }
        });
    }
}
