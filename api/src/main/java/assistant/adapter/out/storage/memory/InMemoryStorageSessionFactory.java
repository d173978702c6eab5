package assistant.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.jboss.logging.Logger;

import assistant.core.model.sync.KnowledgeBase;
import assistant.core.model.sync.McpServer;
import assistant.core.model.sync.ModelServer;
import assistant.core.port.out.ResourceStore;
import assistant.core.port.out.StorageSession;
import assistant.core.port.out.StorageSessionFactory;

/**
 * In-memory implementation of StorageSessionFactory.
 *
 * <p>Each session stages its writes and publishes them to the shared tables on
 * commit. Reads see committed data overlaid with the session's own staged writes.
 */
public class InMemoryStorageSessionFactory implements StorageSessionFactory {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageSessionFactory.class);

    private final ConcurrentHashMap<String, McpServer> mcpServers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ModelServer> modelServers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, KnowledgeBase> knowledgeBases = new ConcurrentHashMap<>();
    private final Object commitLock = new Object();

    @Override
    public StorageSession open() {
        return new Session();
    }

    private final class Session implements StorageSession {

        private final StagedStore<McpServer> mcp = new StagedStore<>(mcpServers, McpServer::toolgroupId);
        private final StagedStore<ModelServer> models = new StagedStore<>(modelServers, ModelServer::providerId);
        private final StagedStore<KnowledgeBase> kbs = new StagedStore<>(knowledgeBases, KnowledgeBase::vectorDbId);
        private boolean closed;

        @Override
        public ResourceStore<McpServer> mcpServers() {
            ensureOpen();
            return mcp;
        }

        @Override
        public ResourceStore<ModelServer> modelServers() {
            ensureOpen();
            return models;
        }

        @Override
        public ResourceStore<KnowledgeBase> knowledgeBases() {
            ensureOpen();
            return kbs;
        }

        @Override
        public void commit() {
            ensureOpen();
            synchronized (commitLock) {
                mcp.publish();
                models.publish();
                kbs.publish();
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            final int discarded = mcp.discard() + models.discard() + kbs.discard();
            if (discarded > 0) {
                LOG.debugf("Discarded %d uncommitted writes", discarded);
            }
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Storage session is closed");
            }
        }
    }

    private static final class StagedStore<T> implements ResourceStore<T> {

        private final Map<String, T> committed;
        private final Function<T, String> idOf;
        private final Map<String, T> staged = new HashMap<>();

        StagedStore(Map<String, T> committed, Function<T, String> idOf) {
            this.committed = committed;
            this.idOf = idOf;
        }

        @Override
        public void upsert(T resource) {
            staged.put(idOf.apply(resource), resource);
        }

        @Override
        public Optional<T> findById(String id) {
            final var local = staged.get(id);
            return local != null ? Optional.of(local) : Optional.ofNullable(committed.get(id));
        }

        @Override
        public List<T> findAll() {
            final var merged = new HashMap<>(committed);
            merged.putAll(staged);
            return new ArrayList<>(merged.values());
        }

        void publish() {
            committed.putAll(staged);
            staged.clear();
        }

        int discard() {
            final int size = staged.size();
            staged.clear();
            return size;
        }
    }
}
