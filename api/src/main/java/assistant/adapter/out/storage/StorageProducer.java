package assistant.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.jboss.logging.Logger;

import assistant.adapter.out.storage.memory.InMemoryStorageSessionFactory;
import assistant.adapter.out.storage.memory.InMemoryUserRepository;
import assistant.core.port.out.StorageSessionFactory;
import assistant.core.port.out.UserRepository;

/**
 * CDI producer for local storage.
 */
@ApplicationScoped
public class StorageProducer {

    private static final Logger LOG = Logger.getLogger(StorageProducer.class);

    @Produces
    @ApplicationScoped
    public UserRepository userRepository() {
        LOG.info("Using in-memory user repository");
        return new InMemoryUserRepository();
    }

    @Produces
    @ApplicationScoped
    public StorageSessionFactory storageSessionFactory() {
        LOG.info("Using in-memory resource storage");
        return new InMemoryStorageSessionFactory();
    }
}
