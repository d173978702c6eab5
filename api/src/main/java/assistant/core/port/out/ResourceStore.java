package assistant.core.port.out;

import java.util.List;
import java.util.Optional;

/**
 * Session-scoped view of one kind of synced resource.
 *
 * <p>Writes become visible to other sessions only after {@link StorageSession#commit()}.
 *
 * @param <T> resource type
 */
public interface ResourceStore<T> {

    /**
     * Insert or replace a resource, keyed by its llama-stack identifier.
     *
     * @param resource the resource
     */
    void upsert(T resource);

    Optional<T> findById(String id);

    List<T> findAll();
}
