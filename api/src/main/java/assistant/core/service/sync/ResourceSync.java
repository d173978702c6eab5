package assistant.core.service.sync;

import assistant.core.port.out.StorageSession;

/**
 * A routine that copies one kind of resource from llama-stack into local storage.
 */
public interface ResourceSync {

    /**
     * @return label used in logs and outcomes (e.g. "MCP servers")
     */
    String label();

    /**
     * Fetch the resources and write them through the given session.
     *
     * <p>Blocks the calling thread. The caller owns the session and commits it.
     *
     * @param session open storage session
     * @return number of resources written
     */
    int sync(StorageSession session);
}
