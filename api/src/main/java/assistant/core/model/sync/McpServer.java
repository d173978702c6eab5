package assistant.core.model.sync;

import java.time.Instant;

/**
 * An MCP server registered as a llama-stack tool group.
 *
 * @param toolgroupId llama-stack tool group identifier
 * @param name        display name
 * @param providerId  llama-stack provider (always {@code model-context-protocol})
 * @param endpointUri MCP endpoint URI, may be null
 * @param syncedAt    when the record was last synced
 */
public record McpServer(String toolgroupId, String name, String providerId, String endpointUri, Instant syncedAt) {

    public static final String PROVIDER_ID = "model-context-protocol";

    public McpServer {
        if (toolgroupId == null || toolgroupId.isBlank()) {
            throw new IllegalArgumentException("Tool group ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = toolgroupId;
        }
        if (syncedAt == null) {
            syncedAt = Instant.now();
        }
    }
}
