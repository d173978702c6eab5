package assistant.core.model.sync;

import java.time.Instant;

/**
 * An inference provider configured in llama-stack.
 *
 * @param providerId   llama-stack provider identifier
 * @param name         display name
 * @param providerType provider implementation (e.g. {@code remote::vllm})
 * @param syncedAt     when the record was last synced
 */
public record ModelServer(String providerId, String name, String providerType, Instant syncedAt) {

    public static final String INFERENCE_API = "inference";

    public ModelServer {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("Provider ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = providerId;
        }
        if (syncedAt == null) {
            syncedAt = Instant.now();
        }
    }
}
