package assistant.core.model.sync;

import java.time.Instant;

/**
 * A knowledge base backed by a llama-stack vector database.
 *
 * @param vectorDbId         llama-stack vector database identifier
 * @param name               display name
 * @param providerId         vector store provider
 * @param embeddingModel     embedding model used for ingestion
 * @param embeddingDimension embedding vector dimension, 0 when unknown
 * @param syncedAt           when the record was last synced
 */
public record KnowledgeBase(
        String vectorDbId,
        String name,
        String providerId,
        String embeddingModel,
        int embeddingDimension,
        Instant syncedAt) {

    public KnowledgeBase {
        if (vectorDbId == null || vectorDbId.isBlank()) {
            throw new IllegalArgumentException("Vector database ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = vectorDbId;
        }
        if (syncedAt == null) {
            syncedAt = Instant.now();
        }
    }
}
