package eu.virtualparadox.lobbymap.query.model;

/**
 * What produced a retrieval result: collection, models and the effective top_k.
 */
public record PipelineArtifacts(String collection,
                                String embeddingModel,
                                String rerankerModel,
                                boolean rerankerEnabled,
                                int topK) {
}
