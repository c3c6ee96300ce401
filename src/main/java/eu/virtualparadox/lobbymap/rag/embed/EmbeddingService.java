package eu.virtualparadox.lobbymap.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for text.
 */
public interface EmbeddingService {

    /**
     * Embeds a single text, typically a query.
     *
     * @param text non-blank text
     * @return dense vector
     */
    float[] embed(String text);

    /**
     * Embeds texts in batch.
     *
     * @param texts texts to embed
     * @return one vector per input text, in input order
     */
    List<float[]> embedBatch(List<String> texts);
}
