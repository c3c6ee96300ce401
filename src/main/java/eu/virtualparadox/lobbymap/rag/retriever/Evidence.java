package eu.virtualparadox.lobbymap.rag.retriever;

import eu.virtualparadox.lobbymap.rag.index.ChunkMetadata;
import eu.virtualparadox.lobbymap.rag.index.SearchHit;

/**
 * A chunk retrieved for a query.
 *
 * @param chunkId     chunk identifier
 * @param text        chunk text
 * @param metadata    chunk metadata
 * @param similarity  cosine similarity to the query
 * @param rerankScore cross-encoder score, {@code null} when reranking was skipped
 */
public record Evidence(String chunkId, String text, ChunkMetadata metadata, float similarity, Float rerankScore) {

    static Evidence of(final SearchHit hit, final Float rerankScore) {
        return new Evidence(hit.chunkId(), hit.text(), hit.metadata(), hit.similarity(), rerankScore);
    }

    public String documentId() {
        return metadata.documentId();
    }
}
