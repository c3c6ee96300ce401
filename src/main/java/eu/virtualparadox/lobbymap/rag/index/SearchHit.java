package eu.virtualparadox.lobbymap.rag.index;

/**
 * A stored chunk matched by a vector search.
 *
 * @param chunkId    chunk identifier
 * @param text       chunk text
 * @param metadata   stored metadata
 * @param similarity cosine similarity to the query vector, in [-1, 1]
 */
public record SearchHit(String chunkId, String text, ChunkMetadata metadata, float similarity) {
}
