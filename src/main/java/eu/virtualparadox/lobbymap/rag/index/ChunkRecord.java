package eu.virtualparadox.lobbymap.rag.index;

/**
 * A chunk as written to the index: id, embedding, text and metadata.
 */
public record ChunkRecord(String chunkId, float[] vector, String text, ChunkMetadata metadata) {
}
