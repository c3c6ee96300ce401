package eu.virtualparadox.lobbymap.rag.index;

import eu.virtualparadox.lobbymap.exception.DuplicateInsertException;
import eu.virtualparadox.lobbymap.exception.IndexUnavailableException;

import java.util.List;
import java.util.Map;

/**
 * Chunk store with filtered nearest-neighbour search.
 */
public interface VectorIndexService {

    /** Attributes accepted by {@link #distinctValues(String)}. */
    List<String> DISTINCT_ATTRIBUTES = List.of("author", "region", "document_id", "language", "date");

    /**
     * Replaces every chunk of {@code documentId} with {@code chunks} as one atomic step. Readers see either
     * the previous chunk set or the new one. An empty list removes the document's chunks.
     *
     * @throws DuplicateInsertException  if another insert for the same document is still running
     * @throws IndexUnavailableException if the index cannot be written
     */
    void insert(String documentId, List<ChunkRecord> chunks);

    /**
     * Removes every chunk of the document.
     *
     * @return {@code true} if any chunk was removed
     */
    boolean delete(String documentId);

    /**
     * Nearest chunks by cosine similarity, best first; ties ordered by ordinal then document id.
     *
     * @throws IndexUnavailableException if the index cannot be read
     */
    List<SearchHit> search(float[] queryVector, SearchFilters filters, int topK);

    /**
     * @return number of stored chunks
     */
    long count();

    /**
     * @param attribute one of {@link #DISTINCT_ATTRIBUTES}
     * @return value to chunk count, sorted by value
     */
    Map<String, Long> distinctValues(String attribute);

    /**
     * @return one summary per stored document, ordered by document id
     */
    List<DocumentSummary> listDocuments();

    /**
     * Deletes every chunk in the collection.
     */
    void clear();

    String collectionName();
}
