package eu.virtualparadox.lobbymap.ingest.model;

/**
 * A chunk produced by the chunker, before embedding and indexing.
 *
 * @param chunkId    {@code documentId_00000}, a function of document id and ordinal
 * @param documentId owning document
 * @param ordinal    0-based position in the document
 * @param text       non-empty chunk text
 * @param tokenCount token count, never above the configured budget
 * @param pageStart  first page covered
 * @param pageEnd    last page covered
 * @param language   detected script family
 */
public record ChunkDraft(String chunkId,
                         String documentId,
                         int ordinal,
                         String text,
                         int tokenCount,
                         int pageStart,
                         int pageEnd,
                         String language) {

    public static String chunkId(final String documentId, final int ordinal) {
        return documentId + "_" + String.format("%05d", ordinal);
    }
}
