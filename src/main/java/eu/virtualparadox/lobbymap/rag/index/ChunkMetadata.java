package eu.virtualparadox.lobbymap.rag.index;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Metadata stored with every chunk record.
 *
 * @param documentId owning document (file name)
 * @param author     company or organisation the document belongs to
 * @param region     optional region
 * @param date       optional document date
 * @param ordinal    0-based position of the chunk in its document
 * @param language   detected script family
 * @param tokenCount chunk token count
 * @param pageStart  first page covered
 * @param pageEnd    last page covered
 * @param uploadTime ingestion time of the document version
 */
public record ChunkMetadata(String documentId,
                            String author,
                            String region,
                            LocalDate date,
                            int ordinal,
                            String language,
                            int tokenCount,
                            int pageStart,
                            int pageEnd,
                            Instant uploadTime) {
}
