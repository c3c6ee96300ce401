package eu.virtualparadox.lobbymap.rag.index;

import java.time.Instant;
import java.time.LocalDate;
import java.util.SortedSet;

/**
 * Per-document view over the indexed chunks.
 */
public record DocumentSummary(String documentId,
                              String author,
                              String region,
                              LocalDate date,
                              SortedSet<String> languages,
                              int chunkCount,
                              Instant uploadTime) {
}
