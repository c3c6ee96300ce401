package eu.virtualparadox.lobbymap.testutil;

import eu.virtualparadox.lobbymap.rag.index.ChunkMetadata;
import eu.virtualparadox.lobbymap.rag.index.SearchHit;
import eu.virtualparadox.lobbymap.rag.retriever.Evidence;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Small builders for evidence and search hits.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static ChunkMetadata metadata(final String documentId, final int ordinal, final int tokenCount,
                                         final int pageStart, final int pageEnd) {
        return new ChunkMetadata(documentId, "Acme", "EU", LocalDate.of(2024, 1, 15), ordinal, "latin-based",
                tokenCount, pageStart, pageEnd, Instant.parse("2024-02-01T00:00:00Z"));
    }

    public static Evidence evidence(final String documentId, final int ordinal, final String text) {
        return evidence(documentId, ordinal, text, 100, ordinal + 1, ordinal + 1);
    }

    public static Evidence evidence(final String documentId, final int ordinal, final String text, final int tokenCount,
                                    final int pageStart, final int pageEnd) {
        return new Evidence(documentId + "_" + String.format("%05d", ordinal), text,
                metadata(documentId, ordinal, tokenCount, pageStart, pageEnd), 0.9f, null);
    }

    public static SearchHit hit(final String documentId, final int ordinal, final String text, final float similarity) {
        return new SearchHit(documentId + "_" + String.format("%05d", ordinal), text,
                metadata(documentId, ordinal, 50, 1, 1), similarity);
    }
}
