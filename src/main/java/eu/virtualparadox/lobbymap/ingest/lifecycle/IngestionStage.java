package eu.virtualparadox.lobbymap.ingest.lifecycle;

/**
 * Per-document ingestion states: {@code RECEIVED -> PARSING -> CHUNKING -> INDEXING -> COMMITTED},
 * or {@code FAILED} from any in-progress stage.
 */
public enum IngestionStage {
    RECEIVED,
    PARSING,
    CHUNKING,
    INDEXING,
    COMMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED;
    }
}
