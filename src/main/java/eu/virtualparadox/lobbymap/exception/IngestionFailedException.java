package eu.virtualparadox.lobbymap.exception;

import eu.virtualparadox.lobbymap.ingest.lifecycle.IngestionStage;

/**
 * Terminal failure of one document ingestion, carrying the stage that failed.
 */
public class IngestionFailedException extends LobbyMapException {

    private final String documentId;
    private final IngestionStage stage;

    public IngestionFailedException(final String documentId, final IngestionStage stage, final Throwable cause) {
        super("Ingestion of '" + documentId + "' failed during " + stage + ": " + cause.getMessage(), cause);
        this.documentId = documentId;
        this.stage = stage;
    }

    public String getDocumentId() {
        return documentId;
    }

    public IngestionStage getStage() {
        return stage;
    }

    /**
     * @return {@code true} if the cause is worth retrying by the caller (timeouts, unavailable index)
     */
    public boolean isTransient() {
        final Throwable cause = getCause();
        return cause instanceof ExternalServiceTimeoutException || cause instanceof IndexUnavailableException;
    }
}
