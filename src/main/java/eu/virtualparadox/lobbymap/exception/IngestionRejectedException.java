package eu.virtualparadox.lobbymap.exception;

/**
 * Raised for a request that waited on a concurrent ingestion of the same document which then
 * failed transiently. The caller should retry.
 */
public class IngestionRejectedException extends LobbyMapException {

    private final String documentId;

    public IngestionRejectedException(final String documentId, final Throwable previousFailure) {
        super("Ingestion of '" + documentId + "' rejected: the preceding attempt failed transiently, retry later",
                previousFailure);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
