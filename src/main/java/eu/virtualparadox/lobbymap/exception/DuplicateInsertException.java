package eu.virtualparadox.lobbymap.exception;

/**
 * Two inserts for the same document overlapped. This is a caller error: writers are expected to
 * hold the per-document lock.
 */
public class DuplicateInsertException extends LobbyMapException {

    private final String documentId;

    public DuplicateInsertException(final String documentId) {
        super("Concurrent insert detected for document " + documentId);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
