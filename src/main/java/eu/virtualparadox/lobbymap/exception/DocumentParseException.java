package eu.virtualparadox.lobbymap.exception;

/**
 * Raised when a document cannot be read: corrupt bytes, encryption, or an unsupported format.
 * Local to one document; other ingestions are unaffected.
 */
public class DocumentParseException extends LobbyMapException {

    public DocumentParseException(final String message) {
        super(message);
    }

    public DocumentParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
