package eu.virtualparadox.lobbymap.exception;

/**
 * Base type for all failures raised by the ingestion and retrieval pipeline.
 */
public class LobbyMapException extends RuntimeException {

    public LobbyMapException(final String message) {
        super(message);
    }

    public LobbyMapException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
