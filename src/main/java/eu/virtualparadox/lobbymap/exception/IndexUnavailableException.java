package eu.virtualparadox.lobbymap.exception;

/**
 * The backing index could not be reached or has been closed.
 * Callers retry with bounded backoff and surface this if the store stays unavailable.
 */
public class IndexUnavailableException extends LobbyMapException {

    public IndexUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
