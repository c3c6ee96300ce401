package eu.virtualparadox.lobbymap.exception;

public class ExternalServiceException extends LobbyMapException {

    public ExternalServiceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
