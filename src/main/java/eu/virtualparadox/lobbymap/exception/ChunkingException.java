package eu.virtualparadox.lobbymap.exception;

public class ChunkingException extends LobbyMapException {

    public ChunkingException(final String message) {
        super(message);
    }

    public ChunkingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
