package eu.virtualparadox.lobbymap.exception;

/**
 * The judgment model answered with output that does not match the expected schema.
 */
public class JudgmentParseException extends LobbyMapException {

    public JudgmentParseException(final String message) {
        super(message);
    }

    public JudgmentParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
