package eu.virtualparadox.lobbymap.exception;

/**
 * An external model call (embedding, rerank, judgment) kept timing out after all retry attempts.
 */
public class ExternalServiceTimeoutException extends LobbyMapException {

    private final String operation;
    private final int attempts;

    public ExternalServiceTimeoutException(final String operation, final int attempts, final long timeoutMs) {
        super("Call '" + operation + "' timed out after " + attempts + " attempt(s) of " + timeoutMs + " ms");
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
