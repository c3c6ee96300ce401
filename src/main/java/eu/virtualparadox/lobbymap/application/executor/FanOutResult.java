package eu.virtualparadox.lobbymap.application.executor;

/**
 * Outcome of one task in a fan-out: either a value or the failure that ended it.
 */
public record FanOutResult<T>(T value, Throwable failure) {

    public static <T> FanOutResult<T> success(final T value) {
        return new FanOutResult<>(value, null);
    }

    public static <T> FanOutResult<T> failure(final Throwable failure) {
        return new FanOutResult<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
