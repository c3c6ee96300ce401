package eu.virtualparadox.lobbymap.application.executor;

import eu.virtualparadox.lobbymap.exception.ExternalServiceException;
import eu.virtualparadox.lobbymap.exception.ExternalServiceTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs calls against external models with a timeout, bounded retries and a global concurrency limit.
 *
 * <ul>
 *   <li>Every attempt runs on a worker thread and is abandoned (and interrupted) once the timeout elapses.</li>
 *   <li>Timed-out attempts are retried up to {@code maxAttempts} times with exponential backoff,
 *       after which {@link ExternalServiceTimeoutException} is thrown.</li>
 *   <li>At most {@code concurrencyLimit} calls execute at once. The permit is taken on the calling
 *       thread before the attempt starts, so time spent queueing for a permit does not count
 *       against the timeout.</li>
 *   <li>Other failures are not retried. Runtime exceptions propagate unchanged, checked ones are
 *       wrapped in {@link ExternalServiceException}.</li>
 *   <li>Interrupting the calling thread cancels the in-flight attempt and raises {@link CancellationException}.</li>
 * </ul>
 */
@Slf4j
public class ModelCallGuard implements AutoCloseable {

    private final long timeoutMs;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Semaphore permits;
    private final ExecutorService workers;

    public ModelCallGuard(final long timeoutMs,
                          final int maxAttempts,
                          final long initialBackoffMs,
                          final long maxBackoffMs,
                          final int concurrencyLimit) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1");
        }
        this.timeoutMs = timeoutMs;
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
        this.permits = new Semaphore(concurrencyLimit, true);
        this.workers = Executors.newCachedThreadPool(new CustomizableThreadFactory("model-call-"));
    }

    /**
     * Executes {@code callable} under the guard.
     *
     * @param operation short name used in logs and errors, e.g. {@code "embed"}
     * @param callable  the external call
     * @return the call's result
     * @throws ExternalServiceTimeoutException if every attempt timed out
     * @throws CancellationException           if the calling thread was interrupted
     */
    public <T> T call(final String operation, final Callable<T> callable) {
        long backoff = initialBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                return attempt(operation, callable);
            } catch (TimeoutException e) {
                if (attempt >= maxAttempts) {
                    throw new ExternalServiceTimeoutException(operation, attempt, timeoutMs);
                }
                log.warn("Call '{}' timed out (attempt {}/{}), retrying in {} ms", operation, attempt, maxAttempts, backoff);
                sleep(operation, backoff);
                backoff = Math.min(backoff * 2, maxBackoffMs);
            }
        }
    }

    private <T> T attempt(final String operation, final Callable<T> callable) throws TimeoutException {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Call '" + operation + "' cancelled while waiting for a permit");
        }

        try {
            final Future<T> future = workers.submit(callable);
            try {
                return future.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw e;
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new CancellationException("Call '" + operation + "' cancelled");
            } catch (ExecutionException e) {
                final Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new ExternalServiceException("Call '" + operation + "' failed: " + cause.getMessage(), cause);
            }
        } finally {
            permits.release();
        }
    }

    private void sleep(final String operation, final long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Call '" + operation + "' cancelled during backoff");
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
