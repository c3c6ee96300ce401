package eu.virtualparadox.lobbymap.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Worker pool used to score independent items (rerank candidates, evidence judgments) in parallel.
 * <p>
 * {@link #invokeAll(List)} waits for every task and keeps per-task failures apart, so one bad item
 * never hides the results of the others. If the waiting thread is interrupted, all outstanding tasks
 * are cancelled and a {@link CancellationException} is thrown.
 */
public class FanOutExecutor extends ThreadPoolTaskExecutor {

    public <T> List<FanOutResult<T>> invokeAll(final List<Callable<T>> tasks) {
        final List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (final Callable<T> task : tasks) {
            futures.add(submit(task));
        }

        final List<FanOutResult<T>> results = new ArrayList<>(futures.size());
        try {
            for (final Future<T> future : futures) {
                try {
                    results.add(FanOutResult.success(future.get()));
                } catch (ExecutionException e) {
                    results.add(FanOutResult.failure(e.getCause()));
                } catch (CancellationException e) {
                    results.add(FanOutResult.failure(e));
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Fan-out interrupted, " + futures.size() + " task(s) cancelled");
        }
        return results;
    }
}
