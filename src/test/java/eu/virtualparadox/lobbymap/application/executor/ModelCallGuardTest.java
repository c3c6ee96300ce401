package eu.virtualparadox.lobbymap.application.executor;

import eu.virtualparadox.lobbymap.exception.ExternalServiceException;
import eu.virtualparadox.lobbymap.exception.ExternalServiceTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelCallGuardTest {

    private ModelCallGuard guard;

    @AfterEach
    void tearDown() {
        if (guard != null) {
            guard.close();
        }
    }

    @Test
    void returnsResultOfSuccessfulCall() {
        guard = new ModelCallGuard(1_000, 3, 10, 100, 2);
        assertThat(guard.call("embed", () -> 42)).isEqualTo(42);
    }

    @Test
    void retriesTimeoutsThenGivesUp() {
        guard = new ModelCallGuard(50, 3, 1, 5, 2);
        final AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> guard.call("rerank", () -> {
            attempts.incrementAndGet();
            Thread.sleep(2_000);
            return 1f;
        }))
                .isInstanceOf(ExternalServiceTimeoutException.class)
                .hasMessageContaining("rerank")
                .hasMessageContaining("3 attempt(s)");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void succeedsWhenARetryIsFastEnough() {
        guard = new ModelCallGuard(100, 3, 1, 5, 2);
        final AtomicInteger attempts = new AtomicInteger();

        final String result = guard.call("judge", () -> {
            if (attempts.incrementAndGet() == 1) {
                Thread.sleep(2_000);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void doesNotRetryOtherFailures() {
        guard = new ModelCallGuard(1_000, 3, 1, 5, 2);
        final AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> guard.call("judge", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bad output");
        })).isInstanceOf(IllegalStateException.class).hasMessage("bad output");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void wrapsCheckedFailures() {
        guard = new ModelCallGuard(1_000, 1, 0, 0, 2);

        assertThatThrownBy(() -> guard.call("embed", () -> {
            throw new IOException("model file missing");
        }))
                .isInstanceOf(ExternalServiceException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void limitsConcurrentCalls() throws Exception {
        guard = new ModelCallGuard(5_000, 1, 0, 0, 2);
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger peak = new AtomicInteger();
        final ExecutorService callers = Executors.newFixedThreadPool(6);
        try {
            final CountDownLatch done = new CountDownLatch(6);
            for (int i = 0; i < 6; i++) {
                callers.submit(() -> {
                    guard.call("judge", () -> {
                        peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                        Thread.sleep(50);
                        running.decrementAndGet();
                        return null;
                    });
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            callers.shutdownNow();
        }
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void waitingForAPermitDoesNotCountAgainstTheTimeout() throws Exception {
        guard = new ModelCallGuard(300, 1, 0, 0, 1);
        final ExecutorService callers = Executors.newFixedThreadPool(3);
        try {
            final List<Future<String>> outcomes = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                outcomes.add(callers.submit(() -> guard.call("rerank", () -> {
                    Thread.sleep(200);
                    return "ok";
                })));
            }
            for (final Future<String> outcome : outcomes) {
                assertThat(outcome.get(10, TimeUnit.SECONDS)).isEqualTo("ok");
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void interruptingTheCallerCancelsTheCall() throws Exception {
        guard = new ModelCallGuard(10_000, 1, 0, 0, 1);
        final CountDownLatch started = new CountDownLatch(1);
        final ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            final Future<Object> future = caller.submit(() -> guard.call("judge", () -> {
                started.countDown();
                Thread.sleep(10_000);
                return null;
            }));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            future.cancel(true);
            caller.shutdown();
            assertThat(caller.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void interruptedCallerSeesCancellation() {
        guard = new ModelCallGuard(10_000, 1, 0, 0, 1);
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> guard.call("embed", () -> "never"))
                    .isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new ModelCallGuard(0, 1, 0, 0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ModelCallGuard(10, 0, 0, 0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ModelCallGuard(10, 1, 0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
