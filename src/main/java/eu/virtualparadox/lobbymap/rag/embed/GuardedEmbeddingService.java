package eu.virtualparadox.lobbymap.rag.embed;

import eu.virtualparadox.lobbymap.application.executor.ModelCallGuard;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes embedding calls through the {@link ModelCallGuard}, splitting large batches so each guarded
 * call stays within its timeout.
 */
@Slf4j
public final class GuardedEmbeddingService implements EmbeddingService, AutoCloseable {

    private final EmbeddingService delegate;
    private final ModelCallGuard guard;
    private final int batchSize;

    public GuardedEmbeddingService(final EmbeddingService delegate, final ModelCallGuard guard, final int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.delegate = delegate;
        this.guard = guard;
        this.batchSize = batchSize;
    }

    @Override
    public float[] embed(final String text) {
        return guard.call("embed", () -> delegate.embed(text));
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) {
        final List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            final List<String> batch = texts.subList(start, Math.min(start + batchSize, texts.size()));
            vectors.addAll(guard.call("embed-batch", () -> delegate.embedBatch(batch)));
        }
        log.debug("Embedded {} text(s) in batches of {}", texts.size(), batchSize);
        return vectors;
    }

    @Override
    public void close() throws Exception {
        if (delegate instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }
}
