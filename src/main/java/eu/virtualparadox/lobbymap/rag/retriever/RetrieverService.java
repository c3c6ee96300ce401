package eu.virtualparadox.lobbymap.rag.retriever;

import eu.virtualparadox.lobbymap.application.config.ApplicationConfig;
import eu.virtualparadox.lobbymap.application.executor.FanOutExecutor;
import eu.virtualparadox.lobbymap.application.executor.FanOutResult;
import eu.virtualparadox.lobbymap.application.executor.ModelCallGuard;
import eu.virtualparadox.lobbymap.exception.IndexUnavailableException;
import eu.virtualparadox.lobbymap.rag.embed.EmbeddingService;
import eu.virtualparadox.lobbymap.rag.index.SearchFilters;
import eu.virtualparadox.lobbymap.rag.index.SearchHit;
import eu.virtualparadox.lobbymap.rag.index.VectorIndexService;
import eu.virtualparadox.lobbymap.rag.rerank.RerankService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Filtered vector retrieval with cross-encoder reranking.
 * <ol>
 *   <li>Embed the query.</li>
 *   <li>Search {@code topK * overfetchFactor} candidates, retrying with backoff while the index is unavailable.</li>
 *   <li>Score every candidate with the reranker in parallel and reorder by that score.</li>
 *   <li>Truncate to {@code topK}.</li>
 * </ol>
 * If the reranker is missing, times out or fails, the candidates keep their vector-similarity order.
 */
@Service
@Slf4j
public class RetrieverService {

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndex;
    private final RerankService reranker;
    private final ModelCallGuard guard;
    private final FanOutExecutor fanOutExecutor;
    private final int overfetchFactor;
    private final int defaultTopK;
    private final int indexRetryAttempts;
    private final long indexRetryBackoffMs;

    @Autowired
    public RetrieverService(final EmbeddingService embeddingService,
                            final VectorIndexService vectorIndex,
                            final Optional<RerankService> reranker,
                            final ModelCallGuard guard,
                            final FanOutExecutor fanOutExecutor,
                            final ApplicationConfig config) {
        this(embeddingService, vectorIndex, reranker.orElse(null), guard, fanOutExecutor,
                config.getRetrieval().getOverfetchFactor(),
                config.getRetrieval().getDefaultTopK(),
                config.getRetrieval().getIndexRetryAttempts(),
                config.getRetrieval().getIndexRetryBackoffMs());
    }

    public RetrieverService(final EmbeddingService embeddingService,
                            final VectorIndexService vectorIndex,
                            final RerankService reranker,
                            final ModelCallGuard guard,
                            final FanOutExecutor fanOutExecutor,
                            final int overfetchFactor,
                            final int defaultTopK,
                            final int indexRetryAttempts,
                            final long indexRetryBackoffMs) {
        if (overfetchFactor < 1) {
            throw new IllegalArgumentException("overfetchFactor must be at least 1");
        }
        if (defaultTopK < 1) {
            throw new IllegalArgumentException("defaultTopK must be positive");
        }
        if (indexRetryAttempts < 1) {
            throw new IllegalArgumentException("indexRetryAttempts must be at least 1");
        }
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
        this.reranker = reranker;
        this.guard = guard;
        this.fanOutExecutor = fanOutExecutor;
        this.overfetchFactor = overfetchFactor;
        this.defaultTopK = defaultTopK;
        this.indexRetryAttempts = indexRetryAttempts;
        this.indexRetryBackoffMs = indexRetryBackoffMs;
    }

    /**
     * Retrieves evidence for a query.
     *
     * @param query   non-blank query text
     * @param filters metadata filters, {@code null} for none
     * @param topK    requested result count; {@code null} or non-positive means the configured default
     * @return at most {@code topK} evidence items, best first; fewer if the index holds fewer matches
     * @throws IndexUnavailableException if the index stays unavailable after all retries
     */
    public List<Evidence> retrieve(final String query, final SearchFilters filters, final Integer topK) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        final int k = resolveTopK(topK);
        final float[] queryVector = embeddingService.embed(query);
        final List<SearchHit> candidates = searchWithBackoff(queryVector, filters, k * overfetchFactor);
        log.debug("Query '{}' returned {} candidate(s) for top_k {}", query, candidates.size(), k);

        final List<Evidence> ranked = rerank(query, candidates);
        return ranked.size() <= k ? ranked : new ArrayList<>(ranked.subList(0, k));
    }

    public int resolveTopK(final Integer topK) {
        return topK == null || topK <= 0 ? defaultTopK : topK;
    }

    private List<SearchHit> searchWithBackoff(final float[] queryVector, final SearchFilters filters, final int candidates) {
        long backoff = indexRetryBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                return vectorIndex.search(queryVector, filters, candidates);
            } catch (IndexUnavailableException e) {
                if (attempt >= indexRetryAttempts) {
                    throw e;
                }
                log.warn("Index unavailable (attempt {}/{}), retrying in {} ms", attempt, indexRetryAttempts, backoff);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Retrieval cancelled while waiting for the index");
                }
                backoff *= 2;
            }
        }
    }

    private List<Evidence> rerank(final String query, final List<SearchHit> candidates) {
        final List<Evidence> vectorOrder = new ArrayList<>(candidates.size());
        for (final SearchHit hit : candidates) {
            vectorOrder.add(Evidence.of(hit, null));
        }
        if (reranker == null || candidates.isEmpty()) {
            return vectorOrder;
        }

        final List<Callable<Float>> tasks = new ArrayList<>(candidates.size());
        for (final SearchHit hit : candidates) {
            tasks.add(() -> guard.call("rerank", () -> reranker.score(query, hit.text())));
        }
        final List<FanOutResult<Float>> scores = fanOutExecutor.invokeAll(tasks);

        final List<Evidence> reranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            final FanOutResult<Float> score = scores.get(i);
            if (!score.isSuccess()) {
                log.warn("Reranking skipped, keeping vector order: {}", score.failure().toString());
                return vectorOrder;
            }
            reranked.add(Evidence.of(candidates.get(i), score.value()));
        }
        // stable: equal rerank scores keep vector order
        reranked.sort(Comparator.comparing(Evidence::rerankScore, Comparator.reverseOrder()));
        return reranked;
    }
}
