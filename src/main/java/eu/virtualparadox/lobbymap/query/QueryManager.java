package eu.virtualparadox.lobbymap.query;

import eu.virtualparadox.lobbymap.application.config.ApplicationConfig;
import eu.virtualparadox.lobbymap.ingest.lifecycle.DocumentRegistry;
import eu.virtualparadox.lobbymap.ingest.lifecycle.IngestionOrchestrator;
import eu.virtualparadox.lobbymap.ingest.lifecycle.IngestionStatus;
import eu.virtualparadox.lobbymap.ingest.model.DocumentMetadata;
import eu.virtualparadox.lobbymap.query.model.DeleteResult;
import eu.virtualparadox.lobbymap.query.model.PipelineArtifacts;
import eu.virtualparadox.lobbymap.query.model.RetrievalResult;
import eu.virtualparadox.lobbymap.rag.index.DocumentSummary;
import eu.virtualparadox.lobbymap.rag.index.SearchFilters;
import eu.virtualparadox.lobbymap.rag.index.VectorIndexService;
import eu.virtualparadox.lobbymap.rag.retriever.Evidence;
import eu.virtualparadox.lobbymap.rag.retriever.RetrieverService;
import eu.virtualparadox.lobbymap.rag.stance.StanceAggregator;
import eu.virtualparadox.lobbymap.rag.stance.StanceVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;

/**
 * Entry point of the read and write paths, shared by the web layer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryManager {

    private final RetrieverService retrieverService;
    private final StanceAggregator stanceAggregator;
    private final IngestionOrchestrator orchestrator;
    private final VectorIndexService vectorIndex;
    private final DocumentRegistry registry;
    private final ApplicationConfig config;

    public RetrievalResult retrieve(final String query, final SearchFilters filters, final Integer topK) {
        final SearchFilters effective = filters == null ? SearchFilters.none() : filters;
        final int k = retrieverService.resolveTopK(topK);
        final List<Evidence> evidence = retrieverService.retrieve(query, effective, k);
        return new RetrievalResult(query, effective, evidence, artifacts(k));
    }

    /**
     * Retrieves evidence for the policy question and judges it. The author filter, when set, is also
     * the company named in the stance prompt.
     */
    public StanceVerdict assess(final String policyQuestion, final SearchFilters filters, final Integer topK) {
        final RetrievalResult retrieval = retrieve(policyQuestion, filters, topK);
        log.info("Assessing '{}' over {} evidence item(s)", policyQuestion, retrieval.evidence().size());
        return stanceAggregator.assess(retrieval.evidence(), policyQuestion, retrieval.filters().author());
    }

    public IngestionStatus insert(final String documentId, final byte[] content, final DocumentMetadata metadata) {
        return orchestrator.ingest(documentId, content, metadata);
    }

    public Future<IngestionStatus> insertAsync(final String documentId,
                                               final byte[] content,
                                               final DocumentMetadata metadata) {
        return orchestrator.submit(documentId, content, metadata);
    }

    public DeleteResult delete(final String documentId) {
        return new DeleteResult(documentId, orchestrator.delete(documentId));
    }

    public Optional<IngestionStatus> status(final String documentId) {
        return orchestrator.status(documentId);
    }

    public long count() {
        return vectorIndex.count();
    }

    public Map<String, Long> distinctValues(final String attribute) {
        return vectorIndex.distinctValues(attribute);
    }

    public List<DocumentSummary> listDocuments() {
        return vectorIndex.listDocuments();
    }

    public void clear() {
        log.warn("Clearing collection '{}'", vectorIndex.collectionName());
        vectorIndex.clear();
        registry.clear();
    }

    public String collectionName() {
        return vectorIndex.collectionName();
    }

    private PipelineArtifacts artifacts(final int topK) {
        final ApplicationConfig.Models models = config.getModel();
        return new PipelineArtifacts(vectorIndex.collectionName(), models.getEmbedding(), models.getReranker(),
                models.isRerankerEnabled(), topK);
    }
}
