package eu.virtualparadox.lobbymap.query;

import eu.virtualparadox.lobbymap.application.config.ApplicationConfig;
import eu.virtualparadox.lobbymap.ingest.lifecycle.DocumentRegistry;
import eu.virtualparadox.lobbymap.ingest.lifecycle.IngestionOrchestrator;
import eu.virtualparadox.lobbymap.ingest.lifecycle.IngestionStatus;
import eu.virtualparadox.lobbymap.query.model.RetrievalResult;
import eu.virtualparadox.lobbymap.rag.index.SearchFilters;
import eu.virtualparadox.lobbymap.rag.index.VectorIndexService;
import eu.virtualparadox.lobbymap.rag.retriever.Evidence;
import eu.virtualparadox.lobbymap.rag.retriever.RetrieverService;
import eu.virtualparadox.lobbymap.rag.stance.StanceAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static eu.virtualparadox.lobbymap.testutil.Fixtures.evidence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryManagerTest {

    private final RetrieverService retriever = mock(RetrieverService.class);
    private final StanceAggregator aggregator = mock(StanceAggregator.class);
    private final IngestionOrchestrator orchestrator = mock(IngestionOrchestrator.class);
    private final VectorIndexService vectorIndex = mock(VectorIndexService.class);
    private final DocumentRegistry registry = new DocumentRegistry();
    private final ApplicationConfig config = new ApplicationConfig();

    private QueryManager queryManager;

    @BeforeEach
    void setUp() {
        config.getModel().setEmbedding("nomic-embed");
        config.getModel().setReranker("bge-reranker");
        when(vectorIndex.collectionName()).thenReturn("test_collection");
        queryManager = new QueryManager(retriever, aggregator, orchestrator, vectorIndex, registry, config);
    }

    @Test
    void retrieveReportsThePipelineThatProducedTheEvidence() {
        final List<Evidence> evidence = List.of(evidence("a.pdf", 0, "Carbon pricing supports emission cuts."));
        when(retriever.resolveTopK(null)).thenReturn(10);
        when(retriever.retrieve("carbon tax", SearchFilters.none(), 10)).thenReturn(evidence);

        final RetrievalResult result = queryManager.retrieve("carbon tax", null, null);

        assertThat(result.evidence()).isEqualTo(evidence);
        assertThat(result.filters()).isEqualTo(SearchFilters.none());
        assertThat(result.artifacts().collection()).isEqualTo("test_collection");
        assertThat(result.artifacts().embeddingModel()).isEqualTo("nomic-embed");
        assertThat(result.artifacts().rerankerModel()).isEqualTo("bge-reranker");
        assertThat(result.artifacts().topK()).isEqualTo(10);
    }

    @Test
    void assessNamesTheFilteredAuthorAsSubject() {
        final SearchFilters filters = new SearchFilters("Acme", null, null, null, null);
        final List<Evidence> evidence = List.of(evidence("a.pdf", 0, "Acme supports the levy."));
        when(retriever.resolveTopK(5)).thenReturn(5);
        when(retriever.retrieve("carbon tax", filters, 5)).thenReturn(evidence);

        queryManager.assess("carbon tax", filters, 5);

        verify(aggregator).assess(evidence, "carbon tax", "Acme");
    }

    @Test
    void deleteReportsWhetherTheDocumentExisted() {
        when(orchestrator.delete("a.pdf")).thenReturn(true);
        when(orchestrator.delete("missing.pdf")).thenReturn(false);

        assertThat(queryManager.delete("a.pdf").found()).isTrue();
        assertThat(queryManager.delete("missing.pdf").found()).isFalse();
    }

    @Test
    void clearEmptiesIndexAndStatusRegistry() {
        registry.update(IngestionStatus.received("a.pdf", "abc").committed(3));

        queryManager.clear();

        verify(vectorIndex).clear();
        assertThat(registry.get("a.pdf")).isEmpty();
    }
}
