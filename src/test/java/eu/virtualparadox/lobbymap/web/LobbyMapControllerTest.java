package eu.virtualparadox.lobbymap.web;

import eu.virtualparadox.lobbymap.exception.DocumentParseException;
import eu.virtualparadox.lobbymap.exception.IndexUnavailableException;
import eu.virtualparadox.lobbymap.exception.IngestionFailedException;
import eu.virtualparadox.lobbymap.exception.IngestionRejectedException;
import eu.virtualparadox.lobbymap.ingest.lifecycle.IngestionStage;
import eu.virtualparadox.lobbymap.ingest.lifecycle.IngestionStatus;
import eu.virtualparadox.lobbymap.ingest.model.DocumentMetadata;
import eu.virtualparadox.lobbymap.query.QueryManager;
import eu.virtualparadox.lobbymap.query.model.DeleteResult;
import eu.virtualparadox.lobbymap.query.model.PipelineArtifacts;
import eu.virtualparadox.lobbymap.query.model.RetrievalResult;
import eu.virtualparadox.lobbymap.rag.index.SearchFilters;
import eu.virtualparadox.lobbymap.rag.stance.AggregationWeighting;
import eu.virtualparadox.lobbymap.rag.stance.StanceLabel;
import eu.virtualparadox.lobbymap.rag.stance.StanceVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static eu.virtualparadox.lobbymap.testutil.Fixtures.evidence;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class LobbyMapControllerTest {

    private final QueryManager queryManager = mock(QueryManager.class);
    private MockMvc mvc;

    private final MockMultipartFile pdf = new MockMultipartFile("file", "report.pdf", "application/pdf", new byte[]{1, 2, 3});

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new LobbyMapController(queryManager))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void retrievePassesFiltersAndTopK() throws Exception {
        final SearchFilters filters = new SearchFilters("Acme", "EU", LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31), null);
        when(queryManager.retrieve("carbon tax", filters, 3)).thenReturn(new RetrievalResult("carbon tax", filters,
                List.of(evidence("a.pdf", 0, "Carbon pricing supports emission cuts.")),
                new PipelineArtifacts("test_collection", "nomic", "bge", true, 3)));

        mvc.perform(get("/retrieve")
                        .param("query", "carbon tax")
                        .param("author", "Acme")
                        .param("region", "EU")
                        .param("date_from", "2023-01-01")
                        .param("date_to", "2023-12-31")
                        .param("top_k", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.evidence[0].chunkId").value("a.pdf_00000"))
                .andExpect(jsonPath("$.artifacts.collection").value("test_collection"));
    }

    @Test
    void retrieveWithoutQueryIsBadRequest() throws Exception {
        mvc.perform(get("/retrieve"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void invertedDateRangeIsBadRequest() throws Exception {
        mvc.perform(get("/retrieve").param("query", "q").param("date_from", "2024-01-01").param("date_to", "2023-01-01"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unavailableIndexIsServiceUnavailable() throws Exception {
        when(queryManager.retrieve(eq("q"), any(), any())).thenThrow(new IndexUnavailableException("closed", null));

        mvc.perform(get("/retrieve").param("query", "q"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void assessUsesAuthorFilter() throws Exception {
        final SearchFilters filters = new SearchFilters("Acme", null, null, null, null);
        when(queryManager.assess("carbon tax", filters, null)).thenReturn(new StanceVerdict("Acme", "carbon tax", 1,
                StanceLabel.SUPPORTING, 0.75, 4, 1, AggregationWeighting.SIMPLE, List.of(), List.of(), List.of()));

        mvc.perform(get("/assess").param("query", "carbon tax").param("author", "Acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallScore").value(1))
                .andExpect(jsonPath("$.label").value("SUPPORTING"))
                .andExpect(jsonPath("$.excludedCount").value(1));
    }

    @Test
    void insertReturnsCommittedStatus() throws Exception {
        final DocumentMetadata metadata = new DocumentMetadata("Acme", "EU", LocalDate.of(2024, 3, 1));
        when(queryManager.insert(eq("report.pdf"), any(), eq(metadata)))
                .thenReturn(IngestionStatus.received("report.pdf", "abc").committed(7));

        mvc.perform(multipart("/insert").file(pdf)
                        .param("author", "Acme")
                        .param("region", "EU")
                        .param("date", "2024-03-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("COMMITTED"))
                .andExpect(jsonPath("$.chunkCount").value(7));
    }

    @Test
    void asyncInsertIsAccepted() throws Exception {
        when(queryManager.insertAsync(eq("report.pdf"), any(), any())).thenReturn(new CompletableFuture<>());

        mvc.perform(multipart("/insert").file(pdf).param("author", "Acme").param("async", "true"))
                .andExpect(status().isAccepted());
        verify(queryManager).insertAsync(eq("report.pdf"), any(), eq(new DocumentMetadata("Acme", null, null)));
    }

    @Test
    void insertWithoutAuthorIsBadRequest() throws Exception {
        mvc.perform(multipart("/insert").file(pdf))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unreadableDocumentIsUnprocessable() throws Exception {
        when(queryManager.insert(eq("report.pdf"), any(), any())).thenThrow(new IngestionFailedException("report.pdf",
                IngestionStage.PARSING, new DocumentParseException("Document is encrypted")));

        mvc.perform(multipart("/insert").file(pdf).param("author", "Acme"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INGESTION_FAILED_PARSING"));
    }

    @Test
    void rejectedInsertIsConflict() throws Exception {
        when(queryManager.insert(eq("report.pdf"), any(), any()))
                .thenThrow(new IngestionRejectedException("report.pdf", new IllegalStateException("timeout")));

        mvc.perform(multipart("/insert").file(pdf).param("author", "Acme"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INGESTION_REJECTED"));
    }

    @Test
    void deleteOfUnknownDocumentIsNotFound() throws Exception {
        when(queryManager.delete("missing.pdf")).thenReturn(new DeleteResult("missing.pdf", false));
        when(queryManager.delete("report.pdf")).thenReturn(new DeleteResult("report.pdf", true));

        mvc.perform(post("/delete").param("document_id", "missing.pdf"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.found").value(false));
        mvc.perform(post("/delete").param("document_id", "report.pdf"))
                .andExpect(status().isOk());
    }

    @Test
    void collectionEndpoints() throws Exception {
        when(queryManager.count()).thenReturn(42L);
        when(queryManager.collectionName()).thenReturn("test_collection");

        mvc.perform(get("/collections/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(42));
        mvc.perform(get("/collections/name"))
                .andExpect(jsonPath("$.name").value("test_collection"));
        mvc.perform(post("/collections/clear"))
                .andExpect(status().isNoContent());
        verify(queryManager).clear();
    }

    @Test
    void statusOfUnknownDocumentIsNotFound() throws Exception {
        when(queryManager.status("missing.pdf")).thenReturn(Optional.empty());

        mvc.perform(get("/documents/missing.pdf/status"))
                .andExpect(status().isNotFound());
    }
}
