package eu.virtualparadox.lobbymap.web;

import eu.virtualparadox.lobbymap.ingest.lifecycle.IngestionStatus;
import eu.virtualparadox.lobbymap.ingest.model.DocumentMetadata;
import eu.virtualparadox.lobbymap.query.QueryManager;
import eu.virtualparadox.lobbymap.query.model.DeleteResult;
import eu.virtualparadox.lobbymap.query.model.RetrievalResult;
import eu.virtualparadox.lobbymap.rag.index.DocumentSummary;
import eu.virtualparadox.lobbymap.rag.index.SearchFilters;
import eu.virtualparadox.lobbymap.rag.stance.StanceVerdict;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class LobbyMapController {

    private final QueryManager queryManager;

    @GetMapping("/retrieve")
    public RetrievalResult retrieve(@RequestParam("query") String query,
                                    @RequestParam(value = "author", required = false) String author,
                                    @RequestParam(value = "region", required = false) String region,
                                    @RequestParam(value = "date_from", required = false)
                                    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
                                    @RequestParam(value = "date_to", required = false)
                                    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
                                    @RequestParam(value = "document_id", required = false) String documentId,
                                    @RequestParam(value = "top_k", required = false) Integer topK) {
        return queryManager.retrieve(query, new SearchFilters(author, region, dateFrom, dateTo, documentId), topK);
    }

    @GetMapping("/assess")
    public StanceVerdict assess(@RequestParam("query") String query,
                                @RequestParam(value = "author", required = false) String author,
                                @RequestParam(value = "region", required = false) String region,
                                @RequestParam(value = "date_from", required = false)
                                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
                                @RequestParam(value = "date_to", required = false)
                                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
                                @RequestParam(value = "document_id", required = false) String documentId,
                                @RequestParam(value = "top_k", required = false) Integer topK) {
        return queryManager.assess(query, new SearchFilters(author, region, dateFrom, dateTo, documentId), topK);
    }

    /**
     * Ingests an uploaded PDF under its original file name. With {@code async=true} the request returns
     * 202 right away and progress is available from {@code /documents/{id}/status}.
     */
    @PostMapping("/insert")
    public ResponseEntity<IngestionStatus> insert(@RequestParam("file") MultipartFile file,
                                                  @RequestParam("author") String author,
                                                  @RequestParam(value = "region", required = false) String region,
                                                  @RequestParam(value = "date", required = false)
                                                  @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                                  @RequestParam(value = "async", defaultValue = "false") boolean async) {
        final String documentId = file.getOriginalFilename();
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("uploaded file has no name");
        }
        final byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read upload " + documentId, e);
        }
        final DocumentMetadata metadata = new DocumentMetadata(author, region, date);

        if (async) {
            queryManager.insertAsync(documentId, content, metadata);
            return ResponseEntity.status(HttpStatus.ACCEPTED).build();
        }
        return ResponseEntity.ok(queryManager.insert(documentId, content, metadata));
    }

    @PostMapping("/delete")
    public ResponseEntity<DeleteResult> delete(@RequestParam("document_id") String documentId) {
        final DeleteResult result = queryManager.delete(documentId);
        return ResponseEntity.status(result.found() ? HttpStatus.OK : HttpStatus.NOT_FOUND).body(result);
    }

    @GetMapping("/collections/count")
    public Map<String, Long> count() {
        return Map.of("count", queryManager.count());
    }

    @GetMapping("/collections/unique")
    public Map<String, Long> unique(@RequestParam("attribute") String attribute) {
        return queryManager.distinctValues(attribute);
    }

    @GetMapping("/collections/documents")
    public List<DocumentSummary> documents() {
        return queryManager.listDocuments();
    }

    @GetMapping("/collections/name")
    public Map<String, String> name() {
        return Map.of("name", queryManager.collectionName());
    }

    @PostMapping("/collections/clear")
    public ResponseEntity<Void> clear() {
        queryManager.clear();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/documents/{id}/status")
    public ResponseEntity<IngestionStatus> status(@PathVariable("id") String documentId) {
        return queryManager.status(documentId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
