package eu.virtualparadox.lobbymap.ingest.lifecycle;

import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory ingestion status per document id. Statuses live only as long as the process.
 */
@Service
public class DocumentRegistry {

    private final Map<String, IngestionStatus> statuses;

    public DocumentRegistry() {
        this.statuses = new ConcurrentHashMap<>();
    }

    public void update(final IngestionStatus status) {
        statuses.put(status.documentId(), status);
    }

    public Optional<IngestionStatus> get(final String documentId) {
        return Optional.ofNullable(statuses.get(documentId));
    }

    public void remove(final String documentId) {
        statuses.remove(documentId);
    }

    public void clear() {
        statuses.clear();
    }
}
