package eu.virtualparadox.lobbymap.query.citation;

import eu.virtualparadox.lobbymap.query.citation.pageinterval.PageInterval;
import eu.virtualparadox.lobbymap.query.citation.pageinterval.PageIntervalMerger;
import eu.virtualparadox.lobbymap.rag.index.ChunkMetadata;
import eu.virtualparadox.lobbymap.rag.retriever.Evidence;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups evidence by document and merges the page spans of each document into compact intervals.
 * <p>Citations come out in the order their document first appears in the evidence list.
 * Evidence without page information (negative pages) contributes a citation without pages.</p>
 */
@Service
@RequiredArgsConstructor
public final class CitationResolverService {

    private final PageIntervalMerger pageIntervalMerger;

    /**
     * @param evidence evidence in ranking order, no {@code null} elements
     * @return unmodifiable list of citations, one per document
     * @throws IllegalArgumentException if an evidence item has {@code fromPage > toPage}
     */
    public List<Citation> getCitations(final List<Evidence> evidence) {
        Objects.requireNonNull(evidence, "evidence must not be null");
        if (evidence.isEmpty()) {
            return Collections.emptyList();
        }

        final Map<String, List<PageInterval>> intervalsByDocumentId = new LinkedHashMap<>();
        final Map<String, String> authorByDocumentId = new LinkedHashMap<>();

        for (final Evidence item : evidence) {
            Objects.requireNonNull(item, "evidence must not contain null elements");
            final ChunkMetadata metadata = item.metadata();
            final String documentId = metadata.documentId();
            authorByDocumentId.putIfAbsent(documentId, metadata.author());

            final List<PageInterval> intervals = intervalsByDocumentId.computeIfAbsent(documentId, k -> new ArrayList<>());
            if (metadata.pageStart() < 1 || metadata.pageEnd() < 1) {
                continue;
            }
            if (metadata.pageStart() > metadata.pageEnd()) {
                throw new IllegalArgumentException("Invalid page interval " + metadata.pageStart() + "-"
                        + metadata.pageEnd() + " for document " + documentId);
            }
            intervals.add(new PageInterval(metadata.pageStart(), metadata.pageEnd()));
        }

        final List<Citation> result = new ArrayList<>(intervalsByDocumentId.size());
        for (final Map.Entry<String, List<PageInterval>> entry : intervalsByDocumentId.entrySet()) {
            result.add(new Citation(entry.getKey(), authorByDocumentId.get(entry.getKey()),
                    pageIntervalMerger.merge(entry.getValue())));
        }
        return Collections.unmodifiableList(result);
    }
}
