package eu.virtualparadox.lobbymap.query.model;

import eu.virtualparadox.lobbymap.rag.index.SearchFilters;
import eu.virtualparadox.lobbymap.rag.retriever.Evidence;

import java.util.List;

public record RetrievalResult(String query, SearchFilters filters, List<Evidence> evidence, PipelineArtifacts artifacts) {
}
