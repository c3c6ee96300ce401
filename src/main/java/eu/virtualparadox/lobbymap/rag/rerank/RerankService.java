package eu.virtualparadox.lobbymap.rag.rerank;

/**
 * Cross-encoder relevance scoring of a (query, passage) pair.
 */
public interface RerankService {

    /**
     * @param query         the user query
     * @param candidateText passage text
     * @return relevance score; higher is more relevant, scale is model specific
     */
    float score(String query, String candidateText);
}
