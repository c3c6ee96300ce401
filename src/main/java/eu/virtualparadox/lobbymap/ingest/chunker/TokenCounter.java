package eu.virtualparadox.lobbymap.ingest.chunker;

/**
 * Counts tokens the way the embedding model would see them.
 */
public interface TokenCounter {

    /**
     * @param text any text
     * @return number of tokens, 0 for blank text
     */
    int count(String text);
}
