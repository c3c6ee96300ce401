package eu.virtualparadox.lobbymap.ingest.chunker;

/**
 * Counts whitespace-separated words. Used when no tokenizer file is configured.
 */
public final class WhitespaceTokenCounter implements TokenCounter {

    @Override
    public int count(final String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
