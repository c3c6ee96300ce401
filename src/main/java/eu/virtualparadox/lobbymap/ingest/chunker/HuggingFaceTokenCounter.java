package eu.virtualparadox.lobbymap.ingest.chunker;

import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Token counts from the embedding model's own {@code tokenizer.json}, without special tokens and
 * without truncation, so long texts report their real length.
 */
public final class HuggingFaceTokenCounter implements TokenCounter, AutoCloseable {

    private final HuggingFaceTokenizer tokenizer;

    public HuggingFaceTokenCounter(final Path tokenizerPath) throws IOException {
        this.tokenizer = HuggingFaceTokenizer.builder()
                .optTokenizerPath(tokenizerPath)
                .optAddSpecialTokens(false)
                .optTruncation(false)
                .build();
    }

    @Override
    public int count(final String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return tokenizer.encode(text).getIds().length;
    }

    @Override
    public void close() {
        tokenizer.close();
    }
}
