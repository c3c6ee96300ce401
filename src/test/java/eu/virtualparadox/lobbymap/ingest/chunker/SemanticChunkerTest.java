package eu.virtualparadox.lobbymap.ingest.chunker;

import eu.virtualparadox.lobbymap.exception.ChunkingException;
import eu.virtualparadox.lobbymap.ingest.language.ScriptLanguageDetector;
import eu.virtualparadox.lobbymap.ingest.model.ChunkDraft;
import eu.virtualparadox.lobbymap.ingest.model.Segment;
import eu.virtualparadox.lobbymap.testutil.BagOfWordsEmbeddingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SemanticChunkerTest {

    private static final String CLIMATE = "Carbon pricing supports emission cuts.";
    private static final String FINANCE = "Quarterly revenue grew in banking.";

    private final BagOfWordsEmbeddingService embeddings = new BagOfWordsEmbeddingService();
    private final SemanticChunker chunker = new SemanticChunker(new WhitespaceTokenCounter(), embeddings,
            new ScriptLanguageDetector(), true, 2);

    // ---------- Helpers ----------

    /** Repeats a five-word sentence so the text has {@code words} whitespace tokens. */
    private static String words(final String sentence, final int words) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words / 5; i++) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(sentence);
        }
        return sb.toString();
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("600/50/700 tokens, budget 1000: similar neighbours merge, the dissimilar one stays alone")
    void mergesSimilarSegmentsWithinBudget() {
        final List<Segment> segments = List.of(
                Segment.ofPage(words(CLIMATE, 600), 1),
                Segment.ofPage(words(CLIMATE, 50), 1),
                Segment.ofPage(words(FINANCE, 700), 2));

        final List<ChunkDraft> chunks = chunker.chunk("policy.pdf", segments, 1000, 0.75);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).tokenCount()).isEqualTo(650);
        assertThat(chunks.get(0).pageStart()).isEqualTo(1);
        assertThat(chunks.get(0).pageEnd()).isEqualTo(1);
        assertThat(chunks.get(1).tokenCount()).isEqualTo(700);
        assertThat(chunks.get(1).pageStart()).isEqualTo(2);
        assertThat(chunks).extracting(ChunkDraft::chunkId).containsExactly("policy.pdf_00000", "policy.pdf_00001");
        assertThat(chunks).extracting(ChunkDraft::ordinal).containsExactly(0, 1);
        assertThat(chunks).extracting(ChunkDraft::language).containsOnly("latin-based");
    }

    @Test
    @DisplayName("Units of one chunk are embedded in a single batch call")
    void embedsAllUnitsInOneBatch() {
        chunker.chunk("doc.pdf", List.of(Segment.ofPage(CLIMATE, 1), Segment.ofPage(FINANCE, 1)), 100, 0.5);
        assertThat(embeddings.batchCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("No segments or only blank segments yield no chunks")
    void emptyInputYieldsNoChunks() {
        assertThat(chunker.chunk("doc.pdf", List.of(), 100, 0.75)).isEmpty();
        assertThat(chunker.chunk("doc.pdf", null, 100, 0.75)).isEmpty();
        assertThat(chunker.chunk("doc.pdf", List.of(Segment.ofPage("   ", 1)), 100, 0.75)).isEmpty();
    }

    @Test
    @DisplayName("Oversized segment is hard-split at sentence boundaries and every piece fits the budget")
    void hardSplitsOversizedSegment() {
        final String text = "Alpha beta gamma delta. Epsilon zeta eta theta. Iota kappa lambda mu.";

        final List<ChunkDraft> chunks = chunker.chunk("doc.pdf", List.of(Segment.ofPage(text, 3)), 10, 0.0);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).text()).isEqualTo("Alpha beta gamma delta. Epsilon zeta eta theta.");
        assertThat(chunks.get(1).text()).isEqualTo("Iota kappa lambda mu.");
        assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(10));
        assertThat(chunks).allSatisfy(c -> assertThat(c.pageStart()).isEqualTo(3));
    }

    @Test
    @DisplayName("Sentence longer than the budget falls back to clause, then word boundaries")
    void splitsLongSentenceByClausesThenWords() {
        final String text = "one two three; four five six seven eight nine";

        final List<ChunkDraft> chunks = chunker.chunk("doc.pdf", List.of(Segment.ofPage(text, 1)), 4, 0.0);

        assertThat(chunks).extracting(ChunkDraft::text)
                .containsExactly("one two three;", "four five six seven", "eight nine");
        assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(4));
    }

    @Test
    @DisplayName("A single word above the budget fails chunking")
    void unsplittableWordFails() {
        final TokenCounter fiveCharsPerToken = text -> text == null || text.isBlank() ? 0 : (text.trim().length() + 4) / 5;
        final SemanticChunker strict = new SemanticChunker(fiveCharsPerToken, embeddings,
                new ScriptLanguageDetector(), true, 2);

        assertThatThrownBy(() -> strict.chunk("doc.pdf",
                List.of(Segment.ofPage("Supercalifragilisticexpialidocious", 1)), 3, 0.5))
                .isInstanceOf(ChunkingException.class)
                .hasMessageContaining("exceeds the budget");
    }

    @Test
    @DisplayName("Threshold 0 merges everything the budget allows")
    void zeroThresholdMergesAcrossTopics() {
        final List<ChunkDraft> chunks = chunker.chunk("doc.pdf",
                List.of(Segment.ofPage(CLIMATE, 1), Segment.ofPage(FINANCE, 1), Segment.ofPage(CLIMATE, 2)), 100, 0.0);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).text()).isEqualTo(CLIMATE + "\n" + FINANCE + "\n" + CLIMATE);
        assertThat(chunks.get(0).tokenCount()).isEqualTo(15);
        assertThat(chunks.get(0).pageEnd()).isEqualTo(2);
    }

    @Test
    @DisplayName("Threshold 1 merges only identical embeddings")
    void fullThresholdMergesOnlyIdenticalUnits() {
        final List<ChunkDraft> chunks = chunker.chunk("doc.pdf",
                List.of(Segment.ofPage(CLIMATE, 1), Segment.ofPage(CLIMATE, 1),
                        Segment.ofPage("Carbon pricing supports growth.", 1)), 100, 1.0);

        assertThat(chunks).extracting(ChunkDraft::tokenCount).containsExactly(10, 4);
    }

    @Test
    @DisplayName("Second pass merges adjacent groups the greedy pass left apart, only when enabled with passes to spare")
    void secondPassFollowsMergeSettings() {
        // greedy: [alpha beta gamma] [gamma delta + alpha beta gamma delta]; the two group centroids score ~0.69
        final List<Segment> segments = List.of(
                Segment.ofPage("alpha beta gamma", 1),
                Segment.ofPage("gamma delta", 1),
                Segment.ofPage("alpha beta gamma delta", 2));

        final SemanticChunker singlePass = new SemanticChunker(new WhitespaceTokenCounter(), embeddings,
                new ScriptLanguageDetector(), false, 2);
        final SemanticChunker noPassesAllowed = new SemanticChunker(new WhitespaceTokenCounter(), embeddings,
                new ScriptLanguageDetector(), true, 0);

        final List<ChunkDraft> merged = chunker.chunk("doc.pdf", segments, 100, 0.65);
        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).tokenCount()).isEqualTo(9);
        assertThat(merged.get(0).pageStart()).isEqualTo(1);
        assertThat(merged.get(0).pageEnd()).isEqualTo(2);

        assertThat(singlePass.chunk("doc.pdf", segments, 100, 0.65))
                .extracting(ChunkDraft::tokenCount).containsExactly(3, 6);
        assertThat(noPassesAllowed.chunk("doc.pdf", segments, 100, 0.65))
                .extracting(ChunkDraft::tokenCount).containsExactly(3, 6);
    }

    @Test
    @DisplayName("Re-chunking the same input yields identical drafts")
    void chunkingIsDeterministic() {
        final List<Segment> segments = List.of(Segment.ofPage(CLIMATE, 1), Segment.ofPage(FINANCE, 2));
        assertThat(chunker.chunk("doc.pdf", segments, 100, 0.75))
                .isEqualTo(chunker.chunk("doc.pdf", segments, 100, 0.75));
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void rejectsInvalidArguments() {
        final List<Segment> segments = List.of(Segment.ofPage(CLIMATE, 1));
        assertThatThrownBy(() -> chunker.chunk(" ", segments, 100, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk("doc.pdf", segments, 0, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk("doc.pdf", segments, 100, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk("doc.pdf", segments, 100, -0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
