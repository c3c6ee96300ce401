package eu.virtualparadox.lobbymap.ingest.chunker;

import eu.virtualparadox.lobbymap.exception.ChunkingException;
import eu.virtualparadox.lobbymap.ingest.language.ScriptLanguageDetector;
import eu.virtualparadox.lobbymap.ingest.model.ChunkDraft;
import eu.virtualparadox.lobbymap.ingest.model.Segment;
import eu.virtualparadox.lobbymap.rag.embed.EmbeddingService;
import eu.virtualparadox.lobbymap.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Token-bounded semantic chunker.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Units:</strong> every parser segment becomes one unit. A segment above the token budget
 *       is first hard-split at sentence boundaries, then clause boundaries, then between words, so that
 *       each piece fits. A single word above the budget cannot be placed and fails the document.</li>
 *   <li><strong>Greedy merge:</strong> units are walked in document order and appended to the open chunk
 *       while the token sum stays within budget and the unit's embedding is at least
 *       {@code similarityThreshold} similar (cosine) to the chunk centroid.</li>
 *   <li><strong>Double-pass merge:</strong> adjacent chunks are then merged when they fit together and
 *       their centroids are similar enough. At most {@code mergePassLimit} passes run.</li>
 *   <li><strong>Thresholds:</strong> {@code 0} merges everything the budget allows, {@code 1} merges only
 *       identical embeddings.</li>
 * </ul>
 *
 * <p>The token count of a chunk is the sum of the counts of its units.</p>
 */
@Component
@Slf4j
public class SemanticChunker {

    /** Absorbs float rounding so identical embeddings still pass threshold 1. */
    private static final double SIMILARITY_EPSILON = 1e-6;

    private static final String UNIT_SEPARATOR = "\n";

    private final TokenCounter tokenCounter;
    private final EmbeddingService embeddingService;
    private final ScriptLanguageDetector languageDetector;
    private final boolean doublePassMerge;
    private final int mergePassLimit;

    public SemanticChunker(final TokenCounter tokenCounter,
                           final EmbeddingService embeddingService,
                           final ScriptLanguageDetector languageDetector,
                           @Value("${lobbymap.chunker.double-pass-merge:true}") final boolean doublePassMerge,
                           @Value("${lobbymap.chunker.merge-pass-limit:2}") final int mergePassLimit) {
        if (mergePassLimit < 0) {
            throw new IllegalArgumentException("mergePassLimit must not be negative");
        }
        this.tokenCounter = tokenCounter;
        this.embeddingService = embeddingService;
        this.languageDetector = languageDetector;
        this.doublePassMerge = doublePassMerge;
        this.mergePassLimit = mergePassLimit;
    }

    /**
     * Chunks the segments of one document.
     *
     * @param documentId          owning document, used to derive chunk ids
     * @param segments            parser output in reading order
     * @param tokenBudget         maximum tokens per chunk
     * @param similarityThreshold minimum cosine similarity for merging, in [0, 1]
     * @return chunk drafts in document order, empty if there are no segments
     * @throws ChunkingException if a single word exceeds the budget or the embedder returns unusable output
     */
    public List<ChunkDraft> chunk(final String documentId,
                                  final List<Segment> segments,
                                  final int tokenBudget,
                                  final double similarityThreshold) {
        validateInputs(documentId, tokenBudget, similarityThreshold);
        if (segments == null || segments.isEmpty()) {
            return List.of();
        }

        final List<Unit> units = toUnits(segments, tokenBudget);
        if (units.isEmpty()) {
            return List.of();
        }
        attachEmbeddings(units);

        List<Group> groups = greedyMerge(units, tokenBudget, similarityThreshold);
        final int firstPass = groups.size();
        if (doublePassMerge) {
            groups = mergeAdjacent(groups, tokenBudget, similarityThreshold);
        }
        log.debug("Chunked {}: {} unit(s) -> {} chunk(s) after greedy pass, {} after merge",
                documentId, units.size(), firstPass, groups.size());

        final List<ChunkDraft> drafts = new ArrayList<>(groups.size());
        for (int ordinal = 0; ordinal < groups.size(); ordinal++) {
            drafts.add(groups.get(ordinal).toDraft(documentId, ordinal));
        }
        return drafts;
    }

    private void validateInputs(final String documentId, final int tokenBudget, final double similarityThreshold) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId cannot be null or blank");
        }
        if (tokenBudget <= 0) {
            throw new IllegalArgumentException("tokenBudget must be positive");
        }
        if (Double.isNaN(similarityThreshold) || similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]");
        }
    }

    private List<Unit> toUnits(final List<Segment> segments, final int tokenBudget) {
        final List<Unit> units = new ArrayList<>();
        for (final Segment segment : segments) {
            final String text = segment.text() == null ? "" : segment.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            final int tokens = tokenCounter.count(text);
            if (tokens <= tokenBudget) {
                units.add(new Unit(text, tokens, segment.page()));
                continue;
            }

            final List<Unit> pieces = new ArrayList<>();
            pack(SentenceSplitter.sentences(text), tokenBudget, 0, segment.page(), pieces);
            log.debug("Hard-split segment of {} tokens on page {} into {} piece(s)", tokens, segment.page(), pieces.size());
            units.addAll(pieces);
        }
        return units;
    }

    /**
     * Packs parts into pieces within budget. Parts that are too long alone are split one level finer:
     * sentences, then clauses, then words.
     */
    private void pack(final List<String> parts, final int tokenBudget, final int level, final int page, final List<Unit> out) {
        final StringBuilder current = new StringBuilder();
        int currentTokens = 0;

        for (final String part : parts) {
            final int tokens = tokenCounter.count(part);
            if (tokens == 0) {
                continue;
            }
            if (tokens > tokenBudget) {
                currentTokens = flush(current, currentTokens, page, out);
                switch (level) {
                    case 0 -> pack(SentenceSplitter.clauses(part), tokenBudget, 1, page, out);
                    case 1 -> pack(SentenceSplitter.words(part), tokenBudget, 2, page, out);
                    default -> throw new ChunkingException("Unsplittable text of " + tokens
                            + " tokens exceeds the budget of " + tokenBudget + " on page " + page);
                }
                continue;
            }
            if (currentTokens + tokens > tokenBudget) {
                currentTokens = flush(current, currentTokens, page, out);
            }
            if (!current.isEmpty()) {
                current.append(' ');
            }
            current.append(part.trim());
            currentTokens += tokens;
        }
        flush(current, currentTokens, page, out);
    }

    private int flush(final StringBuilder current, final int tokens, final int page, final List<Unit> out) {
        if (!current.isEmpty()) {
            out.add(new Unit(current.toString(), tokens, page));
            current.setLength(0);
        }
        return 0;
    }

    private void attachEmbeddings(final List<Unit> units) {
        final List<String> texts = new ArrayList<>(units.size());
        for (final Unit unit : units) {
            texts.add(unit.text);
        }
        final List<float[]> vectors = embeddingService.embedBatch(texts);
        if (vectors == null || vectors.size() != units.size()) {
            throw new ChunkingException("Embedding service returned " + (vectors == null ? 0 : vectors.size())
                    + " vector(s) for " + units.size() + " unit(s)");
        }
        for (int i = 0; i < units.size(); i++) {
            units.get(i).embedding = vectors.get(i);
        }
    }

    private List<Group> greedyMerge(final List<Unit> units, final int tokenBudget, final double threshold) {
        final List<Group> groups = new ArrayList<>();
        Group current = null;
        for (final Unit unit : units) {
            if (current != null
                    && current.tokens + unit.tokens <= tokenBudget
                    && isSimilar(current.centroid(), unit.embedding, threshold)) {
                current.add(unit);
            } else {
                current = new Group(unit);
                groups.add(current);
            }
        }
        return groups;
    }

    private List<Group> mergeAdjacent(final List<Group> input, final int tokenBudget, final double threshold) {
        List<Group> groups = input;
        for (int pass = 0; pass < mergePassLimit && groups.size() > 1; pass++) {
            final List<Group> merged = new ArrayList<>(groups.size());
            boolean changed = false;
            Group current = groups.get(0);
            for (int i = 1; i < groups.size(); i++) {
                final Group next = groups.get(i);
                if (current.tokens + next.tokens <= tokenBudget
                        && isSimilar(current.centroid(), next.centroid(), threshold)) {
                    current.absorb(next);
                    changed = true;
                } else {
                    merged.add(current);
                    current = next;
                }
            }
            merged.add(current);
            groups = merged;
            if (!changed) {
                break;
            }
        }
        return groups;
    }

    private static boolean isSimilar(final float[] a, final float[] b, final double threshold) {
        if (threshold <= 0.0) {
            return true;
        }
        return VectorMath.cosine(a, b) >= threshold - SIMILARITY_EPSILON;
    }

    private static final class Unit {
        final String text;
        final int tokens;
        final int page;
        float[] embedding;

        Unit(final String text, final int tokens, final int page) {
            this.text = text;
            this.tokens = tokens;
            this.page = page;
        }
    }

    private final class Group {
        final List<Unit> units = new ArrayList<>();
        double[] sum;
        int tokens;

        Group(final Unit first) {
            this.sum = new double[first.embedding.length];
            add(first);
        }

        void add(final Unit unit) {
            units.add(unit);
            VectorMath.addInPlace(sum, unit.embedding);
            tokens += unit.tokens;
        }

        void absorb(final Group other) {
            for (final Unit unit : other.units) {
                add(unit);
            }
        }

        float[] centroid() {
            return VectorMath.mean(sum, units.size());
        }

        ChunkDraft toDraft(final String documentId, final int ordinal) {
            final StringBuilder text = new StringBuilder();
            int pageStart = Integer.MAX_VALUE;
            int pageEnd = Integer.MIN_VALUE;
            for (final Unit unit : units) {
                if (!text.isEmpty()) {
                    text.append(UNIT_SEPARATOR);
                }
                text.append(unit.text);
                pageStart = Math.min(pageStart, unit.page);
                pageEnd = Math.max(pageEnd, unit.page);
            }
            final String chunkText = text.toString();
            return new ChunkDraft(ChunkDraft.chunkId(documentId, ordinal), documentId, ordinal, chunkText,
                    tokens, pageStart, pageEnd, languageDetector.detect(chunkText));
        }
    }
}
