package eu.virtualparadox.lobbymap.ingest.chunker;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Unicode-uppercase-aware sentence boundary detection.
 * <p>
 * A sentence ends at {@code .}, {@code !} or {@code ?} followed by whitespace, and the next sentence
 * starts with an uppercase letter or a quote. Trailing abbreviations ({@code Dr.}, months, weekdays, ...)
 * do not end a sentence. Clause boundaries ({@code ;} and {@code :}) are offered as a second level
 * for sentences that are still too long.
 */
final class SentenceSplitter {

    private static final Pattern SENTENCE_SPLIT = Pattern.compile(
            "(?<=[.!?])" +
                    "(?![.!?])" +
                    "\\s+" +
                    "(?=[\\p{Lu}\"'])"
    );

    private static final Pattern CLAUSE_SPLIT = Pattern.compile("(?<=[;:])\\s+");

    private static final Pattern ABBREVIATION_PATTERN = Pattern.compile(
            "\\b(?:Dr|Mr|Mrs|Ms|Prof|Sr|Jr|Inc|Ltd|Corp|Co|St|Ave|Blvd|Rd|etc|vs|eg|ie|cf|ca|approx|Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec|Mon|Tue|Wed|Thu|Fri|Sat|Sun|U\\.S\\.A|U\\.K|U\\.N)\\.$"
    );

    private SentenceSplitter() {
        // prevent instantiation
    }

    static List<String> sentences(final String text) {
        final List<String> sentences = new ArrayList<>();
        final Matcher matcher = SENTENCE_SPLIT.matcher(text);

        int lastEnd = 0;
        while (matcher.find()) {
            final int splitPoint = matcher.start();
            final String beforeSplit = text.substring(Math.max(0, splitPoint - 20), splitPoint).trim();

            if (!ABBREVIATION_PATTERN.matcher(beforeSplit).find()) {
                if (splitPoint > lastEnd) {
                    sentences.add(new SentenceSpan(lastEnd, splitPoint).of(text));
                }
                lastEnd = matcher.end();
            }
        }
        if (lastEnd < text.length()) {
            sentences.add(new SentenceSpan(lastEnd, text.length()).of(text));
        }
        return sentences;
    }

    static List<String> clauses(final String sentence) {
        final List<String> clauses = new ArrayList<>();
        for (final String clause : CLAUSE_SPLIT.split(sentence)) {
            if (!clause.isBlank()) {
                clauses.add(clause);
            }
        }
        return clauses;
    }

    static List<String> words(final String text) {
        final List<String> words = new ArrayList<>();
        for (final String word : text.trim().split("\\s+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }
}
