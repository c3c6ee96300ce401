package eu.virtualparadox.lobbymap.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

@Component
public class TextCleaner {

    /** Glyph placeholders emitted for characters the PDF font could not map, e.g. {@code GLYPH<c=3,font=/F1>}. */
    private static final Pattern GLYPH_PLACEHOLDER = Pattern.compile("GLYPH<[^>]*>");

    private static final Pattern IMAGE_MARKER = Pattern.compile("<!--\\s*image\\s*-->");

    /** Escaped underscores used as dot leaders in tables of contents. */
    private static final Pattern ESCAPED_UNDERSCORE = Pattern.compile("\\\\{1,2}_");

    /**
     * Cleans extracted text by removing extraction artifacts, control characters and zero-width
     * spaces, and normalizing whitespace while keeping diacritics.
     *
     * @param input raw text
     * @return cleaned text, empty for {@code null} input
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        final String withoutArtifacts = removeArtifacts(Normalizer.normalize(input, Normalizer.Form.NFC));
        return withoutArtifacts
                // line breaks -> space
                .replaceAll("[\\r\\n]+", " ")
                // zero-width and similar -> SPACE
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", " ")
                // non-breaking space -> SPACE
                .replace("\u00A0", " ")
                // soft hyphen (0xAD) -> remove
                .replace("\u00AD", "")
                // other format chars -> SPACE
                .replaceAll("\\p{Cf}", " ")
                // control chars -> remove
                .replaceAll("\\p{Cc}", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private String removeArtifacts(final String text) {
        String result = GLYPH_PLACEHOLDER.matcher(text).replaceAll("");
        result = IMAGE_MARKER.matcher(result).replaceAll("");
        return ESCAPED_UNDERSCORE.matcher(result).replaceAll(".");
    }
}
