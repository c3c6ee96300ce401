package eu.virtualparadox.lobbymap.ingest.language;

import org.springframework.stereotype.Component;

import java.lang.Character.UnicodeScript;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Labels text with the script family carrying most of its letters, using the same family names
 * the OCR language selector accepts ({@code latin-based}, {@code cyrillic-based}, ...).
 */
@Component
public class ScriptLanguageDetector {

    public static final String UNKNOWN = "unknown";

    private static final Map<UnicodeScript, String> FAMILIES = new EnumMap<>(UnicodeScript.class);

    static {
        FAMILIES.put(UnicodeScript.LATIN, "latin-based");
        FAMILIES.put(UnicodeScript.CYRILLIC, "cyrillic-based");
        FAMILIES.put(UnicodeScript.ARABIC, "arabic-based");
        FAMILIES.put(UnicodeScript.DEVANAGARI, "devanagari-based");
        FAMILIES.put(UnicodeScript.BENGALI, "bengali-based");
        FAMILIES.put(UnicodeScript.GREEK, "greek-based");
        FAMILIES.put(UnicodeScript.HEBREW, "hebrew-based");
        FAMILIES.put(UnicodeScript.HAN, "chinese");
        FAMILIES.put(UnicodeScript.HIRAGANA, "japanese");
        FAMILIES.put(UnicodeScript.KATAKANA, "japanese");
        FAMILIES.put(UnicodeScript.HANGUL, "korean");
        FAMILIES.put(UnicodeScript.THAI, "thai");
        FAMILIES.put(UnicodeScript.TELUGU, "telugu");
        FAMILIES.put(UnicodeScript.KANNADA, "kannada");
    }

    /**
     * @param text any text
     * @return the dominant script family, or {@value #UNKNOWN} if the text has no letters of a known script
     */
    public String detect(final String text) {
        if (text == null || text.isEmpty()) {
            return UNKNOWN;
        }

        final Map<String, Integer> counts = new TreeMap<>();
        boolean hasKana = false;
        for (int i = 0; i < text.length(); ) {
            final int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (!Character.isLetter(codePoint)) {
                continue;
            }
            final UnicodeScript script = UnicodeScript.of(codePoint);
            final String family = FAMILIES.get(script);
            if (family != null) {
                counts.merge(family, 1, Integer::sum);
                hasKana |= script == UnicodeScript.HIRAGANA || script == UnicodeScript.KATAKANA;
            }
        }
        if (counts.isEmpty()) {
            return UNKNOWN;
        }

        // Japanese mixes kanji with kana; any kana means the Han letters are Japanese too
        if (hasKana && counts.containsKey("chinese")) {
            counts.merge("japanese", counts.remove("chinese"), Integer::sum);
        }

        String best = UNKNOWN;
        int bestCount = 0;
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
