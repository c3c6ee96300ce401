package eu.virtualparadox.lobbymap.ingest.parser;

/**
 * One visual line captured by {@link LayoutTextStripper}.
 *
 * @param page            1-based page number
 * @param text            raw line text
 * @param fontSize        mean glyph size in points
 * @param startsParagraph whether PDFBox detected a paragraph break before this line
 */
record LayoutLine(int page, String text, float fontSize, boolean startsParagraph) {
}
