package eu.virtualparadox.lobbymap.ingest.model;

/**
 * A parser output unit: cleaned text with its position in the source document.
 *
 * @param text        cleaned, non-blank text
 * @param page        1-based page the segment was read from
 * @param startOffset inclusive character offset into the page text
 * @param endOffset   exclusive character offset into the page text
 * @param role        layout role, {@link SegmentRole#UNSPECIFIED} for structure-agnostic parsers
 */
public record Segment(String text, int page, int startOffset, int endOffset, SegmentRole role) {

    public static Segment ofPage(final String text, final int page) {
        return new Segment(text, page, 0, text.length(), SegmentRole.UNSPECIFIED);
    }
}
