package eu.virtualparadox.lobbymap.ingest.model;

import java.util.List;

/**
 * Parser output.
 *
 * @param segments    segments in reading order
 * @param pageCount   number of pages in the source
 * @param failedPages 1-based pages that could not be read and were skipped
 * @param strategy    name of the strategy that produced the segments
 */
public record ParsedDocument(List<Segment> segments, int pageCount, List<Integer> failedPages, String strategy) {

    public ParsedDocument {
        segments = List.copyOf(segments);
        failedPages = List.copyOf(failedPages);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }
}
