package eu.virtualparadox.lobbymap.query.citation;

import eu.virtualparadox.lobbymap.query.citation.pageinterval.PageInterval;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * A source document and the pages the evidence came from.
 */
public record Citation(String documentId, String author, List<PageInterval> pageIntervals) {

    public String asString() {
        return documentId + (pageIntervals.isEmpty() ? "" : " p. " + pagesAsString());
    }

    private String pagesAsString() {
        final List<String> intervals = new ArrayList<>(pageIntervals.size());
        for (final PageInterval interval : pageIntervals) {
            intervals.add(interval.asString());
        }
        return StringUtils.join(intervals, ", ");
    }
}
