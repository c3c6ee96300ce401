package eu.virtualparadox.lobbymap.rag.index;

import java.time.LocalDate;

/**
 * Conjunctive metadata predicates for a search. {@code null} fields do not constrain the result.
 *
 * @param author     exact author
 * @param region     exact region
 * @param dateFrom   inclusive lower date bound
 * @param dateTo     inclusive upper date bound
 * @param documentId exact document id (file name)
 */
public record SearchFilters(String author, String region, LocalDate dateFrom, LocalDate dateTo, String documentId) {

    public SearchFilters {
        author = blankToNull(author);
        region = blankToNull(region);
        documentId = blankToNull(documentId);
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new IllegalArgumentException("dateFrom " + dateFrom + " is after dateTo " + dateTo);
        }
    }

    public static SearchFilters none() {
        return new SearchFilters(null, null, null, null, null);
    }

    public boolean isEmpty() {
        return author == null && region == null && dateFrom == null && dateTo == null && documentId == null;
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
