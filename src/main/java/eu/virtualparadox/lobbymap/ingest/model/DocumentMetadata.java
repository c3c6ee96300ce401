package eu.virtualparadox.lobbymap.ingest.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Caller-supplied attributes of a document. Author is required, region and date are optional.
 */
public record DocumentMetadata(String author, String region, LocalDate date) {

    public DocumentMetadata {
        Objects.requireNonNull(author, "author must not be null");
        if (author.isBlank()) {
            throw new IllegalArgumentException("author must not be blank");
        }
    }
}
