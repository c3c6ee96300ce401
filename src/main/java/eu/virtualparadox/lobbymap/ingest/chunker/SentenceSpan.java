package eu.virtualparadox.lobbymap.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into the source text.
 */
final class SentenceSpan {
    final int start;
    final int end;

    SentenceSpan(final int start, final int end) {
        this.start = start;
        this.end = end;
    }

    String of(final String text) {
        return text.substring(start, end);
    }
}
