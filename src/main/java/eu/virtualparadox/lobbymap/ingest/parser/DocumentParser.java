package eu.virtualparadox.lobbymap.ingest.parser;

import eu.virtualparadox.lobbymap.exception.DocumentParseException;
import eu.virtualparadox.lobbymap.ingest.model.ParsedDocument;
import eu.virtualparadox.lobbymap.ingest.model.ParserOptions;

/**
 * Converts raw document bytes into ordered text segments.
 * <p>Implementations must be deterministic for a given document so that re-ingestion is idempotent.</p>
 */
public interface DocumentParser {

    /**
     * @param document raw document bytes
     * @param options  backend options
     * @return parsed segments in reading order, possibly empty
     * @throws DocumentParseException if the document is corrupt, encrypted or of an unsupported format,
     *                                or if no page at all could be read
     */
    ParsedDocument parse(byte[] document, ParserOptions options);

    /**
     * @return the strategy name used in configuration
     */
    String name();
}
