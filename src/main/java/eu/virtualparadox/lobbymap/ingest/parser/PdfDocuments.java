package eu.virtualparadox.lobbymap.ingest.parser;

import eu.virtualparadox.lobbymap.exception.DocumentParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads PDF bytes with PDFBox and translates load failures into {@link DocumentParseException}.
 */
@Slf4j
final class PdfDocuments {

    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    /** PDF readers tolerate leading garbage before the header; so do we, within this window. */
    private static final int HEADER_SEARCH_WINDOW = 1024;

    private PdfDocuments() {
        // prevent instantiation
    }

    static PDDocument load(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DocumentParseException("Document is empty");
        }
        if (!hasPdfHeader(bytes)) {
            throw new DocumentParseException("Unsupported format: missing %PDF- header");
        }

        final PDDocument document;
        try {
            document = PDDocument.load(bytes);
        } catch (InvalidPasswordException e) {
            throw new DocumentParseException("Document is encrypted", e);
        } catch (IOException e) {
            throw new DocumentParseException("Document is corrupt: " + e.getMessage(), e);
        }

        if (!document.getCurrentAccessPermission().canExtractContent()) {
            closeQuietly(document);
            throw new DocumentParseException("Document is encrypted: text extraction not permitted");
        }
        return document;
    }

    static void closeQuietly(final PDDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            log.debug("Unable to close PDF document", e);
        }
    }

    private static boolean hasPdfHeader(final byte[] bytes) {
        final int limit = Math.min(bytes.length, HEADER_SEARCH_WINDOW) - PDF_MAGIC.length;
        for (int i = 0; i <= limit; i++) {
            boolean match = true;
            for (int j = 0; j < PDF_MAGIC.length; j++) {
                if (bytes[i + j] != PDF_MAGIC[j]) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return true;
            }
        }
        return false;
    }
}
