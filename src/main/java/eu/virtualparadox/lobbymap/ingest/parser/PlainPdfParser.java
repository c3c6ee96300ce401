package eu.virtualparadox.lobbymap.ingest.parser;

import eu.virtualparadox.lobbymap.exception.DocumentParseException;
import eu.virtualparadox.lobbymap.ingest.cleaner.TextCleaner;
import eu.virtualparadox.lobbymap.ingest.model.ParsedDocument;
import eu.virtualparadox.lobbymap.ingest.model.ParserOptions;
import eu.virtualparadox.lobbymap.ingest.model.Segment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Structure-agnostic PDF parser: one segment per page, raw text in content-stream order.
 * <p>Pages that fail to extract are skipped and reported; the parse only fails if no page could be read.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class PlainPdfParser implements DocumentParser {

    public static final String NAME = "plain";

    private final TextCleaner textCleaner;

    @Override
    public ParsedDocument parse(final byte[] document, final ParserOptions options) {
        final PDDocument pdf = PdfDocuments.load(document);
        try {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final List<Segment> segments = new ArrayList<>();
            final List<Integer> failedPages = new ArrayList<>();

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                try {
                    final String pageText = textCleaner.cleanText(stripper.getText(pdf));
                    if (!pageText.isEmpty()) {
                        segments.add(Segment.ofPage(pageText, page));
                    }
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping unreadable page {} of {}", page, pageCount, e);
                    failedPages.add(page);
                }
            }

            if (pageCount > 0 && failedPages.size() == pageCount) {
                throw new DocumentParseException("No page of the document could be read");
            }
            return new ParsedDocument(segments, pageCount, failedPages, NAME);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to extract text: " + e.getMessage(), e);
        } finally {
            PdfDocuments.closeQuietly(pdf);
        }
    }

    @Override
    public String name() {
        return NAME;
    }
}
