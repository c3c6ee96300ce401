package eu.virtualparadox.lobbymap.ingest.parser;

import eu.virtualparadox.lobbymap.exception.DocumentParseException;
import eu.virtualparadox.lobbymap.ingest.cleaner.TextCleaner;
import eu.virtualparadox.lobbymap.ingest.model.ParsedDocument;
import eu.virtualparadox.lobbymap.ingest.model.ParserOptions;
import eu.virtualparadox.lobbymap.ingest.model.Segment;
import eu.virtualparadox.lobbymap.ingest.model.SegmentRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

/**
 * Layout-aware PDF parser built on PDFBox position sorting.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Reading order:</strong> glyphs are sorted by position and article beads are honoured,
 *       so columns are read top to bottom instead of in content-stream order.</li>
 *   <li><strong>Roles:</strong> a line whose font is clearly larger than the page's dominant body size
 *       is a heading; bullet or numbered lines are list items; everything else is body text.</li>
 *   <li><strong>Segments:</strong> consecutive lines of the same role form one segment until PDFBox reports
 *       a paragraph break. Each list item is its own segment.</li>
 *   <li><strong>Threads:</strong> page ranges are stripped in parallel, each worker holding its own
 *       {@link PDDocument} because PDFBox documents are not thread-safe.</li>
 *   <li><strong>Fallback:</strong> if layout analysis fails internally, the document is re-parsed with
 *       {@link PlainPdfParser}. Load failures (corrupt, encrypted, unsupported) are not retried.</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class LayoutAwarePdfParser implements DocumentParser {

    public static final String NAME = "layout-aware";

    private static final float HEADING_SIZE_RATIO = 1.15f;
    private static final int MAX_HEADING_LENGTH = 200;
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:[\u2022\u25E6\u25AA\u2023\\-*]|\\(?\\d{1,3}[.)]|\\(?[a-z][.)])\\s+.*");

    private final TextCleaner textCleaner;
    private final PlainPdfParser fallback;

    @Override
    public ParsedDocument parse(final byte[] document, final ParserOptions options) {
        if ("gpu".equalsIgnoreCase(options.device())) {
            log.info("Device 'gpu' requested but the PDFBox layout backend runs on cpu only");
        }

        final int pageCount = countPages(document);
        try {
            return parseLayout(document, pageCount, options.threadCount());
        } catch (DocumentParseException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Layout analysis failed, falling back to plain extraction", e);
            return fallback.parse(document, options);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    private int countPages(final byte[] document) {
        final PDDocument pdf = PdfDocuments.load(document);
        try {
            return pdf.getNumberOfPages();
        } finally {
            PdfDocuments.closeQuietly(pdf);
        }
    }

    private ParsedDocument parseLayout(final byte[] document, final int pageCount, final int threadCount) {
        final Map<Integer, List<LayoutLine>> linesByPage = new TreeMap<>();
        final List<Integer> failedPages = new ArrayList<>();

        if (pageCount > 0) {
            final int workers = Math.min(threadCount, pageCount);
            final ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("layout-parse-"));
            try {
                final List<Future<RangeResult>> futures = new ArrayList<>();
                for (final int[] range : partition(pageCount, workers)) {
                    futures.add(pool.submit(stripRange(document, range[0], range[1])));
                }
                for (final Future<RangeResult> future : futures) {
                    final RangeResult result = future.get();
                    linesByPage.putAll(result.linesByPage());
                    failedPages.addAll(result.failedPages());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Layout parsing interrupted");
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Layout worker failed", e.getCause());
            } finally {
                pool.shutdownNow();
            }
        }

        if (pageCount > 0 && failedPages.size() == pageCount) {
            throw new DocumentParseException("No page of the document could be read");
        }
        failedPages.sort(Integer::compareTo);

        final List<Segment> segments = new ArrayList<>();
        for (final Map.Entry<Integer, List<LayoutLine>> entry : linesByPage.entrySet()) {
            segments.addAll(toSegments(entry.getKey(), entry.getValue()));
        }
        return new ParsedDocument(segments, pageCount, failedPages, NAME);
    }

    private Callable<RangeResult> stripRange(final byte[] document, final int startPage, final int endPage) {
        return () -> {
            final PDDocument pdf = PdfDocuments.load(document);
            try {
                final LayoutTextStripper stripper = new LayoutTextStripper();
                final Map<Integer, List<LayoutLine>> linesByPage = new HashMap<>();
                final List<Integer> failed = new ArrayList<>();
                // strip page by page so one broken page only loses itself
                for (int page = startPage; page <= endPage; page++) {
                    try {
                        linesByPage.put(page, stripper.stripLines(pdf, page, page));
                    } catch (IOException e) {
                        log.warn("Skipping unreadable page {}", page, e);
                        failed.add(page);
                    }
                }
                return new RangeResult(linesByPage, failed);
            } finally {
                PdfDocuments.closeQuietly(pdf);
            }
        };
    }

    private List<Segment> toSegments(final int page, final List<LayoutLine> lines) {
        final List<Segment> segments = new ArrayList<>();
        if (lines.isEmpty()) {
            return segments;
        }

        final float bodySize = dominantFontSize(lines);
        final StringBuilder block = new StringBuilder();
        SegmentRole blockRole = null;
        int offset = 0;

        for (final LayoutLine line : lines) {
            final SegmentRole role = classify(line, bodySize);
            final boolean boundary = blockRole != null
                    && (role != blockRole || role == SegmentRole.LIST_ITEM || (line.startsParagraph() && role != SegmentRole.HEADING));
            if (boundary) {
                offset = emit(segments, block, blockRole, page, offset);
            }
            if (!block.isEmpty()) {
                block.append('\n');
            }
            block.append(line.text());
            blockRole = role;
        }
        emit(segments, block, blockRole, page, offset);
        return segments;
    }

    private int emit(final List<Segment> segments,
                     final StringBuilder block,
                     final SegmentRole role,
                     final int page,
                     final int offset) {
        final String text = textCleaner.cleanText(block.toString());
        block.setLength(0);
        if (text.isEmpty()) {
            return offset;
        }
        final int end = offset + text.length();
        segments.add(new Segment(text, page, offset, end, role));
        // account for the separator between segments of the page
        return end + 1;
    }

    private SegmentRole classify(final LayoutLine line, final float bodySize) {
        final String text = line.text().trim();
        if (bodySize > 0f
                && line.fontSize() >= bodySize * HEADING_SIZE_RATIO
                && text.length() <= MAX_HEADING_LENGTH) {
            return SegmentRole.HEADING;
        }
        if (LIST_ITEM.matcher(text).matches()) {
            return SegmentRole.LIST_ITEM;
        }
        return SegmentRole.BODY;
    }

    /**
     * Font size carrying the most characters on the page, rounded to half points.
     */
    private static float dominantFontSize(final List<LayoutLine> lines) {
        final Map<Float, Integer> charsBySize = new TreeMap<>();
        for (final LayoutLine line : lines) {
            final float rounded = Math.round(line.fontSize() * 2f) / 2f;
            charsBySize.merge(rounded, line.text().length(), Integer::sum);
        }
        float best = 0f;
        int bestChars = -1;
        for (final Map.Entry<Float, Integer> entry : charsBySize.entrySet()) {
            if (entry.getValue() > bestChars) {
                best = entry.getKey();
                bestChars = entry.getValue();
            }
        }
        return best;
    }

    private static List<int[]> partition(final int pageCount, final int parts) {
        final List<int[]> ranges = new ArrayList<>(parts);
        final int base = pageCount / parts;
        final int remainder = pageCount % parts;
        int start = 1;
        for (int i = 0; i < parts; i++) {
            final int size = base + (i < remainder ? 1 : 0);
            ranges.add(new int[]{start, start + size - 1});
            start += size;
        }
        return ranges;
    }

    private record RangeResult(Map<Integer, List<LayoutLine>> linesByPage, List<Integer> failedPages) {
    }
}
