package eu.virtualparadox.lobbymap.ingest.parser;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * PDFBox stripper that records lines with their font size and paragraph breaks instead of
 * writing plain text. Text is sorted by position so multi-column layouts come out in reading order.
 */
final class LayoutTextStripper extends PDFTextStripper {

    private final List<LayoutLine> lines = new ArrayList<>();
    private final StringBuilder currentLine = new StringBuilder();
    private float fontSizeSum;
    private int glyphCount;
    private boolean paragraphPending = true;

    LayoutTextStripper() throws IOException {
        super();
        setSortByPosition(true);
        setShouldSeparateByBeads(true);
    }

    /**
     * Strips the inclusive page range and returns its lines in reading order.
     */
    List<LayoutLine> stripLines(final PDDocument document, final int startPage, final int endPage) throws IOException {
        lines.clear();
        resetLine();
        paragraphPending = true;
        setStartPage(startPage);
        setEndPage(endPage);
        writeText(document, Writer.nullWriter());
        flushLine();
        return new ArrayList<>(lines);
    }

    @Override
    protected void writeString(final String text, final List<TextPosition> textPositions) throws IOException {
        currentLine.append(text);
        for (final TextPosition position : textPositions) {
            fontSizeSum += position.getFontSizeInPt();
            glyphCount++;
        }
    }

    @Override
    protected void writeWordSeparator() throws IOException {
        currentLine.append(' ');
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        flushLine();
    }

    @Override
    protected void writeParagraphStart() throws IOException {
        flushLine();
        paragraphPending = true;
    }

    @Override
    protected void writePageEnd() throws IOException {
        flushLine();
        paragraphPending = true;
    }

    private void flushLine() {
        final String text = currentLine.toString();
        if (!text.isBlank()) {
            final float fontSize = glyphCount == 0 ? 0f : fontSizeSum / glyphCount;
            lines.add(new LayoutLine(getCurrentPageNo(), text, fontSize, paragraphPending));
            paragraphPending = false;
        }
        resetLine();
    }

    private void resetLine() {
        currentLine.setLength(0);
        fontSizeSum = 0f;
        glyphCount = 0;
    }
}
