package eu.virtualparadox.lobbymap.testutil;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Generates small PDF fixtures with PDFBox.
 */
public final class TestPdfFactory {

    private TestPdfFactory() {
    }

    /**
     * A line of text with its font size.
     */
    public record Line(String text, float fontSize) {
    }

    /**
     * One page per entry, each page holding a single Helvetica line.
     */
    public static byte[] pages(final String... pageTexts) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (final String text : pageTexts) {
                final PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA, 12);
                    content.newLineAtOffset(50, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            return save(document);
        }
    }

    /**
     * A single page with the given lines written top to bottom, bold for lines of 16pt and above.
     */
    public static byte[] layout(final List<Line> lines) throws IOException {
        try (PDDocument document = new PDDocument()) {
            final PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                float y = 720;
                for (final Line line : lines) {
                    final PDFont font = line.fontSize() >= 16 ? PDType1Font.HELVETICA_BOLD : PDType1Font.HELVETICA;
                    content.beginText();
                    content.setFont(font, line.fontSize());
                    content.newLineAtOffset(50, y);
                    content.showText(line.text());
                    content.endText();
                    y -= line.fontSize() * 1.6f;
                }
            }
            return save(document);
        }
    }

    /**
     * A single-page document protected with a user password.
     */
    public static byte[] encrypted(final String text) throws IOException {
        try (PDDocument document = new PDDocument()) {
            final PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(PDType1Font.HELVETICA, 12);
                content.newLineAtOffset(50, 700);
                content.showText(text);
                content.endText();
            }
            final StandardProtectionPolicy policy = new StandardProtectionPolicy("owner-secret", "user-secret", new AccessPermission());
            policy.setEncryptionKeyLength(128);
            document.protect(policy);
            return save(document);
        }
    }

    private static byte[] save(final PDDocument document) throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        return out.toByteArray();
    }
}
