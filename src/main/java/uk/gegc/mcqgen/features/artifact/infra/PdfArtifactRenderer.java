package uk.gegc.mcqgen.features.artifact.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.artifact.application.ArtifactRenderer;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactFormat;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactWriteException;
import uk.gegc.mcqgen.features.artifact.domain.RenderedArtifact;
import uk.gegc.mcqgen.features.mcq.domain.McqRecord;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;

/**
 * Paginated PDF rendering of a result set.
 * <p>
 * Letter pages with 50pt margins, Helvetica 12pt at 1.2 leading. Each record's
 * block text is word-wrapped to the text width and followed by a fixed gap;
 * pages break automatically.
 */
@Slf4j
@Component
public class PdfArtifactRenderer implements ArtifactRenderer {

    static final String DOCUMENT_TITLE = "Generated MCQs";
    static final String DOCUMENT_CREATOR = "mcq-generator";

    private static final PDFont FONT = PDType1Font.HELVETICA;
    private static final float FONT_SIZE = 12f;
    private static final float MARGIN = 50f;
    private static final float PAGE_WIDTH = PDRectangle.LETTER.getWidth();
    private static final float MAX_TEXT_WIDTH = PAGE_WIDTH - (2 * MARGIN);
    private static final float LINE_SPACING = 1.2f;
    private static final float RECORD_SPACING = 15f;
    private static final char REPLACEMENT = '?';

    @Override
    public boolean supports(ArtifactFormat format) {
        return format == ArtifactFormat.DOCUMENT;
    }

    @Override
    public RenderedArtifact render(McqResultSet resultSet) {
        try (PDDocument document = new PDDocument()) {
            describe(document);

            if (resultSet.isEmpty()) {
                document.addPage(new PDPage(PDRectangle.LETTER));
            } else {
                PDPageContext context = new PDPageContext(document);
                for (McqRecord record : resultSet.records()) {
                    renderRecord(context, record);
                }
                context.close();
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            byte[] bytes = out.toByteArray();
            log.debug("Rendered {} records into a {}-page PDF ({} bytes)",
                    resultSet.size(), document.getNumberOfPages(), bytes.length);
            return new RenderedArtifact(ArtifactFormat.DOCUMENT, bytes);
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to render MCQ document", e);
        }
    }

    private void describe(PDDocument document) {
        PDDocumentInformation info = document.getDocumentInformation();
        info.setTitle(DOCUMENT_TITLE);
        info.setCreator(DOCUMENT_CREATOR);
        info.setCreationDate(Calendar.getInstance());
    }

    private void renderRecord(PDPageContext context, McqRecord record) throws IOException {
        for (String line : record.blockText().split("\\R")) {
            String text = sanitize(line);
            if (text.isBlank()) {
                context.skipLine();
            } else {
                context.writeWrappedText(text);
            }
        }
        context.y -= RECORD_SPACING;
    }

    /**
     * Replace characters Helvetica cannot encode with {@code '?'}; control and
     * whitespace characters become plain spaces.
     */
    static String sanitize(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            if (Character.isWhitespace(codePoint) || Character.isISOControl(codePoint)) {
                sb.append(' ');
            } else if (canEncode(codePoint)) {
                sb.appendCodePoint(codePoint);
            } else {
                sb.append(REPLACEMENT);
            }
        });
        return sb.toString();
    }

    private static boolean canEncode(int codePoint) {
        try {
            FONT.encode(new String(Character.toChars(codePoint)));
            return true;
        } catch (IOException | IllegalArgumentException e) {
            return false;
        }
    }

    private static class PDPageContext {
        private final PDDocument document;
        private PDPage currentPage;
        private PDPageContentStream contentStream;
        private float y;
        private final float pageHeight = PDRectangle.LETTER.getHeight();

        PDPageContext(PDDocument document) {
            this.document = document;
        }

        void startNewPage() throws IOException {
            if (contentStream != null) {
                contentStream.close();
            }
            currentPage = new PDPage(PDRectangle.LETTER);
            document.addPage(currentPage);
            contentStream = new PDPageContentStream(document, currentPage);
            y = pageHeight - MARGIN;
        }

        void ensureSpace(float requiredSpace) throws IOException {
            if (currentPage == null || y < MARGIN + requiredSpace) {
                startNewPage();
            }
        }

        void skipLine() throws IOException {
            ensureSpace(FONT_SIZE * LINE_SPACING);
            y -= FONT_SIZE * LINE_SPACING;
        }

        /**
         * Write text with word wrapping to fit within page margins
         */
        void writeWrappedText(String text) throws IOException {
            for (String line : wrap(text)) {
                writeSingleLine(line);
            }
        }

        private List<String> wrap(String text) throws IOException {
            List<String> lines = new ArrayList<>();
            StringBuilder line = new StringBuilder();

            for (String word : text.strip().split("\\s+")) {
                String candidate = line.length() == 0 ? word : line + " " + word;
                if (width(candidate) <= MAX_TEXT_WIDTH) {
                    line = new StringBuilder(candidate);
                    continue;
                }
                if (line.length() > 0) {
                    lines.add(line.toString());
                }
                line = new StringBuilder(word);
                // Hard-break words wider than the text area
                while (width(line.toString()) > MAX_TEXT_WIDTH && line.length() > 1) {
                    int cut = fittingPrefixLength(line.toString());
                    lines.add(line.substring(0, cut));
                    line = new StringBuilder(line.substring(cut));
                }
            }

            if (line.length() > 0) {
                lines.add(line.toString());
            }
            return lines;
        }

        private int fittingPrefixLength(String word) throws IOException {
            int end = 1;
            while (end < word.length() && width(word.substring(0, end + 1)) <= MAX_TEXT_WIDTH) {
                end++;
            }
            if (Character.isHighSurrogate(word.charAt(end - 1)) && end < word.length()) {
                end++;
            }
            return end;
        }

        private float width(String text) throws IOException {
            return FONT.getStringWidth(text) / 1000 * FONT_SIZE;
        }

        private void writeSingleLine(String text) throws IOException {
            ensureSpace(FONT_SIZE * LINE_SPACING);
            contentStream.beginText();
            contentStream.setFont(FONT, FONT_SIZE);
            contentStream.newLineAtOffset(MARGIN, y);
            contentStream.showText(text);
            contentStream.endText();
            y -= FONT_SIZE * LINE_SPACING;
        }

        void close() throws IOException {
            if (contentStream != null) {
                contentStream.close();
            }
        }
    }
}
