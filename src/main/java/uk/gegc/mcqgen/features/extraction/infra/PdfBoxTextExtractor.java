package uk.gegc.mcqgen.features.extraction.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.extraction.domain.DecodeException;
import uk.gegc.mcqgen.features.extraction.domain.EmptyContentException;
import uk.gegc.mcqgen.features.extraction.domain.ExtractedText;
import uk.gegc.mcqgen.features.extraction.domain.SourceFormat;
import uk.gegc.mcqgen.features.extraction.domain.TextExtractor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF text extractor using Apache PDFBox.
 * <p>
 * Pages are stripped one at a time so that a single unreadable page only
 * drops that page. Pages are joined with a newline.
 */
@Component
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

    @Override
    public SourceFormat format() {
        return SourceFormat.PDF;
    }

    @Override
    public ExtractedText extract(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("No PDF content supplied");
        }

        try (PDDocument document = PDDocument.load(bytes)) {
            int pageCount = document.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            List<String> pages = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                String pageText = extractPage(stripper, document, page, pageCount);
                if (pageText != null) {
                    pages.add(pageText);
                }
            }

            if (pages.isEmpty()) {
                throw new EmptyContentException("No text could be extracted from any of the " + pageCount + " PDF pages");
            }

            log.debug("Extracted text from {}/{} PDF pages", pages.size(), pageCount);
            return new ExtractedText(String.join("\n", pages));
        } catch (InvalidPasswordException e) {
            throw new DecodeException("PDF document is encrypted", e);
        } catch (IOException e) {
            throw new DecodeException("Failed to read PDF document: " + e.getMessage(), e);
        }
    }

    private String extractPage(PDFTextStripper stripper, PDDocument document, int page, int pageCount) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        try {
            String text = stripper.getText(document);
            if (text == null || text.isBlank()) {
                log.debug("PDF page {}/{} has no extractable text", page, pageCount);
                return null;
            }
            return text.strip();
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping PDF page {}/{}: {}", page, pageCount, e.getMessage());
            return null;
        }
    }
}
