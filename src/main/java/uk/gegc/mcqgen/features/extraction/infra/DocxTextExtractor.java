package uk.gegc.mcqgen.features.extraction.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.extraction.domain.DecodeException;
import uk.gegc.mcqgen.features.extraction.domain.EmptyContentException;
import uk.gegc.mcqgen.features.extraction.domain.ExtractedText;
import uk.gegc.mcqgen.features.extraction.domain.SourceFormat;
import uk.gegc.mcqgen.features.extraction.domain.TextExtractor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;

/**
 * DOCX extractor using Apache POI. Reads body paragraphs in document order.
 */
@Component
@Slf4j
public class DocxTextExtractor implements TextExtractor {

    @Override
    public SourceFormat format() {
        return SourceFormat.DOCX;
    }

    @Override
    public ExtractedText extract(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("No DOCX content supplied");
        }

        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(bytes))) {
            List<String> paragraphs = document.getParagraphs().stream()
                    .map(XWPFParagraph::getText)
                    .map(text -> text == null ? "" : text)
                    .toList();

            if (paragraphs.stream().allMatch(String::isBlank)) {
                throw new EmptyContentException("DOCX document has no paragraph text (" + paragraphs.size() + " paragraphs)");
            }

            log.debug("Extracted {} DOCX paragraphs", paragraphs.size());
            return new ExtractedText(String.join("\n", paragraphs));
        } catch (IOException | POIXMLException | IllegalArgumentException e) {
            throw new DecodeException("Failed to read DOCX document: " + e.getMessage(), e);
        }
    }
}
