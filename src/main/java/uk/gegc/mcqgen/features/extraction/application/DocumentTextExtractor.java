package uk.gegc.mcqgen.features.extraction.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.extraction.domain.DecodeException;
import uk.gegc.mcqgen.features.extraction.domain.ExtractedText;
import uk.gegc.mcqgen.features.extraction.domain.SourceFormat;
import uk.gegc.mcqgen.features.extraction.domain.TextExtractor;
import uk.gegc.mcqgen.features.extraction.domain.UnsupportedFormatException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a document from disk and delegates to the extractor for its format.
 */
@Service
@Slf4j
public class DocumentTextExtractor {

    private final Map<SourceFormat, TextExtractor> extractors = new EnumMap<>(SourceFormat.class);
    private final ContentSignatureDetector signatureDetector;

    public DocumentTextExtractor(List<TextExtractor> extractors, ContentSignatureDetector signatureDetector) {
        for (TextExtractor extractor : extractors) {
            this.extractors.put(extractor.format(), extractor);
        }
        this.signatureDetector = signatureDetector;
    }

    /**
     * Extracts text from the document at {@code path}, read as {@code declaredFormat}.
     *
     * @throws UnsupportedFormatException if the format is missing, unhandled, or contradicted by the content
     * @throws DecodeException            if the file cannot be read or decoded
     * @throws uk.gegc.mcqgen.features.extraction.domain.EmptyContentException if no text is found
     */
    public ExtractedText extract(Path path, SourceFormat declaredFormat) {
        if (declaredFormat == null) {
            throw new UnsupportedFormatException("No document format declared for: " + path.getFileName());
        }
        TextExtractor extractor = extractors.get(declaredFormat);
        if (extractor == null) {
            throw new UnsupportedFormatException("No extractor available for format: " + declaredFormat);
        }

        byte[] bytes = readDocument(path);
        signatureDetector.verify(declaredFormat, bytes);

        ExtractedText text = extractor.extract(bytes);
        log.info("Extracted {} characters from {} ({}, {} bytes)",
                text.length(), path.getFileName(), declaredFormat, bytes.length);
        return text;
    }

    /**
     * Extracts text using the format implied by the file extension.
     */
    public ExtractedText extract(Path path) {
        SourceFormat format = SourceFormat.fromFilename(path.getFileName().toString())
                .orElseThrow(() -> new UnsupportedFormatException("Unsupported file type: " + path.getFileName()));
        return extract(path, format);
    }

    private byte[] readDocument(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return in.readAllBytes();
        } catch (NoSuchFileException e) {
            throw new DecodeException("Document not found: " + path.getFileName(), e);
        } catch (IOException e) {
            throw new DecodeException("Failed to read document " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
