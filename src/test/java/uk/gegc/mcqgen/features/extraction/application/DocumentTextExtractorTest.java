package uk.gegc.mcqgen.features.extraction.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.mcqgen.features.extraction.domain.DecodeException;
import uk.gegc.mcqgen.features.extraction.domain.EmptyContentException;
import uk.gegc.mcqgen.features.extraction.domain.SourceFormat;
import uk.gegc.mcqgen.features.extraction.domain.UnsupportedFormatException;
import uk.gegc.mcqgen.features.extraction.infra.DocxTextExtractor;
import uk.gegc.mcqgen.features.extraction.infra.PdfBoxTextExtractor;
import uk.gegc.mcqgen.features.extraction.infra.PlainTextExtractor;
import uk.gegc.mcqgen.testsupport.DocumentFixtures;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DocumentTextExtractor")
class DocumentTextExtractorTest {

    @TempDir
    Path tempDir;

    private DocumentTextExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new DocumentTextExtractor(
                List.of(new PlainTextExtractor(), new PdfBoxTextExtractor(), new DocxTextExtractor()),
                new ContentSignatureDetector());
    }

    private Path write(String name, byte[] bytes) throws IOException {
        return Files.write(tempDir.resolve(name), bytes);
    }

    @Nested
    @DisplayName("Dispatch by declared format")
    class Dispatch {

        @Test
        void text_isExtracted() throws IOException {
            Path file = write("notes.txt", "Plate tectonics explains earthquakes.".getBytes(StandardCharsets.UTF_8));

            assertThat(extractor.extract(file, SourceFormat.TEXT).value())
                    .isEqualTo("Plate tectonics explains earthquakes.");
        }

        @Test
        void pdf_isExtracted() throws IOException {
            Path file = write("notes.pdf", DocumentFixtures.pdf("Volcanoes form at plate boundaries."));

            assertThat(extractor.extract(file, SourceFormat.PDF).value())
                    .isEqualTo("Volcanoes form at plate boundaries.");
        }

        @Test
        void docx_isExtracted() throws IOException {
            Path file = write("notes.docx", DocumentFixtures.docx("Magma cools into igneous rock."));

            assertThat(extractor.extract(file, SourceFormat.DOCX).value())
                    .isEqualTo("Magma cools into igneous rock.");
        }

        @Test
        void emptyDocx_failsWithEmptyContent() throws IOException {
            Path file = write("empty.docx", DocumentFixtures.docx());

            assertThatThrownBy(() -> extractor.extract(file, SourceFormat.DOCX))
                    .isInstanceOf(EmptyContentException.class);
        }

        @Test
        void formatDerivedFromExtension() throws IOException {
            Path file = write("chapter.TXT", "Erosion shapes valleys.".getBytes(StandardCharsets.UTF_8));

            assertThat(extractor.extract(file).value()).isEqualTo("Erosion shapes valleys.");
        }
    }

    @Nested
    @DisplayName("Unsupported formats")
    class Unsupported {

        @Test
        void unknownExtension_isUnsupported() throws IOException {
            Path file = write("table.csv", "a,b,c".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> extractor.extract(file))
                    .isInstanceOf(UnsupportedFormatException.class);
        }

        @Test
        void nullFormat_isUnsupported() throws IOException {
            Path file = write("notes.txt", "text".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> extractor.extract(file, null))
                    .isInstanceOf(UnsupportedFormatException.class);
        }

        @Test
        @DisplayName("a text file declared as PDF is rejected by its signature")
        void declaredPdfButTextContent_isUnsupported() throws IOException {
            Path file = write("fake.pdf", "I am not a PDF".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> extractor.extract(file, SourceFormat.PDF))
                    .isInstanceOf(UnsupportedFormatException.class)
                    .hasMessageContaining("does not match declared format PDF");
        }

        @Test
        void declaredDocxButPdfContent_isUnsupported() throws IOException {
            Path file = write("fake.docx", DocumentFixtures.pdf("Hello"));

            assertThatThrownBy(() -> extractor.extract(file, SourceFormat.DOCX))
                    .isInstanceOf(UnsupportedFormatException.class);
        }

        @Test
        void missingExtractor_isUnsupported() throws IOException {
            DocumentTextExtractor textOnly = new DocumentTextExtractor(
                    List.of(new PlainTextExtractor()), new ContentSignatureDetector());
            Path file = write("notes.pdf", DocumentFixtures.pdf("Hello"));

            assertThatThrownBy(() -> textOnly.extract(file, SourceFormat.PDF))
                    .isInstanceOf(UnsupportedFormatException.class)
                    .hasMessageContaining("No extractor available");
        }
    }

    @Test
    void missingFile_isDecodeError() {
        Path missing = tempDir.resolve("gone.txt");

        assertThatThrownBy(() -> extractor.extract(missing, SourceFormat.TEXT))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("Document not found");
    }
}
