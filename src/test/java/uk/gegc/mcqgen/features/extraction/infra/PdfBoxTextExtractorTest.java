package uk.gegc.mcqgen.features.extraction.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mcqgen.features.extraction.domain.DecodeException;
import uk.gegc.mcqgen.features.extraction.domain.EmptyContentException;
import uk.gegc.mcqgen.features.extraction.domain.ExtractedText;
import uk.gegc.mcqgen.testsupport.DocumentFixtures;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfBoxTextExtractorTest {

    private PdfBoxTextExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PdfBoxTextExtractor();
    }

    @Test
    @DisplayName("extract: every page's text is joined in page order")
    void extract_multiPagePdf_joinsPagesInOrder() {
        byte[] pdf = DocumentFixtures.pdf("Mitochondria produce ATP.", "Ribosomes build proteins.");

        ExtractedText text = extractor.extract(pdf);

        assertThat(text.value()).isEqualTo("Mitochondria produce ATP.\nRibosomes build proteins.");
    }

    @Test
    @DisplayName("extract: pages without text are skipped")
    void extract_blankPageInBetween_isSkipped() {
        byte[] pdf = DocumentFixtures.pdf("First page", "", "Third page");

        assertThat(extractor.extract(pdf).value()).isEqualTo("First page\nThird page");
    }

    @Test
    void extract_noPageHasText_throwsEmptyContentException() {
        byte[] pdf = DocumentFixtures.pdf("", "");

        assertThatThrownBy(() -> extractor.extract(pdf))
                .isInstanceOf(EmptyContentException.class)
                .hasMessageContaining("2 PDF pages");
    }

    @Test
    void extract_corruptBytes_throwsDecodeException() {
        byte[] corrupt = "This is not a PDF".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extract(corrupt))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("Failed to read PDF document");
    }

    @Test
    void extract_encryptedPdf_throwsDecodeException() {
        byte[] encrypted = DocumentFixtures.encryptedPdf("Secret notes");

        assertThatThrownBy(() -> extractor.extract(encrypted))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("encrypted");
    }

    @Test
    void extract_emptyBytes_throwsDecodeException() {
        assertThatThrownBy(() -> extractor.extract(new byte[0]))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void extract_nullBytes_throwsDecodeException() {
        assertThatThrownBy(() -> extractor.extract(null))
                .isInstanceOf(DecodeException.class);
    }
}
