package uk.gegc.mcqgen.features.artifact.application;

import org.junit.jupiter.api.Test;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactFormat;
import uk.gegc.mcqgen.features.artifact.domain.OutputArtifacts;
import uk.gegc.mcqgen.features.artifact.infra.PdfArtifactRenderer;
import uk.gegc.mcqgen.features.artifact.infra.TranscriptArtifactRenderer;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;
import uk.gegc.mcqgen.testsupport.McqFixtures;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactRenderingServiceTest {

    private final ArtifactRenderingService service = new ArtifactRenderingService(
            List.of(new PdfArtifactRenderer(), new TranscriptArtifactRenderer()));

    @Test
    void render_producesTranscriptAndDocument() {
        OutputArtifacts artifacts = service.render(McqFixtures.resultSet(2));

        assertThat(artifacts.transcript().format()).isEqualTo(ArtifactFormat.TRANSCRIPT);
        assertThat(artifacts.document().format()).isEqualTo(ArtifactFormat.DOCUMENT);
        assertThat(artifacts.transcriptText())
                .startsWith("Question: Question 1?")
                .contains("\n\nQuestion: Question 2?");
        assertThat(new String(artifacts.document().content(), 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
    }

    @Test
    void render_emptySet_yieldsEmptyTranscriptAndValidDocument() {
        OutputArtifacts artifacts = service.render(McqResultSet.empty());

        assertThat(artifacts.transcriptText()).isEmpty();
        assertThat(artifacts.document().size()).isPositive();
    }

    @Test
    void render_withoutDocumentRenderer_fails() {
        ArtifactRenderingService transcriptOnly = new ArtifactRenderingService(List.of(new TranscriptArtifactRenderer()));

        assertThatThrownBy(() -> transcriptOnly.render(McqFixtures.resultSet(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DOCUMENT");
    }
}
