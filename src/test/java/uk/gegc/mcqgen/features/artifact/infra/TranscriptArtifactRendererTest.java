package uk.gegc.mcqgen.features.artifact.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactFormat;
import uk.gegc.mcqgen.features.artifact.domain.RenderedArtifact;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;
import uk.gegc.mcqgen.features.mcq.domain.OptionLabel;
import uk.gegc.mcqgen.features.mcq.infra.parser.LineBasedMcqParser;
import uk.gegc.mcqgen.testsupport.McqFixtures;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptArtifactRendererTest {

    private TranscriptArtifactRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new TranscriptArtifactRenderer();
    }

    private static String text(RenderedArtifact artifact) {
        return new String(artifact.content(), StandardCharsets.UTF_8);
    }

    @Test
    void supportsOnlyTranscript() {
        assertThat(renderer.supports(ArtifactFormat.TRANSCRIPT)).isTrue();
        assertThat(renderer.supports(ArtifactFormat.DOCUMENT)).isFalse();
    }

    @Test
    void emptySet_rendersEmptyTranscript() {
        RenderedArtifact artifact = renderer.render(McqResultSet.empty());

        assertThat(artifact.format()).isEqualTo(ArtifactFormat.TRANSCRIPT);
        assertThat(artifact.size()).isZero();
    }

    @Test
    void records_areSeparatedByOneBlankLine() {
        String transcript = text(renderer.render(McqFixtures.resultSet(2)));

        assertThat(transcript).isEqualTo(
                McqFixtures.record(1).blockText() + "\n\n" + McqFixtures.record(2).blockText());
        assertThat(transcript).doesNotEndWith("\n");
    }

    @Test
    void nonAsciiText_isWrittenAsUtf8() {
        McqResultSet set = new McqResultSet(
                List.of(McqFixtures.record("Qu'est-ce que «café»?", "é", "ü", "ß", "東京", OptionLabel.D)), 0);

        assertThat(text(renderer.render(set))).contains("«café»").contains("東京");
    }

    @Test
    @DisplayName("transcript equals the well-formed delimiter-split blocks, trimmed and rejoined")
    void transcript_roundTripsWellFormedBlocks() {
        String raw = """
                ## MCQ
                Question: One?
                A) 1
                B) 2
                C) 3
                D) 4
                Correct Answer: A

                ## MCQ
                Question: broken
                ## MCQ
                  Question: Two?
                A) 1
                B) 2
                C) 3
                D) 4
                Correct Answer: (B)
                """;
        McqResultSet set = new LineBasedMcqParser().parse(raw);

        String expected = Arrays.stream(raw.split("## MCQ"))
                .map(String::strip)
                .filter(block -> block.startsWith("Question: One?") || block.startsWith("Question: Two?"))
                .collect(Collectors.joining("\n\n"));

        assertThat(text(renderer.render(set))).isEqualTo(expected);
    }
}
