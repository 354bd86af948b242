package uk.gegc.mcqgen.features.artifact.infra;

import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.artifact.application.ArtifactRenderer;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactFormat;
import uk.gegc.mcqgen.features.artifact.domain.RenderedArtifact;
import uk.gegc.mcqgen.features.mcq.domain.McqRecord;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;

import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * Plain-text transcript: the source block of every record, separated by one blank line.
 */
@Component
public class TranscriptArtifactRenderer implements ArtifactRenderer {

    static final String RECORD_SEPARATOR = "\n\n";

    @Override
    public boolean supports(ArtifactFormat format) {
        return format == ArtifactFormat.TRANSCRIPT;
    }

    @Override
    public RenderedArtifact render(McqResultSet resultSet) {
        String transcript = resultSet.records().stream()
                .map(McqRecord::blockText)
                .map(String::strip)
                .collect(Collectors.joining(RECORD_SEPARATOR));
        return new RenderedArtifact(ArtifactFormat.TRANSCRIPT, transcript.getBytes(StandardCharsets.UTF_8));
    }
}
