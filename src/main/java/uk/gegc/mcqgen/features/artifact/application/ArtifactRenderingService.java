package uk.gegc.mcqgen.features.artifact.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactFormat;
import uk.gegc.mcqgen.features.artifact.domain.OutputArtifacts;
import uk.gegc.mcqgen.features.artifact.domain.RenderedArtifact;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;

import java.util.List;

/**
 * Renders a result set into both output artifacts using the registered renderers.
 */
@Service
@Slf4j
public class ArtifactRenderingService {

    private final List<ArtifactRenderer> renderers;

    public ArtifactRenderingService(List<ArtifactRenderer> renderers) {
        this.renderers = List.copyOf(renderers);
    }

    public OutputArtifacts render(McqResultSet resultSet) {
        RenderedArtifact transcript = rendererFor(ArtifactFormat.TRANSCRIPT).render(resultSet);
        RenderedArtifact document = rendererFor(ArtifactFormat.DOCUMENT).render(resultSet);
        log.info("Rendered {} records: transcript {} bytes, document {} bytes",
                resultSet.size(), transcript.size(), document.size());
        return new OutputArtifacts(transcript, document);
    }

    private ArtifactRenderer rendererFor(ArtifactFormat format) {
        return renderers.stream()
                .filter(renderer -> renderer.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No renderer registered for " + format));
    }
}
