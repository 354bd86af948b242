package uk.gegc.mcqgen.features.artifact.application;

import uk.gegc.mcqgen.features.artifact.domain.ArtifactFormat;
import uk.gegc.mcqgen.features.artifact.domain.RenderedArtifact;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;

/**
 * SPI for rendering a result set into one artifact format.
 */
public interface ArtifactRenderer {
    boolean supports(ArtifactFormat format);

    RenderedArtifact render(McqResultSet resultSet);
}
