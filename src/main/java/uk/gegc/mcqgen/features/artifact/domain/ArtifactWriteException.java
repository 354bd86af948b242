package uk.gegc.mcqgen.features.artifact.domain;

import uk.gegc.mcqgen.shared.exception.FailureType;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;

/**
 * Thrown when an artifact cannot be rendered or persisted.
 */
public class ArtifactWriteException extends McqGenerationException {

    public ArtifactWriteException(String message) {
        super(message);
    }

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType getFailureType() {
        return FailureType.ARTIFACT_WRITE;
    }
}
