package uk.gegc.mcqgen.features.extraction.domain;

import uk.gegc.mcqgen.shared.exception.FailureType;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;

/**
 * Thrown when a document decodes but holds no usable text.
 */
public class EmptyContentException extends McqGenerationException {

    public EmptyContentException(String message) {
        super(message);
    }

    public EmptyContentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType getFailureType() {
        return FailureType.EMPTY_CONTENT;
    }
}
