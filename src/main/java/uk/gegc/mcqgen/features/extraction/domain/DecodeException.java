package uk.gegc.mcqgen.features.extraction.domain;

import uk.gegc.mcqgen.shared.exception.FailureType;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;

/**
 * Thrown when document bytes cannot be decoded in the declared format.
 */
public class DecodeException extends McqGenerationException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType getFailureType() {
        return FailureType.DECODE_ERROR;
    }
}
