package uk.gegc.mcqgen.features.extraction.domain;

import uk.gegc.mcqgen.shared.exception.FailureType;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;

/**
 * Thrown when a document format is not accepted or does not match its content.
 */
public class UnsupportedFormatException extends McqGenerationException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureType getFailureType() {
        return FailureType.UNSUPPORTED_FORMAT;
    }
}
