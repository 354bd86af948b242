package uk.gegc.mcqgen.features.generation.domain;

import uk.gegc.mcqgen.shared.exception.FailureType;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;

/**
 * Thrown when the generation service answers but neither reply shape holds any text.
 */
public class EmptyResponseException extends McqGenerationException {

    public EmptyResponseException(String message) {
        super(message);
    }

    @Override
    public FailureType getFailureType() {
        return FailureType.EMPTY_RESPONSE;
    }
}
