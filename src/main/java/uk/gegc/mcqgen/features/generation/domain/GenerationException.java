package uk.gegc.mcqgen.features.generation.domain;

import uk.gegc.mcqgen.shared.exception.FailureType;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;

/**
 * Thrown when the generation service cannot be reached, rejects the call, or times out.
 * Carries the upstream detail in its message and cause.
 */
public class GenerationException extends McqGenerationException {

    private final boolean timeout;
    private final boolean transientFailure;

    public GenerationException(String message, Throwable cause, boolean timeout, boolean transientFailure) {
        super(message, cause);
        this.timeout = timeout;
        this.transientFailure = transientFailure;
    }

    public GenerationException(String message, Throwable cause) {
        this(message, cause, false, false);
    }

    public GenerationException(String message) {
        this(message, null, false, false);
    }

    public static GenerationException timedOut(String message, Throwable cause) {
        return new GenerationException(message, cause, true, true);
    }

    public static GenerationException transientFailure(String message, Throwable cause) {
        return new GenerationException(message, cause, false, true);
    }

    public boolean isTimeout() {
        return timeout;
    }

    /**
     * @return true for rate limiting, temporary unavailability and timeouts
     */
    public boolean isTransient() {
        return transientFailure;
    }

    @Override
    public FailureType getFailureType() {
        return FailureType.GENERATION_FAILURE;
    }
}
