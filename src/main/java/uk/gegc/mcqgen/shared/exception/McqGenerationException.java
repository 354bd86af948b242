package uk.gegc.mcqgen.shared.exception;

/**
 * Base type for classified pipeline failures.
 * Each subclass maps to exactly one {@link FailureType}.
 */
public abstract class McqGenerationException extends RuntimeException {

    protected McqGenerationException(String message) {
        super(message);
    }

    protected McqGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureType getFailureType();
}
