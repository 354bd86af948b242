package uk.gegc.mcqgen.features.mcq.domain;

/**
 * Thrown when an upload request is rejected before the pipeline runs.
 */
public class InvalidUploadException extends RuntimeException {
    public InvalidUploadException(String message) {
        super(message);
    }

    public InvalidUploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
