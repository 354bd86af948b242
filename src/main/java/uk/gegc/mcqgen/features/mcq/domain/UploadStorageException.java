package uk.gegc.mcqgen.features.mcq.domain;

public class UploadStorageException extends RuntimeException {
    public UploadStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
