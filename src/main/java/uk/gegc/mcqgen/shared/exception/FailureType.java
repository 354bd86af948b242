package uk.gegc.mcqgen.shared.exception;

/**
 * Classification of every terminal failure a generation run can end with.
 */
public enum FailureType {
    UNSUPPORTED_FORMAT,
    DECODE_ERROR,
    EMPTY_CONTENT,
    GENERATION_FAILURE,
    EMPTY_RESPONSE,
    NO_VALID_RECORDS,
    ARTIFACT_WRITE
}
