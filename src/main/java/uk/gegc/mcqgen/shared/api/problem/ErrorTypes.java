package uk.gegc.mcqgen.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs returned by the API.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://mcq-generator.gegc.uk/docs/errors";

    // ==================== Request Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI PAYLOAD_TOO_LARGE = URI.create(BASE_URL + "/payload-too-large");
    public static final URI ARTIFACT_NOT_FOUND = URI.create(BASE_URL + "/artifact-not-found");

    // ==================== Pipeline Errors ====================
    public static final URI UNSUPPORTED_FORMAT = URI.create(BASE_URL + "/unsupported-format");
    public static final URI DECODE_FAILED = URI.create(BASE_URL + "/decode-failed");
    public static final URI EMPTY_CONTENT = URI.create(BASE_URL + "/empty-content");
    public static final URI GENERATION_FAILED = URI.create(BASE_URL + "/generation-failed");
    public static final URI GENERATION_TIMEOUT = URI.create(BASE_URL + "/generation-timeout");
    public static final URI EMPTY_RESPONSE = URI.create(BASE_URL + "/empty-response");
    public static final URI NO_VALID_RECORDS = URI.create(BASE_URL + "/no-valid-records");
    public static final URI ARTIFACT_WRITE_FAILED = URI.create(BASE_URL + "/artifact-write-failed");
    public static final URI UPLOAD_STORAGE_FAILED = URI.create(BASE_URL + "/upload-storage-failed");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
