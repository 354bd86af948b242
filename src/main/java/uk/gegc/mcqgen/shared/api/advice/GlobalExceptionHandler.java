package uk.gegc.mcqgen.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactNotFoundException;
import uk.gegc.mcqgen.features.generation.domain.GenerationException;
import uk.gegc.mcqgen.features.mcq.domain.InvalidUploadException;
import uk.gegc.mcqgen.features.mcq.domain.UploadStorageException;
import uk.gegc.mcqgen.features.pipeline.domain.McqGenerationFailedException;
import uk.gegc.mcqgen.features.pipeline.domain.PipelineFailure;
import uk.gegc.mcqgen.shared.api.problem.ErrorTypes;
import uk.gegc.mcqgen.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.mcqgen.shared.exception.FailureType;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;

import java.net.URI;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(McqGenerationFailedException.class)
    public ResponseEntity<ProblemDetail> handleGenerationFailed(McqGenerationFailedException ex, HttpServletRequest request) {
        PipelineFailure failure = ex.getFailure();
        return pipelineProblem(failure.type(), failure.timeout(), failure.message(), request);
    }

    @ExceptionHandler(McqGenerationException.class)
    public ResponseEntity<ProblemDetail> handleMcqGeneration(McqGenerationException ex, HttpServletRequest request) {
        boolean timeout = ex instanceof GenerationException generation && generation.isTimeout();
        return pipelineProblem(ex.getFailureType(), timeout, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidUploadException.class)
    public ResponseEntity<ProblemDetail> handleInvalidUpload(InvalidUploadException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleArtifactNotFound(ArtifactNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.ARTIFACT_NOT_FOUND,
                "Artifact Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(UploadStorageException.class)
    public ResponseEntity<ProblemDetail> handleUploadStorage(UploadStorageException ex, HttpServletRequest request) {
        logger.error("Upload storage failed: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.UPLOAD_STORAGE_FAILED,
                "Upload Storage Failed",
                "The uploaded file could not be saved",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_ARGUMENT,
                "Invalid Argument",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String param = ex.getName();
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        String msg = "Invalid value for parameter '" + param + "'. Expected type: " + requiredType + ".";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch",
                msg,
                request
        );
        problem.setProperty("parameter", param);
        problem.setProperty("expectedType", requiredType);
        problem.setProperty("providedValue", ex.getValue());
        return ResponseEntity.badRequest().body(problem);
    }

    @Override
    protected ResponseEntity<Object> handleMissingServletRequestParameter(
            @NonNull MissingServletRequestParameterException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Required parameter '" + ex.getParameterName() + "' is missing",
                request
        );
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMissingServletRequestPart(
            @NonNull MissingServletRequestPartException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Required part '" + ex.getRequestPartName() + "' is missing",
                request
        );
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMaxUploadSizeExceededException(
            @NonNull MaxUploadSizeExceededException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.PAYLOAD_TOO_LARGE,
                ErrorTypes.PAYLOAD_TOO_LARGE,
                "Payload Too Large",
                "Uploaded file exceeds the maximum allowed size",
                request
        );
        return new ResponseEntity<>(problem, headers, HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private ResponseEntity<ProblemDetail> pipelineProblem(FailureType type, boolean timeout, String detail,
                                                          HttpServletRequest request) {
        ProblemMapping mapping = mappingFor(type, timeout);
        ProblemDetail problem = ProblemDetailBuilder.create(
                mapping.status(),
                mapping.type(),
                mapping.title(),
                detail,
                request
        );
        problem.setProperty("failureType", type.name());
        if (timeout) {
            problem.setProperty("timeout", true);
        }
        return ResponseEntity.status(mapping.status()).body(problem);
    }

    private ProblemMapping mappingFor(FailureType type, boolean timeout) {
        return switch (type) {
            case UNSUPPORTED_FORMAT ->
                    new ProblemMapping(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ErrorTypes.UNSUPPORTED_FORMAT, "Unsupported Format");
            case DECODE_ERROR ->
                    new ProblemMapping(HttpStatus.UNPROCESSABLE_ENTITY, ErrorTypes.DECODE_FAILED, "Document Could Not Be Read");
            case EMPTY_CONTENT ->
                    new ProblemMapping(HttpStatus.UNPROCESSABLE_ENTITY, ErrorTypes.EMPTY_CONTENT, "Document Has No Text");
            case GENERATION_FAILURE -> timeout
                    ? new ProblemMapping(HttpStatus.GATEWAY_TIMEOUT, ErrorTypes.GENERATION_TIMEOUT, "Generation Timed Out")
                    : new ProblemMapping(HttpStatus.BAD_GATEWAY, ErrorTypes.GENERATION_FAILED, "Generation Failed");
            case EMPTY_RESPONSE ->
                    new ProblemMapping(HttpStatus.BAD_GATEWAY, ErrorTypes.EMPTY_RESPONSE, "Empty Generation Response");
            case NO_VALID_RECORDS ->
                    new ProblemMapping(HttpStatus.UNPROCESSABLE_ENTITY, ErrorTypes.NO_VALID_RECORDS, "No Valid MCQs Generated");
            case ARTIFACT_WRITE ->
                    new ProblemMapping(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.ARTIFACT_WRITE_FAILED, "Artifact Write Failed");
        };
    }

    private record ProblemMapping(HttpStatus status, URI type, String title) {
    }
}
