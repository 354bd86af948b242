package uk.gegc.mcqgen.features.pipeline.domain;

import uk.gegc.mcqgen.features.generation.domain.GenerationException;
import uk.gegc.mcqgen.shared.exception.FailureType;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;

/**
 * A classified pipeline failure.
 *
 * @param type    which stage failed and how
 * @param message human-readable detail, including upstream detail where available
 * @param timeout true only when the generation service did not answer in time
 */
public record PipelineFailure(FailureType type, String message, boolean timeout) {
    public PipelineFailure {
        if (type == null) {
            throw new IllegalArgumentException("Failure type cannot be null");
        }
        if (message == null || message.isBlank()) {
            message = type.name();
        }
    }

    public static PipelineFailure from(McqGenerationException exception) {
        boolean timedOut = exception instanceof GenerationException generation && generation.isTimeout();
        return new PipelineFailure(exception.getFailureType(), exception.getMessage(), timedOut);
    }
}
