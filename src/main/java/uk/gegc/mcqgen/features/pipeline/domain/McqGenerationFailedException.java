package uk.gegc.mcqgen.features.pipeline.domain;

/**
 * Raised at the API boundary when a pipeline run ends in a classified failure.
 */
public class McqGenerationFailedException extends RuntimeException {

    private final PipelineFailure failure;

    public McqGenerationFailedException(PipelineFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public PipelineFailure getFailure() {
        return failure;
    }
}
