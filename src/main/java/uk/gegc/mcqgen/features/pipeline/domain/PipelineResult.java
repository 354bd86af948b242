package uk.gegc.mcqgen.features.pipeline.domain;

import uk.gegc.mcqgen.features.artifact.domain.StoredArtifacts;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;

/**
 * Outcome of one pipeline run: either the parsed records with their stored
 * artifacts, or a classified failure. Never both.
 */
public record PipelineResult(
        McqResultSet resultSet,
        StoredArtifacts artifacts,
        PipelineFailure failure
) {
    public PipelineResult {
        boolean success = resultSet != null && artifacts != null;
        if (success == (failure != null)) {
            throw new IllegalArgumentException("A result is either a success or a failure");
        }
    }

    public static PipelineResult ok(McqResultSet resultSet, StoredArtifacts artifacts) {
        return new PipelineResult(resultSet, artifacts, null);
    }

    public static PipelineResult failed(PipelineFailure failure) {
        return new PipelineResult(null, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
