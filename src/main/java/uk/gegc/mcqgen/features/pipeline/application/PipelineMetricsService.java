package uk.gegc.mcqgen.features.pipeline.application;

import uk.gegc.mcqgen.shared.exception.FailureType;

import java.time.Duration;

/**
 * Counters and timings for pipeline runs.
 */
public interface PipelineMetricsService {

    /**
     * Record a successful run.
     *
     * @param requested       questions asked for
     * @param generated       valid records produced
     * @param discardedBlocks blocks dropped by the parser
     */
    void recordSuccess(int requested, int generated, int discardedBlocks);

    void recordFailure(FailureType type, boolean timeout);

    void recordDuration(Duration duration);
}
