package uk.gegc.mcqgen.features.pipeline.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.pipeline.application.PipelineMetricsService;
import uk.gegc.mcqgen.shared.exception.FailureType;

import java.time.Duration;
import java.util.Locale;

/**
 * Publishes pipeline metrics through Micrometer.
 */
@Slf4j
@Service
public class MicrometerPipelineMetricsService implements PipelineMetricsService {

    static final String RUNS = "mcq.pipeline.runs";
    static final String FAILURES = "mcq.pipeline.failures";
    static final String RECORDS_GENERATED = "mcq.records.generated";
    static final String BLOCKS_DISCARDED = "mcq.blocks.discarded";
    static final String PARTIAL_RESULTS = "mcq.pipeline.partial";
    static final String DURATION = "mcq.pipeline.duration";

    private final MeterRegistry meterRegistry;

    private final Counter successCounter;
    private final Counter recordsGeneratedCounter;
    private final Counter blocksDiscardedCounter;
    private final Counter partialResultCounter;
    private final Timer durationTimer;

    public MicrometerPipelineMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.successCounter = Counter.builder(RUNS)
                .description("Pipeline runs by outcome")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.recordsGeneratedCounter = Counter.builder(RECORDS_GENERATED)
                .description("Valid MCQ records produced")
                .register(meterRegistry);
        this.blocksDiscardedCounter = Counter.builder(BLOCKS_DISCARDED)
                .description("Response blocks dropped as malformed")
                .register(meterRegistry);
        this.partialResultCounter = Counter.builder(PARTIAL_RESULTS)
                .description("Successful runs that produced fewer MCQs than requested")
                .register(meterRegistry);
        this.durationTimer = Timer.builder(DURATION)
                .description("End-to-end pipeline latency")
                .register(meterRegistry);
    }

    @Override
    public void recordSuccess(int requested, int generated, int discardedBlocks) {
        log.debug("METRIC: {} outcome=success requested={} generated={} discarded={}",
                RUNS, requested, generated, discardedBlocks);
        successCounter.increment();
        recordsGeneratedCounter.increment(generated);
        blocksDiscardedCounter.increment(discardedBlocks);
        if (generated < requested) {
            partialResultCounter.increment();
        }
    }

    @Override
    public void recordFailure(FailureType type, boolean timeout) {
        log.debug("METRIC: {} outcome=failure type={} timeout={}", RUNS, type, timeout);
        // Failure counters are tagged per type, so they are looked up on demand
        Counter.builder(RUNS)
                .tag("outcome", "failure")
                .register(meterRegistry)
                .increment();
        Counter.builder(FAILURES)
                .tag("type", type.name().toLowerCase(Locale.ROOT))
                .tag("timeout", String.valueOf(timeout))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordDuration(Duration duration) {
        durationTimer.record(duration);
    }
}
