package uk.gegc.mcqgen.features.pipeline.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.artifact.application.ArtifactRenderingService;
import uk.gegc.mcqgen.features.artifact.application.ArtifactStore;
import uk.gegc.mcqgen.features.artifact.domain.OutputArtifacts;
import uk.gegc.mcqgen.features.artifact.domain.StoredArtifacts;
import uk.gegc.mcqgen.features.extraction.application.DocumentTextExtractor;
import uk.gegc.mcqgen.features.extraction.domain.ExtractedText;
import uk.gegc.mcqgen.features.extraction.domain.SourceFormat;
import uk.gegc.mcqgen.features.generation.application.GenerationClient;
import uk.gegc.mcqgen.features.generation.application.McqPromptBuilder;
import uk.gegc.mcqgen.features.generation.domain.GenerationRequest;
import uk.gegc.mcqgen.features.generation.domain.RawGenerationResponse;
import uk.gegc.mcqgen.features.mcq.application.McqParser;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;
import uk.gegc.mcqgen.features.mcq.domain.NoValidRecordsException;
import uk.gegc.mcqgen.features.pipeline.domain.PipelineFailure;
import uk.gegc.mcqgen.features.pipeline.domain.PipelineResult;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;
import uk.gegc.mcqgen.shared.util.FilenameSanitizer;

import java.nio.file.Path;
import java.time.Duration;

/**
 * End-to-end MCQ generation: extract, prompt, generate, parse, render, store.
 * <p>
 * Classified failures come back as a failed {@link PipelineResult}; anything
 * else is a bug and propagates. Artifacts are only written once at least one
 * record parsed, so a failed run leaves no files behind.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class McqGenerationPipeline {

    private final DocumentTextExtractor textExtractor;
    private final McqPromptBuilder promptBuilder;
    private final GenerationClient generationClient;
    private final McqParser parser;
    private final ArtifactRenderingService renderingService;
    private final ArtifactStore artifactStore;
    private final PipelineMetricsService metrics;

    public PipelineResult run(Path source, SourceFormat format, int requestedCount) {
        if (source == null) {
            throw new IllegalArgumentException("Source path cannot be null");
        }
        if (requestedCount < 1) {
            throw new IllegalArgumentException("Requested question count must be at least 1, got " + requestedCount);
        }

        String sourceName = source.getFileName().toString();
        log.info("Starting MCQ generation for {} ({}), {} questions requested", sourceName, format, requestedCount);

        long start = System.nanoTime();
        try {
            ExtractedText text = textExtractor.extract(source, format);
            GenerationRequest request = promptBuilder.build(text, requestedCount);
            RawGenerationResponse response = generationClient.generate(request);

            McqResultSet resultSet = parser.parse(response.text());
            log.info("Parsed {} of {} requested MCQs for {} ({} blocks discarded)",
                    resultSet.size(), requestedCount, sourceName, resultSet.discardedBlocks());
            if (resultSet.isEmpty()) {
                throw new NoValidRecordsException("Generation response contained no valid MCQ blocks ("
                        + resultSet.discardedBlocks() + " discarded)");
            }
            if (resultSet.size() < requestedCount) {
                log.warn("Partial result for {}: generated {} of {} requested MCQs",
                        sourceName, resultSet.size(), requestedCount);
            }

            OutputArtifacts artifacts = renderingService.render(resultSet);
            StoredArtifacts stored = artifactStore.store(FilenameSanitizer.stem(sourceName), artifacts);
            metrics.recordSuccess(requestedCount, resultSet.size(), resultSet.discardedBlocks());
            return PipelineResult.ok(resultSet, stored);
        } catch (McqGenerationException e) {
            PipelineFailure failure = PipelineFailure.from(e);
            log.error("MCQ generation failed for {}: {} - {}", sourceName, failure.type(), failure.message(), e);
            metrics.recordFailure(failure.type(), failure.timeout());
            return PipelineResult.failed(failure);
        } finally {
            metrics.recordDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
